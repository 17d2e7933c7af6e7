package com.flamingo.ai.knowledgedesk.service.supervisor;

import com.flamingo.ai.knowledgedesk.domain.enums.SpecialistTag;
import java.util.Comparator;
import java.util.List;

/**
 * Per-specialist confidence for one query, best first. Equal confidences keep the declaration
 * order of {@link SpecialistTag}.
 */
public record Classification(List<TagScore> scores, String classifier) {

  private static final Comparator<TagScore> BEST_FIRST =
      Comparator.comparingDouble(TagScore::confidence)
          .reversed()
          .thenComparing(TagScore::tag);

  public Classification {
    scores = scores.stream().sorted(BEST_FIRST).toList();
  }

  /** The user picked a specialist explicitly. */
  public static Classification chosenByUser(SpecialistTag tag) {
    return new Classification(List.of(new TagScore(tag, 1.0)), "user");
  }

  public TagScore top() {
    return scores.isEmpty() ? new TagScore(SpecialistTag.GENERAL, 0.0) : scores.get(0);
  }

  /** Second best score, or null with fewer than two candidates. */
  public TagScore runnerUp() {
    return scores.size() < 2 ? null : scores.get(1);
  }

  public double confidenceOf(SpecialistTag tag) {
    return scores.stream()
        .filter(s -> s.tag() == tag)
        .mapToDouble(TagScore::confidence)
        .findFirst()
        .orElse(0.0);
  }
}
