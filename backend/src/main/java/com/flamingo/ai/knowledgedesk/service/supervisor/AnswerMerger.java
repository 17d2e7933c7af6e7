package com.flamingo.ai.knowledgedesk.service.supervisor;

import com.flamingo.ai.knowledgedesk.service.rag.retrieval.Answer;
import com.flamingo.ai.knowledgedesk.service.rag.retrieval.Citation;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Combines the answers of several specialists into one.
 *
 * <p>Answers are ordered by the confidence of the specialist that was asked, highest first, ties
 * in specialist declaration order. Ungrounded answers are dropped when at least one answer is
 * grounded. Citations keep the first occurrence of each document in that order.
 */
@Component
public class AnswerMerger {

  static final Comparator<SpecialistOutcome> BY_CONFIDENCE =
      Comparator.comparingDouble(SpecialistOutcome::confidence)
          .reversed()
          .thenComparing(SpecialistOutcome::requested);

  /**
   * Merges successful outcomes.
   *
   * @param outcomes at least one successful outcome
   */
  public Answer merge(List<SpecialistOutcome> outcomes) {
    List<SpecialistOutcome> ordered =
        outcomes.stream().filter(SpecialistOutcome::succeeded).sorted(BY_CONFIDENCE).toList();
    if (ordered.isEmpty()) {
      throw new IllegalArgumentException("Nothing to merge");
    }
    if (ordered.size() == 1) {
      return ordered.get(0).answer();
    }
    List<SpecialistOutcome> grounded =
        ordered.stream().filter(o -> o.answer().grounded()).toList();
    if (grounded.isEmpty()) {
      return Answer.noGroundedAnswer();
    }
    if (grounded.size() == 1) {
      return grounded.get(0).answer();
    }

    StringBuilder text = new StringBuilder();
    Map<String, Citation> citations = new LinkedHashMap<>();
    for (SpecialistOutcome outcome : grounded) {
      if (text.length() > 0) {
        text.append("\n\n");
      }
      text.append("**")
          .append(outcome.answeredBy().displayName())
          .append("**\n")
          .append(outcome.answer().text().strip());
      for (Citation citation : outcome.answer().citations()) {
        citations.putIfAbsent(citation.documentKey(), citation);
      }
    }
    return new Answer(text.toString(), List.copyOf(citations.values()), true);
  }
}
