package com.flamingo.ai.knowledgedesk.service.supervisor;

import com.flamingo.ai.knowledgedesk.agent.QueryClassificationAgent;
import com.flamingo.ai.knowledgedesk.agent.dto.QueryClassificationResult;
import com.flamingo.ai.knowledgedesk.domain.enums.SpecialistTag;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Classifies with the language model. Any failure of the model call, or a result naming no known
 * specialist, falls back to the heuristic classifier.
 */
@Slf4j
public class LlmQueryClassifier implements QueryClassifier {

  private final QueryClassificationAgent agent;
  private final QueryClassifier fallback;
  private final MeterRegistry meterRegistry;

  public LlmQueryClassifier(
      QueryClassificationAgent agent, QueryClassifier fallback, MeterRegistry meterRegistry) {
    this.agent = agent;
    this.fallback = fallback;
    this.meterRegistry = meterRegistry;
  }

  @Override
  @Timed(value = "router.classify", description = "Time to classify a query with the model")
  public Classification classify(String query) {
    QueryClassificationResult result;
    try {
      result = agent.classify(query);
    } catch (RuntimeException e) {
      log.warn("Model classification failed, using heuristic: {}", e.getMessage());
      meterRegistry.counter("router.classifier.fallback").increment();
      return fallback.classify(query);
    }
    Map<SpecialistTag, Double> scores = new EnumMap<>(SpecialistTag.class);
    if (result != null && result.scores() != null) {
      for (QueryClassificationResult.SpecialistScore score : result.scores()) {
        SpecialistTag tag = parseTag(score.specialist());
        if (tag != null) {
          scores.merge(tag, clamp(score.confidence()), Math::max);
        }
      }
    }
    if (scores.isEmpty()) {
      log.warn("Model classification named no known specialist, using heuristic");
      meterRegistry.counter("router.classifier.fallback").increment();
      return fallback.classify(query);
    }
    log.debug("Model classification: {} ({})", scores, result.reasoning());
    List<TagScore> tagScores = new ArrayList<>();
    scores.forEach((tag, confidence) -> tagScores.add(new TagScore(tag, confidence)));
    return new Classification(tagScores, "llm");
  }

  private static SpecialistTag parseTag(String name) {
    if (name == null) {
      return null;
    }
    try {
      return SpecialistTag.valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      log.debug("Ignoring unknown specialist '{}'", name);
      return null;
    }
  }

  private static double clamp(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }
}
