package com.flamingo.ai.knowledgedesk.agent.dto;

import java.util.List;

/** Structured output from QueryClassificationAgent. */
public record QueryClassificationResult(List<SpecialistScore> scores, String reasoning) {

  /** Confidence for one specialist, named as in the agent prompt. */
  public record SpecialistScore(String specialist, double confidence) {}
}
