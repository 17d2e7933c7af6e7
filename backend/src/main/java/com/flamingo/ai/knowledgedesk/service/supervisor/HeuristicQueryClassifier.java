package com.flamingo.ai.knowledgedesk.service.supervisor;

import java.util.List;

/** Classifies by asking every specialist for its own relevance estimate. */
public class HeuristicQueryClassifier implements QueryClassifier {

  private final List<Specialist> specialists;

  public HeuristicQueryClassifier(List<Specialist> specialists) {
    this.specialists = specialists;
  }

  @Override
  public Classification classify(String query) {
    return new Classification(
        specialists.stream()
            .map(s -> new TagScore(s.tag(), clamp(s.classifyRelevance(query))))
            .toList(),
        "heuristic");
  }

  private static double clamp(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }
}
