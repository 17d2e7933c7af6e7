package com.flamingo.ai.knowledgedesk.service.supervisor;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Scores a query by how many of a specialist's keywords it contains. No hit scores 0, one hit
 * scores 0.6, and every further hit adds 0.1 up to 0.9.
 */
final class KeywordRelevance {

  private final List<Pattern> keywords;

  KeywordRelevance(List<String> keywords) {
    this.keywords =
        keywords.stream()
            .map(k -> Pattern.compile("\\b" + Pattern.quote(k.toLowerCase(Locale.ROOT)) + "\\b"))
            .toList();
  }

  double score(String query) {
    String text = query.toLowerCase(Locale.ROOT);
    long hits = keywords.stream().filter(k -> k.matcher(text).find()).count();
    if (hits == 0) {
      return 0.0;
    }
    return Math.min(0.9, 0.5 + 0.1 * hits);
  }
}
