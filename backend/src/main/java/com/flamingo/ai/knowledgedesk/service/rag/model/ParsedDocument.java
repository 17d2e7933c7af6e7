package com.flamingo.ai.knowledgedesk.service.rag.model;

import java.util.List;

/**
 * Structured text extracted from a source document.
 *
 * @param fullText plain text of the whole document
 * @param sections top-level section tree, empty for unstructured text
 */
public record ParsedDocument(String fullText, List<DocumentSection> sections) {

  public boolean isBlank() {
    return fullText == null || fullText.isBlank();
  }
}
