package com.flamingo.ai.knowledgedesk.service.rag.parsing;

import com.flamingo.ai.knowledgedesk.service.rag.model.ParsedDocument;

/**
 * Turns fetched document bytes into a {@link ParsedDocument}.
 *
 * <p>Implementations are stateless and shared across ingestion workers.
 */
public interface DocumentParser {

  ParsedDocument parse(byte[] content, String mimeType);

  boolean supports(String mimeType);
}
