package com.flamingo.ai.knowledgedesk.service.source;

/**
 * Fetched content of a listed document.
 *
 * @param descriptor what was fetched
 * @param content raw bytes as served by the source
 * @param mimeType content type, used to pick a parser
 */
public record SourceDocument(DocumentDescriptor descriptor, byte[] content, String mimeType) {}
