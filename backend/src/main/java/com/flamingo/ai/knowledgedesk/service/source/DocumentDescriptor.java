package com.flamingo.ai.knowledgedesk.service.source;

import java.time.Instant;

/**
 * A document listed by a source, not yet fetched.
 *
 * @param path identity of the document within its collection
 * @param modifiedAt last modification reported by the source, may be null
 * @param title display title
 * @param url link to the document at the source, may be null
 * @param sourceId the source's own identifier (page id, absolute file path)
 */
public record DocumentDescriptor(
    String path, Instant modifiedAt, String title, String url, String sourceId) {}
