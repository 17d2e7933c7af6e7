package com.flamingo.ai.knowledgedesk.service.source;

import java.util.List;

/**
 * Reads documents from an external source bound to one collection.
 *
 * <p>Failures are signalled distinctly: {@link
 * com.flamingo.ai.knowledgedesk.exception.PermanentSourceException} for not found and access
 * denied, {@link com.flamingo.ai.knowledgedesk.exception.TransientSourceException} for network
 * errors, timeouts and rate limiting.
 */
public interface SourceAdapter {

  /** Lists documents under the configured root that pass its include and exclude patterns. */
  List<DocumentDescriptor> list(SourceConfig config);

  SourceDocument fetch(DocumentDescriptor descriptor);
}
