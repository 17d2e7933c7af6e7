package com.flamingo.ai.knowledgedesk.service.ingestion;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation flag for one sync run. Cancelling stops dispatch of further documents; a document
 * whose replace already started runs to completion.
 */
public final class IngestionCancellation {

  private final AtomicBoolean cancelled = new AtomicBoolean();

  public static IngestionCancellation create() {
    return new IngestionCancellation();
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}
