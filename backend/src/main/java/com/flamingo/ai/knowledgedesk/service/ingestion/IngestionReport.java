package com.flamingo.ai.knowledgedesk.service.ingestion;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one sync of a collection.
 *
 * @param collection the synced collection
 * @param status how the run ended
 * @param ingested documents written under a new version
 * @param unchanged documents whose content hash matched the ledger
 * @param deleted documents removed by the tombstone pass
 * @param failed documents that could not be ingested or deleted
 * @param failures one entry per failed document
 * @param elapsed wall time of the run
 */
public record IngestionReport(
    String collection,
    Status status,
    int ingested,
    int unchanged,
    int deleted,
    int failed,
    List<IngestionFailure> failures,
    Duration elapsed) {

  /** How a sync run ended. */
  public enum Status {
    COMPLETED,

    /** Stopped before all documents were dispatched; the tombstone pass did not run. */
    CANCELLED,

    /** The source could not be listed; nothing was written. */
    LISTING_FAILED
  }

  /** Why a single document failed. */
  public record IngestionFailure(
      String path, String errorType, String message, boolean transientError) {}
}
