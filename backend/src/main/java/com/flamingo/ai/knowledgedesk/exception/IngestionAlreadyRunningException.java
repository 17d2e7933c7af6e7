package com.flamingo.ai.knowledgedesk.exception;

/** Exception thrown when a sync is requested for a collection that is already syncing. */
public class IngestionAlreadyRunningException extends RuntimeException {

  private final String collection;

  public IngestionAlreadyRunningException(String collection) {
    super("Ingestion already running for collection: " + collection);
    this.collection = collection;
  }

  public String getCollection() {
    return collection;
  }
}
