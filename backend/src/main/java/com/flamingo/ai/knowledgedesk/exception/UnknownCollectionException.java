package com.flamingo.ai.knowledgedesk.exception;

/** Exception thrown when a collection name is not configured. */
public class UnknownCollectionException extends RuntimeException {

  public UnknownCollectionException(String collection) {
    super("Collection not configured: " + collection);
  }
}
