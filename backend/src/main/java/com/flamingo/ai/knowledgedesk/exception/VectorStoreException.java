package com.flamingo.ai.knowledgedesk.exception;

/**
 * Exception thrown when the vector store rejects or fails an operation.
 *
 * <p>{@code storeUnavailable} marks outages of the store itself; those abort whole operations
 * instead of a single document.
 */
public class VectorStoreException extends RuntimeException {

  private final boolean storeUnavailable;

  public VectorStoreException(String message, boolean storeUnavailable) {
    super(message);
    this.storeUnavailable = storeUnavailable;
  }

  public VectorStoreException(String message, boolean storeUnavailable, Throwable cause) {
    super(message, cause);
    this.storeUnavailable = storeUnavailable;
  }

  public boolean isStoreUnavailable() {
    return storeUnavailable;
  }

  public String getUserMessage() {
    return "Search is temporarily unavailable. Please try again.";
  }
}
