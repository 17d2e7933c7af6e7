package com.flamingo.ai.knowledgedesk.exception;

/** Exception thrown when the embedding service fails. */
public class EmbeddingServiceException extends RuntimeException {

  private final boolean permanent;

  public EmbeddingServiceException(String message, boolean permanent) {
    super(message);
    this.permanent = permanent;
  }

  public EmbeddingServiceException(String message, boolean permanent, Throwable cause) {
    super(message, cause);
    this.permanent = permanent;
  }

  /** True when the service rejected the input itself, so a retry would fail the same way. */
  public boolean isPermanent() {
    return permanent;
  }

  public String getUserMessage() {
    return "Embedding service is temporarily unavailable. Please try again later.";
  }
}
