package com.flamingo.ai.knowledgedesk.exception;

/** A source call failed for a reason that may go away: network, timeout, rate limit. */
public class TransientSourceException extends RuntimeException {

  private final String userMessage;

  public TransientSourceException(String message) {
    super(message);
    this.userMessage = "Document source is temporarily unavailable.";
  }

  public TransientSourceException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Document source is temporarily unavailable.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
