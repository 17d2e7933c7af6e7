package com.flamingo.ai.knowledgedesk.exception;

/** Exception thrown when the issue tracker API fails. */
public class TicketTrackerException extends RuntimeException {

  private final boolean transientFailure;
  private final int httpStatus;

  public TicketTrackerException(String message, boolean transientFailure) {
    this(message, 0, transientFailure, null);
  }

  public TicketTrackerException(String message, boolean transientFailure, Throwable cause) {
    this(message, 0, transientFailure, cause);
  }

  public TicketTrackerException(
      String message, int httpStatus, boolean transientFailure, Throwable cause) {
    super(message, cause);
    this.httpStatus = httpStatus;
    this.transientFailure = transientFailure;
  }

  public boolean isTransientFailure() {
    return transientFailure;
  }

  /** HTTP status the tracker answered with, or 0 when no response was received. */
  public int getHttpStatus() {
    return httpStatus;
  }

  public boolean isNotFound() {
    return httpStatus == 404;
  }

  public String getUserMessage() {
    return transientFailure
        ? "The issue tracker is temporarily unavailable."
        : "The issue tracker rejected the request.";
  }
}
