package com.flamingo.ai.knowledgedesk.exception;

/** Exception thrown when the chat completion service fails. */
public class CompletionServiceException extends RuntimeException {

  private final boolean permanent;
  private final String userMessage;

  public CompletionServiceException(String message, Throwable cause) {
    this(message, false, cause);
  }

  public CompletionServiceException(String message, boolean permanent, Throwable cause) {
    super(message, cause);
    this.permanent = permanent;
    this.userMessage =
        permanent
            ? "The AI service rejected the request."
            : "AI service is temporarily unavailable. Please try again later.";
  }

  public boolean isPermanent() {
    return permanent;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
