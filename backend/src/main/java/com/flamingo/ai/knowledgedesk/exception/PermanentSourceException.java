package com.flamingo.ai.knowledgedesk.exception;

/** A source call failed in a way retrying cannot fix. */
public class PermanentSourceException extends RuntimeException {

  /** Why the source refused the request. */
  public enum Kind {
    NOT_FOUND,
    ACCESS_DENIED,

    /** Fetched, but the content cannot be parsed. */
    UNREADABLE
  }

  private final Kind kind;
  private final String path;

  public PermanentSourceException(Kind kind, String path, String message) {
    super(message);
    this.kind = kind;
    this.path = path;
  }

  public PermanentSourceException(Kind kind, String path, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.path = path;
  }

  public static PermanentSourceException notFound(String path) {
    return new PermanentSourceException(Kind.NOT_FOUND, path, "Document not found: " + path);
  }

  public static PermanentSourceException accessDenied(String path) {
    return new PermanentSourceException(Kind.ACCESS_DENIED, path, "Access denied: " + path);
  }

  public Kind getKind() {
    return kind;
  }

  public String getPath() {
    return path;
  }

  public String getUserMessage() {
    return switch (kind) {
      case NOT_FOUND -> "The document no longer exists at the source.";
      case ACCESS_DENIED -> "The document source denied access.";
      case UNREADABLE -> "The document could not be read.";
    };
  }
}
