package com.example.signStream.error;

/**
 * Base type for failures that are converted into structured results at the
 * boundary of the component that raised them.
 */
public abstract class StreamException extends Exception {

  private final ErrorType type;

  protected StreamException(ErrorType type, String message) {
    super(message);
    this.type = type;
  }

  protected StreamException(ErrorType type, String message, Throwable cause) {
    super(message, cause);
    this.type = type;
  }

  public ErrorType getType() {
    return type;
  }
}
