package com.example.signStream.error;

/** A control action is not valid for the current practice session state. */
public class SessionStateException extends StreamException {

  public SessionStateException(String message) {
    super(ErrorType.SESSION_STATE_ERROR, message);
  }
}
