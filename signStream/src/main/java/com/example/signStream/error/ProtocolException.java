package com.example.signStream.error;

/** Unknown message type or malformed message envelope. */
public class ProtocolException extends StreamException {

  public ProtocolException(String message) {
    super(ErrorType.PROTOCOL_ERROR, message);
  }

  public ProtocolException(String message, Throwable cause) {
    super(ErrorType.PROTOCOL_ERROR, message, cause);
  }
}
