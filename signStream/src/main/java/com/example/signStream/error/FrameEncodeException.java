package com.example.signStream.error;

/** Re-encoding an output frame failed. */
public class FrameEncodeException extends StreamException {

  public FrameEncodeException(String message) {
    super(ErrorType.ENCODE_ERROR, message);
  }

  public FrameEncodeException(String message, Throwable cause) {
    super(ErrorType.ENCODE_ERROR, message, cause);
  }
}
