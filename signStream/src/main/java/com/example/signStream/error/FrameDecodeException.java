package com.example.signStream.error;

/** Malformed or undecodable frame data. */
public class FrameDecodeException extends StreamException {

  public FrameDecodeException(String message) {
    super(ErrorType.DECODE_ERROR, message);
  }

  public FrameDecodeException(String message, Throwable cause) {
    super(ErrorType.DECODE_ERROR, message, cause);
  }
}
