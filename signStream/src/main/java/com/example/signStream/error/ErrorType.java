package com.example.signStream.error;

/**
 * Failure categories reported to clients in the {@code error_type} field.
 */
public enum ErrorType {
  DECODE_ERROR("decode_error"),
  DETECTOR_ERROR("detector_error"),
  ENCODE_ERROR("encode_error"),
  SESSION_STATE_ERROR("session_state_error"),
  PROTOCOL_ERROR("protocol_error"),
  FRAME_DROPPED("frame_dropped"),
  PIPELINE_ERROR("pipeline_error");

  private final String wireName;

  ErrorType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }
}
