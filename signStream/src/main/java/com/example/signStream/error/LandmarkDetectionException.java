package com.example.signStream.error;

/** The landmark detector was unavailable, timed out or threw. */
public class LandmarkDetectionException extends StreamException {

  public LandmarkDetectionException(String message) {
    super(ErrorType.DETECTOR_ERROR, message);
  }

  public LandmarkDetectionException(String message, Throwable cause) {
    super(ErrorType.DETECTOR_ERROR, message, cause);
  }
}
