package com.example.signStream.detector;

import com.example.signStream.codec.DecodedFrame;
import com.example.signStream.error.LandmarkDetectionException;

/**
 * External hand/face/pose landmark model.
 *
 * One instance is shared by every connection, so implementations must accept
 * concurrent {@link #detect} calls.
 */
public interface LandmarkDetector {

  LandmarkDetection detect(DecodedFrame frame) throws LandmarkDetectionException;

  /** Short identifier reported by the status endpoint. */
  String name();
}
