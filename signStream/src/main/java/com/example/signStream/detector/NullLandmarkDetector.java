package com.example.signStream.detector;

import com.example.signStream.codec.DecodedFrame;

/**
 * Stand-in used when no landmark model is deployed. Frames still flow
 * through the pipeline; nothing is ever detected.
 */
public class NullLandmarkDetector implements LandmarkDetector {

  @Override
  public LandmarkDetection detect(DecodedFrame frame) {
    return LandmarkDetection.none();
  }

  @Override
  public String name() {
    return "none";
  }
}
