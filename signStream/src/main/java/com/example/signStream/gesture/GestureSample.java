package com.example.signStream.gesture;

import com.example.signStream.detector.LandmarkDetection;
import com.example.signStream.dto.Landmark3D;

/**
 * One frame's contribution to gesture segmentation. Hand position is null
 * when no hand was seen or the detector reported presence only.
 */
public record GestureSample(boolean hasHands, long timestampMs, Double handX, Double handY) {

  public static GestureSample presence(boolean hasHands, long timestampMs) {
    return new GestureSample(hasHands, timestampMs, null, null);
  }

  public static GestureSample at(long timestampMs, double handX, double handY) {
    return new GestureSample(true, timestampMs, handX, handY);
  }

  public static GestureSample of(LandmarkDetection detection, long timestampMs) {
    if (!detection.hasHands()) {
      return presence(false, timestampMs);
    }
    return detection.primaryHandCentroid()
        .map((Landmark3D c) -> at(timestampMs, c.getX(), c.getY()))
        .orElseGet(() -> presence(true, timestampMs));
  }

  public boolean hasPosition() {
    return hasHands && handX != null && handY != null;
  }
}
