package com.example.signStream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Gesture segmentation thresholds. Read once at startup; sessions never
 * renegotiate them.
 */
@ConfigurationProperties(prefix = "storysign.gesture")
public class GestureProperties {
  private boolean enabled = true;
  private double velocityThreshold = 0.02; // normalized units per frame
  private long pauseDurationMs = 1000;
  private long minGestureDurationMs = 500;
  private int landmarkBufferSize = 100;
  private int smoothingWindow = 5;

  public boolean isEnabled() { return enabled; }
  public void setEnabled(boolean enabled) { this.enabled = enabled; }

  public double getVelocityThreshold() { return velocityThreshold; }
  public void setVelocityThreshold(double velocityThreshold) { this.velocityThreshold = velocityThreshold; }

  public long getPauseDurationMs() { return pauseDurationMs; }
  public void setPauseDurationMs(long pauseDurationMs) { this.pauseDurationMs = pauseDurationMs; }

  public long getMinGestureDurationMs() { return minGestureDurationMs; }
  public void setMinGestureDurationMs(long minGestureDurationMs) { this.minGestureDurationMs = minGestureDurationMs; }

  public int getLandmarkBufferSize() { return landmarkBufferSize; }
  public void setLandmarkBufferSize(int landmarkBufferSize) { this.landmarkBufferSize = landmarkBufferSize; }

  public int getSmoothingWindow() { return smoothingWindow; }
  public void setSmoothingWindow(int smoothingWindow) { this.smoothingWindow = smoothingWindow; }
}
