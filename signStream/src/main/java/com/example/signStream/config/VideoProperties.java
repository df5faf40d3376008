package com.example.signStream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "storysign.video")
public class VideoProperties {
  private int fps = 30;
  private double frameBudgetMs = 16.67; // 60 fps target
  private double minProcessingEfficiency = 0.1;
  private int maxFrameBytes = 2_000_000;
  private long maxFramePixels = 1920L * 1080 * 2;

  // adaptive JPEG encoder
  private int initialQuality = 50;
  private int minQuality = 20;
  private int qualityStep = 10;
  private int maxEncodedBytes = 60_000;
  private double downscaleFactor = 0.75;
  private int maxEncodeAttempts = 6;

  public int getFps() { return fps; }
  public void setFps(int fps) { this.fps = fps; }

  public double getFrameBudgetMs() { return frameBudgetMs; }
  public void setFrameBudgetMs(double frameBudgetMs) { this.frameBudgetMs = frameBudgetMs; }

  public double getMinProcessingEfficiency() { return minProcessingEfficiency; }
  public void setMinProcessingEfficiency(double minProcessingEfficiency) { this.minProcessingEfficiency = minProcessingEfficiency; }

  public int getMaxFrameBytes() { return maxFrameBytes; }
  public void setMaxFrameBytes(int maxFrameBytes) { this.maxFrameBytes = maxFrameBytes; }

  public long getMaxFramePixels() { return maxFramePixels; }
  public void setMaxFramePixels(long maxFramePixels) { this.maxFramePixels = maxFramePixels; }

  public int getInitialQuality() { return initialQuality; }
  public void setInitialQuality(int initialQuality) { this.initialQuality = initialQuality; }

  public int getMinQuality() { return minQuality; }
  public void setMinQuality(int minQuality) { this.minQuality = minQuality; }

  public int getQualityStep() { return qualityStep; }
  public void setQualityStep(int qualityStep) { this.qualityStep = qualityStep; }

  public int getMaxEncodedBytes() { return maxEncodedBytes; }
  public void setMaxEncodedBytes(int maxEncodedBytes) { this.maxEncodedBytes = maxEncodedBytes; }

  public double getDownscaleFactor() { return downscaleFactor; }
  public void setDownscaleFactor(double downscaleFactor) { this.downscaleFactor = downscaleFactor; }

  public int getMaxEncodeAttempts() { return maxEncodeAttempts; }
  public void setMaxEncodeAttempts(int maxEncodeAttempts) { this.maxEncodeAttempts = maxEncodeAttempts; }
}
