package com.example.signStream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "storysign.connection")
public class ConnectionProperties {
  private int maxQueuedFrames = 2;
  private int maxTextMessageBytes = 4 * 1024 * 1024;
  private int sendTimeLimitMs = 5000;
  private int sendBufferSizeLimit = 4 * 1024 * 1024;
  private long workerShutdownMs = 1000;
  private int maxConnections = 10;

  public int getMaxQueuedFrames() { return maxQueuedFrames; }
  public void setMaxQueuedFrames(int maxQueuedFrames) { this.maxQueuedFrames = maxQueuedFrames; }

  public int getMaxTextMessageBytes() { return maxTextMessageBytes; }
  public void setMaxTextMessageBytes(int maxTextMessageBytes) { this.maxTextMessageBytes = maxTextMessageBytes; }

  public int getSendTimeLimitMs() { return sendTimeLimitMs; }
  public void setSendTimeLimitMs(int sendTimeLimitMs) { this.sendTimeLimitMs = sendTimeLimitMs; }

  public int getSendBufferSizeLimit() { return sendBufferSizeLimit; }
  public void setSendBufferSizeLimit(int sendBufferSizeLimit) { this.sendBufferSizeLimit = sendBufferSizeLimit; }

  public long getWorkerShutdownMs() { return workerShutdownMs; }
  public void setWorkerShutdownMs(long workerShutdownMs) { this.workerShutdownMs = workerShutdownMs; }

  public int getMaxConnections() { return maxConnections; }
  public void setMaxConnections(int maxConnections) { this.maxConnections = maxConnections; }
}
