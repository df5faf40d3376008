package com.example.signStream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "storysign.detector")
public class DetectorProperties {
  private String type = "none"; // none | remote
  private String baseUrl = "http://localhost:8765";
  private int connectTimeoutMs = 2000;
  private int timeoutMs = 250;
  private int poolSize = 4;

  public String getType() { return type; }
  public void setType(String type) { this.type = type; }

  public String getBaseUrl() { return baseUrl; }
  public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

  public int getConnectTimeoutMs() { return connectTimeoutMs; }
  public void setConnectTimeoutMs(int connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

  public int getTimeoutMs() { return timeoutMs; }
  public void setTimeoutMs(int timeoutMs) { this.timeoutMs = timeoutMs; }

  public int getPoolSize() { return poolSize; }
  public void setPoolSize(int poolSize) { this.poolSize = poolSize; }
}
