package com.example.signStream.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EncodingMetrics {

  private double encodingTimeMs;
  private int compressedSizeBytes;
  private long originalSizeBytes;
  private double compressionRatio;
  private int quality;
  private String format;
  private int width;
  private int height;
  private int attempts;

  /** false when the byte ceiling could not be reached within the attempt budget */
  private boolean targetMet;
}
