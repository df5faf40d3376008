package com.example.signStream.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** {@code metadata} block of a {@code processed_frame} message. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FrameMetadata {

  private long serverFrameNumber;
  private Long clientFrameNumber;
  private String clientTimestamp;

  private double processingTimeMs;
  private double encodingTimeMs;
  private double totalPipelineTimeMs;

  private LandmarkPresence landmarksDetected;
  private QualityMetrics qualityMetrics;
  private EncodingMetrics encodingMetadata;

  private String gestureState;
  private PracticeFrameUpdate practiceSession;

  private boolean success;
  private String error;
  private String errorType;
}
