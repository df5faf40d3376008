package com.example.signStream.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Advisory telemetry only; nothing gates on these values. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class QualityMetrics {

  private double landmarksConfidence;
  private double processingEfficiency;

  public static QualityMetrics zero() {
    return new QualityMetrics(0.0, 0.0);
  }
}
