package com.example.signStream.pipeline;

import com.example.signStream.dto.EncodingMetrics;
import com.example.signStream.dto.LandmarkPresence;
import com.example.signStream.dto.PracticeFrameUpdate;
import com.example.signStream.dto.QualityMetrics;
import com.example.signStream.error.ErrorType;
import com.example.signStream.gesture.GestureState;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Output of one pipeline pass. Always produced, failures included.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProcessingResult {

  private boolean success;
  private String error;
  private ErrorType errorType;

  private long serverFrameNumber;
  private Long clientFrameNumber;
  private String clientTimestamp;

  /** data URL of the annotated frame; null when nothing could be encoded */
  private String frameData;

  @Builder.Default
  private LandmarkPresence landmarks = LandmarkPresence.none();

  private double detectorTimeMs;
  private double encodeTimeMs;
  private double totalPipelineTimeMs;

  private EncodingMetrics encodingMetrics;

  @Builder.Default
  private QualityMetrics qualityMetrics = QualityMetrics.zero();

  private GestureState gestureState;

  /** null when no practice session is active */
  private PracticeFrameUpdate practice;

  public static ProcessingResult failure(FrameSample sample, ErrorType type, String error) {
    return ProcessingResult.builder()
        .success(false)
        .errorType(type)
        .error(error)
        .serverFrameNumber(sample.sequence())
        .clientFrameNumber(sample.clientFrameNumber())
        .clientTimestamp(sample.clientTimestamp())
        .build();
  }

  public static ProcessingResult dropped(FrameSample sample) {
    return failure(sample, ErrorType.FRAME_DROPPED, "Frame dropped: superseded by a newer frame");
  }
}
