package com.example.signStream.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Practice-session fields attached to a processed frame while a session is active. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PracticeFrameUpdate {

  private boolean practiceActive;
  private String sessionId;
  private String currentSentence;
  private Integer currentSentenceIndex;
  private String practiceMode;
  private String gestureState;

  private boolean gestureCompleted;
  private Long gestureDurationMs;
  private Integer landmarkBufferSize;
}
