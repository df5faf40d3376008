package com.example.signStream.practice;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Row written once when a practice session ends. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PracticeSessionSummary {

  private String sessionId;
  private String clientId;
  private int totalSentences;
  private int sentencesReached;
  private boolean completed;
  private int attempts;
  private int gesturesDetected;
  private String endReason;
  private Instant startedAt;
  private Instant endedAt;
}
