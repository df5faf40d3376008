package com.example.signStream.practice;

import java.time.Instant;
import java.util.List;

import lombok.Getter;
import lombok.Setter;

/**
 * Story practice state of one connection. Mutated only by
 * {@link PracticeSessionManager} on the connection's worker thread.
 */
@Getter
@Setter
class PracticeSession {

  private final String sessionId;
  private final List<String> sentences;
  private final Instant startedAt;

  private int currentIndex;
  private PracticeMode mode = PracticeMode.LISTENING;
  private boolean active = true;

  private int attempts = 1;
  private int gesturesDetected;
  private Object lastFeedback;
  private boolean summaryRecorded;

  PracticeSession(String sessionId, List<String> sentences, Instant startedAt) {
    this.sessionId = sessionId;
    this.sentences = List.copyOf(sentences);
    this.startedAt = startedAt;
  }

  String currentSentence() {
    return sentences.get(currentIndex);
  }

  boolean isLastSentence() {
    return currentIndex == sentences.size() - 1;
  }
}
