package com.example.signStream.practice;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.example.signStream.dto.ControlResult;
import com.example.signStream.dto.PracticeFrameUpdate;
import com.example.signStream.error.ErrorType;
import com.example.signStream.error.SessionStateException;
import com.example.signStream.gesture.GestureDetector;
import com.example.signStream.gesture.GestureEvent;
import com.example.signStream.gesture.GestureState;
import com.example.signStream.service.StreamStatsService;

import lombok.extern.slf4j.Slf4j;

/**
 * Sequences story sentences for one connection.
 *
 * Every transport-level action goes through {@link #control(String, Map)}.
 * A finished gesture only moves LISTENING to FEEDBACK; the sentence index
 * advances on an explicit {@code next_sentence} / {@code complete_story}.
 *
 * Not thread-safe: owned by one connection and called from its worker thread.
 */
@Slf4j
public class PracticeSessionManager {

  public static final String START_SESSION = "start_session";
  public static final String TRY_AGAIN = "try_again";
  public static final String NEXT_SENTENCE = "next_sentence";
  public static final String COMPLETE_STORY = "complete_story";
  public static final String STOP_SESSION = "stop_session";
  public static final String SET_FEEDBACK = "set_feedback";

  private final String clientId;
  private final GestureDetector gestureDetector;
  private final PracticeSessionSink sink;
  private final StreamStatsService stats;
  private final Clock clock;

  private PracticeSession session;

  public PracticeSessionManager(String clientId, GestureDetector gestureDetector,
                                PracticeSessionSink sink, StreamStatsService stats) {
    this(clientId, gestureDetector, sink, stats, Clock.systemUTC());
  }

  public PracticeSessionManager(String clientId, GestureDetector gestureDetector,
                                PracticeSessionSink sink, StreamStatsService stats, Clock clock) {
    this.clientId = clientId;
    this.gestureDetector = gestureDetector;
    this.sink = sink;
    this.stats = stats;
    this.clock = clock;
  }

  public ControlResult start(List<String> sentences, String sessionId) {
    if (sentences == null || sentences.isEmpty()) {
      return ControlResult.failure(START_SESSION, ErrorType.SESSION_STATE_ERROR,
          "Cannot start a session without story sentences");
    }
    // indices must line up with the client's list
    for (int i = 0; i < sentences.size(); i++) {
      String s = sentences.get(i);
      if (s == null || s.isBlank()) {
        return ControlResult.failure(START_SESSION, ErrorType.PROTOCOL_ERROR,
            "Story sentence " + i + " is blank");
      }
    }

    if (isActive()) {
      finish(SessionEndReason.REPLACED);
      session.setActive(false);
    }

    String id = (sessionId == null || sessionId.isBlank())
        ? "session_" + clock.millis()
        : sessionId.trim();
    session = new PracticeSession(id, sentences, clock.instant());
    gestureDetector.reset();
    if (stats != null) stats.sessionStarted();

    log.info("[PRACTICE] client={} session={} started ({} sentences)", clientId, id, sentences.size());
    return snapshot(START_SESSION);
  }

  /**
   * Single entry point for practice actions. Never throws; failures come back
   * as {@code success=false} with the state left untouched.
   */
  public ControlResult control(String action, Map<String, Object> payload) {
    String a = action == null ? "" : action.trim();
    Map<String, Object> data = payload == null ? Map.of() : payload;

    try {
      switch (a) {
        case START_SESSION:
          return startFromPayload(data);
        case TRY_AGAIN:
          return tryAgain();
        case NEXT_SENTENCE:
          return nextSentence();
        case COMPLETE_STORY:
          return completeStory();
        case STOP_SESSION:
          return stopSession();
        case SET_FEEDBACK:
          return setFeedback(data);
        default:
          log.warn("[PRACTICE] client={} unknown action '{}'", clientId, a);
          return withState(ControlResult.failure(a, ErrorType.PROTOCOL_ERROR, "Unknown action: " + a));
      }
    } catch (SessionStateException e) {
      log.debug("[PRACTICE] client={} action={} rejected: {}", clientId, a, e.getMessage());
      return withState(ControlResult.failure(a, e.getType(), e.getMessage()));
    }
  }

  /**
   * Feeds the gesture outcome of one processed frame. Returns null when no
   * session is active so callers can omit the practice block.
   */
  public PracticeFrameUpdate onFrame(GestureState gestureState, Optional<GestureEvent> event) {
    if (!isActive()) return null;

    boolean completed = false;
    Long durationMs = null;
    if (event.isPresent()) {
      GestureEvent e = event.get();
      session.setGesturesDetected(session.getGesturesDetected() + 1);
      durationMs = e.durationMs();
      if (session.getMode() == PracticeMode.LISTENING) {
        session.setMode(PracticeMode.FEEDBACK);
        completed = true;
        log.info("[PRACTICE] client={} session={} attempt finished on sentence {} ({}ms)",
            clientId, session.getSessionId(), session.getCurrentIndex(), e.durationMs());
      }
    }

    return PracticeFrameUpdate.builder()
        .practiceActive(true)
        .sessionId(session.getSessionId())
        .currentSentence(session.currentSentence())
        .currentSentenceIndex(session.getCurrentIndex())
        .practiceMode(session.getMode().wireName())
        .gestureState(gestureState == null ? null : gestureState.wireName())
        .gestureCompleted(completed)
        .gestureDurationMs(durationMs)
        .landmarkBufferSize(completed ? gestureDetector.bufferSize() : null)
        .build();
  }

  /** Connection is going away; summarize whatever is still open. */
  public void close() {
    if (isActive()) {
      finish(SessionEndReason.DISCONNECTED);
      session.setActive(false);
    }
  }

  public boolean isActive() {
    return session != null && session.isActive();
  }

  public Optional<ControlResult> state() {
    if (session == null) return Optional.empty();
    return Optional.of(snapshot("get_state"));
  }

  // ----------------- actions -----------------

  private ControlResult startFromPayload(Map<String, Object> data) {
    Object raw = data.get("story_sentences");
    if (raw != null && !(raw instanceof List)) {
      return ControlResult.failure(START_SESSION, ErrorType.PROTOCOL_ERROR, "story_sentences must be a list");
    }
    List<String> sentences = new ArrayList<>();
    if (raw != null) {
      for (Object o : (List<?>) raw) {
        sentences.add(o == null ? null : o.toString());
      }
    }
    Object id = data.get("session_id");
    return start(sentences, id == null ? null : id.toString());
  }

  private ControlResult tryAgain() throws SessionStateException {
    requireActive();
    session.setMode(PracticeMode.LISTENING);
    session.setLastFeedback(null);
    session.setAttempts(session.getAttempts() + 1);
    gestureDetector.reset();
    return snapshot(TRY_AGAIN);
  }

  private ControlResult nextSentence() throws SessionStateException {
    requireActive();
    if (session.getMode() == PracticeMode.COMPLETED) {
      return snapshot(NEXT_SENTENCE);
    }
    if (session.getCurrentIndex() + 1 < session.getSentences().size()) {
      session.setCurrentIndex(session.getCurrentIndex() + 1);
      session.setMode(PracticeMode.LISTENING);
      session.setLastFeedback(null);
      session.setAttempts(session.getAttempts() + 1);
      gestureDetector.reset();
      log.debug("[PRACTICE] client={} session={} -> sentence {}", clientId, session.getSessionId(), session.getCurrentIndex());
      return snapshot(NEXT_SENTENCE);
    }
    markCompleted();
    return snapshot(NEXT_SENTENCE);
  }

  private ControlResult completeStory() throws SessionStateException {
    requireActive();
    markCompleted();
    return snapshot(COMPLETE_STORY);
  }

  private ControlResult stopSession() throws SessionStateException {
    requireActive();
    finish(SessionEndReason.STOPPED);
    session.setActive(false);
    gestureDetector.reset();
    log.info("[PRACTICE] client={} session={} stopped", clientId, session.getSessionId());
    return snapshot(STOP_SESSION);
  }

  private ControlResult setFeedback(Map<String, Object> data) throws SessionStateException {
    requireActive();
    Object feedback = data.get("feedback");
    if (feedback == null) {
      return withState(ControlResult.failure(SET_FEEDBACK, ErrorType.PROTOCOL_ERROR, "No feedback data provided"));
    }
    session.setLastFeedback(feedback);
    session.setMode(PracticeMode.FEEDBACK);
    return snapshot(SET_FEEDBACK);
  }

  // ----------------- internal -----------------

  private void requireActive() throws SessionStateException {
    if (!isActive()) {
      throw new SessionStateException("No active session");
    }
  }

  private void markCompleted() {
    if (session.getMode() != PracticeMode.COMPLETED) {
      session.setMode(PracticeMode.COMPLETED);
      log.info("[PRACTICE] client={} session={} completed", clientId, session.getSessionId());
    }
    finish(SessionEndReason.COMPLETED);
  }

  /** Hands the summary to the sink once per session; sink failures stay here. */
  private void finish(SessionEndReason reason) {
    if (session == null || session.isSummaryRecorded()) return;
    session.setSummaryRecorded(true);
    if (stats != null) stats.sessionFinished();

    PracticeSessionSummary summary = PracticeSessionSummary.builder()
        .sessionId(session.getSessionId())
        .clientId(clientId)
        .totalSentences(session.getSentences().size())
        .sentencesReached(session.getCurrentIndex() + 1)
        .completed(session.getMode() == PracticeMode.COMPLETED)
        .attempts(session.getAttempts())
        .gesturesDetected(session.getGesturesDetected())
        .endReason(reason.name())
        .startedAt(session.getStartedAt())
        .endedAt(clock.instant())
        .build();
    try {
      sink.sessionFinished(summary);
    } catch (Exception e) {
      log.warn("[PRACTICE] client={} session={} summary not saved", clientId, session.getSessionId(), e);
    }
  }

  private ControlResult snapshot(String action) {
    return ControlResult.builder()
        .success(true)
        .action(action)
        .sessionId(session.getSessionId())
        .currentSentence(session.currentSentence())
        .currentSentenceIndex(session.getCurrentIndex())
        .totalSentences(session.getSentences().size())
        .practiceMode(session.getMode().wireName())
        .lastSentence(session.isLastSentence())
        .feedback(session.getLastFeedback())
        .build();
  }

  private ControlResult withState(ControlResult failure) {
    if (!isActive()) return failure;
    ControlResult s = snapshot(failure.getAction());
    return s.toBuilder()
        .success(false)
        .error(failure.getError())
        .errorType(failure.getErrorType())
        .build();
  }
}
