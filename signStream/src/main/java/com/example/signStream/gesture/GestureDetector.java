package com.example.signStream.gesture;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Optional;

import com.example.signStream.config.GestureProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns a stream of per-frame hand samples into discrete sign attempts.
 *
 * <pre>
 *   IDLE --hands seen--> ACTIVE --pause--> ENDED --hands gone--> IDLE
 *                        ACTIVE --hands lost--> IDLE
 * </pre>
 *
 * An attempt shorter than {@code minGestureDurationMs} is dropped and the
 * detector returns to IDLE without emitting anything. Exactly one
 * {@link GestureEvent} is produced per completed attempt.
 *
 * Not thread-safe: owned by a single connection and driven from its worker
 * thread only.
 */
@Slf4j
public class GestureDetector {

  private final double velocityThreshold;
  private final long pauseDurationMs;
  private final long minGestureDurationMs;
  private final int capacity;
  private final int smoothingWindow;

  private final Deque<GestureSample> buffer;

  private GestureState state = GestureState.IDLE;
  private long startedAt;
  private long lastMotionAt;
  private int activeSamples;

  public GestureDetector(GestureProperties props) {
    if (props.getPauseDurationMs() <= 0 || props.getMinGestureDurationMs() < 0) {
      throw new IllegalArgumentException("gesture durations must be positive");
    }
    if (props.getLandmarkBufferSize() < 2 || props.getSmoothingWindow() < 1) {
      throw new IllegalArgumentException("landmark buffer needs at least 2 samples");
    }
    this.velocityThreshold = props.getVelocityThreshold();
    this.pauseDurationMs = props.getPauseDurationMs();
    this.minGestureDurationMs = props.getMinGestureDurationMs();
    this.capacity = props.getLandmarkBufferSize();
    this.smoothingWindow = props.getSmoothingWindow();
    this.buffer = new ArrayDeque<>(capacity);
  }

  public Optional<GestureEvent> update(GestureSample sample) {
    if (buffer.size() >= capacity) {
      buffer.pollFirst();
    }
    buffer.addLast(sample);
    long ts = sample.timestampMs();

    if (state == GestureState.IDLE) {
      if (sample.hasHands()) {
        state = GestureState.ACTIVE;
        startedAt = ts;
        lastMotionAt = ts;
        activeSamples = 1;
        log.debug("[GESTURE] start at {}", ts);
      }
      return Optional.empty();
    }

    if (state == GestureState.ACTIVE) {
      if (!sample.hasHands()) {
        return finish(ts, GestureEndReason.HANDS_LOST);
      }
      activeSamples++;
      if (motion() >= velocityThreshold) {
        lastMotionAt = ts;
      }
      if (ts - lastMotionAt >= pauseDurationMs) {
        return finish(ts, GestureEndReason.PAUSE);
      }
      return Optional.empty();
    }

    // ENDED: wait for the hands to leave before arming the next attempt
    if (!sample.hasHands()) {
      state = GestureState.IDLE;
    }
    return Optional.empty();
  }

  /**
   * Checks the pause timer without a new sample. Hands are assumed to still
   * be where the last sample saw them.
   */
  public Optional<GestureEvent> poll(long nowMs) {
    if (state == GestureState.ACTIVE && nowMs - lastMotionAt >= pauseDurationMs) {
      return finish(nowMs, GestureEndReason.PAUSE);
    }
    return Optional.empty();
  }

  public GestureState state() {
    return state;
  }

  public boolean isGestureActive() {
    return state == GestureState.ACTIVE;
  }

  public int bufferSize() {
    return buffer.size();
  }

  public void reset() {
    state = GestureState.IDLE;
    startedAt = 0;
    lastMotionAt = 0;
    activeSamples = 0;
    buffer.clear();
  }

  private Optional<GestureEvent> finish(long endTs, GestureEndReason reason) {
    long duration = endTs - startedAt;
    if (duration < minGestureDurationMs) {
      log.debug("[GESTURE] discarded {}ms attempt ({})", duration, reason);
      state = GestureState.IDLE;
      activeSamples = 0;
      return Optional.empty();
    }
    // hands already gone: nothing to wait for, re-arm at once
    state = reason == GestureEndReason.HANDS_LOST ? GestureState.IDLE : GestureState.ENDED;
    GestureEvent event = new GestureEvent(GestureState.ENDED, startedAt, duration, reason, activeSamples);
    log.debug("[GESTURE] end {}ms reason={} samples={}", duration, reason, activeSamples);
    return Optional.of(event);
  }

  /** Mean hand displacement per frame over the smoothing window. */
  private double motion() {
    double total = 0;
    int steps = 0;
    GestureSample newer = null;
    Iterator<GestureSample> it = buffer.descendingIterator();
    while (it.hasNext() && steps < smoothingWindow) {
      GestureSample s = it.next();
      if (!s.hasPosition()) {
        if (newer != null) break;
        continue;
      }
      if (newer != null) {
        double dx = newer.handX() - s.handX();
        double dy = newer.handY() - s.handY();
        total += Math.sqrt(dx * dx + dy * dy);
        steps++;
      }
      newer = s;
    }
    return steps == 0 ? 0.0 : total / steps;
  }
}
