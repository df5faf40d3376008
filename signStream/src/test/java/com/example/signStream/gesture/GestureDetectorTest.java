package com.example.signStream.gesture;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.example.signStream.config.GestureProperties;

class GestureDetectorTest {

  private static final long FRAME_MS = 33;

  private GestureProperties props;
  private GestureDetector detector;

  @BeforeEach
  void setUp() {
    props = new GestureProperties();
    detector = new GestureDetector(props);
  }

  @Test
  void testUpdate_MotionThenStillness_EmitsExactlyOneEvent() {
    // Given: three frames of clear motion, then the hand holds still for 1200ms
    List<GestureEvent> events = new ArrayList<>();
    feed(events, GestureSample.at(0, 0.1, 0.5));
    feed(events, GestureSample.at(33, 0.4, 0.5));
    feed(events, GestureSample.at(66, 0.7, 0.5));

    // When
    for (long t = 66 + FRAME_MS; t <= 66 + 1200; t += FRAME_MS) {
      feed(events, GestureSample.at(t, 0.7, 0.5));
    }

    // Then
    assertEquals(1, events.size());
    GestureEvent e = events.get(0);
    assertEquals(GestureState.ENDED, e.state());
    assertEquals(GestureEndReason.PAUSE, e.reason());
    assertEquals(0, e.startedAt());
    assertTrue(e.durationMs() >= props.getPauseDurationMs());
    assertEquals(GestureState.ENDED, detector.state());
  }

  @Test
  void testUpdate_SubThresholdJitter_TreatedAsStillness() {
    List<GestureEvent> events = new ArrayList<>();
    for (long t = 0, i = 0; t <= 1500; t += FRAME_MS, i++) {
      double jitter = (i % 2 == 0) ? 0.001 : -0.001;
      feed(events, GestureSample.at(t, 0.5 + jitter, 0.5 - jitter));
    }

    assertEquals(1, events.size());
    assertEquals(GestureEndReason.PAUSE, events.get(0).reason());
    assertTrue(events.get(0).durationMs() >= 1000);
    assertTrue(events.get(0).durationMs() < 1000 + FRAME_MS);
  }

  @Test
  void testUpdate_HandsLostAfterLongAttempt_EndsWithHandsLost() {
    List<GestureEvent> events = new ArrayList<>();
    double x = 0.1;
    long t = 0;
    for (; t < 600; t += FRAME_MS) {
      feed(events, GestureSample.at(t, x, 0.5));
      x += 0.05;
    }
    assertTrue(detector.isGestureActive());

    feed(events, GestureSample.presence(false, t));

    assertEquals(1, events.size());
    assertEquals(GestureEndReason.HANDS_LOST, events.get(0).reason());
    assertEquals(t, events.get(0).durationMs());
    assertTrue(events.get(0).sampleCount() > 1);
  }

  @Test
  void testUpdate_HandsBackRightAfterHandsLost_SegmentsNextAttempt() {
    // Given: a first attempt ended by a single frame without hands
    List<GestureEvent> events = new ArrayList<>();
    long t = moveFor(events, 0, 600);
    feed(events, GestureSample.presence(false, t));
    assertEquals(1, events.size());
    assertEquals(GestureState.IDLE, detector.state());

    // When: hands return on the very next frame, keep moving for 2s, then leave
    long secondStart = t + FRAME_MS;
    t = moveFor(events, secondStart, secondStart + 2000);
    feed(events, GestureSample.presence(false, t));

    // Then
    assertEquals(2, events.size());
    GestureEvent second = events.get(1);
    assertEquals(GestureEndReason.HANDS_LOST, second.reason());
    assertEquals(secondStart, second.startedAt());
    assertEquals(t - secondStart, second.durationMs());
  }

  @Test
  void testUpdate_AttemptShorterThanMinimum_IsDiscarded() {
    List<GestureEvent> events = new ArrayList<>();
    feed(events, GestureSample.at(0, 0.2, 0.2));
    feed(events, GestureSample.at(33, 0.3, 0.2));
    feed(events, GestureSample.at(66, 0.4, 0.2));

    feed(events, GestureSample.presence(false, 99));

    assertTrue(events.isEmpty());
    assertEquals(GestureState.IDLE, detector.state());
  }

  @Test
  void testUpdate_EndedWaitsForHandsToLeaveBeforeRearming() {
    List<GestureEvent> events = new ArrayList<>();
    long t = 0;
    for (; t <= 1100; t += FRAME_MS) {
      feed(events, GestureSample.presence(true, t));
    }
    assertEquals(1, events.size());
    assertEquals(GestureState.ENDED, detector.state());

    // hands still up: no new attempt
    feed(events, GestureSample.presence(true, t += FRAME_MS));
    assertEquals(GestureState.ENDED, detector.state());

    feed(events, GestureSample.presence(false, t += FRAME_MS));
    assertEquals(GestureState.IDLE, detector.state());

    feed(events, GestureSample.presence(true, t += FRAME_MS));
    assertEquals(GestureState.ACTIVE, detector.state());
    assertEquals(1, events.size());
  }

  @Test
  void testPoll_PauseElapsedWithoutFrames_EmitsOnce() {
    detector.update(GestureSample.at(0, 0.5, 0.5));
    detector.update(GestureSample.at(33, 0.5, 0.5));

    assertTrue(detector.poll(500).isEmpty());
    Optional<GestureEvent> event = detector.poll(1000);
    Optional<GestureEvent> again = detector.poll(2000);

    assertTrue(event.isPresent());
    assertEquals(1000, event.get().durationMs());
    assertTrue(again.isEmpty());
  }

  @Test
  void testPoll_Idle_ReturnsEmpty() {
    assertTrue(detector.poll(10_000).isEmpty());
    assertEquals(GestureState.IDLE, detector.state());
  }

  @Test
  void testBuffer_IsBoundedByConfiguredSize() {
    for (int i = 0; i < props.getLandmarkBufferSize() * 3; i++) {
      detector.update(GestureSample.presence(false, i * FRAME_MS));
    }

    assertEquals(props.getLandmarkBufferSize(), detector.bufferSize());
  }

  @Test
  void testReset_ClearsStateAndBuffer() {
    detector.update(GestureSample.presence(true, 0));
    detector.update(GestureSample.presence(true, 33));

    detector.reset();

    assertEquals(GestureState.IDLE, detector.state());
    assertEquals(0, detector.bufferSize());
  }

  @Test
  void testConstructor_InvalidSettings_Rejected() {
    GestureProperties bad = new GestureProperties();
    bad.setPauseDurationMs(0);
    assertThrows(IllegalArgumentException.class, () -> new GestureDetector(bad));

    GestureProperties tiny = new GestureProperties();
    tiny.setLandmarkBufferSize(1);
    assertThrows(IllegalArgumentException.class, () -> new GestureDetector(tiny));
  }

  /** Feeds a steadily moving hand from {@code from} until {@code until}; returns the next frame time. */
  private long moveFor(List<GestureEvent> sink, long from, long until) {
    long t = from;
    double x = 0.1;
    for (; t < until; t += FRAME_MS) {
      feed(sink, GestureSample.at(t, x, 0.5));
      x += 0.05;
    }
    return t;
  }

  private void feed(List<GestureEvent> sink, GestureSample sample) {
    detector.update(sample).ifPresent(sink::add);
  }
}
