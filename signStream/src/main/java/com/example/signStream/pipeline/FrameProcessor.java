package com.example.signStream.pipeline;

import java.awt.image.BufferedImage;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.example.signStream.codec.DecodedFrame;
import com.example.signStream.codec.EncodedFrame;
import com.example.signStream.codec.FrameAnnotator;
import com.example.signStream.codec.FrameCodec;
import com.example.signStream.config.VideoProperties;
import com.example.signStream.detector.LandmarkDetection;
import com.example.signStream.detector.LandmarkDetector;
import com.example.signStream.dto.LandmarkPresence;
import com.example.signStream.dto.PracticeFrameUpdate;
import com.example.signStream.dto.QualityMetrics;
import com.example.signStream.error.ErrorType;
import com.example.signStream.error.FrameDecodeException;
import com.example.signStream.error.FrameEncodeException;
import com.example.signStream.error.LandmarkDetectionException;
import com.example.signStream.gesture.GestureDetector;
import com.example.signStream.gesture.GestureEvent;
import com.example.signStream.gesture.GestureSample;
import com.example.signStream.practice.PracticeSessionManager;

import lombok.extern.slf4j.Slf4j;

/**
 * decode → detect → gesture → practice → annotate → encode, for one frame.
 *
 * {@link #process(FrameSample)} never throws: every stage failure becomes a
 * {@code success=false} {@link ProcessingResult}. One instance per
 * connection; frames must be fed sequentially.
 */
@Slf4j
public class FrameProcessor {

  private final FrameCodec codec;
  private final FrameAnnotator annotator;
  private final LandmarkDetector detector;
  private final ExecutorService detectorExecutor;
  private final long detectorTimeoutMs;
  private final GestureDetector gestureDetector;
  private final boolean gestureEnabled;
  private final PracticeSessionManager practice;
  private final VideoProperties video;

  public FrameProcessor(FrameCodec codec,
                        FrameAnnotator annotator,
                        LandmarkDetector detector,
                        ExecutorService detectorExecutor,
                        long detectorTimeoutMs,
                        GestureDetector gestureDetector,
                        boolean gestureEnabled,
                        PracticeSessionManager practice,
                        VideoProperties video) {
    this.codec = codec;
    this.annotator = annotator;
    this.detector = detector;
    this.detectorExecutor = detectorExecutor;
    this.detectorTimeoutMs = detectorTimeoutMs;
    this.gestureDetector = gestureDetector;
    this.gestureEnabled = gestureEnabled;
    this.practice = practice;
    this.video = video;
  }

  public ProcessingResult process(FrameSample sample) {
    long start = System.nanoTime();
    try {
      DecodedFrame frame;
      try {
        frame = codec.decode(sample.frameData());
      } catch (FrameDecodeException e) {
        log.debug("[PIPE] frame {} decode failed: {}", sample.sequence(), e.getMessage());
        return failed(sample, e.getType(), e.getMessage(), start);
      }

      long detectStart = System.nanoTime();
      LandmarkDetection detection;
      try {
        detection = detect(frame);
      } catch (LandmarkDetectionException e) {
        log.warn("[PIPE] frame {} detector failed: {}", sample.sequence(), e.getMessage());
        return detectorFailed(sample, frame, e, elapsedMs(detectStart), start);
      }
      double detectorMs = elapsedMs(detectStart);

      Optional<GestureEvent> event = Optional.empty();
      if (gestureEnabled) {
        event = gestureDetector.update(GestureSample.of(detection, sample.receivedAtMs()));
      }
      PracticeFrameUpdate practiceUpdate = practice.onFrame(gestureDetector.state(), event);

      BufferedImage annotated = annotator.annotate(frame.image(), detection);
      EncodedFrame encoded;
      try {
        encoded = codec.encode(annotated);
      } catch (FrameEncodeException e) {
        log.warn("[PIPE] frame {} encode failed: {}", sample.sequence(), e.getMessage());
        return failed(sample, e.getType(), e.getMessage(), start);
      }

      double totalMs = elapsedMs(start);
      LandmarkPresence presence = detection.presence();

      ProcessingResult result = ProcessingResult.builder()
          .success(true)
          .serverFrameNumber(sample.sequence())
          .clientFrameNumber(sample.clientFrameNumber())
          .clientTimestamp(sample.clientTimestamp())
          .frameData(encoded.dataUrl())
          .landmarks(presence)
          .detectorTimeMs(round2(detectorMs))
          .encodeTimeMs(encoded.metrics().getEncodingTimeMs())
          .totalPipelineTimeMs(round2(totalMs))
          .encodingMetrics(encoded.metrics())
          .qualityMetrics(new QualityMetrics(landmarksConfidence(presence), processingEfficiency(totalMs)))
          .gestureState(gestureDetector.state())
          .practice(practiceUpdate)
          .build();

      log.debug("[PIPE] frame {} done in {}ms landmarks={}", sample.sequence(), result.getTotalPipelineTimeMs(), presence);
      return result;

    } catch (RuntimeException e) {
      log.error("[PIPE] frame {} pipeline error", sample.sequence(), e);
      return failed(sample, ErrorType.PIPELINE_ERROR, "Pipeline error: " + e.getMessage(), start);
    }
  }

  /** Fraction of the three landmark groups present in the frame. */
  public static double landmarksConfidence(LandmarkPresence presence) {
    return presence.detectedCount() / 3.0;
  }

  /** frame budget / actual time, clamped to [minProcessingEfficiency, 1.0]. */
  public double processingEfficiency(double totalMs) {
    if (totalMs <= 0) return 1.0;
    double ratio = video.getFrameBudgetMs() / totalMs;
    double floor = video.getMinProcessingEfficiency();
    return round2(Math.max(floor, Math.min(1.0, ratio)));
  }

  private LandmarkDetection detect(DecodedFrame frame) throws LandmarkDetectionException {
    Future<LandmarkDetection> future;
    try {
      future = detectorExecutor.submit(() -> detector.detect(frame));
    } catch (RejectedExecutionException e) {
      throw new LandmarkDetectionException("Detector pool is not accepting work", e);
    }

    try {
      return future.get(detectorTimeoutMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new LandmarkDetectionException("Detector timed out after " + detectorTimeoutMs + "ms", e);
    } catch (InterruptedException e) {
      // connection closing
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new LandmarkDetectionException("Detection cancelled", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof LandmarkDetectionException) {
        throw (LandmarkDetectionException) cause;
      }
      throw new LandmarkDetectionException("Detector failed: " + cause, cause);
    }
  }

  /**
   * The raw frame is still sent back (best effort) so the client's preview
   * keeps moving while the detector is down.
   */
  private ProcessingResult detectorFailed(FrameSample sample, DecodedFrame frame,
                                          LandmarkDetectionException e, double detectorMs, long start) {
    ProcessingResult result = failed(sample, e.getType(), e.getMessage(), start);
    result.setDetectorTimeMs(round2(detectorMs));
    if (Thread.currentThread().isInterrupted()) {
      return result;
    }
    try {
      EncodedFrame raw = codec.encode(frame.image());
      result.setFrameData(raw.dataUrl());
      result.setEncodingMetrics(raw.metrics());
      result.setEncodeTimeMs(raw.metrics().getEncodingTimeMs());
    } catch (FrameEncodeException encodeError) {
      log.debug("[PIPE] frame {} raw re-encode failed: {}", sample.sequence(), encodeError.getMessage());
    }
    result.setTotalPipelineTimeMs(round2(elapsedMs(start)));
    return result;
  }

  private ProcessingResult failed(FrameSample sample, ErrorType type, String error, long start) {
    ProcessingResult r = ProcessingResult.failure(sample, type, error);
    r.setTotalPipelineTimeMs(round2(elapsedMs(start)));
    r.setGestureState(gestureDetector.state());
    return r;
  }

  private static double elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000.0;
  }

  private static double round2(double v) {
    return Math.round(v * 100.0) / 100.0;
  }
}
