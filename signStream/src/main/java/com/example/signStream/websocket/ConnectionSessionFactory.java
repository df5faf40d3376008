package com.example.signStream.websocket;

import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import com.example.signStream.codec.FrameAnnotator;
import com.example.signStream.codec.FrameCodec;
import com.example.signStream.config.ConnectionProperties;
import com.example.signStream.config.DetectorProperties;
import com.example.signStream.config.GestureProperties;
import com.example.signStream.config.VideoProperties;
import com.example.signStream.detector.LandmarkDetector;
import com.example.signStream.gesture.GestureDetector;
import com.example.signStream.pipeline.FrameProcessor;
import com.example.signStream.practice.PracticeSessionManager;
import com.example.signStream.practice.PracticeSessionSink;
import com.example.signStream.service.StreamStatsService;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Wires the per-connection state (gesture detector, practice manager,
 * frame processor, worker thread) onto the shared beans.
 */
@Component
public class ConnectionSessionFactory {

  private final ObjectMapper om;
  private final FrameCodec codec;
  private final FrameAnnotator annotator;
  private final LandmarkDetector detector;
  private final ExecutorService detectorExecutor;
  private final VideoProperties video;
  private final GestureProperties gesture;
  private final DetectorProperties detectorProps;
  private final ConnectionProperties connection;
  private final PracticeSessionSink sink;
  private final StreamStatsService stats;

  public ConnectionSessionFactory(ObjectMapper om,
                                  FrameCodec codec,
                                  FrameAnnotator annotator,
                                  LandmarkDetector detector,
                                  @Qualifier("detectorExecutor") ExecutorService detectorExecutor,
                                  VideoProperties video,
                                  GestureProperties gesture,
                                  DetectorProperties detectorProps,
                                  ConnectionProperties connection,
                                  PracticeSessionSink sink,
                                  StreamStatsService stats) {
    this.om = om;
    this.codec = codec;
    this.annotator = annotator;
    this.detector = detector;
    this.detectorExecutor = detectorExecutor;
    this.video = video;
    this.gesture = gesture;
    this.detectorProps = detectorProps;
    this.connection = connection;
    this.sink = sink;
    this.stats = stats;
  }

  public ConnectionSession create(WebSocketSession session) {
    String clientId = "client_" + UUID.randomUUID().toString().substring(0, 8);

    GestureDetector gestureDetector = new GestureDetector(gesture);
    PracticeSessionManager practice = new PracticeSessionManager(clientId, gestureDetector, sink, stats);
    FrameProcessor processor = new FrameProcessor(
        codec, annotator, detector, detectorExecutor, detectorProps.getTimeoutMs(),
        gestureDetector, gesture.isEnabled(), practice, video);

    WebSocketSession out = new ConcurrentWebSocketSessionDecorator(
        session, connection.getSendTimeLimitMs(), connection.getSendBufferSizeLimit());
    ExecutorService worker = Executors.newSingleThreadExecutor(new CustomizableThreadFactory(clientId + "-"));

    return new ConnectionSession(clientId, out, om, processor, practice, worker, stats,
        connection.getMaxQueuedFrames(), connection.getWorkerShutdownMs());
  }
}
