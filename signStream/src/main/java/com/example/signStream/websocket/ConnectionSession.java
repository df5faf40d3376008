package com.example.signStream.websocket;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import com.example.signStream.dto.ControlResult;
import com.example.signStream.dto.FrameMetadata;
import com.example.signStream.dto.StreamMessage;
import com.example.signStream.error.ProtocolException;
import com.example.signStream.pipeline.FrameProcessor;
import com.example.signStream.pipeline.FrameSample;
import com.example.signStream.pipeline.ProcessingResult;
import com.example.signStream.practice.PracticeSessionManager;
import com.example.signStream.service.StreamStatsService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Protocol loop of one /ws/video connection.
 *
 * Frames and control actions run one at a time on this connection's worker
 * thread, so the gesture and practice state it owns needs no locking.
 * {@code ping} and {@code get_stats} are answered on the receiving thread
 * and never wait behind frame work. At most {@code maxQueuedFrames} frames
 * wait for the worker; on overflow the oldest is answered as dropped.
 */
@Slf4j
public class ConnectionSession {

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final String clientId;
  private final WebSocketSession ws;
  private final ObjectMapper om;
  private final FrameProcessor processor;
  private final PracticeSessionManager practice;
  private final ExecutorService worker;
  private final StreamStatsService stats;
  private final int maxQueuedFrames;
  private final long workerShutdownMs;

  private final Deque<FrameSample> mailbox = new ArrayDeque<>();
  private final AtomicLong sequence = new AtomicLong();
  private final AtomicBoolean closed = new AtomicBoolean();
  private volatile Thread workerThread;

  private final AtomicLong framesReceived = new AtomicLong();
  private final AtomicLong framesProcessed = new AtomicLong();
  private final AtomicLong framesFailed = new AtomicLong();
  private final AtomicLong framesDropped = new AtomicLong();
  private final AtomicLong totalPipelineMicros = new AtomicLong();
  private final AtomicLong peakPipelineMicros = new AtomicLong();

  public ConnectionSession(String clientId,
                           WebSocketSession ws,
                           ObjectMapper om,
                           FrameProcessor processor,
                           PracticeSessionManager practice,
                           ExecutorService worker,
                           StreamStatsService stats,
                           int maxQueuedFrames,
                           long workerShutdownMs) {
    this.clientId = clientId;
    this.ws = ws;
    this.om = om;
    this.processor = processor;
    this.practice = practice;
    this.worker = worker;
    this.stats = stats;
    this.maxQueuedFrames = Math.max(1, maxQueuedFrames);
    this.workerShutdownMs = workerShutdownMs;
  }

  public String getClientId() {
    return clientId;
  }

  public boolean isClosed() {
    return closed.get();
  }

  public void sendConnectionEstablished(Map<String, Object> serverInfo) {
    send(StreamMessage.connectionEstablished(clientId, serverInfo));
  }

  /**
   * Entry point for every inbound text message. Always answers, never throws.
   */
  public void handleText(String payload) {
    if (closed.get()) return;

    JsonNode node;
    try {
      node = om.readTree(payload);
    } catch (JsonProcessingException e) {
      log.warn("[WS] client={} invalid JSON: {}", clientId, e.getOriginalMessage());
      send(StreamMessage.error("Invalid JSON format"));
      return;
    }

    try {
      MessageType type = MessageType.from(node);
      switch (type) {
        case PING:
          send(StreamMessage.pong());
          break;
        case GET_STATS:
          send(StreamMessage.stats(clientId, statsSnapshot()));
          break;
        case RAW_FRAME:
          enqueueFrame(toSample(node));
          break;
        case CONTROL:
          handleControl(node);
          break;
        case PRACTICE_SESSION_START:
          Map<String, Object> start = toMap(node);
          submit(() -> send(StreamMessage.sessionStarted(
              practice.control(PracticeSessionManager.START_SESSION, start))));
          break;
        default:
          throw new ProtocolException("Unsupported message type: " + type.wireName());
      }
    } catch (ProtocolException e) {
      log.warn("[WS] client={} {}", clientId, e.getMessage());
      send(StreamMessage.error(e.getMessage()));
    } catch (Exception e) {
      fail(e);
    }
  }

  /**
   * Stops the worker (interrupting an in-flight detector call), drops queued
   * frames and ends any open practice session once the worker has stopped.
   * Idempotent.
   */
  public void close() {
    if (!closed.compareAndSet(false, true)) return;

    synchronized (mailbox) {
      mailbox.clear();
    }
    worker.shutdownNow();

    boolean workerStopped = Thread.currentThread() == workerThread;
    if (!workerStopped) {
      try {
        workerStopped = worker.awaitTermination(workerShutdownMs, TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }

    // practice state belongs to the worker; never touch it while a task may still run
    if (workerStopped) {
      practice.close();
    } else {
      log.warn("[WS] client={} worker did not stop within {}ms, session summary skipped", clientId, workerShutdownMs);
    }
    log.info("[WS] client={} closed frames={} dropped={} failed={}",
        clientId, framesProcessed.get(), framesDropped.get(), framesFailed.get());
  }

  // ----------------- handlers -----------------

  private void handleControl(JsonNode node) throws ProtocolException {
    JsonNode actionNode = node.get("action");
    if (actionNode == null || !actionNode.isTextual() || actionNode.asText().isBlank()) {
      throw new ProtocolException("Control message is missing 'action'");
    }
    String action = actionNode.asText().trim();
    JsonNode data = node.get("data");
    Map<String, Object> payload = (data != null && data.isObject()) ? toMap(data) : new LinkedHashMap<>();

    // start_session may carry its fields at the top level, like practice_session_start
    if (PracticeSessionManager.START_SESSION.equals(action)) {
      if (!payload.containsKey("story_sentences") && node.has("story_sentences")) {
        payload.put("story_sentences", om.convertValue(node.get("story_sentences"), Object.class));
      }
      if (!payload.containsKey("session_id") && node.hasNonNull("session_id")) {
        payload.put("session_id", node.get("session_id").asText());
      }
    }

    submit(() -> {
      ControlResult result = practice.control(action, payload);
      send(StreamMessage.controlResponse(action, result));
    });
  }

  private void enqueueFrame(FrameSample sample) {
    framesReceived.incrementAndGet();
    stats.frameReceived();

    FrameSample evicted = null;
    synchronized (mailbox) {
      if (mailbox.size() >= maxQueuedFrames) {
        evicted = mailbox.pollFirst();
      }
      mailbox.addLast(sample);
    }

    if (evicted != null) {
      framesDropped.incrementAndGet();
      stats.frameDropped();
      log.debug("[WS] client={} dropped frame {}", clientId, evicted.sequence());
      send(toMessage(ProcessingResult.dropped(evicted)));
    }
    submit(this::processNextFrame);
  }

  private void processNextFrame() {
    FrameSample next;
    synchronized (mailbox) {
      next = mailbox.pollFirst();
    }
    if (next == null) return; // superseded by an eviction

    ProcessingResult result = processor.process(next);

    long micros = Math.round(result.getTotalPipelineTimeMs() * 1000);
    framesProcessed.incrementAndGet();
    if (!result.isSuccess()) framesFailed.incrementAndGet();
    totalPipelineMicros.addAndGet(micros);
    peakPipelineMicros.accumulateAndGet(micros, Math::max);
    stats.frameProcessed(result.isSuccess());

    send(toMessage(result));
  }

  // ----------------- plumbing -----------------

  private void submit(Runnable task) {
    try {
      worker.execute(() -> {
        workerThread = Thread.currentThread();
        try {
          task.run();
        } catch (Exception e) {
          fail(e);
        }
      });
    } catch (RejectedExecutionException e) {
      log.debug("[WS] client={} closing, task rejected", clientId);
    }
  }

  private FrameSample toSample(JsonNode node) {
    JsonNode frameData = node.get("frame_data");
    JsonNode metadata = node.path("metadata");
    JsonNode frameNumber = metadata.get("frame_number");
    JsonNode timestamp = metadata.get("timestamp");

    return new FrameSample(
        frameData != null && frameData.isTextual() ? frameData.asText() : null,
        frameNumber != null && frameNumber.canConvertToLong() ? frameNumber.asLong() : null,
        timestamp != null && !timestamp.isNull() ? timestamp.asText() : null,
        sequence.incrementAndGet(),
        System.currentTimeMillis());
  }

  private Map<String, Object> toMap(JsonNode node) {
    Map<String, Object> m = om.convertValue(node, MAP_TYPE);
    return m == null ? new LinkedHashMap<>() : m;
  }

  static StreamMessage toMessage(ProcessingResult r) {
    FrameMetadata metadata = FrameMetadata.builder()
        .serverFrameNumber(r.getServerFrameNumber())
        .clientFrameNumber(r.getClientFrameNumber())
        .clientTimestamp(r.getClientTimestamp())
        .processingTimeMs(r.getDetectorTimeMs())
        .encodingTimeMs(r.getEncodeTimeMs())
        .totalPipelineTimeMs(r.getTotalPipelineTimeMs())
        .landmarksDetected(r.getLandmarks())
        .qualityMetrics(r.getQualityMetrics())
        .encodingMetadata(r.getEncodingMetrics())
        .gestureState(r.getGestureState() == null ? null : r.getGestureState().wireName())
        .practiceSession(r.getPractice())
        .success(r.isSuccess())
        .error(r.getError())
        .errorType(r.getErrorType() == null ? null : r.getErrorType().wireName())
        .build();
    return StreamMessage.processedFrame(r.getFrameData(), metadata);
  }

  Map<String, Object> statsSnapshot() {
    long processed = framesProcessed.get();
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("frames_received", framesReceived.get());
    m.put("frames_processed", processed);
    m.put("frames_failed", framesFailed.get());
    m.put("frames_dropped", framesDropped.get());
    m.put("avg_processing_time_ms", processed == 0 ? 0.0 : round2(totalPipelineMicros.get() / 1000.0 / processed));
    m.put("peak_processing_time_ms", round2(peakPipelineMicros.get() / 1000.0));
    synchronized (mailbox) {
      m.put("queued_frames", mailbox.size());
    }
    m.put("practice_active", practice.isActive());
    return m;
  }

  private void send(StreamMessage msg) {
    if (!ws.isOpen()) return;
    try {
      ws.sendMessage(new TextMessage(om.writeValueAsString(msg)));
    } catch (Exception e) {
      log.warn("[WS] client={} send failed type={}", clientId, msg.getType(), e);
    }
  }

  /** Last line of defense: report, then drop only this connection. */
  private void fail(Throwable e) {
    log.error("[WS] client={} unrecoverable error, closing", clientId, e);
    send(StreamMessage.error("Internal server error"));
    try {
      ws.close(CloseStatus.SERVER_ERROR);
    } catch (Exception closeError) {
      log.debug("[WS] client={} close after error failed", clientId, closeError);
    }
    close();
  }

  private static double round2(double v) {
    return Math.round(v * 100.0) / 100.0;
  }
}
