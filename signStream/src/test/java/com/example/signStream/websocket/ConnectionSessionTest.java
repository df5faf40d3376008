package com.example.signStream.websocket;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import com.example.signStream.codec.FrameAnnotator;
import com.example.signStream.codec.FrameCodec;
import com.example.signStream.config.GestureProperties;
import com.example.signStream.config.VideoProperties;
import com.example.signStream.detector.LandmarkDetection;
import com.example.signStream.detector.LandmarkDetector;
import com.example.signStream.gesture.GestureDetector;
import com.example.signStream.pipeline.FrameProcessor;
import com.example.signStream.practice.PracticeSessionManager;
import com.example.signStream.practice.PracticeSessionSink;
import com.example.signStream.practice.PracticeSessionSummary;
import com.example.signStream.service.StreamStatsService;
import com.example.signStream.testsupport.TestFrames;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Protocol behaviour of one connection against a mocked WebSocket session.
 */
class ConnectionSessionTest {

  private final ObjectMapper om = new ObjectMapper();
  private final List<JsonNode> sent = new CopyOnWriteArrayList<>();

  private WebSocketSession ws;
  private LandmarkDetector detector;
  private PracticeSessionSink sink;
  private ExecutorService detectorPool;
  private ConnectionSession session;

  @BeforeEach
  void setUp() throws Exception {
    ws = mock(WebSocketSession.class);
    when(ws.isOpen()).thenReturn(true);
    doAnswer(inv -> {
      TextMessage m = inv.getArgument(0);
      sent.add(om.readTree(m.getPayload()));
      return null;
    }).when(ws).sendMessage(any());

    detector = mock(LandmarkDetector.class);
    when(detector.detect(any())).thenReturn(LandmarkDetection.none());
    sink = mock(PracticeSessionSink.class);
    detectorPool = Executors.newFixedThreadPool(2);

    VideoProperties video = new VideoProperties();
    StreamStatsService stats = new StreamStatsService();
    GestureDetector gestureDetector = new GestureDetector(new GestureProperties());
    PracticeSessionManager practice = new PracticeSessionManager("client_test", gestureDetector, sink, stats);
    FrameProcessor processor = new FrameProcessor(new FrameCodec(video), new FrameAnnotator(), detector,
        detectorPool, 5000, gestureDetector, true, practice, video);

    session = new ConnectionSession("client_test", ws, om, processor, practice,
        Executors.newSingleThreadExecutor(), stats, 2, 1000);
  }

  @AfterEach
  void tearDown() {
    session.close();
    detectorPool.shutdownNow();
  }

  private List<JsonNode> ofType(String type) {
    return sent.stream().filter(n -> type.equals(n.path("type").asText())).collect(Collectors.toList());
  }

  private List<JsonNode> awaitType(String type, int count) throws InterruptedException {
    long deadline = System.currentTimeMillis() + 5000;
    while (System.currentTimeMillis() < deadline) {
      List<JsonNode> found = ofType(type);
      if (found.size() >= count) return found;
      Thread.sleep(10);
    }
    fail("expected " + count + " '" + type + "' messages, got " + ofType(type).size() + " in " + sent);
    return List.of();
  }

  private static String rawFrame(String frameData, long frameNumber) {
    return "{\"type\":\"raw_frame\",\"frame_data\":\"" + frameData + "\","
        + "\"metadata\":{\"frame_number\":" + frameNumber + ",\"timestamp\":\"2024-05-01T10:00:00Z\"}}";
  }

  @Test
  void testPing_AnsweredWithPong() throws Exception {
    session.handleText("{\"type\":\"ping\"}");

    assertEquals(1, awaitType("pong", 1).size());
  }

  @Test
  void testUnknownType_ReportsErrorAndStaysOpen() throws Exception {
    session.handleText("{\"type\":\"foo\"}");
    session.handleText("{\"type\":\"ping\"}");

    JsonNode err = awaitType("error", 1).get(0);
    assertEquals("Unknown message type: foo", err.path("message").asText());
    awaitType("pong", 1);
    verify(ws, never()).close(any());
  }

  @Test
  void testInvalidJson_ReportsError() throws Exception {
    session.handleText("{not json");
    session.handleText("[1,2,3]");

    List<JsonNode> errors = awaitType("error", 2);
    assertEquals("Invalid JSON format", errors.get(0).path("message").asText());
    assertFalse(session.isClosed());
  }

  @Test
  void testRawFrame_EchoesClientFrameNumber() throws Exception {
    // When
    session.handleText(rawFrame(TestFrames.jpegDataUrl(48, 32), 42));

    // Then
    JsonNode msg = awaitType("processed_frame", 1).get(0);
    JsonNode md = msg.path("metadata");
    assertTrue(md.path("success").asBoolean());
    assertEquals(42, md.path("client_frame_number").asLong());
    assertEquals(1, md.path("server_frame_number").asLong());
    assertEquals("2024-05-01T10:00:00Z", md.path("client_timestamp").asText());
    assertTrue(msg.path("frame_data").asText().startsWith("data:image/jpeg;base64,"));
    assertFalse(md.path("landmarks_detected").path("hands").asBoolean());
  }

  @Test
  void testRawFrame_Malformed_ReportsDecodeError() throws Exception {
    session.handleText(rawFrame("data:image/jpeg;base64,AAAA", 7));

    JsonNode md = awaitType("processed_frame", 1).get(0).path("metadata");
    assertFalse(md.path("success").asBoolean());
    assertEquals("decode_error", md.path("error_type").asText());
    assertEquals(7, md.path("client_frame_number").asLong());
    assertEquals(0.0, md.path("quality_metrics").path("landmarks_confidence").asDouble());
  }

  @Test
  void testRawFrame_WorkerBusy_DropsOldestQueuedFrames() throws Exception {
    // Given: the first frame blocks inside the detector
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    when(detector.detect(any())).thenAnswer(inv -> {
      entered.countDown();
      release.await(5, TimeUnit.SECONDS);
      return LandmarkDetection.none();
    });
    String frame = TestFrames.jpegDataUrl(16, 16);
    session.handleText(rawFrame(frame, 1));
    assertTrue(entered.await(5, TimeUnit.SECONDS));

    // When: four more arrive while it is busy
    for (int i = 2; i <= 5; i++) {
      session.handleText(rawFrame(frame, i));
    }
    release.countDown();

    // Then: every frame is answered, the two oldest waiting ones as dropped
    List<JsonNode> all = awaitType("processed_frame", 5);
    List<Long> dropped = all.stream()
        .filter(n -> "frame_dropped".equals(n.path("metadata").path("error_type").asText()))
        .map(n -> n.path("metadata").path("client_frame_number").asLong())
        .collect(Collectors.toList());
    assertEquals(List.of(2L, 3L), dropped);

    session.handleText("{\"type\":\"get_stats\"}");
    JsonNode stats = awaitType("stats", 1).get(0).path("processing_stats");
    assertEquals(5, stats.path("frames_received").asLong());
    assertEquals(2, stats.path("frames_dropped").asLong());
    assertEquals(3, stats.path("frames_processed").asLong());
  }

  @Test
  void testControl_NoSession_ReportsFailure() throws Exception {
    session.handleText("{\"type\":\"control\",\"action\":\"next_sentence\",\"data\":{}}");

    JsonNode msg = awaitType("control_response", 1).get(0);
    assertEquals("next_sentence", msg.path("action").asText());
    assertFalse(msg.path("result").path("success").asBoolean());
    assertEquals("No active session", msg.path("result").path("error").asText());
  }

  @Test
  void testControl_MissingAction_ReportsError() throws Exception {
    session.handleText("{\"type\":\"control\"}");

    assertEquals(1, awaitType("error", 1).size());
  }

  @Test
  void testPracticeFlow_StartAdvanceAndDisconnect() throws Exception {
    // Given
    session.handleText("{\"type\":\"practice_session_start\",\"session_id\":\"s1\","
        + "\"story_sentences\":[\"A\",\"B\",\"C\"]}");
    JsonNode started = awaitType("practice_session_response", 1).get(0);
    assertEquals("session_started", started.path("action").asText());
    assertEquals("s1", started.path("result").path("session_id").asText());
    assertEquals("A", started.path("result").path("current_sentence").asText());

    // When
    session.handleText("{\"type\":\"control\",\"action\":\"next_sentence\"}");
    JsonNode next = awaitType("control_response", 1).get(0);
    session.handleText(rawFrame(TestFrames.jpegDataUrl(16, 16), 9));
    JsonNode frame = awaitType("processed_frame", 1).get(0);
    session.close();

    // Then
    assertEquals("B", next.path("result").path("current_sentence").asText());
    assertEquals("s1", frame.path("metadata").path("practice_session").path("session_id").asText());
    verify(sink).sessionFinished(argThat((PracticeSessionSummary s) -> "DISCONNECTED".equals(s.getEndReason())));
  }

  @Test
  void testControl_StartSessionWithData_UsesPayload() throws Exception {
    session.handleText("{\"type\":\"control\",\"action\":\"start_session\","
        + "\"data\":{\"story_sentences\":[\"Hi\"],\"session_id\":\"x\"}}");

    JsonNode msg = awaitType("control_response", 1).get(0);
    assertTrue(msg.path("result").path("success").asBoolean());
    assertTrue(msg.path("result").path("is_last_sentence").asBoolean());
  }

  @Test
  void testClose_WorkerStillRunning_LeavesPracticeStateAlone() throws Exception {
    // Given: a worker that will not terminate in time
    ExecutorService stuckWorker = mock(ExecutorService.class);
    when(stuckWorker.awaitTermination(anyLong(), any())).thenReturn(false);
    StreamStatsService stats = new StreamStatsService();
    GestureDetector gestureDetector = new GestureDetector(new GestureProperties());
    PracticeSessionManager practice = new PracticeSessionManager("client_stuck", gestureDetector, sink, stats);
    practice.start(List.of("A"), "s-stuck");
    ConnectionSession stuck = new ConnectionSession("client_stuck", ws, om, mock(FrameProcessor.class),
        practice, stuckWorker, stats, 2, 10);

    // When
    stuck.close();

    // Then
    verify(stuckWorker).shutdownNow();
    verify(sink, never()).sessionFinished(any());
    assertTrue(practice.isActive());
    assertTrue(stuck.isClosed());
  }

  @Test
  void testClose_EndsActiveSessionAsDisconnected() throws Exception {
    session.handleText("{\"type\":\"practice_session_start\",\"story_sentences\":[\"A\"]}");
    awaitType("practice_session_response", 1);

    session.close();

    verify(sink, times(1)).sessionFinished(argThat((PracticeSessionSummary s) -> "DISCONNECTED".equals(s.getEndReason())));
  }

  @Test
  void testClose_IgnoresLaterMessages() throws Exception {
    session.close();
    session.handleText("{\"type\":\"ping\"}");

    Thread.sleep(100);
    assertTrue(ofType("pong").isEmpty());
    assertTrue(session.isClosed());
  }
}
