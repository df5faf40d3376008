package com.example.signStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import com.example.signStream.detector.LandmarkDetector;
import com.example.signStream.practice.PracticeSessionSummary;
import com.example.signStream.service.PracticeSessionDbService;
import com.example.signStream.testsupport.TestFrames;
import com.example.signStream.websocket.ConnectionRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Full application on a random port with the in-memory database.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("ci")
@AutoConfigureMockMvc
public class SignStreamApplicationTests {

  @LocalServerPort
  private int port;

  @Autowired
  private MockMvc mockMvc;

  @Autowired
  private ObjectMapper om;

  @Autowired
  private LandmarkDetector detector;

  @Autowired
  private ConnectionRegistry registry;

  @Autowired
  private PracticeSessionDbService sessionDb;

  @Test
  public void testContextLoads_DefaultDetectorIsNone() {
    assertEquals("none", detector.name());
  }

  @Test
  public void testStatusEndpoint_ReportsDetectorAndStats() throws Exception {
    mockMvc.perform(get("/api/stream/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.detector").value("none"))
        .andExpect(jsonPath("$.connections").isNumber())
        .andExpect(jsonPath("$.stats.frames_received").isNumber());
  }

  @Test
  public void testSessionSummary_PersistedAndQueryable() throws Exception {
    // Given
    Instant started = Instant.now().truncatedTo(ChronoUnit.SECONDS);
    PracticeSessionSummary summary = PracticeSessionSummary.builder()
        .sessionId("it-session-1")
        .clientId("client_it")
        .totalSentences(3)
        .sentencesReached(2)
        .completed(false)
        .attempts(4)
        .gesturesDetected(2)
        .endReason("STOPPED")
        .startedAt(started)
        .endedAt(started.plusSeconds(30))
        .build();

    // When
    sessionDb.sessionFinished(summary);
    List<PracticeSessionSummary> found = sessionDb.find("it-session-1");

    // Then
    assertEquals(1, found.size());
    assertEquals("client_it", found.get(0).getClientId());
    assertEquals(2, found.get(0).getSentencesReached());
    assertEquals("STOPPED", found.get(0).getEndReason());
    mockMvc.perform(get("/api/stream/sessions/it-session-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].sessionId").value("it-session-1"));
  }

  @Test
  public void testSessionSummary_Unknown_NotFound() throws Exception {
    mockMvc.perform(get("/api/stream/sessions/does-not-exist"))
        .andExpect(status().isNotFound());
  }

  @Test
  public void testVideoSocket_HandshakePingAndFrame() throws Exception {
    // Given
    BlockingQueue<JsonNode> inbox = new LinkedBlockingQueue<>();
    StandardWebSocketClient client = new StandardWebSocketClient();
    WebSocketSession ws = client.execute(new TextWebSocketHandler() {
      @Override
      protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        inbox.add(om.readTree(message.getPayload()));
      }
    }, "ws://localhost:" + port + "/ws/video").get(5, TimeUnit.SECONDS);

    try {
      JsonNode hello = inbox.poll(5, TimeUnit.SECONDS);
      assertNotNull(hello);
      assertEquals("connection_established", hello.path("type").asText());
      assertTrue(hello.path("client_id").asText().startsWith("client_"));
      assertEquals("none", hello.path("server_info").path("detector").asText());
      assertEquals(1, registry.count());

      // When
      ws.sendMessage(new TextMessage("{\"type\":\"ping\"}"));
      JsonNode pong = inbox.poll(5, TimeUnit.SECONDS);

      ws.sendMessage(new TextMessage("{\"type\":\"raw_frame\",\"frame_data\":\""
          + TestFrames.jpegDataUrl(64, 48) + "\",\"metadata\":{\"frame_number\":3}}"));
      JsonNode frame = inbox.poll(5, TimeUnit.SECONDS);

      // Then
      assertNotNull(pong);
      assertEquals("pong", pong.path("type").asText());
      assertNotNull(frame);
      assertEquals("processed_frame", frame.path("type").asText());
      assertTrue(frame.path("metadata").path("success").asBoolean());
      assertEquals(3, frame.path("metadata").path("client_frame_number").asLong());
    } finally {
      ws.close(CloseStatus.NORMAL);
    }

    long deadline = System.currentTimeMillis() + 5000;
    while (registry.count() > 0 && System.currentTimeMillis() < deadline) {
      Thread.sleep(20);
    }
    assertEquals(0, registry.count());
  }
}
