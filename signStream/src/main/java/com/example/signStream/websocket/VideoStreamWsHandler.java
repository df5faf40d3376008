package com.example.signStream.websocket;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import com.example.signStream.config.ConnectionProperties;
import com.example.signStream.config.VideoProperties;
import com.example.signStream.detector.LandmarkDetector;
import com.example.signStream.dto.StreamMessage;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
public class VideoStreamWsHandler extends TextWebSocketHandler {

  public static final String SERVER_VERSION = "1.0.0";

  private final ConnectionRegistry registry;
  private final ConnectionSessionFactory factory;
  private final ConnectionProperties connection;
  private final VideoProperties video;
  private final LandmarkDetector detector;
  private final ObjectMapper om;

  public VideoStreamWsHandler(
      ConnectionRegistry registry,
      ConnectionSessionFactory factory,
      ConnectionProperties connection,
      VideoProperties video,
      LandmarkDetector detector,
      ObjectMapper om
  ) {
    this.registry = registry;
    this.factory = factory;
    this.connection = connection;
    this.video = video;
    this.detector = detector;
    this.om = om;
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) throws Exception {
    if (registry.count() >= connection.getMaxConnections()) {
      log.warn("[WS] reject {}: {} connections open", session.getId(), registry.count());
      session.sendMessage(new TextMessage(om.writeValueAsString(
          StreamMessage.error("Server is at capacity, try again later"))));
      session.close(CloseStatus.SERVICE_OVERLOAD);
      return;
    }

    ConnectionSession cs = factory.create(session);
    registry.register(session.getId(), cs);
    cs.sendConnectionEstablished(serverInfo());
    log.info("[WS] client connected: ws={} client={}", session.getId(), cs.getClientId());
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) {
    ConnectionSession cs = registry.find(session.getId());
    if (cs == null) {
      log.debug("[WS] message for unknown session {} ignored", session.getId());
      return;
    }
    cs.handleText(message.getPayload());
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    log.warn("[WS] transport error ws={}: {}", session.getId(), exception.getMessage());
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    registry.remove(session.getId());
    log.info("[WS] client disconnected: {} {}", session.getId(), status);
  }

  Map<String, Object> serverInfo() {
    Map<String, Object> info = new LinkedHashMap<>();
    info.put("version", SERVER_VERSION);
    info.put("features", List.of("real_time_processing", "landmark_detection", "gesture_analysis", "practice_sessions"));
    info.put("max_frame_rate", video.getFps());
    info.put("supported_formats", List.of("JPEG"));
    info.put("detector", detector.name());
    return info;
  }
}
