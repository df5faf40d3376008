package com.example.signStream.dto;

import java.time.Instant;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outbound envelope sent to the browser on /ws/video.
 * Only the fields relevant to {@link #type} are populated.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StreamMessage {

  private String type;
  private String timestamp;
  private String clientId;

  private String frameData;
  private FrameMetadata metadata;

  private String action;
  private Object result;

  private String message;

  private Map<String, Object> serverInfo;
  private Map<String, Object> processingStats;

  private static String now() {
    return Instant.now().toString();
  }

  public static StreamMessage connectionEstablished(String clientId, Map<String, Object> serverInfo) {
    return StreamMessage.builder()
        .type("connection_established")
        .timestamp(now())
        .clientId(clientId)
        .message("WebSocket connection established successfully")
        .serverInfo(serverInfo)
        .build();
  }

  public static StreamMessage processedFrame(String frameData, FrameMetadata metadata) {
    return StreamMessage.builder()
        .type("processed_frame")
        .timestamp(now())
        .frameData(frameData)
        .metadata(metadata)
        .build();
  }

  public static StreamMessage controlResponse(String action, ControlResult result) {
    return StreamMessage.builder()
        .type("control_response")
        .timestamp(now())
        .action(action)
        .result(result)
        .build();
  }

  public static StreamMessage sessionStarted(ControlResult result) {
    return StreamMessage.builder()
        .type("practice_session_response")
        .timestamp(now())
        .action("session_started")
        .result(result)
        .build();
  }

  public static StreamMessage pong() {
    return StreamMessage.builder().type("pong").timestamp(now()).build();
  }

  public static StreamMessage stats(String clientId, Map<String, Object> processingStats) {
    return StreamMessage.builder()
        .type("stats")
        .timestamp(now())
        .clientId(clientId)
        .processingStats(processingStats)
        .build();
  }

  public static StreamMessage error(String message) {
    return StreamMessage.builder().type("error").timestamp(now()).message(message).build();
  }
}
