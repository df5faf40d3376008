package com.example.signStream.websocket;

import com.example.signStream.error.ProtocolException;
import com.fasterxml.jackson.databind.JsonNode;

/** Inbound {@code type} discriminator on /ws/video. */
public enum MessageType {
  RAW_FRAME("raw_frame"),
  CONTROL("control"),
  PRACTICE_SESSION_START("practice_session_start"),
  PING("ping"),
  GET_STATS("get_stats");

  private final String wireName;

  MessageType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static MessageType from(JsonNode node) throws ProtocolException {
    if (node == null || !node.isObject()) {
      throw new ProtocolException("Message must be a JSON object");
    }
    JsonNode t = node.get("type");
    if (t == null || !t.isTextual() || t.asText().isBlank()) {
      throw new ProtocolException("Message is missing 'type'");
    }
    String raw = t.asText().trim();
    for (MessageType m : values()) {
      if (m.wireName.equals(raw)) return m;
    }
    throw new ProtocolException("Unknown message type: " + raw);
  }
}
