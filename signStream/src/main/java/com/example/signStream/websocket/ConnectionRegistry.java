package com.example.signStream.websocket;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

/**
 * Live /ws/video connections keyed by WebSocket session id.
 */
@Slf4j
@Component
public class ConnectionRegistry {

  private final Map<String, ConnectionSession> sessions = new ConcurrentHashMap<>();

  public void register(String wsSessionId, ConnectionSession session) {
    sessions.put(wsSessionId, session);
    log.info("[REG] register ws={} client={} total={}", wsSessionId, session.getClientId(), sessions.size());
  }

  public ConnectionSession find(String wsSessionId) {
    return sessions.get(wsSessionId);
  }

  /** Removes and closes; a second call for the same id is a no-op. */
  public void remove(String wsSessionId) {
    ConnectionSession s = sessions.remove(wsSessionId);
    if (s == null) return;
    s.close();
    log.info("[REG] remove ws={} client={} total={}", wsSessionId, s.getClientId(), sessions.size());
  }

  public int count() {
    return sessions.size();
  }

  @PreDestroy
  public void closeAll() {
    List<String> ids = new ArrayList<>(sessions.keySet());
    for (String id : ids) {
      remove(id);
    }
  }
}
