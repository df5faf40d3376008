package com.example.signStream.controller;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.signStream.detector.LandmarkDetector;
import com.example.signStream.practice.PracticeSessionSummary;
import com.example.signStream.service.PracticeSessionDbService;
import com.example.signStream.service.StreamStatsService;
import com.example.signStream.websocket.ConnectionRegistry;
import com.example.signStream.websocket.VideoStreamWsHandler;

@RestController
@RequestMapping("/api/stream")
@CrossOrigin(origins = "*")
public class StreamStatusController {

  private final ConnectionRegistry registry;
  private final StreamStatsService stats;
  private final LandmarkDetector detector;
  private final PracticeSessionDbService sessions; // null when persistence is off

  public StreamStatusController(ConnectionRegistry registry,
                                StreamStatsService stats,
                                LandmarkDetector detector,
                                ObjectProvider<PracticeSessionDbService> sessions) {
    this.registry = registry;
    this.stats = stats;
    this.detector = detector;
    this.sessions = sessions.getIfAvailable();
  }

  @GetMapping("/status")
  public Map<String, Object> status() {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("version", VideoStreamWsHandler.SERVER_VERSION);
    out.put("connections", registry.count());
    out.put("detector", detector.name());
    out.put("stats", stats.snapshot());
    return out;
  }

  @GetMapping("/sessions/{sessionId}")
  public ResponseEntity<?> session(@PathVariable("sessionId") String sessionId) {
    if (sessions == null) {
      return ResponseEntity.status(404).body(Map.of("ok", false, "error", "Session persistence is disabled"));
    }
    List<PracticeSessionSummary> found = sessions.find(sessionId);
    if (found.isEmpty()) {
      return ResponseEntity.status(404).body(Map.of("ok", false, "error", "Unknown session: " + sessionId));
    }
    return ResponseEntity.ok(found);
  }
}
