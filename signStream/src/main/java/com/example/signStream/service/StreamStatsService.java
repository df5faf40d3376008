package com.example.signStream.service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.stereotype.Service;

/**
 * Process-wide counters across all connections. Per-connection figures live
 * on each connection; this only aggregates.
 */
@Service
public class StreamStatsService {

  private final AtomicLong framesReceived = new AtomicLong();
  private final AtomicLong framesProcessed = new AtomicLong();
  private final AtomicLong framesFailed = new AtomicLong();
  private final AtomicLong framesDropped = new AtomicLong();
  private final AtomicLong sessionsStarted = new AtomicLong();
  private final AtomicLong sessionsFinished = new AtomicLong();

  public void frameReceived() { framesReceived.incrementAndGet(); }
  public void frameProcessed(boolean success) {
    framesProcessed.incrementAndGet();
    if (!success) framesFailed.incrementAndGet();
  }
  public void frameDropped() { framesDropped.incrementAndGet(); }
  public void sessionStarted() { sessionsStarted.incrementAndGet(); }
  public void sessionFinished() { sessionsFinished.incrementAndGet(); }

  /** 저장본 대신 스냅샷으로 반환 */
  public Map<String, Object> snapshot() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("frames_received", framesReceived.get());
    m.put("frames_processed", framesProcessed.get());
    m.put("frames_failed", framesFailed.get());
    m.put("frames_dropped", framesDropped.get());
    m.put("sessions_started", sessionsStarted.get());
    m.put("sessions_finished", sessionsFinished.get());
    return m;
  }
}
