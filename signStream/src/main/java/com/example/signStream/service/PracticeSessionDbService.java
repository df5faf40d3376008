package com.example.signStream.service;

import java.util.List;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import com.example.signStream.mapper.PracticeSessionMapper;
import com.example.signStream.practice.PracticeSessionSink;
import com.example.signStream.practice.PracticeSessionSummary;

import lombok.extern.slf4j.Slf4j;

/**
 * Writes finished-session summaries through MyBatis.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "storysign.persistence", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PracticeSessionDbService implements PracticeSessionSink {

  private final PracticeSessionMapper mapper;

  public PracticeSessionDbService(PracticeSessionMapper mapper) {
    this.mapper = mapper;
  }

  @Override
  public void sessionFinished(PracticeSessionSummary summary) {
    if (summary == null) return;
    mapper.insert(summary);
    log.info("[SINK] saved session={} reason={} reached={}/{}",
        summary.getSessionId(), summary.getEndReason(),
        summary.getSentencesReached(), summary.getTotalSentences());
  }

  public List<PracticeSessionSummary> find(String sessionId) {
    if (sessionId == null || sessionId.isBlank()) return List.of();
    return mapper.findBySessionId(sessionId.trim());
  }
}
