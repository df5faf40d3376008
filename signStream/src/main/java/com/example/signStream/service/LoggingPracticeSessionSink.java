package com.example.signStream.service;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import com.example.signStream.practice.PracticeSessionSink;
import com.example.signStream.practice.PracticeSessionSummary;

import lombok.extern.slf4j.Slf4j;

/** Used when no database is configured (storysign.persistence.enabled=false). */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "storysign.persistence", name = "enabled", havingValue = "false")
public class LoggingPracticeSessionSink implements PracticeSessionSink {

  @Override
  public void sessionFinished(PracticeSessionSummary summary) {
    log.info("[SINK] session finished (not persisted): {}", summary);
  }
}
