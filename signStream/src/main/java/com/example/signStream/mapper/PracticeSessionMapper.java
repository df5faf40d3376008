package com.example.signStream.mapper;

import java.util.List;

import org.apache.ibatis.annotations.*;

import com.example.signStream.practice.PracticeSessionSummary;

@Mapper
public interface PracticeSessionMapper {

  @Insert("""
      INSERT INTO practice_session_summary(
        session_id, client_id, total_sentences, sentences_reached, completed,
        attempts, gestures_detected, end_reason, started_at, ended_at)
      VALUES(
        #{sessionId}, #{clientId}, #{totalSentences}, #{sentencesReached}, #{completed},
        #{attempts}, #{gesturesDetected}, #{endReason}, #{startedAt}, #{endedAt})
      """)
  int insert(PracticeSessionSummary summary);

  @Select("""
      SELECT session_id, client_id, total_sentences, sentences_reached, completed,
             attempts, gestures_detected, end_reason, started_at, ended_at
      FROM practice_session_summary
      WHERE session_id = #{sessionId}
      ORDER BY ended_at DESC
      """)
  List<PracticeSessionSummary> findBySessionId(@Param("sessionId") String sessionId);
}
