package com.example.signStream.practice;

/**
 * Receives finished-session summaries. Called at most once per session,
 * from the owning connection's worker thread.
 */
public interface PracticeSessionSink {

  void sessionFinished(PracticeSessionSummary summary);
}
