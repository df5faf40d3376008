package com.example.signStream.practice;

public enum PracticeMode {
  /** waiting for the learner to sign the current sentence */
  LISTENING,
  /** an attempt finished; waiting for the learner's next choice */
  FEEDBACK,
  COMPLETED;

  public String wireName() {
    return name().toLowerCase();
  }
}
