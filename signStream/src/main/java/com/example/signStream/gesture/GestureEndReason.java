package com.example.signStream.gesture;

public enum GestureEndReason {
  /** hands still visible but stopped moving */
  PAUSE,
  HANDS_LOST
}
