package com.example.signStream.gesture;

public enum GestureState {
  IDLE,
  ACTIVE,
  ENDED;

  public String wireName() {
    return name().toLowerCase();
  }
}
