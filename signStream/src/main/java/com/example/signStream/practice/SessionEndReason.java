package com.example.signStream.practice;

public enum SessionEndReason {
  COMPLETED,
  STOPPED,
  REPLACED,
  DISCONNECTED
}
