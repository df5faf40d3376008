package com.example.signStream.gesture;

/**
 * Emitted once per completed sign attempt.
 */
public record GestureEvent(
    GestureState state,
    long startedAt,
    long durationMs,
    GestureEndReason reason,
    int sampleCount
) {
}
