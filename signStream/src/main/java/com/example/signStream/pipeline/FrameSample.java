package com.example.signStream.pipeline;

/**
 * One inbound frame, alive for a single pipeline pass.
 *
 * @param frameData        data URL as sent by the client
 * @param clientFrameNumber client-side counter, echoed back untouched (may be null)
 * @param clientTimestamp  client capture time (ISO-8601), echoed back untouched
 * @param sequence         connection-scoped number assigned on receipt
 * @param receivedAtMs     server receive time, drives gesture timing
 */
public record FrameSample(
    String frameData,
    Long clientFrameNumber,
    String clientTimestamp,
    long sequence,
    long receivedAtMs
) {
}
