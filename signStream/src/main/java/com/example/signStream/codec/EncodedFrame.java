package com.example.signStream.codec;

import com.example.signStream.dto.EncodingMetrics;

public record EncodedFrame(byte[] bytes, String dataUrl, EncodingMetrics metrics) {
}
