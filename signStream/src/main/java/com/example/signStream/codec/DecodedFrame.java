package com.example.signStream.codec;

import java.awt.image.BufferedImage;

/**
 * Frame decoded from a client message. {@code encoded} keeps the original
 * compressed bytes so detectors that need them do not have to re-encode.
 */
public record DecodedFrame(BufferedImage image, byte[] encoded) {

  public int width() {
    return image.getWidth();
  }

  public int height() {
    return image.getHeight();
  }
}
