package com.example.signStream.testsupport;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Random;
import java.util.zip.CRC32;

import javax.imageio.ImageIO;

/**
 * JPEG frames for tests.
 */
public final class TestFrames {

  private TestFrames() {}

  public static BufferedImage solid(int w, int h, Color color) {
    BufferedImage img = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
    Graphics2D g = img.createGraphics();
    try {
      g.setColor(color);
      g.fillRect(0, 0, w, h);
    } finally {
      g.dispose();
    }
    return img;
  }

  /** Random pixels compress badly, which is what the size ceiling tests need. */
  public static BufferedImage noise(int w, int h, long seed) {
    Random rnd = new Random(seed);
    BufferedImage img = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
    for (int y = 0; y < h; y++) {
      for (int x = 0; x < w; x++) {
        img.setRGB(x, y, rnd.nextInt(0xFFFFFF));
      }
    }
    return img;
  }

  public static String base64Jpeg(BufferedImage img) {
    try (ByteArrayOutputStream bos = new ByteArrayOutputStream()) {
      ImageIO.write(img, "jpg", bos);
      return Base64.getEncoder().encodeToString(bos.toByteArray());
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static String jpegDataUrl(BufferedImage img) {
    return "data:image/jpeg;base64," + base64Jpeg(img);
  }

  public static String jpegDataUrl(int w, int h) {
    return jpegDataUrl(solid(w, h, Color.DARK_GRAY));
  }

  /** PNG signature plus an IHDR chunk, no pixel data. */
  public static byte[] pngHeader(int width, int height) {
    ByteBuffer ihdr = ByteBuffer.allocate(17);
    ihdr.put("IHDR".getBytes(StandardCharsets.US_ASCII));
    ihdr.putInt(width).putInt(height);
    ihdr.put((byte) 1).put((byte) 0).put((byte) 0).put((byte) 0).put((byte) 0);
    CRC32 crc = new CRC32();
    crc.update(ihdr.array());

    ByteBuffer png = ByteBuffer.allocate(8 + 4 + 17 + 4);
    png.put(new byte[] {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'});
    png.putInt(13).put(ihdr.array()).putInt((int) crc.getValue());
    return png.array();
  }

  public static String pngHeaderDataUrl(int width, int height) {
    return "data:image/png;base64," + Base64.getEncoder().encodeToString(pngHeader(width, height));
  }
}
