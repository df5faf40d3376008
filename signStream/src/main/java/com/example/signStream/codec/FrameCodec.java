package com.example.signStream.codec;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;
import java.util.Iterator;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;

import org.springframework.stereotype.Component;

import com.example.signStream.config.VideoProperties;
import com.example.signStream.dto.EncodingMetrics;
import com.example.signStream.error.FrameDecodeException;
import com.example.signStream.error.FrameEncodeException;

import lombok.extern.slf4j.Slf4j;

/**
 * Data-URL frame decoding and adaptive JPEG re-encoding.
 *
 * Stateless and safe to share between connections.
 */
@Slf4j
@Component
public class FrameCodec {

  public static final String JPEG_DATA_URL_PREFIX = "data:image/jpeg;base64,";

  private final VideoProperties props;

  public FrameCodec(VideoProperties props) {
    this.props = props;
    // no temp files for every frame
    ImageIO.setUseCache(false);
  }

  /**
   * Decodes {@code data:image/...;base64,...} (or bare base64) into an image.
   */
  public DecodedFrame decode(String frameData) throws FrameDecodeException {
    if (frameData == null || frameData.isBlank()) {
      throw new FrameDecodeException("Empty frame data");
    }

    String payload = frameData.trim();
    if (payload.startsWith("data:")) {
      int comma = payload.indexOf(',');
      if (comma < 0) {
        throw new FrameDecodeException("Malformed data URL: missing ','");
      }
      String header = payload.substring(5, comma);
      if (!header.endsWith(";base64")) {
        throw new FrameDecodeException("Data URL is not base64 encoded");
      }
      payload = payload.substring(comma + 1);
    }

    // base64 expands 3 bytes into 4 chars
    if ((long) payload.length() * 3 / 4 > props.getMaxFrameBytes()) {
      throw new FrameDecodeException("Frame exceeds " + props.getMaxFrameBytes() + " bytes");
    }

    byte[] bytes;
    try {
      bytes = Base64.getDecoder().decode(payload);
    } catch (IllegalArgumentException e) {
      throw new FrameDecodeException("Invalid base64 frame data", e);
    }
    if (bytes.length == 0) {
      throw new FrameDecodeException("Empty frame data");
    }

    BufferedImage image = readBounded(bytes);

    log.debug("[CODEC] decoded {}x{} ({} bytes)", image.getWidth(), image.getHeight(), bytes.length);
    return new DecodedFrame(image, bytes);
  }

  /**
   * Reads the header first so an image whose raster would not fit the pixel
   * budget is rejected before anything is allocated for it.
   */
  private BufferedImage readBounded(byte[] bytes) throws FrameDecodeException {
    try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
      Iterator<ImageReader> readers = in == null ? null : ImageIO.getImageReaders(in);
      if (readers == null || !readers.hasNext()) {
        throw new FrameDecodeException("Unsupported or corrupt image data");
      }
      ImageReader reader = readers.next();
      try {
        reader.setInput(in, true, true);
        long w = reader.getWidth(0);
        long h = reader.getHeight(0);
        if (w <= 0 || h <= 0 || w * h > props.getMaxFramePixels()) {
          throw new FrameDecodeException("Frame dimensions " + w + "x" + h
              + " exceed " + props.getMaxFramePixels() + " pixels");
        }
        BufferedImage image = reader.read(0);
        if (image == null) {
          throw new FrameDecodeException("Unsupported or corrupt image data");
        }
        return image;
      } finally {
        reader.dispose();
      }
    } catch (IOException | RuntimeException e) {
      throw new FrameDecodeException("Failed to decode image data", e);
    }
  }

  /**
   * Encodes as JPEG, lowering quality and then resolution until the result
   * fits {@code maxEncodedBytes} or the attempt budget runs out. The smallest
   * attempt is returned either way; {@link EncodingMetrics#isTargetMet()}
   * tells which.
   */
  public EncodedFrame encode(BufferedImage image) throws FrameEncodeException {
    if (image == null) {
      throw new FrameEncodeException("No image to encode");
    }
    long start = System.nanoTime();

    int minQuality = clamp(props.getMinQuality(), 1, 100);
    int quality = clamp(props.getInitialQuality(), minQuality, 100);
    int step = Math.max(1, props.getQualityStep());
    int maxAttempts = Math.max(1, props.getMaxEncodeAttempts());
    int ceiling = props.getMaxEncodedBytes();

    BufferedImage current = toRgb(image);
    byte[] best = null;
    int bestQuality = quality;
    int bestWidth = current.getWidth();
    int bestHeight = current.getHeight();
    boolean targetMet = false;
    int attempts = 0;

    while (attempts < maxAttempts) {
      attempts++;
      byte[] out = writeJpeg(current, quality);
      if (best == null || out.length <= best.length) {
        best = out;
        bestQuality = quality;
        bestWidth = current.getWidth();
        bestHeight = current.getHeight();
      }
      if (ceiling <= 0 || out.length <= ceiling) {
        targetMet = true;
        break;
      }

      if (quality > minQuality) {
        quality = Math.max(minQuality, quality - step);
      } else if (current.getWidth() > 1 || current.getHeight() > 1) {
        current = downscale(current, props.getDownscaleFactor());
      } else {
        break;
      }
    }

    if (!targetMet) {
      log.debug("[CODEC] ceiling {} not met after {} attempts, best={} bytes", ceiling, attempts, best.length);
    }

    long originalSize = (long) image.getWidth() * image.getHeight() * 3;
    double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;

    EncodingMetrics metrics = EncodingMetrics.builder()
        .encodingTimeMs(round2(elapsedMs))
        .compressedSizeBytes(best.length)
        .originalSizeBytes(originalSize)
        .compressionRatio(best.length > 0 ? round2((double) originalSize / best.length) : 0.0)
        .quality(bestQuality)
        .format("JPEG")
        .width(bestWidth)
        .height(bestHeight)
        .attempts(attempts)
        .targetMet(targetMet)
        .build();

    String dataUrl = JPEG_DATA_URL_PREFIX + Base64.getEncoder().encodeToString(best);
    return new EncodedFrame(best, dataUrl, metrics);
  }

  /** Single JPEG encode at a fixed quality (0~100). */
  public byte[] writeJpeg(BufferedImage image, int quality) throws FrameEncodeException {
    Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
    if (!writers.hasNext()) {
      throw new FrameEncodeException("No JPEG writer available");
    }
    ImageWriter writer = writers.next();
    try (ByteArrayOutputStream bos = new ByteArrayOutputStream();
         ImageOutputStream ios = ImageIO.createImageOutputStream(bos)) {
      writer.setOutput(ios);
      ImageWriteParam param = writer.getDefaultWriteParam();
      param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
      param.setCompressionQuality(clamp(quality, 1, 100) / 100f);
      writer.write(null, new IIOImage(toRgb(image), null, null), param);
      ios.flush();
      return bos.toByteArray();
    } catch (IOException | RuntimeException e) {
      throw new FrameEncodeException("JPEG encoding failed", e);
    } finally {
      writer.dispose();
    }
  }

  /** JPEG has no alpha channel; anything else is redrawn onto an RGB raster. */
  static BufferedImage toRgb(BufferedImage src) {
    int type = src.getType();
    if (type == BufferedImage.TYPE_INT_RGB || type == BufferedImage.TYPE_3BYTE_BGR) {
      return src;
    }
    BufferedImage rgb = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_RGB);
    Graphics2D g = rgb.createGraphics();
    try {
      g.drawImage(src, 0, 0, null);
    } finally {
      g.dispose();
    }
    return rgb;
  }

  static BufferedImage downscale(BufferedImage src, double factor) {
    double f = (factor <= 0 || factor >= 1) ? 0.5 : factor;
    int w = Math.max(1, (int) Math.round(src.getWidth() * f));
    int h = Math.max(1, (int) Math.round(src.getHeight() * f));
    BufferedImage out = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
    Graphics2D g = out.createGraphics();
    try {
      g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
      g.drawImage(src, 0, 0, w, h, null);
    } finally {
      g.dispose();
    }
    return out;
  }

  private static int clamp(int v, int lo, int hi) {
    return Math.max(lo, Math.min(hi, v));
  }

  private static double round2(double v) {
    return Math.round(v * 100.0) / 100.0;
  }
}
