package com.example.signStream.codec;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.List;

import org.springframework.stereotype.Component;

import com.example.signStream.detector.LandmarkDetection;
import com.example.signStream.dto.Landmark3D;

/**
 * Draws detected landmarks onto the outgoing frame.
 */
@Component
public class FrameAnnotator {

  // MediaPipe hand topology (21 points)
  private static final int[][] HAND_CONNECTIONS = {
      {0, 1}, {1, 2}, {2, 3}, {3, 4},
      {0, 5}, {5, 6}, {6, 7}, {7, 8},
      {5, 9}, {9, 10}, {10, 11}, {11, 12},
      {9, 13}, {13, 14}, {14, 15}, {15, 16},
      {13, 17}, {0, 17}, {17, 18}, {18, 19}, {19, 20}
  };

  private static final Color HAND_LINE = new Color(0, 200, 0);
  private static final Color HAND_POINT = new Color(230, 40, 40);
  private static final Color POSE_POINT = new Color(40, 120, 255);
  private static final Color FACE_POINT = new Color(200, 200, 200);

  /**
   * Returns an RGB copy of {@code src} with landmarks drawn on it, or the
   * RGB form of {@code src} itself when nothing was detected.
   */
  public BufferedImage annotate(BufferedImage src, LandmarkDetection detection) {
    BufferedImage out = FrameCodec.toRgb(src);
    if (detection == null) return out;
    if (detection.hands().isEmpty() && detection.face().isEmpty() && detection.pose().isEmpty()) {
      return out;
    }

    if (out == src) {
      out = copy(src);
    }

    int w = out.getWidth();
    int h = out.getHeight();
    Graphics2D g = out.createGraphics();
    try {
      g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);

      g.setColor(FACE_POINT);
      for (Landmark3D p : detection.face()) {
        dot(g, p, w, h, 1);
      }

      g.setColor(POSE_POINT);
      for (Landmark3D p : detection.pose()) {
        dot(g, p, w, h, 3);
      }

      for (List<Landmark3D> hand : detection.hands()) {
        g.setColor(HAND_LINE);
        g.setStroke(new BasicStroke(2f));
        for (int[] c : HAND_CONNECTIONS) {
          if (c[0] >= hand.size() || c[1] >= hand.size()) continue;
          Landmark3D a = hand.get(c[0]);
          Landmark3D b = hand.get(c[1]);
          g.drawLine(px(a.getX(), w), px(a.getY(), h), px(b.getX(), w), px(b.getY(), h));
        }
        g.setColor(HAND_POINT);
        for (Landmark3D p : hand) {
          dot(g, p, w, h, 2);
        }
      }
    } finally {
      g.dispose();
    }
    return out;
  }

  private static void dot(Graphics2D g, Landmark3D p, int w, int h, int r) {
    g.fillOval(px(p.getX(), w) - r, px(p.getY(), h) - r, r * 2 + 1, r * 2 + 1);
  }

  private static int px(double normalized, int size) {
    return (int) Math.round(normalized * (size - 1));
  }

  private static BufferedImage copy(BufferedImage src) {
    BufferedImage dst = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_RGB);
    Graphics2D g = dst.createGraphics();
    try {
      g.drawImage(src, 0, 0, null);
    } finally {
      g.dispose();
    }
    return dst;
  }
}
