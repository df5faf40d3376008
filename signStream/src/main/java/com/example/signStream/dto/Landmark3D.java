package com.example.signStream.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Single MediaPipe-style landmark.
 *
 * The detector sidecar sends:
 *   {"x": float, "y": float, "z": float}
 * with x/y normalized to the frame size (0~1).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Landmark3D {
  private double x;
  private double y;
  private double z;
}
