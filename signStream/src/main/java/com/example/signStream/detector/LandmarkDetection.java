package com.example.signStream.detector;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.example.signStream.dto.Landmark3D;
import com.example.signStream.dto.LandmarkPresence;

/**
 * Landmarks found in one frame. Coordinates are normalized to the frame.
 * Consumed by the pipeline and discarded; never persisted.
 */
public record LandmarkDetection(
    List<List<Landmark3D>> hands,
    List<Landmark3D> face,
    List<Landmark3D> pose
) {

  private static final LandmarkDetection NONE =
      new LandmarkDetection(Collections.emptyList(), Collections.emptyList(), Collections.emptyList());

  public LandmarkDetection {
    hands = hands == null ? Collections.emptyList() : List.copyOf(hands);
    face = face == null ? Collections.emptyList() : List.copyOf(face);
    pose = pose == null ? Collections.emptyList() : List.copyOf(pose);
  }

  public static LandmarkDetection none() {
    return NONE;
  }

  public boolean hasHands() {
    return hands.stream().anyMatch(h -> h != null && !h.isEmpty());
  }

  public LandmarkPresence presence() {
    return new LandmarkPresence(hasHands(), !face.isEmpty(), !pose.isEmpty());
  }

  /**
   * Mean position of the first non-empty hand; used as the motion signal for
   * gesture segmentation.
   */
  public Optional<Landmark3D> primaryHandCentroid() {
    for (List<Landmark3D> hand : hands) {
      if (hand == null || hand.isEmpty()) continue;
      double x = 0, y = 0, z = 0;
      for (Landmark3D p : hand) {
        x += p.getX();
        y += p.getY();
        z += p.getZ();
      }
      int n = hand.size();
      return Optional.of(new Landmark3D(x / n, y / n, z / n));
    }
    return Optional.empty();
  }
}
