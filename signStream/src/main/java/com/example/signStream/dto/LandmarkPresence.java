package com.example.signStream.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LandmarkPresence {

  private boolean hands;
  private boolean face;
  private boolean pose;

  public static LandmarkPresence none() {
    return new LandmarkPresence(false, false, false);
  }

  public int detectedCount() {
    int n = 0;
    if (hands) n++;
    if (face) n++;
    if (pose) n++;
    return n;
  }
}
