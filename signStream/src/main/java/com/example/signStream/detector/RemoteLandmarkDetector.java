package com.example.signStream.detector;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import com.example.signStream.codec.DecodedFrame;
import com.example.signStream.config.DetectorProperties;
import com.example.signStream.dto.Landmark3D;
import com.example.signStream.error.LandmarkDetectionException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.slf4j.Slf4j;

/**
 * Calls a MediaPipe Holistic sidecar over HTTP.
 *
 * Request:  POST {baseUrl}/detect {"image": base64 JPEG, "width": w, "height": h}
 * Response: {"hands": [[{x,y,z}...], ...], "face": [{x,y,z}...], "pose": [{x,y,z}...]}
 *
 * {@link HttpClient} is thread-safe, so a single instance serves all connections.
 */
@Slf4j
public class RemoteLandmarkDetector implements LandmarkDetector {

  private final DetectorProperties props;
  private final ObjectMapper om;
  private final HttpClient http;
  private final URI endpoint;

  public RemoteLandmarkDetector(DetectorProperties props, ObjectMapper om) {
    this(props, om, HttpClient.newBuilder()
        .connectTimeout(Duration.ofMillis(props.getConnectTimeoutMs()))
        .build());
  }

  RemoteLandmarkDetector(DetectorProperties props, ObjectMapper om, HttpClient http) {
    this.props = props;
    this.om = om;
    this.http = http;
    String base = props.getBaseUrl() == null ? "" : props.getBaseUrl().trim();
    if (base.isEmpty()) {
      throw new IllegalStateException("storysign.detector.base-url is empty");
    }
    if (base.endsWith("/")) base = base.substring(0, base.length() - 1);
    this.endpoint = URI.create(base + "/detect");
  }

  @Override
  public LandmarkDetection detect(DecodedFrame frame) throws LandmarkDetectionException {
    ObjectNode body = om.createObjectNode();
    body.put("image", Base64.getEncoder().encodeToString(frame.encoded()));
    body.put("width", frame.width());
    body.put("height", frame.height());

    HttpRequest req = HttpRequest.newBuilder()
        .uri(endpoint)
        .timeout(Duration.ofMillis(props.getTimeoutMs()))
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
        .build();

    HttpResponse<String> res;
    try {
      res = http.send(req, HttpResponse.BodyHandlers.ofString());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LandmarkDetectionException("Detector call interrupted", e);
    } catch (Exception e) {
      throw new LandmarkDetectionException("Detector unavailable: " + e.getMessage(), e);
    }

    if (res.statusCode() / 100 != 2) {
      throw new LandmarkDetectionException("Detector error: " + res.statusCode());
    }

    try {
      return parse(om.readTree(res.body()));
    } catch (Exception e) {
      throw new LandmarkDetectionException("Unreadable detector response", e);
    }
  }

  @Override
  public String name() {
    return "remote";
  }

  LandmarkDetection parse(JsonNode root) {
    List<List<Landmark3D>> hands = new ArrayList<>();
    JsonNode handsNode = root.path("hands");
    if (handsNode.isArray()) {
      for (JsonNode hand : handsNode) {
        List<Landmark3D> points = points(hand);
        if (!points.isEmpty()) hands.add(points);
      }
    }
    return new LandmarkDetection(hands, points(root.path("face")), points(root.path("pose")));
  }

  private static List<Landmark3D> points(JsonNode arr) {
    List<Landmark3D> out = new ArrayList<>();
    if (arr == null || !arr.isArray()) return out;
    for (JsonNode p : arr) {
      if (!p.isObject()) continue;
      out.add(new Landmark3D(p.path("x").asDouble(), p.path("y").asDouble(), p.path("z").asDouble()));
    }
    return out;
  }
}
