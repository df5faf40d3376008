package com.example.signStream.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import com.example.signStream.detector.LandmarkDetector;
import com.example.signStream.detector.NullLandmarkDetector;
import com.example.signStream.detector.RemoteLandmarkDetector;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Picks the landmark detector once at startup from storysign.detector.type.
 */
@Slf4j
@Configuration
public class DetectorConfig {

  @Bean
  public LandmarkDetector landmarkDetector(DetectorProperties props, ObjectMapper om) {
    String type = props.getType() == null ? "none" : props.getType().trim().toLowerCase();
    LandmarkDetector detector;
    switch (type) {
      case "remote":
        detector = new RemoteLandmarkDetector(props, om);
        break;
      case "none":
      case "mock":
        detector = new NullLandmarkDetector();
        break;
      default:
        throw new IllegalStateException("Unknown storysign.detector.type: " + props.getType());
    }
    log.info("[DETECT] using {} detector (timeout={}ms pool={})", detector.name(), props.getTimeoutMs(), props.getPoolSize());
    return detector;
  }

  /** Shared by all connections; bounds concurrent detector calls. */
  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService detectorExecutor(DetectorProperties props) {
    return Executors.newFixedThreadPool(Math.max(1, props.getPoolSize()), new CustomizableThreadFactory("detector-"));
  }
}
