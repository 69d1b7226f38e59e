package com.legacyrules.engine.detection;

/** Human-readable confidence bands for detection results. */
public enum DetectionConfidence {
  VERY_LOW(0.0d),
  LOW(0.3d),
  MEDIUM(0.6d),
  HIGH(0.8d),
  VERY_HIGH(0.95d);

  private final double threshold;

  DetectionConfidence(double threshold) {
    this.threshold = threshold;
  }

  public double threshold() {
    return threshold;
  }

  public static DetectionConfidence of(double confidence) {
    DetectionConfidence level = VERY_LOW;
    for (DetectionConfidence candidate : values()) {
      if (confidence >= candidate.threshold) {
        level = candidate;
      }
    }
    return level;
  }
}
