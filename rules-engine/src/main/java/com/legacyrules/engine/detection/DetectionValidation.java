package com.legacyrules.engine.detection;

import java.util.List;

public record DetectionValidation(
    boolean valid,
    String reason,
    double confidence,
    double requiredConfidence,
    double estimatedRuleDensity,
    RuleDensityRange expectedRange,
    List<String> suggestions) {

  public DetectionValidation {
    suggestions = List.copyOf(suggestions);
  }
}
