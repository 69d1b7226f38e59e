package com.legacyrules.engine.detection;

import java.util.List;
import org.springframework.lang.Nullable;

/** Outcome of one detection call. Never represents a failure; low confidence is a flag. */
public record DetectionResult(
    String language,
    double confidence,
    @Nullable LanguageProfile profile,
    DetectionEvidence evidence,
    List<String> recommendations) {

  public DetectionResult {
    confidence = Math.max(0.0d, Math.min(1.0d, confidence));
    recommendations = List.copyOf(recommendations);
  }

  public boolean isConfident() {
    return profile != null && confidence >= profile.confidenceRequired();
  }

  public DetectionConfidence confidenceLevel() {
    return DetectionConfidence.of(confidence);
  }

  /** The detected profile when confident, otherwise the supplied fallback. */
  public LanguageProfile effectiveProfile(LanguageProfile fallback) {
    return isConfident() ? profile : fallback;
  }
}
