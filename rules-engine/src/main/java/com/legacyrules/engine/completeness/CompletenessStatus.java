package com.legacyrules.engine.completeness;

/** Extraction completeness tiers. Each threshold is inclusive on its lower bound. */
public enum CompletenessStatus {
  EXCELLENT(95.0d, "SUCCESS: Rule extraction meeting or exceeding targets. Current strategy is effective."),
  GOOD(90.0d, "SUCCESS: Rule extraction meeting or exceeding targets. Current strategy is effective."),
  WARNING(80.0d, "CAUTION: Near 90% target. Minor adjustments to chunking may improve results."),
  POOR(70.0d, "WARNING: Rule extraction below 80%. Review section boundaries and increase chunk overlap."),
  CRITICAL(
      0.0d,
      "CRITICAL: Less than 70% rule extraction. Consider manual review and chunking strategy redesign.");

  private final double threshold;
  private final String recommendation;

  CompletenessStatus(double threshold, String recommendation) {
    this.threshold = threshold;
    this.recommendation = recommendation;
  }

  public double threshold() {
    return threshold;
  }

  public String recommendation() {
    return recommendation;
  }

  public static CompletenessStatus of(double percentage) {
    for (CompletenessStatus status : values()) {
      if (percentage >= status.threshold) {
        return status;
      }
    }
    return CRITICAL;
  }
}
