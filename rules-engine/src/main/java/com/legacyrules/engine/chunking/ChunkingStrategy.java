package com.legacyrules.engine.chunking;

/** Chunking strategies in fallback order. */
public enum ChunkingStrategy {
  SECTION_AWARE("section", 0.9d),
  RULE_BOUNDARY("rule", 0.8d),
  SMART_OVERLAP("smart", 0.7d),
  FIXED_SIZE("fixed", 0.5d);

  private final String idPrefix;
  private final double confidence;

  ChunkingStrategy(String idPrefix, double confidence) {
    this.idPrefix = idPrefix;
    this.confidence = confidence;
  }

  public String idPrefix() {
    return idPrefix;
  }

  /** Reliability score assigned to every chunk this strategy produces. */
  public double confidence() {
    return confidence;
  }

  /** Next strategy to try when this one yields no usable plan, or {@code null} after FIXED_SIZE. */
  public ChunkingStrategy next() {
    ChunkingStrategy[] all = values();
    return ordinal() + 1 < all.length ? all[ordinal() + 1] : null;
  }
}
