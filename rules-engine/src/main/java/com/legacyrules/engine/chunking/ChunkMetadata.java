package com.legacyrules.engine.chunking;

import org.springframework.lang.Nullable;

/** Describes one chunk. Line numbers are 1-based and inclusive. */
public record ChunkMetadata(
    String chunkId,
    int startLine,
    int endLine,
    int contentLines,
    ChunkingStrategy strategy,
    @Nullable String sectionName,
    int ruleCountEstimate,
    double confidence,
    int overlapLines,
    String hash) {

  static final int OPTIMAL_CHUNK_LINES = 200;

  /** Ratio of content lines to the optimal chunk size, capped at 1. */
  public double sizeEfficiency() {
    return Math.min((double) contentLines / OPTIMAL_CHUNK_LINES, 1.0d);
  }
}
