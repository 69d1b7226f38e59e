package com.legacyrules.engine.completeness;

import java.util.List;

public record ProgressReport(
    int currentExtracted,
    int expectedTotal,
    double progressPercentage,
    int chunksProcessed,
    int totalChunks,
    int unclassifiableRules,
    List<ProgressWarning> warnings,
    List<ChunkEfficiency> chunkEfficiency,
    boolean targetAchieved,
    int estimatedFinal) {

  public ProgressReport {
    warnings = List.copyOf(warnings);
    chunkEfficiency = List.copyOf(chunkEfficiency);
  }

  public boolean hasWarnings() {
    return !warnings.isEmpty();
  }

  public boolean hasCritical() {
    return warnings.stream().anyMatch(warning -> warning.level() == ProgressWarning.Level.CRITICAL);
  }
}
