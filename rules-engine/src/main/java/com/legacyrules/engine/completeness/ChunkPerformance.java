package com.legacyrules.engine.completeness;

import com.legacyrules.engine.chunking.ChunkingStrategy;
import java.util.List;
import org.springframework.lang.Nullable;

public record ChunkPerformance(
    String chunkId,
    int startLine,
    int endLine,
    int contentLines,
    int estimatedRules,
    double confidence,
    ChunkingStrategy strategy,
    @Nullable String sectionName,
    int identifiedGaps,
    List<String> gapDetails) {

  public ChunkPerformance {
    gapDetails = List.copyOf(gapDetails);
  }
}
