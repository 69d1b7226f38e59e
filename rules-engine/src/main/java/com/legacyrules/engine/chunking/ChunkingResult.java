package com.legacyrules.engine.chunking;

import java.util.List;

public record ChunkingResult(
    List<String> chunks,
    List<ChunkMetadata> metadata,
    String language,
    ChunkingStrategy strategyUsed,
    int totalLines,
    double estimatedCoverage,
    List<String> fileContext) {

  public ChunkingResult {
    chunks = List.copyOf(chunks);
    metadata = List.copyOf(metadata);
    fileContext = List.copyOf(fileContext);
    if (chunks.size() != metadata.size()) {
      throw new IllegalArgumentException("chunks and metadata must have the same size");
    }
  }

  static ChunkingResult empty(String language, ChunkingStrategy strategy) {
    return new ChunkingResult(List.of(), List.of(), language, strategy, 0, 0.0d, List.of());
  }

  public int chunkCount() {
    return chunks.size();
  }

  public boolean isEmpty() {
    return chunks.isEmpty();
  }

  public double averageChunkSize() {
    return metadata.stream().mapToInt(ChunkMetadata::contentLines).average().orElse(0.0d);
  }

  /** Coefficient of variation of chunk sizes (population standard deviation over mean). */
  public double sizeVariance() {
    if (metadata.size() < 2) {
      return 0.0d;
    }
    double mean = averageChunkSize();
    if (mean == 0.0d) {
      return 0.0d;
    }
    double sumSquares = 0.0d;
    for (ChunkMetadata chunk : metadata) {
      double delta = chunk.contentLines() - mean;
      sumSquares += delta * delta;
    }
    return Math.sqrt(sumSquares / metadata.size()) / mean;
  }

  public int totalRuleEstimate() {
    return metadata.stream().mapToInt(ChunkMetadata::ruleCountEstimate).sum();
  }
}
