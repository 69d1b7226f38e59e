package com.legacyrules.engine.pipeline;

import com.legacyrules.engine.chunking.ChunkingResult;
import com.legacyrules.engine.detection.DetectionResult;
import com.legacyrules.engine.detection.DetectionValidation;

public record PreparedSource(
    String filename,
    String content,
    DetectionResult detection,
    DetectionValidation validation,
    ChunkingResult chunking) {

  public boolean hasWork() {
    return !chunking.isEmpty();
  }
}
