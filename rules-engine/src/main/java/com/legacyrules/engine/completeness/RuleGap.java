package com.legacyrules.engine.completeness;

import com.legacyrules.engine.detection.RuleCategory;
import java.util.List;
import org.springframework.lang.Nullable;

public record RuleGap(
    RuleCategory category,
    String sectionName,
    int expectedCount,
    int extractedCount,
    double confidence,
    @Nullable LineRange lineRange,
    List<String> suggestions) {

  public RuleGap {
    extractedCount = Math.max(0, extractedCount);
    suggestions = List.copyOf(suggestions);
  }

  public int gapCount() {
    return Math.max(0, expectedCount - extractedCount);
  }

  public double completenessRatio() {
    return expectedCount > 0 ? (double) extractedCount / expectedCount : 1.0d;
  }
}
