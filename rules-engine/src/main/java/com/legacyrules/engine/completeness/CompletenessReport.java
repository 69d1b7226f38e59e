package com.legacyrules.engine.completeness;

import java.time.Duration;
import java.util.List;

public record CompletenessReport(
    String filename,
    String language,
    int totalExpectedRules,
    int totalExtractedRules,
    int unclassifiableRules,
    double completenessPercentage,
    CompletenessStatus status,
    List<RuleGap> gaps,
    List<SectionCompleteness> sections,
    List<ChunkPerformance> chunkPerformance,
    List<String> recommendations,
    Duration processingTime) {

  public static final double TARGET_PERCENTAGE = 90.0d;

  public CompletenessReport {
    gaps = List.copyOf(gaps);
    sections = List.copyOf(sections);
    chunkPerformance = List.copyOf(chunkPerformance);
    recommendations = List.copyOf(recommendations);
  }

  public boolean isTargetAchieved() {
    return completenessPercentage >= TARGET_PERCENTAGE;
  }

  /** Total number of missing rules across all gaps. */
  public int gapCount() {
    return gaps.stream().mapToInt(RuleGap::gapCount).sum();
  }
}
