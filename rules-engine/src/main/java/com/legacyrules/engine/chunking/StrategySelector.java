package com.legacyrules.engine.chunking;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Scores every strategy from file structure and picks the highest. Ties resolve to the earlier
 * strategy in declaration order.
 */
public final class StrategySelector {

  static final int SECTION_MARKER_THRESHOLD = 3;
  static final int RULE_PATTERN_THRESHOLD = 5;

  private StrategySelector() {}

  public static ChunkingStrategy select(
      int sectionMarkers, int rulePatterns, boolean blockStructured) {
    Map<ChunkingStrategy, Double> scores = scores(sectionMarkers, rulePatterns, blockStructured);
    ChunkingStrategy best = ChunkingStrategy.FIXED_SIZE;
    double bestScore = Double.NEGATIVE_INFINITY;
    for (ChunkingStrategy strategy : ChunkingStrategy.values()) {
      double score = scores.get(strategy);
      if (score > bestScore) {
        best = strategy;
        bestScore = score;
      }
    }
    return best;
  }

  public static Map<ChunkingStrategy, Double> scores(
      int sectionMarkers, int rulePatterns, boolean blockStructured) {
    Map<ChunkingStrategy, Double> scores = new EnumMap<>(ChunkingStrategy.class);
    boolean structured = sectionMarkers >= SECTION_MARKER_THRESHOLD && blockStructured;
    scores.put(ChunkingStrategy.SECTION_AWARE, structured ? 1.0d + 0.3d * sectionMarkers : 0.1d);
    boolean ruleHeavy =
        rulePatterns >= RULE_PATTERN_THRESHOLD && sectionMarkers < SECTION_MARKER_THRESHOLD;
    scores.put(
        ChunkingStrategy.RULE_BOUNDARY,
        ruleHeavy ? 0.8d + 0.2d * rulePatterns : Math.min(0.5d, 0.1d * rulePatterns));
    scores.put(ChunkingStrategy.SMART_OVERLAP, 0.6d);
    scores.put(ChunkingStrategy.FIXED_SIZE, 0.4d);
    return Collections.unmodifiableMap(scores);
  }
}
