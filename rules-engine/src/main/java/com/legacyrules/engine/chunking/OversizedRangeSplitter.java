package com.legacyrules.engine.chunking;

import com.legacyrules.engine.detection.ChunkingParameters;
import java.util.ArrayList;
import java.util.List;

/**
 * Subdivides ranges longer than the max size into preferred-size pieces with overlap. Cut points
 * are moved off detected rule spans when the resulting piece still respects the size bounds.
 */
final class OversizedRangeSplitter {

  private OversizedRangeSplitter() {}

  static List<ChunkRange> split(List<ChunkRange> ranges, ChunkingContext context) {
    ChunkingParameters parameters = context.parameters();
    List<ChunkRange> result = new ArrayList<>(ranges.size());
    for (ChunkRange range : ranges) {
      if (range.length() <= parameters.maxSize()) {
        result.add(range);
      } else {
        result.addAll(splitRange(range, context));
      }
    }
    return result;
  }

  private static List<ChunkRange> splitRange(ChunkRange range, ChunkingContext context) {
    ChunkingParameters parameters = context.parameters();
    int min = parameters.minSize();
    int max = parameters.maxSize();
    int overlap = parameters.overlapSize();
    List<ChunkRange> pieces = new ArrayList<>();
    int start = range.start();
    int overlapIn = range.overlapLines();
    String section = range.sectionName();
    while (range.end() - start > max) {
      int cut = start + parameters.preferredSize();
      if (range.end() - (cut - overlap) < min) {
        cut = Math.max(start + min, range.end() - min + overlap);
      }
      cut = avoidRuleSpan(cut, start, range.end(), context);
      pieces.add(new ChunkRange(start, cut, section, overlapIn));
      int next = Math.max(start + 1, cut - overlap);
      overlapIn = cut - next;
      start = next;
      String resolved = context.sectionAt(start);
      if (resolved != null) {
        section = resolved;
      }
    }
    pieces.add(new ChunkRange(start, range.end(), section, overlapIn));
    return pieces;
  }

  private static int avoidRuleSpan(int cut, int start, int limit, ChunkingContext context) {
    RuleSpan span = context.spanAcross(cut);
    if (span == null) {
      return cut;
    }
    ChunkingParameters parameters = context.parameters();
    if (span.start() - start >= parameters.minSize()) {
      return span.start();
    }
    if (span.end() - start <= parameters.maxSize() && span.end() < limit) {
      return span.end();
    }
    return cut;
  }
}
