package com.legacyrules.engine.chunking;

import com.legacyrules.engine.detection.ChunkingParameters;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Ends each chunk at a natural boundary (blank or comment line) between the preferred and the max
 * size, and widens the overlap where the chunk is dense with rules.
 */
final class SmartOverlapPlanner implements ChunkPlanner {

  private static final Pattern COMMENT_LINE = Pattern.compile("^\\s*(\\*|//|#|--|/\\*|;)");

  @Override
  public List<ChunkRange> plan(ChunkingContext context) {
    ChunkingParameters parameters = context.parameters();
    List<String> lines = context.lines();
    int total = lines.size();
    List<ChunkRange> ranges = new ArrayList<>();
    int position = 0;
    int overlapIn = 0;

    while (position < total) {
      int preferredEnd = Math.min(position + parameters.preferredSize(), total);
      int maxEnd = Math.min(position + parameters.maxSize(), total);
      int end = naturalBoundary(lines, preferredEnd, maxEnd);
      if (total - end < parameters.minSize() && total - position <= parameters.maxSize()) {
        end = total;
      }
      ranges.add(new ChunkRange(position, end, context.sectionAt(position), overlapIn));
      if (end >= total) {
        break;
      }
      int overlap = adaptiveOverlap(context, position, end);
      int next = Math.max(position + parameters.minSize(), end - overlap);
      next = Math.min(next, end);
      overlapIn = end - next;
      position = next;
    }
    return ranges;
  }

  private static int naturalBoundary(List<String> lines, int from, int to) {
    for (int i = from; i < to; i++) {
      String line = lines.get(i);
      if (line.isBlank() || COMMENT_LINE.matcher(line).find()) {
        return i + 1;
      }
    }
    return from;
  }

  private static int adaptiveOverlap(ChunkingContext context, int start, int end) {
    int base = context.parameters().overlapSize();
    int length = end - start;
    int rules = RuleCountEstimator.estimate(context.lines(), start, end, context.profile());
    double density = length > 0 ? (double) rules / length : 0.0d;
    int adaptive = Math.max(base, (int) (base * (1.0d + density)));
    return Math.min(adaptive, Math.max(0, length / 3));
  }
}
