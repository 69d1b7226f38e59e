package com.legacyrules.engine.chunking;

import com.legacyrules.engine.detection.ChunkingParameters;
import java.util.ArrayList;
import java.util.List;

/** Closes a chunk right before the rule span that would push it past the max size. */
final class RuleBoundaryPlanner implements ChunkPlanner {

  @Override
  public List<ChunkRange> plan(ChunkingContext context) {
    List<RuleSpan> spans = context.ruleSpans();
    if (spans.isEmpty()) {
      return List.of();
    }
    ChunkingParameters parameters = context.parameters();
    int total = context.lineCount();
    List<ChunkRange> ranges = new ArrayList<>();
    int chunkStart = 0;
    int overlapIn = 0;

    for (RuleSpan span : spans) {
      if (span.start() < chunkStart) {
        continue;
      }
      int potentialSize = span.end() - chunkStart;
      if (potentialSize > parameters.maxSize() && span.start() - chunkStart >= parameters.minSize()) {
        int chunkEnd = span.start();
        ranges.add(new ChunkRange(chunkStart, chunkEnd, context.sectionAt(chunkStart), overlapIn));
        int nextStart = Math.max(chunkStart + 1, span.start() - parameters.overlapSize());
        overlapIn = chunkEnd - nextStart;
        chunkStart = nextStart;
      }
    }
    ranges.add(new ChunkRange(chunkStart, total, context.sectionAt(chunkStart), overlapIn));
    return OversizedRangeSplitter.split(ranges, context);
  }
}
