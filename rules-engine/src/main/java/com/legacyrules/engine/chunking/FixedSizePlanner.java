package com.legacyrules.engine.chunking;

import com.legacyrules.engine.detection.ChunkingParameters;
import java.util.ArrayList;
import java.util.List;

final class FixedSizePlanner implements ChunkPlanner {

  @Override
  public List<ChunkRange> plan(ChunkingContext context) {
    ChunkingParameters parameters = context.parameters();
    int total = context.lineCount();
    List<ChunkRange> ranges = new ArrayList<>();
    int position = 0;
    int overlapIn = 0;
    while (position < total) {
      int end = Math.min(position + parameters.preferredSize(), total);
      ranges.add(new ChunkRange(position, end, context.sectionAt(position), overlapIn));
      if (end >= total) {
        break;
      }
      int next = end - parameters.overlapSize();
      overlapIn = end - next;
      position = next;
    }
    return ranges;
  }
}
