package com.legacyrules.engine.chunking;

import com.legacyrules.engine.detection.ChunkingParameters;
import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates whole sections into a chunk until adding the next one would pass the preferred size
 * for the current section. Each cut keeps {@code overlap} lines of context on both sides of the
 * section boundary.
 */
final class SectionAwarePlanner implements ChunkPlanner {

  @Override
  public List<ChunkRange> plan(ChunkingContext context) {
    List<SectionBoundary> sections = context.sections();
    if (sections.isEmpty()) {
      return List.of();
    }
    ChunkingParameters parameters = context.parameters();
    int total = context.lineCount();
    int overlap = parameters.overlapSize();
    List<ChunkRange> ranges = new ArrayList<>();
    int chunkStart = 0;
    int overlapIn = 0;
    String currentSection = context.sectionAt(0);

    for (SectionBoundary section : sections) {
      if (currentSection == null) {
        currentSection = section.name();
      }
      int currentSize = section.start() - chunkStart;
      int preferred = parameters.preferredSizeFor(currentSection);
      if (currentSize + section.size() > preferred && currentSize >= parameters.minSize()) {
        int chunkEnd = Math.min(section.start() + overlap, total);
        ranges.add(new ChunkRange(chunkStart, chunkEnd, currentSection, overlapIn));
        int nextStart = Math.max(chunkStart + 1, section.start() - overlap);
        overlapIn = chunkEnd - nextStart;
        chunkStart = nextStart;
        currentSection = section.name();
      }
    }
    ranges.add(new ChunkRange(chunkStart, total, currentSection, overlapIn));
    return OversizedRangeSplitter.split(ranges, context);
  }
}
