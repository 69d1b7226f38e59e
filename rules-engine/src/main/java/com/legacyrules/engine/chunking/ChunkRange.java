package com.legacyrules.engine.chunking;

// Zero-based line indices, end exclusive.
record ChunkRange(int start, int end, String sectionName, int overlapLines) {

  int length() {
    return end - start;
  }

  int firstOwnedLine() {
    return Math.min(end, start + Math.max(0, overlapLines));
  }
}
