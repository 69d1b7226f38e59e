package com.legacyrules.engine.chunking;

public record SectionBoundary(String name, int start, int end) {

  public int size() {
    return end - start;
  }
}
