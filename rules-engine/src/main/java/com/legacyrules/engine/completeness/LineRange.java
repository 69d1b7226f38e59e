package com.legacyrules.engine.completeness;

public record LineRange(int startLine, int endLine) {

  public boolean overlaps(int otherStart, int otherEnd) {
    return startLine <= otherEnd && otherStart <= endLine;
  }
}
