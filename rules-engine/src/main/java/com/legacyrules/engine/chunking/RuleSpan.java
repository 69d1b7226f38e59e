package com.legacyrules.engine.chunking;

public record RuleSpan(int start, int end) {

  public boolean contains(int line) {
    return line > start && line < end;
  }
}
