package com.legacyrules.engine.completeness;

public record ProgressWarning(Level level, String message, String recommendation) {

  public enum Level {
    WARNING,
    CRITICAL
  }
}
