package com.legacyrules.engine.detection;

import java.util.Locale;
import java.util.Optional;

public enum RuleCategory {
  VALIDATION("validation"),
  CALCULATION("calculation"),
  DECISION("decision"),
  WORKFLOW("workflow"),
  DATA_TRANSFORMATION("data_transformation"),
  CONDITIONAL("conditional");

  private final String tag;

  RuleCategory(String tag) {
    this.tag = tag;
  }

  public String tag() {
    return tag;
  }

  /** Accepts {@code data-transformation}, {@code data_transformation}, {@code DATA_TRANSFORM}. */
  public static Optional<RuleCategory> fromTag(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    if ("data_transform".equals(normalized)) {
      return Optional.of(DATA_TRANSFORMATION);
    }
    for (RuleCategory category : values()) {
      if (category.tag.equals(normalized)) {
        return Optional.of(category);
      }
    }
    return Optional.empty();
  }
}
