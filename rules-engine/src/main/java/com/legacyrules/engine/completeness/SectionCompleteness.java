package com.legacyrules.engine.completeness;

import com.legacyrules.engine.detection.RuleCategory;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public record SectionCompleteness(
    String sectionName,
    int expected,
    int extracted,
    double percentage,
    Health health,
    LineRange lineRange,
    Map<RuleCategory, Integer> categoryBreakdown) {

  public enum Health {
    GOOD,
    WARNING,
    POOR;

    static Health of(double percentage) {
      if (percentage >= 90.0d) {
        return GOOD;
      }
      return percentage >= 80.0d ? WARNING : POOR;
    }
  }

  public SectionCompleteness {
    EnumMap<RuleCategory, Integer> copy = new EnumMap<>(RuleCategory.class);
    copy.putAll(categoryBreakdown);
    categoryBreakdown = Collections.unmodifiableMap(copy);
  }
}
