package com.legacyrules.engine.completeness;

import com.legacyrules.engine.detection.RuleCategory;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

record SectionExpectation(String sectionName, LineRange lineRange, Map<RuleCategory, Integer> categories) {

  SectionExpectation {
    EnumMap<RuleCategory, Integer> copy = new EnumMap<>(RuleCategory.class);
    copy.putAll(categories);
    categories = Collections.unmodifiableMap(copy);
  }

  int total() {
    return categories.values().stream().mapToInt(Integer::intValue).sum();
  }
}
