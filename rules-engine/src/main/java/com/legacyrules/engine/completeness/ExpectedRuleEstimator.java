package com.legacyrules.engine.completeness;

import com.legacyrules.engine.chunking.SectionBoundary;
import com.legacyrules.engine.chunking.SectionResolver;
import com.legacyrules.engine.detection.LanguageProfile;
import com.legacyrules.engine.detection.RuleCategory;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Counts expected rules per section and category by running the profile's category patterns over
 * each line. A line counts at most once per category but may count toward several categories.
 */
final class ExpectedRuleEstimator {

  static final String WHOLE_FILE_SECTION = "ENTIRE-FILE";
  static final String PREAMBLE_SECTION = "PREAMBLE";

  private ExpectedRuleEstimator() {}

  static List<SectionExpectation> estimate(List<String> lines, LanguageProfile profile) {
    List<SectionBoundary> sections = new SectionResolver(lines, profile).sections();
    List<SectionExpectation> expectations = new ArrayList<>();
    if (sections.isEmpty()) {
      expectations.add(expectation(WHOLE_FILE_SECTION, lines, 0, lines.size(), profile));
      return expectations;
    }
    int firstMarker = sections.get(0).start();
    if (firstMarker > 0) {
      SectionExpectation preamble = expectation(PREAMBLE_SECTION, lines, 0, firstMarker, profile);
      if (preamble.total() > 0) {
        expectations.add(preamble);
      }
    }
    for (SectionBoundary section : sections) {
      expectations.add(expectation(section.name(), lines, section.start(), section.end(), profile));
    }
    return expectations;
  }

  private static SectionExpectation expectation(
      String name, List<String> lines, int start, int end, LanguageProfile profile) {
    Map<RuleCategory, Integer> counts = new EnumMap<>(RuleCategory.class);
    for (RuleCategory category : RuleCategory.values()) {
      List<Pattern> patterns = profile.categoryPatterns(category);
      if (patterns.isEmpty()) {
        continue;
      }
      int count = 0;
      for (int i = start; i < end; i++) {
        if (LanguageProfile.anyMatch(patterns, lines.get(i))) {
          count++;
        }
      }
      counts.put(category, count);
    }
    return new SectionExpectation(name, new LineRange(start + 1, Math.max(start + 1, end)), counts);
  }
}
