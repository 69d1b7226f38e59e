package com.legacyrules.engine.detection;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable bundle of detection patterns and chunking defaults for one language or dialect. All
 * patterns are compiled case-insensitive and multi-line.
 */
public record LanguageProfile(
    String key,
    String name,
    String description,
    double confidenceRequired,
    List<String> fileExtensions,
    List<Pattern> strongPatterns,
    List<Pattern> supportingPatterns,
    List<Pattern> rulePatterns,
    List<Pattern> sectionMarkers,
    List<Pattern> ruleMarkers,
    RuleBlockPatterns ruleBlock,
    Map<RuleCategory, List<Pattern>> categoryPatterns,
    ChunkingParameters chunking,
    RuleDensityRange ruleDensity) {

  public static final int PATTERN_FLAGS = Pattern.CASE_INSENSITIVE | Pattern.MULTILINE;

  public LanguageProfile {
    key = key.toLowerCase(Locale.ROOT);
    confidenceRequired = Math.max(0.0d, Math.min(1.0d, confidenceRequired));
    fileExtensions = List.copyOf(fileExtensions);
    strongPatterns = List.copyOf(strongPatterns);
    supportingPatterns = List.copyOf(supportingPatterns);
    rulePatterns = List.copyOf(rulePatterns);
    sectionMarkers = List.copyOf(sectionMarkers);
    ruleMarkers = List.copyOf(ruleMarkers);
    ruleBlock = ruleBlock != null ? ruleBlock : RuleBlockPatterns.none();
    EnumMap<RuleCategory, List<Pattern>> categories = new EnumMap<>(RuleCategory.class);
    categoryPatterns.forEach((category, patterns) -> categories.put(category, List.copyOf(patterns)));
    categoryPatterns = Collections.unmodifiableMap(categories);
  }

  public boolean matchesExtension(String extension) {
    return extension != null && fileExtensions.contains(extension.toLowerCase(Locale.ROOT));
  }

  public boolean isSectionMarker(String line) {
    return anyMatch(sectionMarkers, line);
  }

  public boolean isRuleLine(String line) {
    return anyMatch(rulePatterns, line);
  }

  public boolean isRuleMarker(String line) {
    return anyMatch(ruleMarkers, line);
  }

  public List<Pattern> categoryPatterns(RuleCategory category) {
    return categoryPatterns.getOrDefault(category, List.of());
  }

  public static boolean anyMatch(List<Pattern> patterns, String line) {
    if (line == null || patterns.isEmpty()) {
      return false;
    }
    for (Pattern pattern : patterns) {
      if (pattern.matcher(line).find()) {
        return true;
      }
    }
    return false;
  }

  /** Number of non-overlapping matches of one pattern in the text. */
  public static int countMatches(Pattern pattern, CharSequence text) {
    if (text == null) {
      return 0;
    }
    Matcher matcher = pattern.matcher(text);
    int count = 0;
    while (matcher.find()) {
      count++;
    }
    return count;
  }
}
