package com.legacyrules.engine.completeness;

import com.legacyrules.engine.config.LegacyRulesProperties;
import com.legacyrules.engine.detection.RuleCategory;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.springframework.util.StringUtils;

/**
 * Keyword heuristics that place an extracted rule into one category and one section. Keywords
 * match at word starts, so {@code valid} also matches {@code validation}.
 */
final class ExtractedRuleClassifier {

  static final String UNKNOWN_SECTION = "UNKNOWN";

  private static final List<RuleCategory> CLASSIFICATION_ORDER =
      List.of(
          RuleCategory.CALCULATION,
          RuleCategory.VALIDATION,
          RuleCategory.DECISION,
          RuleCategory.WORKFLOW,
          RuleCategory.DATA_TRANSFORMATION,
          RuleCategory.CONDITIONAL);

  private final Map<RuleCategory, Pattern> categoryKeywords = new EnumMap<>(RuleCategory.class);
  private final List<SectionKeywords> sectionKeywords = new ArrayList<>();

  ExtractedRuleClassifier(LegacyRulesProperties.Completeness settings) {
    settings
        .getCategoryKeywords()
        .forEach(
            (tag, keywords) ->
                RuleCategory.fromTag(tag)
                    .ifPresent(category -> categoryKeywords.put(category, keywordPattern(keywords))));
    for (LegacyRulesProperties.SectionVocabulary vocabulary : settings.getSectionVocabulary()) {
      if (StringUtils.hasText(vocabulary.getSection()) && !vocabulary.getKeywords().isEmpty()) {
        sectionKeywords.add(
            new SectionKeywords(vocabulary.getSection().trim(), keywordPattern(vocabulary.getKeywords())));
      }
    }
  }

  RuleCategory category(ExtractedRule rule) {
    String text = rule.classificationText();
    for (RuleCategory category : CLASSIFICATION_ORDER) {
      Pattern keywords = categoryKeywords.get(category);
      if (keywords != null && keywords.matcher(text).find()) {
        return category;
      }
    }
    return RuleCategory.DECISION;
  }

  String section(ExtractedRule rule) {
    String description = rule.businessDescription();
    if (!StringUtils.hasText(description)) {
      return UNKNOWN_SECTION;
    }
    for (SectionKeywords candidate : sectionKeywords) {
      if (candidate.keywords().matcher(description).find()) {
        return candidate.section();
      }
    }
    return UNKNOWN_SECTION;
  }

  private static Pattern keywordPattern(List<String> keywords) {
    List<String> quoted = new ArrayList<>();
    for (String keyword : keywords) {
      if (StringUtils.hasText(keyword)) {
        quoted.add(Pattern.quote(keyword.trim().toLowerCase(Locale.ROOT)));
      }
    }
    if (quoted.isEmpty()) {
      return Pattern.compile("(?!)");
    }
    return Pattern.compile("\\b(?:" + String.join("|", quoted) + ")", Pattern.CASE_INSENSITIVE);
  }

  private record SectionKeywords(String section, Pattern keywords) {}
}
