package com.legacyrules.engine.completeness;

import com.legacyrules.engine.chunking.ChunkMetadata;
import com.legacyrules.engine.chunking.ChunkingResult;
import com.legacyrules.engine.config.LegacyRulesProperties;
import com.legacyrules.engine.detection.LanguageProfile;
import com.legacyrules.engine.detection.LanguageProfileStore;
import com.legacyrules.engine.detection.RuleCategory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

/**
 * Estimates how many rules a source file should yield and scores an extraction against it.
 *
 * <p>Expected counts come from the language profile's category patterns, per section. Extracted
 * counts come from classifying each well-formed rule record into one category and one section.
 * The ratio of the two drives the status, the gaps and the recommendations.
 */
@Service
public class RuleCompletenessAnalyzer {

  private static final Logger log = LoggerFactory.getLogger(RuleCompletenessAnalyzer.class);

  private final LanguageProfileStore profileStore;
  private final LegacyRulesProperties.Completeness settings;
  private final ExtractedRuleClassifier classifier;
  private final MeterRegistry meterRegistry;
  private final AtomicReference<CompletenessReport> lastReport = new AtomicReference<>();

  public RuleCompletenessAnalyzer(
      LanguageProfileStore profileStore,
      LegacyRulesProperties properties,
      @Nullable MeterRegistry meterRegistry) {
    this.profileStore = Objects.requireNonNull(profileStore, "profileStore");
    this.settings = Objects.requireNonNull(properties, "properties").getCompleteness();
    this.classifier = new ExtractedRuleClassifier(settings);
    this.meterRegistry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
  }

  public CompletenessReport analyze(
      String sourceContent,
      @Nullable List<ExtractedRule> extractedRules,
      @Nullable ChunkingResult chunkingResult,
      String filename) {
    long started = System.nanoTime();
    List<String> lines = lines(sourceContent);
    LanguageProfile profile = resolveProfile(filename, chunkingResult);
    List<SectionExpectation> expectations = ExpectedRuleEstimator.estimate(lines, profile);
    boolean wholeFileOnly =
        expectations.size() == 1
            && ExpectedRuleEstimator.WHOLE_FILE_SECTION.equals(expectations.get(0).sectionName());

    Map<String, Map<RuleCategory, Integer>> extractedBySection = new HashMap<>();
    int extracted = 0;
    int unclassifiable = 0;
    if (extractedRules != null) {
      for (ExtractedRule rule : extractedRules) {
        if (rule == null || !rule.isWellFormed()) {
          unclassifiable++;
          continue;
        }
        RuleCategory category = classifier.category(rule);
        String section =
            wholeFileOnly ? ExpectedRuleEstimator.WHOLE_FILE_SECTION : classifier.section(rule);
        extractedBySection
            .computeIfAbsent(section, ignored -> new EnumMap<>(RuleCategory.class))
            .merge(category, 1, Integer::sum);
        extracted++;
      }
    }
    if (unclassifiable > 0) {
      log.warn("Skipped {} malformed rule records for {}", unclassifiable, filename);
    }

    int expected = expectations.stream().mapToInt(SectionExpectation::total).sum();
    double percentage = percentage(extracted, expected);
    CompletenessStatus status = CompletenessStatus.of(percentage);

    List<RuleGap> gaps = gaps(expectations, extractedBySection);
    List<SectionCompleteness> sections = sections(expectations, extractedBySection);
    List<ChunkPerformance> performance = chunkPerformance(chunkingResult, gaps);
    List<String> recommendations = recommendations(status, gaps, sections);

    CompletenessReport report =
        new CompletenessReport(
            filename,
            profile.key(),
            expected,
            extracted,
            unclassifiable,
            percentage,
            status,
            gaps,
            sections,
            performance,
            recommendations,
            Duration.ofNanos(System.nanoTime() - started));
    lastReport.set(report);
    meterRegistry
        .counter("legacy_rules_completeness_reports_total", "status", status.name().toLowerCase(Locale.ROOT))
        .increment();
    log.debug(
        "Completeness for {}: {}/{} rules ({}%), status={}, gaps={}",
        filename,
        extracted,
        expected,
        String.format(Locale.ROOT, "%.1f", percentage),
        status,
        gaps.size());
    return report;
  }

  /**
   * Running progress while chunks are still being extracted. Pure function of its arguments, so
   * repeated calls with the same cumulative input return equal reports. Without chunk metadata the
   * processed chunks are taken as the complete set.
   */
  public ProgressReport monitorProgress(
      @Nullable List<? extends List<ExtractedRule>> chunkResults,
      int expectedTotal,
      @Nullable List<ChunkMetadata> chunkMetadata) {
    List<? extends List<ExtractedRule>> results = chunkResults != null ? chunkResults : List.of();
    int processed = results.size();
    int totalChunks =
        chunkMetadata != null && !chunkMetadata.isEmpty() ? Math.max(chunkMetadata.size(), processed) : processed;

    int current = 0;
    int unclassifiable = 0;
    List<ChunkEfficiency> efficiency = new ArrayList<>();
    for (int i = 0; i < processed; i++) {
      List<ExtractedRule> chunkRules = results.get(i);
      int wellFormed = 0;
      if (chunkRules != null) {
        for (ExtractedRule rule : chunkRules) {
          if (rule != null && rule.isWellFormed()) {
            wellFormed++;
          } else {
            unclassifiable++;
          }
        }
      }
      current += wellFormed;
      if (chunkMetadata != null && i < chunkMetadata.size() && chunkMetadata.get(i) != null) {
        ChunkMetadata metadata = chunkMetadata.get(i);
        int estimated = metadata.ruleCountEstimate();
        efficiency.add(
            new ChunkEfficiency(
                metadata.chunkId(), wellFormed, estimated, (double) wellFormed / Math.max(estimated, 1)));
      }
    }

    double percentage = percentage(current, expectedTotal);
    double doneFraction = totalChunks > 0 ? (double) processed / totalChunks : 0.0d;
    List<ProgressWarning> warnings = new ArrayList<>();
    if (doneFraction >= 0.7d && percentage < settings.getTargetPercentage()) {
      warnings.add(
          new ProgressWarning(
              ProgressWarning.Level.WARNING,
              "Extraction below %s%% target: %s%% (%d/%d)"
                  .formatted(
                      format(settings.getTargetPercentage(), 0), format(percentage, 1), current, expectedTotal),
              "Consider increasing chunk overlap or refining section boundaries"));
    }
    if (doneFraction >= 0.5d && percentage < CompletenessStatus.POOR.threshold()) {
      warnings.add(
          new ProgressWarning(
              ProgressWarning.Level.CRITICAL,
              "Critical extraction gap: %s%% - significant rules may be missing"
                  .formatted(format(percentage, 1)),
              "Review chunking strategy and consider manual section identification"));
    }
    int estimatedFinal = doneFraction > 0.0d ? (int) Math.round(current / doneFraction) : current;
    return new ProgressReport(
        current,
        expectedTotal,
        percentage,
        processed,
        totalChunks,
        unclassifiable,
        warnings,
        efficiency,
        percentage >= settings.getTargetPercentage(),
        estimatedFinal);
  }

  /** The most recent report produced by {@link #analyze}, if any. */
  public Optional<CompletenessReport> lastReport() {
    return Optional.ofNullable(lastReport.get());
  }

  private LanguageProfile resolveProfile(String filename, @Nullable ChunkingResult chunkingResult) {
    if (chunkingResult != null
        && !LanguageProfileStore.UNKNOWN_LANGUAGE.equals(chunkingResult.language())) {
      Optional<LanguageProfile> profile = profileStore.profile(chunkingResult.language());
      if (profile.isPresent()) {
        return profile.get();
      }
    }
    return profileStore.profileForFilename(filename).orElse(profileStore.fallback());
  }

  private List<RuleGap> gaps(
      List<SectionExpectation> expectations, Map<String, Map<RuleCategory, Integer>> extractedBySection) {
    List<RuleGap> gaps = new ArrayList<>();
    for (SectionExpectation expectation : expectations) {
      Map<RuleCategory, Integer> extracted =
          extractedBySection.getOrDefault(expectation.sectionName(), Map.of());
      for (Map.Entry<RuleCategory, Integer> entry : expectation.categories().entrySet()) {
        int expectedCount = entry.getValue();
        int extractedCount = extracted.getOrDefault(entry.getKey(), 0);
        if (extractedCount < expectedCount) {
          gaps.add(
              new RuleGap(
                  entry.getKey(),
                  expectation.sectionName(),
                  expectedCount,
                  extractedCount,
                  settings.getGapConfidence(),
                  expectation.lineRange(),
                  gapSuggestions(entry.getKey(), expectedCount - extractedCount)));
        }
      }
    }
    return gaps;
  }

  private static List<String> gapSuggestions(RuleCategory category, int missing) {
    return switch (category) {
      case CALCULATION -> List.of(
          "Review COMPUTE statements and calculation logic",
          "Check for multi-line calculation statements that may be split");
      case VALIDATION -> List.of(
          "Examine IF statements with comparison operators (<, >, =)",
          "Look for validation rules in comments (* Business Rule:)");
      case DECISION -> missing > 2
          ? List.of(
              "Review nested IF-THEN-ELSE structures",
              "Check for EVALUATE statements that may contain multiple rules")
          : List.of();
      default -> List.of();
    };
  }

  private List<SectionCompleteness> sections(
      List<SectionExpectation> expectations, Map<String, Map<RuleCategory, Integer>> extractedBySection) {
    List<SectionCompleteness> sections = new ArrayList<>(expectations.size());
    for (SectionExpectation expectation : expectations) {
      int extracted =
          extractedBySection.getOrDefault(expectation.sectionName(), Map.of()).values().stream()
              .mapToInt(Integer::intValue)
              .sum();
      int expected = expectation.total();
      double percentage = expected > 0 ? extracted * 100.0d / expected : 100.0d;
      sections.add(
          new SectionCompleteness(
              expectation.sectionName(),
              expected,
              extracted,
              percentage,
              SectionCompleteness.Health.of(percentage),
              expectation.lineRange(),
              expectation.categories()));
    }
    return sections;
  }

  private static List<ChunkPerformance> chunkPerformance(
      @Nullable ChunkingResult chunkingResult, List<RuleGap> gaps) {
    if (chunkingResult == null) {
      return List.of();
    }
    List<ChunkPerformance> performance = new ArrayList<>(chunkingResult.chunkCount());
    for (ChunkMetadata metadata : chunkingResult.metadata()) {
      List<String> details = new ArrayList<>();
      for (RuleGap gap : gaps) {
        if (gap.lineRange() != null && gap.lineRange().overlaps(metadata.startLine(), metadata.endLine())) {
          details.add("%s/%s: %d".formatted(gap.sectionName(), gap.category().tag(), gap.gapCount()));
        }
      }
      performance.add(
          new ChunkPerformance(
              metadata.chunkId(),
              metadata.startLine(),
              metadata.endLine(),
              metadata.contentLines(),
              metadata.ruleCountEstimate(),
              metadata.confidence(),
              metadata.strategy(),
              metadata.sectionName(),
              details.size(),
              details));
    }
    return performance;
  }

  private List<String> recommendations(
      CompletenessStatus status, List<RuleGap> gaps, List<SectionCompleteness> sections) {
    List<String> recommendations = new ArrayList<>();
    recommendations.add(status.recommendation());

    Map<RuleCategory, Integer> missing = new EnumMap<>(RuleCategory.class);
    for (RuleGap gap : gaps) {
      missing.merge(gap.category(), gap.gapCount(), Integer::sum);
    }
    if (missing.getOrDefault(RuleCategory.CALCULATION, 0) > 2) {
      recommendations.add(
          "Multiple calculation rules missing: review COMPUTE-style statements and calculation sections.");
    }
    if (missing.getOrDefault(RuleCategory.VALIDATION, 0) > 3) {
      recommendations.add(
          "Improve validation rule detection: Consider expanding IF-THEN pattern recognition.");
    }
    if (missing.getOrDefault(RuleCategory.DECISION, 0) > 2) {
      recommendations.add(
          "Enhance decision logic extraction: Review nested IF and EVALUATE statements.");
    }

    List<String> weakSections = new ArrayList<>();
    for (SectionCompleteness section : sections) {
      if (section.percentage() < settings.getSectionCallOutPercentage()) {
        weakSections.add(section.sectionName());
      }
    }
    if (!weakSections.isEmpty()) {
      recommendations.add("Target sections for improvement: " + String.join(", ", weakSections));
    }
    return recommendations;
  }

  private static double percentage(int extracted, int expected) {
    return expected > 0 ? extracted * 100.0d / expected : 0.0d;
  }

  private static List<String> lines(@Nullable String content) {
    if (content == null || content.isEmpty()) {
      return List.of();
    }
    return List.of(content.replace("\r\n", "\n").replace('\r', '\n').split("\n", -1));
  }

  private static String format(double value, int decimals) {
    return String.format(Locale.ROOT, "%." + decimals + "f", value);
  }
}
