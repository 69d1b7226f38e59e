package com.legacyrules.engine.completeness;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

import com.legacyrules.engine.chunking.ChunkMetadata;
import com.legacyrules.engine.chunking.ChunkingResult;
import com.legacyrules.engine.chunking.ChunkingStrategy;
import com.legacyrules.engine.chunking.FileContextExtractor;
import com.legacyrules.engine.chunking.IntelligentChunker;
import com.legacyrules.engine.config.LegacyRulesProperties;
import com.legacyrules.engine.detection.LanguageDetector;
import com.legacyrules.engine.detection.LanguageProfileStore;
import com.legacyrules.engine.detection.RuleCategory;
import com.legacyrules.engine.support.CobolFixtures;
import com.legacyrules.engine.support.RuleRecords;
import com.legacyrules.engine.support.TestProfiles;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class RuleCompletenessAnalyzerTest {

  private static final String PROGRAM = CobolFixtures.premiumProgram();

  private final LegacyRulesProperties properties = TestProfiles.applicationProperties();
  private final LanguageProfileStore store = new LanguageProfileStore(properties);
  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final RuleCompletenessAnalyzer analyzer =
      new RuleCompletenessAnalyzer(store, properties, registry);

  @Test
  void mapsPercentagesToStatusTiers() {
    assertThat(CompletenessStatus.of(100.0d)).isEqualTo(CompletenessStatus.EXCELLENT);
    assertThat(CompletenessStatus.of(95.0d)).isEqualTo(CompletenessStatus.EXCELLENT);
    assertThat(CompletenessStatus.of(94.9d)).isEqualTo(CompletenessStatus.GOOD);
    assertThat(CompletenessStatus.of(90.0d)).isEqualTo(CompletenessStatus.GOOD);
    assertThat(CompletenessStatus.of(89.9d)).isEqualTo(CompletenessStatus.WARNING);
    assertThat(CompletenessStatus.of(80.0d)).isEqualTo(CompletenessStatus.WARNING);
    assertThat(CompletenessStatus.of(79.9d)).isEqualTo(CompletenessStatus.POOR);
    assertThat(CompletenessStatus.of(70.0d)).isEqualTo(CompletenessStatus.POOR);
    assertThat(CompletenessStatus.of(69.9d)).isEqualTo(CompletenessStatus.CRITICAL);
    assertThat(CompletenessStatus.of(0.0d)).isEqualTo(CompletenessStatus.CRITICAL);
  }

  @Test
  void expectsRulesPerParagraphFromCategoryPatterns() {
    CompletenessReport report = analyzer.analyze(PROGRAM, List.of(), null, "PREMCALC.cbl");

    assertThat(report.language()).isEqualTo("cobol");
    assertThat(report.totalExpectedRules()).isEqualTo(CobolFixtures.PREMIUM_PROGRAM_EXPECTED_RULES);
    assertThat(report.sections())
        .extracting(SectionCompleteness::sectionName, SectionCompleteness::expected)
        .containsExactly(
            tuple("VALIDATE-APPLICATION", 8),
            tuple("AUTO-VALIDATION", 10),
            tuple("CALCULATE-PREMIUM", 7));
    assertThat(report.sections().get(2).categoryBreakdown())
        .containsEntry(RuleCategory.VALIDATION, 4)
        .containsEntry(RuleCategory.CALCULATION, 3);
    assertThat(report.sections().get(2).lineRange()).isEqualTo(new LineRange(291, 400));
  }

  @Test
  void reportsGapsAndTargetedRecommendations() {
    List<ExtractedRule> rules = new ArrayList<>(RuleRecords.applicantChecks(8));
    rules.addAll(RuleRecords.vehicleChecks(9));
    ChunkingResult chunking = chunk(PROGRAM, "PREMCALC.cbl");

    CompletenessReport report = analyzer.analyze(PROGRAM, rules, chunking, "PREMCALC.cbl");

    assertThat(report.totalExtractedRules()).isEqualTo(17);
    assertThat(report.completenessPercentage()).isCloseTo(68.0d, within(1e-9));
    assertThat(report.status()).isEqualTo(CompletenessStatus.CRITICAL);
    assertThat(report.isTargetAchieved()).isFalse();
    assertThat(report.gaps())
        .extracting(RuleGap::sectionName, RuleGap::category, RuleGap::gapCount)
        .containsExactlyInAnyOrder(
            tuple("AUTO-VALIDATION", RuleCategory.CONDITIONAL, 1),
            tuple("CALCULATE-PREMIUM", RuleCategory.VALIDATION, 4),
            tuple("CALCULATE-PREMIUM", RuleCategory.CALCULATION, 3));
    assertThat(report.gapCount()).isEqualTo(8);
    assertThat(report.gaps()).allSatisfy(gap -> assertThat(gap.completenessRatio()).isZero());
    assertThat(report.gaps()).allSatisfy(gap -> assertThat(gap.confidence()).isEqualTo(0.8d));
    assertThat(report.sections())
        .extracting(SectionCompleteness::sectionName, SectionCompleteness::health)
        .containsExactly(
            tuple("VALIDATE-APPLICATION", SectionCompleteness.Health.GOOD),
            tuple("AUTO-VALIDATION", SectionCompleteness.Health.GOOD),
            tuple("CALCULATE-PREMIUM", SectionCompleteness.Health.POOR));
    assertThat(report.recommendations())
        .containsExactly(
            CompletenessStatus.CRITICAL.recommendation(),
            "Multiple calculation rules missing: review COMPUTE-style statements and calculation sections.",
            "Improve validation rule detection: Consider expanding IF-THEN pattern recognition.",
            "Target sections for improvement: CALCULATE-PREMIUM");
    assertThat(report.chunkPerformance())
        .extracting(ChunkPerformance::chunkId, ChunkPerformance::identifiedGaps)
        .containsExactly(tuple("section_1", 1), tuple("section_2", 3), tuple("section_3", 3));
  }

  @Test
  void reachesTargetWithNearlyCompleteExtraction() {
    CompletenessReport report =
        analyzer.analyze(
            PROGRAM, RuleRecords.premiumProgramExtraction(), chunk(PROGRAM, "PREMCALC.cbl"), "PREMCALC.cbl");

    assertThat(report.totalExtractedRules()).isEqualTo(23);
    assertThat(report.completenessPercentage()).isCloseTo(92.0d, within(1e-9));
    assertThat(report.status()).isEqualTo(CompletenessStatus.GOOD);
    assertThat(report.isTargetAchieved()).isTrue();
    assertThat(report.recommendations()).first().isEqualTo(CompletenessStatus.GOOD.recommendation());
  }

  @Test
  void malformedRecordsAreCountedButNotScored() {
    List<ExtractedRule> rules = new ArrayList<>(RuleRecords.applicantChecks(2));
    rules.add(new ExtractedRule("R-9", "WS-A > 1", null, "Missing actions", null));
    rules.add(null);

    CompletenessReport report = analyzer.analyze(PROGRAM, rules, null, "PREMCALC.cbl");

    assertThat(report.totalExtractedRules()).isEqualTo(2);
    assertThat(report.unclassifiableRules()).isEqualTo(2);
    assertThat(report.completenessPercentage()).isCloseTo(8.0d, within(1e-9));
  }

  @Test
  void unsectionedSourceAttributesEveryRuleToWholeFile() {
    String source =
        String.join(
            "\n",
            "if amount > 100 then reject",
            "compute total from lines",
            "switch mode",
            "print summary");
    List<ExtractedRule> rules =
        List.of(
            ExtractedRule.of("amount > 100", "reject", "Reject orders over the maximum"),
            ExtractedRule.of("always", "total = sum(lines)", "Compute the total"));

    CompletenessReport report = analyzer.analyze(source, rules, null, "orders.txt");

    assertThat(report.language()).isEqualTo(LanguageProfileStore.UNKNOWN_LANGUAGE);
    assertThat(report.totalExpectedRules()).isEqualTo(3);
    assertThat(report.sections()).singleElement().satisfies(section -> {
      assertThat(section.sectionName()).isEqualTo("ENTIRE-FILE");
      assertThat(section.extracted()).isEqualTo(2);
    });
    assertThat(report.gaps())
        .extracting(RuleGap::category, RuleGap::gapCount)
        .containsExactly(tuple(RuleCategory.DECISION, 1));
    assertThat(report.chunkPerformance()).isEmpty();
  }

  @Test
  void nothingExpectedIsCritical() {
    CompletenessReport report =
        analyzer.analyze("plain notes\nwithout logic", List.of(), null, "notes.txt");

    assertThat(report.totalExpectedRules()).isZero();
    assertThat(report.completenessPercentage()).isZero();
    assertThat(report.status()).isEqualTo(CompletenessStatus.CRITICAL);
    assertThat(report.gaps()).isEmpty();
  }

  @Test
  void keepsLastReportAndCountsByStatus() {
    assertThat(analyzer.lastReport()).isEmpty();

    CompletenessReport report = analyzer.analyze(PROGRAM, List.of(), null, "PREMCALC.cbl");

    assertThat(analyzer.lastReport()).containsSame(report);
    assertThat(
            registry.get("legacy_rules_completeness_reports_total").tag("status", "critical").counter().count())
        .isEqualTo(1.0d);
  }

  @Test
  void progressWarnsWhenLateChunksStillFallShort() {
    List<ChunkMetadata> metadata = metadata(4, 5);
    List<List<ExtractedRule>> processed =
        List.of(
            RuleRecords.applicantChecks(4), RuleRecords.applicantChecks(4), RuleRecords.applicantChecks(2));

    ProgressReport progress = analyzer.monitorProgress(processed, 20, metadata);

    assertThat(progress.currentExtracted()).isEqualTo(10);
    assertThat(progress.progressPercentage()).isCloseTo(50.0d, within(1e-9));
    assertThat(progress.chunksProcessed()).isEqualTo(3);
    assertThat(progress.totalChunks()).isEqualTo(4);
    assertThat(progress.warnings())
        .extracting(ProgressWarning::level)
        .containsExactly(ProgressWarning.Level.WARNING, ProgressWarning.Level.CRITICAL);
    assertThat(progress.hasCritical()).isTrue();
    assertThat(progress.estimatedFinal()).isEqualTo(13);
    assertThat(progress.targetAchieved()).isFalse();
    assertThat(progress.chunkEfficiency())
        .extracting(ChunkEfficiency::chunkId, ChunkEfficiency::isGood)
        .containsExactly(tuple("fixed_1", true), tuple("fixed_2", true), tuple("fixed_3", false));
  }

  @Test
  void earlyProgressDoesNotWarn() {
    ProgressReport progress =
        analyzer.monitorProgress(List.of(RuleRecords.applicantChecks(1)), 20, metadata(4, 5));

    assertThat(progress.hasWarnings()).isFalse();
    assertThat(progress.estimatedFinal()).isEqualTo(4);
  }

  @Test
  void progressIsRepeatableForTheSameInput() {
    List<List<ExtractedRule>> processed = List.of(RuleRecords.applicantChecks(3));
    List<ChunkMetadata> metadata = metadata(2, 3);

    ProgressReport first = analyzer.monitorProgress(processed, 6, metadata);
    ProgressReport second = analyzer.monitorProgress(processed, 6, metadata);

    assertThat(second).isEqualTo(first);
  }

  @Test
  void progressWithoutMetadataTreatsProcessedChunksAsComplete() {
    List<ExtractedRule> withMalformed = new ArrayList<>(RuleRecords.applicantChecks(4));
    withMalformed.add(new ExtractedRule(null, null, "noop", "broken", null));

    ProgressReport progress =
        analyzer.monitorProgress(List.of(RuleRecords.applicantChecks(5), withMalformed), 10, null);

    assertThat(progress.currentExtracted()).isEqualTo(9);
    assertThat(progress.unclassifiableRules()).isEqualTo(1);
    assertThat(progress.totalChunks()).isEqualTo(2);
    assertThat(progress.targetAchieved()).isTrue();
    assertThat(progress.hasWarnings()).isFalse();
    assertThat(progress.estimatedFinal()).isEqualTo(9);
    assertThat(progress.chunkEfficiency()).isEmpty();
  }

  @Test
  void progressWithNothingProcessedIsEmpty() {
    ProgressReport progress = analyzer.monitorProgress(null, 0, null);

    assertThat(progress.progressPercentage()).isZero();
    assertThat(progress.totalChunks()).isZero();
    assertThat(progress.hasWarnings()).isFalse();
    assertThat(progress.estimatedFinal()).isZero();
  }

  @Test
  void finishedProgressAgreesWithFinalReport() {
    ChunkingResult chunking = chunk(PROGRAM, "PREMCALC.cbl");
    List<ExtractedRule> all = RuleRecords.premiumProgramExtraction();
    List<List<ExtractedRule>> perChunk =
        List.of(all.subList(0, 10), all.subList(10, 18), all.subList(18, all.size()));

    CompletenessReport report = analyzer.analyze(PROGRAM, all, chunking, "PREMCALC.cbl");
    ProgressReport progress =
        analyzer.monitorProgress(perChunk, report.totalExpectedRules(), chunking.metadata());

    assertThat(chunking.chunkCount()).isEqualTo(3);
    assertThat(progress.progressPercentage()).isEqualTo(report.completenessPercentage());
    assertThat(progress.targetAchieved()).isEqualTo(report.isTargetAchieved());
    assertThat(progress.estimatedFinal()).isEqualTo(report.totalExtractedRules());
  }

  private ChunkingResult chunk(String content, String filename) {
    LanguageDetector detector = new LanguageDetector(store, properties, null);
    IntelligentChunker chunker =
        new IntelligentChunker(store, new FileContextExtractor(4), properties, null);
    return chunker.chunk(content, filename, detector.detect(filename, content));
  }

  private static List<ChunkMetadata> metadata(int chunks, int rulesEach) {
    List<ChunkMetadata> metadata = new ArrayList<>();
    for (int i = 0; i < chunks; i++) {
      metadata.add(
          new ChunkMetadata(
              "fixed_" + (i + 1),
              i * 150 + 1,
              i * 150 + 175,
              175,
              ChunkingStrategy.FIXED_SIZE,
              null,
              rulesEach,
              ChunkingStrategy.FIXED_SIZE.confidence(),
              i == 0 ? 0 : 25,
              "hash-" + i));
    }
    return metadata;
  }
}
