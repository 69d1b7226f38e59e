package com.legacyrules.engine.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.legacyrules.engine.config.LegacyRulesProperties;
import com.legacyrules.engine.detection.DetectionResult;
import com.legacyrules.engine.detection.LanguageDetector;
import com.legacyrules.engine.detection.LanguageProfileStore;
import com.legacyrules.engine.support.CobolFixtures;
import com.legacyrules.engine.support.TestProfiles;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class IntelligentChunkerTest {

  private final LegacyRulesProperties properties = TestProfiles.applicationProperties();
  private final LanguageProfileStore store = new LanguageProfileStore(properties);
  private final LanguageDetector detector = new LanguageDetector(store, properties, null);
  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final IntelligentChunker chunker =
      new IntelligentChunker(store, new FileContextExtractor(16), properties, registry);

  @ParameterizedTest
  @EnumSource(ChunkingStrategy.class)
  void everyStrategyCoversAllLinesWithinSizeBounds(ChunkingStrategy strategy) {
    for (int total : new int[] {176, 263, 500, 1003, 2500}) {
      for (long seed = 1; seed <= 3; seed++) {
        String content = mixedSource(total, seed);
        DetectionResult detection = detector.detect("generated.cbl", content);

        ChunkingResult result = chunker.chunk(content, "generated.cbl", detection, strategy);

        assertThat(result.totalLines()).isEqualTo(total);
        assertCoversWithoutGaps(result);
        assertRespectsSizeBounds(result, 87, 262);
      }
    }
  }

  @Test
  void sectionedCobolUsesSectionAwareChunking() {
    String content = CobolFixtures.premiumProgram();
    DetectionResult detection = detector.detect("PREMCALC.cbl", content);

    ChunkingResult result = chunker.chunk(content, "PREMCALC.cbl", detection);

    assertThat(result.language()).isEqualTo("cobol");
    assertThat(result.strategyUsed()).isEqualTo(ChunkingStrategy.SECTION_AWARE);
    assertThat(result.chunkCount()).isGreaterThanOrEqualTo(2);
    assertThat(result.metadata()).extracting(ChunkMetadata::chunkId).startsWith("section_1", "section_2");
    assertThat(result.metadata()).allSatisfy(chunk -> assertThat(chunk.confidence()).isEqualTo(0.9d));
    assertThat(result.metadata().get(1).sectionName()).isEqualTo("AUTO-VALIDATION");
    assertThat(result.metadata().get(1).overlapLines()).isEqualTo(50);
    assertThat(result.estimatedCoverage()).isCloseTo(0.9d, within(1e-9));
    assertThat(result.totalRuleEstimate()).isEqualTo(CobolFixtures.PREMIUM_PROGRAM_RULE_LINES);
    assertThat(result.fileContext())
        .contains("       IDENTIFICATION DIVISION.", "      * Premium calculation batch");
    assertCoversWithoutGaps(result);
  }

  @Test
  void ruleDenseFileKeepsEveryRuleSpanInsideOneChunk() {
    String content = CobolFixtures.unsectionedRules(60, 4);
    DetectionResult detection = detector.detect("RULES.cbl", content);
    ChunkableFile file = ChunkableFile.from("RULES.cbl", content);
    List<RuleSpan> spans = RuleSpanDetector.detect(file.lines(), store.profile("cobol").orElseThrow());

    ChunkingResult result = chunker.chunk(content, "RULES.cbl", detection);

    assertThat(detection.isConfident()).isTrue();
    assertThat(spans).hasSize(60);
    assertThat(result.strategyUsed()).isEqualTo(ChunkingStrategy.RULE_BOUNDARY);
    assertThat(result.chunkCount()).isGreaterThan(1);
    for (RuleSpan span : spans) {
      assertThat(result.metadata())
          .anySatisfy(
              chunk -> {
                assertThat(chunk.startLine()).isLessThanOrEqualTo(span.start() + 1);
                assertThat(chunk.endLine()).isGreaterThanOrEqualTo(span.end());
              });
    }
    assertThat(result.totalRuleEstimate()).isEqualTo(60);
  }

  @Test
  void ruleEstimatesSumToFileTotalDespiteOverlap() {
    String content = CobolFixtures.unsectionedRules(60, 4);
    DetectionResult detection = detector.detect("RULES.cbl", content);

    ChunkingResult fixed = chunker.chunk(content, "RULES.cbl", detection, ChunkingStrategy.FIXED_SIZE);
    ChunkingResult smart = chunker.chunk(content, "RULES.cbl", detection, ChunkingStrategy.SMART_OVERLAP);

    assertThat(fixed.metadata()).extracting(ChunkMetadata::overlapLines).contains(25);
    assertThat(fixed.totalRuleEstimate()).isEqualTo(60);
    assertThat(smart.totalRuleEstimate()).isEqualTo(60);
  }

  @Test
  void chunkingIsDeterministic() {
    String content = mixedSource(1200, 42L);
    DetectionResult detection = detector.detect("generated.cbl", content);

    ChunkingResult first = chunker.chunk(content, "generated.cbl", detection);
    ChunkingResult second = chunker.chunk(content, "generated.cbl", detection);

    assertThat(second).isEqualTo(first);
  }

  @Test
  void smallFileBecomesSingleChunk() {
    String content =
        IntStream.rangeClosed(1, 100).mapToObj(i -> "line " + i).collect(Collectors.joining("\n"));

    ChunkingResult result = chunker.chunk(content, "small.txt", null);

    assertThat(result.chunkCount()).isEqualTo(1);
    ChunkMetadata only = result.metadata().get(0);
    assertThat(only.chunkId()).isEqualTo(IntelligentChunker.SINGLE_CHUNK_ID);
    assertThat(only.startLine()).isEqualTo(1);
    assertThat(only.endLine()).isEqualTo(100);
    assertThat(only.confidence()).isEqualTo(1.0d);
    assertThat(only.sizeEfficiency()).isEqualTo(0.5d);
    assertThat(result.estimatedCoverage()).isEqualTo(1.0d);
    assertThat(result.chunks().get(0)).isEqualTo(content);
    assertThat(result.sizeVariance()).isZero();
  }

  @Test
  void emptyContentYieldsExplicitEmptyResult() {
    ChunkingResult empty = chunker.chunk("", "empty.cbl", null);
    ChunkingResult nullContent = chunker.chunk(null, "empty.cbl", null);

    assertThat(empty.isEmpty()).isTrue();
    assertThat(empty.totalLines()).isZero();
    assertThat(empty.estimatedCoverage()).isZero();
    assertThat(empty.averageChunkSize()).isZero();
    assertThat(nullContent.isEmpty()).isTrue();
  }

  @Test
  void fallsThroughWhenForcedStrategyHasNoPlan() {
    String rules = CobolFixtures.unsectionedRules(60, 4);
    String plain =
        IntStream.rangeClosed(1, 600).mapToObj(i -> "plain line " + i).collect(Collectors.joining("\n"));

    ChunkingResult toRuleBoundary =
        chunker.chunk(rules, "RULES.cbl", detector.detect("RULES.cbl", rules), ChunkingStrategy.SECTION_AWARE);
    ChunkingResult toSmartOverlap =
        chunker.chunk(plain, "plain.txt", detector.detect("plain.txt", plain), ChunkingStrategy.SECTION_AWARE);

    assertThat(toRuleBoundary.strategyUsed()).isEqualTo(ChunkingStrategy.RULE_BOUNDARY);
    assertThat(toSmartOverlap.strategyUsed()).isEqualTo(ChunkingStrategy.SMART_OVERLAP);
    assertThat(toSmartOverlap.metadata()).extracting(ChunkMetadata::chunkId).startsWith("smart_1");
    assertCoversWithoutGaps(toSmartOverlap);
  }

  @Test
  void lowConfidenceDetectionUsesFallbackProfile() {
    String plain =
        IntStream.rangeClosed(1, 400).mapToObj(i -> "plain line " + i).collect(Collectors.joining("\n"));
    DetectionResult detection = detector.detect("plain.txt", plain);

    ChunkingResult result = chunker.chunk(plain, "plain.txt", detection);

    assertThat(detection.isConfident()).isFalse();
    assertThat(result.language()).isEqualTo(LanguageProfileStore.UNKNOWN_LANGUAGE);
    assertThat(result.strategyUsed()).isEqualTo(ChunkingStrategy.SMART_OVERLAP);
    assertThat(result.metadata().get(0).contentLines()).isEqualTo(175);
    assertThat(registry.get("legacy_rules_chunking_total").tag("strategy", "smart_overlap").counter().count())
        .isEqualTo(1.0d);
  }

  @Test
  void coverageIsRuleWeightedMeanOfConfidences() {
    ChunkMetadata heavy = metadata("a", 0.9d, 9);
    ChunkMetadata light = metadata("b", 0.5d, 1);
    ChunkMetadata none = metadata("c", 0.5d, 0);

    assertThat(IntelligentChunker.coverage(List.of(heavy, light))).isCloseTo(0.86d, within(1e-9));
    assertThat(IntelligentChunker.coverage(List.of(none, metadata("d", 0.7d, 0))))
        .isCloseTo(0.6d, within(1e-9));
    assertThat(IntelligentChunker.coverage(List.of())).isZero();
  }

  private static ChunkMetadata metadata(String id, double confidence, int rules) {
    return new ChunkMetadata(id, 1, 10, 10, ChunkingStrategy.FIXED_SIZE, null, rules, confidence, 0, "");
  }

  static void assertCoversWithoutGaps(ChunkingResult result) {
    List<ChunkMetadata> chunks = result.metadata();
    assertThat(chunks).isNotEmpty();
    assertThat(chunks.get(0).startLine()).isEqualTo(1);
    assertThat(chunks.get(chunks.size() - 1).endLine()).isEqualTo(result.totalLines());
    ChunkMetadata previous = null;
    for (ChunkMetadata chunk : chunks) {
      assertThat(chunk.startLine()).isLessThanOrEqualTo(chunk.endLine());
      assertThat(chunk.contentLines()).isEqualTo(chunk.endLine() - chunk.startLine() + 1);
      if (previous != null) {
        assertThat(chunk.startLine()).isGreaterThan(previous.startLine());
        assertThat(chunk.startLine()).isLessThanOrEqualTo(previous.endLine() + 1);
      }
      previous = chunk;
    }
  }

  private static void assertRespectsSizeBounds(ChunkingResult result, int min, int max) {
    List<ChunkMetadata> chunks = result.metadata();
    for (int i = 0; i < chunks.size(); i++) {
      ChunkMetadata chunk = chunks.get(i);
      assertThat(chunk.contentLines()).isLessThanOrEqualTo(max);
      if (i > 0 && i < chunks.size() - 1) {
        assertThat(chunk.contentLines()).isGreaterThanOrEqualTo(min);
      }
    }
  }

  /** COBOL-flavoured text with paragraphs, IF blocks, comments and blank lines. */
  static String mixedSource(int totalLines, long seed) {
    Random random = new Random(seed);
    List<String> lines = new ArrayList<>(totalLines);
    lines.add("       IDENTIFICATION DIVISION.");
    lines.add("       PROGRAM-ID. GENERATED.");
    int paragraph = 1;
    while (lines.size() < totalLines) {
      int roll = random.nextInt(100);
      if (roll < 3) {
        lines.add("       PARA-%03d.".formatted(paragraph++));
      } else if (roll < 15 && lines.size() + 3 <= totalLines) {
        lines.add("           IF WS-COUNT-%d > %d".formatted(random.nextInt(50), random.nextInt(500)));
        lines.add("               MOVE 1 TO WS-FLAG");
        lines.add("           END-IF.");
      } else if (roll < 20) {
        lines.add("");
      } else if (roll < 25) {
        lines.add("      * note " + random.nextInt(1000));
      } else if (roll < 28) {
        lines.add("           COMPUTE WS-TOTAL = WS-TOTAL + " + random.nextInt(10));
      } else {
        lines.add("           DISPLAY 'STEP " + random.nextInt(1000) + "'");
      }
    }
    return String.join("\n", lines);
  }
}
