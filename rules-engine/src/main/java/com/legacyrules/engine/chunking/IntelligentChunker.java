package com.legacyrules.engine.chunking;

import com.legacyrules.engine.config.LegacyRulesProperties;
import com.legacyrules.engine.detection.DetectionResult;
import com.legacyrules.engine.detection.LanguageProfile;
import com.legacyrules.engine.detection.LanguageProfileStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

/**
 * Splits a source file into bounded, overlapping line ranges aligned with its structure.
 *
 * <p>Files no longer than the preferred size become a single chunk. Otherwise a strategy is chosen
 * from the file structure (or forced by the caller) and, if it yields no valid plan, the next
 * strategy in {@link ChunkingStrategy} order is tried. Fixed-size chunking always succeeds.
 */
@Service
public class IntelligentChunker {

  private static final Logger log = LoggerFactory.getLogger(IntelligentChunker.class);

  static final String SINGLE_CHUNK_ID = "single_chunk";

  private final LanguageProfileStore profileStore;
  private final FileContextExtractor contextExtractor;
  private final LegacyRulesProperties.Chunking settings;
  private final MeterRegistry meterRegistry;

  private final SectionAwarePlanner sectionAwarePlanner = new SectionAwarePlanner();
  private final RuleBoundaryPlanner ruleBoundaryPlanner = new RuleBoundaryPlanner();
  private final SmartOverlapPlanner smartOverlapPlanner = new SmartOverlapPlanner();
  private final FixedSizePlanner fixedSizePlanner = new FixedSizePlanner();

  public IntelligentChunker(
      LanguageProfileStore profileStore,
      FileContextExtractor contextExtractor,
      LegacyRulesProperties properties,
      @Nullable MeterRegistry meterRegistry) {
    this.profileStore = Objects.requireNonNull(profileStore, "profileStore");
    this.contextExtractor = Objects.requireNonNull(contextExtractor, "contextExtractor");
    this.settings = Objects.requireNonNull(properties, "properties").getChunking();
    this.meterRegistry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
  }

  public ChunkingResult chunk(String content, String filename, @Nullable DetectionResult detection) {
    return chunk(content, filename, detection, null);
  }

  public ChunkingResult chunk(
      String content,
      String filename,
      @Nullable DetectionResult detection,
      @Nullable ChunkingStrategy forcedStrategy) {
    ChunkableFile file = ChunkableFile.from(filename, content);
    boolean confident = detection != null && detection.isConfident();
    LanguageProfile profile =
        detection != null ? detection.effectiveProfile(profileStore.fallback()) : profileStore.fallback();
    String language = confident ? detection.language() : LanguageProfileStore.UNKNOWN_LANGUAGE;

    if (file.isEmpty()) {
      log.debug("Empty content for {}, nothing to chunk", file.filename());
      return ChunkingResult.empty(
          language, forcedStrategy != null ? forcedStrategy : ChunkingStrategy.FIXED_SIZE);
    }

    List<String> fileContext = contextExtractor.extract(file.lines(), settings.getContextMaxLines());
    int total = file.lineCount();
    if (total <= profile.chunking().preferredSize()) {
      return singleChunk(file, profile, language, fileContext);
    }

    ChunkingContext context = new ChunkingContext(file, profile);
    ChunkingStrategy strategy =
        forcedStrategy != null
            ? forcedStrategy
            : StrategySelector.select(
                context.sectionMarkerCount(), context.rulePatternMatches(), isBlockStructured(language));

    for (ChunkingStrategy candidate = strategy; candidate != null; candidate = candidate.next()) {
      List<ChunkRange> ranges = plannerFor(candidate).plan(context);
      if (isValidPlan(ranges, total)) {
        if (candidate != strategy) {
          log.warn(
              "Strategy {} produced no usable plan for {}, fell through to {}",
              strategy,
              file.filename(),
              candidate);
        }
        return assemble(context, ranges, candidate, language, fileContext);
      }
      log.debug("Strategy {} yielded no valid plan for {}", candidate, file.filename());
    }
    throw new IllegalStateException("Fixed-size chunking produced no plan for " + file.filename());
  }

  private ChunkPlanner plannerFor(ChunkingStrategy strategy) {
    return switch (strategy) {
      case SECTION_AWARE -> sectionAwarePlanner;
      case RULE_BOUNDARY -> ruleBoundaryPlanner;
      case SMART_OVERLAP -> smartOverlapPlanner;
      case FIXED_SIZE -> fixedSizePlanner;
    };
  }

  private boolean isBlockStructured(String language) {
    return settings.getBlockStructuredLanguages().stream()
        .anyMatch(candidate -> candidate.trim().equalsIgnoreCase(language));
  }

  static boolean isValidPlan(List<ChunkRange> ranges, int total) {
    if (ranges == null || ranges.isEmpty()) {
      return false;
    }
    if (ranges.get(0).start() != 0 || ranges.get(ranges.size() - 1).end() != total) {
      return false;
    }
    ChunkRange previous = null;
    for (ChunkRange range : ranges) {
      if (range.start() >= range.end()) {
        return false;
      }
      if (previous != null
          && (range.start() <= previous.start() || range.start() > previous.end())) {
        return false;
      }
      previous = range;
    }
    return true;
  }

  private ChunkingResult singleChunk(
      ChunkableFile file, LanguageProfile profile, String language, List<String> fileContext) {
    int total = file.lineCount();
    ChunkMetadata metadata =
        new ChunkMetadata(
            SINGLE_CHUNK_ID,
            1,
            total,
            total,
            ChunkingStrategy.SECTION_AWARE,
            null,
            RuleCountEstimator.estimate(file.lines(), 0, total, profile),
            1.0d,
            0,
            ContentHashing.sha256(file.content()));
    record(ChunkingStrategy.SECTION_AWARE);
    return new ChunkingResult(
        List.of(file.content()),
        List.of(metadata),
        language,
        ChunkingStrategy.SECTION_AWARE,
        total,
        1.0d,
        fileContext);
  }

  private ChunkingResult assemble(
      ChunkingContext context,
      List<ChunkRange> ranges,
      ChunkingStrategy strategy,
      String language,
      List<String> fileContext) {
    List<String> lines = context.lines();
    List<String> chunks = new ArrayList<>(ranges.size());
    List<ChunkMetadata> metadata = new ArrayList<>(ranges.size());
    int index = 1;
    for (ChunkRange range : ranges) {
      String text = String.join("\n", lines.subList(range.start(), range.end()));
      int ruleEstimate =
          RuleCountEstimator.estimate(lines, range.firstOwnedLine(), range.end(), context.profile());
      chunks.add(text);
      metadata.add(
          new ChunkMetadata(
              strategy.idPrefix() + "_" + index++,
              range.start() + 1,
              range.end(),
              range.length(),
              strategy,
              range.sectionName(),
              ruleEstimate,
              strategy.confidence(),
              range.overlapLines(),
              ContentHashing.sha256(text)));
    }
    double coverage = coverage(metadata);
    log.debug(
        "Chunked {} into {} chunks using {} (language={}, coverage={})",
        context.file().filename(),
        chunks.size(),
        strategy,
        language,
        String.format(Locale.ROOT, "%.2f", coverage));
    record(strategy);
    return new ChunkingResult(
        chunks, metadata, language, strategy, context.lineCount(), coverage, fileContext);
  }

  /** Rule-weighted mean of chunk confidences; unweighted when no rules were estimated. */
  static double coverage(List<ChunkMetadata> metadata) {
    if (metadata.isEmpty()) {
      return 0.0d;
    }
    int totalRules = metadata.stream().mapToInt(ChunkMetadata::ruleCountEstimate).sum();
    if (totalRules == 0) {
      return metadata.stream().mapToDouble(ChunkMetadata::confidence).average().orElse(0.0d);
    }
    double weighted = 0.0d;
    for (ChunkMetadata chunk : metadata) {
      weighted += chunk.confidence() * chunk.ruleCountEstimate();
    }
    return weighted / totalRules;
  }

  private void record(ChunkingStrategy strategy) {
    meterRegistry
        .counter("legacy_rules_chunking_total", "strategy", strategy.name().toLowerCase(Locale.ROOT))
        .increment();
  }
}
