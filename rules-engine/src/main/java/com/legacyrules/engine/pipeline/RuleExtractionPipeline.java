package com.legacyrules.engine.pipeline;

import com.legacyrules.engine.chunking.ChunkingResult;
import com.legacyrules.engine.chunking.IntelligentChunker;
import com.legacyrules.engine.completeness.CompletenessReport;
import com.legacyrules.engine.completeness.ExtractedRule;
import com.legacyrules.engine.completeness.RuleCompletenessAnalyzer;
import com.legacyrules.engine.detection.DetectionResult;
import com.legacyrules.engine.detection.DetectionValidation;
import com.legacyrules.engine.detection.LanguageDetector;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Chains detection, chunking and completeness analysis around the external extraction step.
 * Callers run {@link #prepare}, extract rules from each chunk themselves, then {@link #evaluate}.
 */
@Service
public class RuleExtractionPipeline {

  private static final Logger log = LoggerFactory.getLogger(RuleExtractionPipeline.class);

  private final LanguageDetector detector;
  private final IntelligentChunker chunker;
  private final RuleCompletenessAnalyzer analyzer;

  public RuleExtractionPipeline(
      LanguageDetector detector, IntelligentChunker chunker, RuleCompletenessAnalyzer analyzer) {
    this.detector = Objects.requireNonNull(detector, "detector");
    this.chunker = Objects.requireNonNull(chunker, "chunker");
    this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
  }

  public PreparedSource prepare(String filename, String content) {
    String source = content != null ? content : "";
    DetectionResult detection = detector.detect(filename, source);
    DetectionValidation validation = detector.validate(detection, source);
    if (!detection.isConfident()) {
      log.info(
          "Low confidence detection for {} (best={}, confidence={}), using fallback chunking",
          filename,
          detection.language(),
          detection.confidence());
    }
    ChunkingResult chunking = chunker.chunk(source, filename, detection);
    return new PreparedSource(filename, source, detection, validation, chunking);
  }

  /** Prepares every file; a failure on one file is recorded and does not stop the others. */
  public BatchPreparation prepareAll(Map<String, String> sources) {
    List<PreparedSource> prepared = new ArrayList<>();
    Map<String, String> failures = new LinkedHashMap<>();
    if (sources == null) {
      return new BatchPreparation(prepared, failures);
    }
    sources.forEach(
        (filename, content) -> {
          try {
            prepared.add(prepare(filename, content));
          } catch (RuntimeException ex) {
            log.warn("Failed to prepare {}: {}", filename, ex.getMessage(), ex);
            failures.put(filename, ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
          }
        });
    return new BatchPreparation(prepared, failures);
  }

  public CompletenessReport evaluate(PreparedSource prepared, List<ExtractedRule> extractedRules) {
    Objects.requireNonNull(prepared, "prepared");
    return analyzer.analyze(prepared.content(), extractedRules, prepared.chunking(), prepared.filename());
  }
}
