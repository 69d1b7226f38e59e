package com.legacyrules.engine.chunking;

import com.legacyrules.engine.detection.ChunkingParameters;
import com.legacyrules.engine.detection.LanguageProfile;
import java.util.List;

public final class ChunkingContext {

  private final ChunkableFile file;
  private final LanguageProfile profile;
  private final ChunkingParameters parameters;
  private final SectionResolver sectionResolver;
  private final List<RuleSpan> ruleSpans;
  private final int rulePatternMatches;

  public ChunkingContext(ChunkableFile file, LanguageProfile profile) {
    this.file = file;
    this.profile = profile;
    this.parameters = profile.chunking();
    this.sectionResolver = new SectionResolver(file.lines(), profile);
    this.ruleSpans = List.copyOf(RuleSpanDetector.detect(file.lines(), profile));
    this.rulePatternMatches =
        profile.rulePatterns().stream()
            .mapToInt(pattern -> LanguageProfile.countMatches(pattern, file.content()))
            .sum();
  }

  public ChunkableFile file() {
    return file;
  }

  public List<String> lines() {
    return file.lines();
  }

  public int lineCount() {
    return file.lineCount();
  }

  public LanguageProfile profile() {
    return profile;
  }

  public ChunkingParameters parameters() {
    return parameters;
  }

  public List<SectionBoundary> sections() {
    return sectionResolver.sections();
  }

  public String sectionAt(int lineIndex) {
    return sectionResolver.resolve(lineIndex);
  }

  public List<RuleSpan> ruleSpans() {
    return ruleSpans;
  }

  public int sectionMarkerCount() {
    return sectionResolver.markerCount();
  }

  public int rulePatternMatches() {
    return rulePatternMatches;
  }

  /** Rule span strictly containing the cut point {@code line}, if any. */
  RuleSpan spanAcross(int line) {
    for (RuleSpan span : ruleSpans) {
      if (span.start() >= line) {
        break;
      }
      if (span.contains(line)) {
        return span;
      }
    }
    return null;
  }
}
