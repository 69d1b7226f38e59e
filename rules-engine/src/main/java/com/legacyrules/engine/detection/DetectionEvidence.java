package com.legacyrules.engine.detection;

import java.util.List;

public record DetectionEvidence(
    double extensionScore,
    double strongPatternScore,
    double supportingPatternScore,
    double rulePatternScore,
    List<PatternMatch> strongMatches,
    List<PatternMatch> supportingMatches,
    List<PatternMatch> ruleMatches,
    double totalScore,
    String reason) {

  public DetectionEvidence {
    strongMatches = List.copyOf(strongMatches);
    supportingMatches = List.copyOf(supportingMatches);
    ruleMatches = List.copyOf(ruleMatches);
  }

  public static DetectionEvidence none(String reason) {
    return new DetectionEvidence(0, 0, 0, 0, List.of(), List.of(), List.of(), 0, reason);
  }

  public int strongMatchCount() {
    return sum(strongMatches);
  }

  public int supportingMatchCount() {
    return sum(supportingMatches);
  }

  public int ruleMatchCount() {
    return sum(ruleMatches);
  }

  private static int sum(List<PatternMatch> matches) {
    return matches.stream().mapToInt(PatternMatch::matches).sum();
  }

  public record PatternMatch(String pattern, int matches) {}
}
