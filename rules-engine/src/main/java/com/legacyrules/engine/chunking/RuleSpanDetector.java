package com.legacyrules.engine.chunking;

import com.legacyrules.engine.detection.LanguageProfile;
import com.legacyrules.engine.detection.RuleBlockPatterns;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds multi-line rule spans. A rule starts on a line matching a rule pattern or rule marker. If
 * that line opens a block the span runs to the matching close line, respecting nesting; otherwise
 * it runs until a blank line, the next rule, a section marker or a terminator. Spans shorter than
 * two lines are not reported.
 */
final class RuleSpanDetector {

  private RuleSpanDetector() {}

  static List<RuleSpan> detect(List<String> lines, LanguageProfile profile) {
    List<RuleSpan> spans = new ArrayList<>();
    RuleBlockPatterns block = profile.ruleBlock();
    int n = lines.size();
    int i = 0;
    while (i < n) {
      String line = lines.get(i);
      if (!profile.isRuleLine(line) && !profile.isRuleMarker(line)) {
        i++;
        continue;
      }
      int end = LanguageProfile.anyMatch(block.open(), line)
          ? blockEnd(lines, i, profile, block)
          : statementEnd(lines, i, profile, block);
      if (end - i >= 2) {
        spans.add(new RuleSpan(i, end));
      }
      i = Math.max(end, i + 1);
    }
    return spans;
  }

  private static int blockEnd(
      List<String> lines, int start, LanguageProfile profile, RuleBlockPatterns block) {
    int limit = Math.min(lines.size(), start + block.blockLookahead());
    int depth = 0;
    for (int j = start + 1; j < limit; j++) {
      String candidate = lines.get(j);
      if (LanguageProfile.anyMatch(block.open(), candidate)) {
        depth++;
      } else if (LanguageProfile.anyMatch(block.close(), candidate)) {
        if (depth == 0) {
          return j + 1;
        }
        depth--;
      } else if (profile.isSectionMarker(candidate)) {
        return j;
      } else if (LanguageProfile.anyMatch(block.terminators(), candidate)) {
        return j + 1;
      }
    }
    return start + 1;
  }

  private static int statementEnd(
      List<String> lines, int start, LanguageProfile profile, RuleBlockPatterns block) {
    int limit = Math.min(lines.size(), start + block.statementLookahead());
    for (int j = start + 1; j < limit; j++) {
      String candidate = lines.get(j);
      if (candidate.isBlank() || profile.isRuleLine(candidate) || profile.isSectionMarker(candidate)) {
        return j;
      }
      if (LanguageProfile.anyMatch(block.terminators(), candidate)) {
        return j + 1;
      }
    }
    return start + 1;
  }
}
