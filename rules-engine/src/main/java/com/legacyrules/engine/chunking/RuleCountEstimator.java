package com.legacyrules.engine.chunking;

import com.legacyrules.engine.detection.LanguageProfile;
import java.util.List;

final class RuleCountEstimator {

  private RuleCountEstimator() {}

  static int estimate(List<String> lines, int from, int to, LanguageProfile profile) {
    int start = Math.max(0, from);
    int end = Math.min(lines.size(), to);
    int markers = 0;
    int ruleLines = 0;
    for (int i = start; i < end; i++) {
      String line = lines.get(i);
      if (profile.isRuleMarker(line)) {
        markers++;
      }
      if (profile.isRuleLine(line)) {
        ruleLines++;
      }
    }
    return markers > 0 ? markers : ruleLines;
  }
}
