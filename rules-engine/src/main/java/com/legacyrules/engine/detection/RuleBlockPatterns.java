package com.legacyrules.engine.detection;

import java.util.List;
import java.util.regex.Pattern;

public record RuleBlockPatterns(
    List<Pattern> open,
    List<Pattern> close,
    List<Pattern> terminators,
    int blockLookahead,
    int statementLookahead) {

  public RuleBlockPatterns {
    open = List.copyOf(open);
    close = List.copyOf(close);
    terminators = List.copyOf(terminators);
    blockLookahead = Math.max(1, blockLookahead);
    statementLookahead = Math.max(1, statementLookahead);
  }

  public static RuleBlockPatterns none() {
    return new RuleBlockPatterns(List.of(), List.of(), List.of(), 30, 15);
  }
}
