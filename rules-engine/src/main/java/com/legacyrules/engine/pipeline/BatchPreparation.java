package com.legacyrules.engine.pipeline;

import java.util.List;
import java.util.Map;

public record BatchPreparation(List<PreparedSource> prepared, Map<String, String> failures) {

  public BatchPreparation {
    prepared = List.copyOf(prepared);
    failures = Map.copyOf(failures);
  }

  public boolean hasFailures() {
    return !failures.isEmpty();
  }
}
