package com.legacyrules.engine.detection;

import java.util.Locale;
import java.util.Map;

/**
 * Line-based chunk sizing attached to a language profile. Instances are always normalized so that
 * {@code minSize <= preferredSize <= maxSize} and {@code overlapSize < preferredSize}.
 */
public record ChunkingParameters(
    int preferredSize, int minSize, int maxSize, int overlapSize, Map<String, Integer> sectionPriority) {

  public ChunkingParameters {
    preferredSize = Math.max(2, preferredSize);
    minSize = Math.max(1, Math.min(minSize, preferredSize));
    maxSize = Math.max(preferredSize, maxSize);
    overlapSize = Math.max(0, Math.min(overlapSize, preferredSize - 1));
    sectionPriority = sectionPriority == null ? Map.of() : Map.copyOf(sectionPriority);
  }

  /** Preferred size for a chunk that starts in the given section, honoring section priority. */
  public int preferredSizeFor(String sectionName) {
    if (sectionName == null || sectionPriority.isEmpty()) {
      return preferredSize;
    }
    String normalized = sectionName.trim().toUpperCase(Locale.ROOT);
    for (Map.Entry<String, Integer> entry : sectionPriority.entrySet()) {
      if (entry.getValue() != null
          && entry.getValue() > 0
          && normalized.startsWith(entry.getKey().trim().toUpperCase(Locale.ROOT))) {
        return Math.max(minSize, Math.min(maxSize, entry.getValue()));
      }
    }
    return preferredSize;
  }
}
