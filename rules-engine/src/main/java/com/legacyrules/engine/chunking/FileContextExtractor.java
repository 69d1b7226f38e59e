package com.legacyrules.engine.chunking;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Extracts header lines (comments, imports, declarations, identification lines) used as prompt
 * context for every chunk of a file. Results are memoized in a bounded Caffeine cache keyed by a
 * hash of the trimmed prefix and the line limit.
 */
public class FileContextExtractor {

  private static final List<String> PREFIXES =
      List.of("*", "//", "#", "/*", "--", "import", "from", "package", "using", "include", "use ");
  private static final List<String> DECLARATIONS =
      List.of(
          "class ",
          "interface ",
          "def ",
          "function ",
          "procedure ",
          "program ",
          "identification division",
          "program-id",
          "author.",
          "date-written");

  private final Cache<String, List<String>> cache;

  public FileContextExtractor(int maximumSize) {
    this.cache = Caffeine.newBuilder().maximumSize(Math.max(1, maximumSize)).build();
  }

  public List<String> extract(List<String> lines, int maxLines) {
    int limit = Math.max(0, maxLines);
    if (lines == null || lines.isEmpty() || limit == 0) {
      return List.of();
    }
    List<String> prefix = lines.subList(0, Math.min(limit, lines.size()));
    String key = ContentHashing.sha256(String.join("\n", prefix).trim()) + ":" + limit;
    return cache.get(key, ignored -> collect(prefix));
  }

  public long cachedEntries() {
    cache.cleanUp();
    return cache.estimatedSize();
  }

  public void invalidateAll() {
    cache.invalidateAll();
  }

  private static List<String> collect(List<String> prefix) {
    List<String> context = new ArrayList<>();
    for (String line : prefix) {
      String stripped = line.strip();
      if (stripped.isEmpty()) {
        continue;
      }
      if (isContextLine(stripped)) {
        context.add(line);
      }
    }
    return List.copyOf(context);
  }

  private static boolean isContextLine(String stripped) {
    String lower = stripped.toLowerCase(Locale.ROOT);
    for (String prefix : PREFIXES) {
      if (lower.startsWith(prefix)) {
        return true;
      }
    }
    for (String declaration : DECLARATIONS) {
      if (lower.contains(declaration)) {
        return true;
      }
    }
    return false;
  }
}
