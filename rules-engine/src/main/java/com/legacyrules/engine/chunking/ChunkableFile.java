package com.legacyrules.engine.chunking;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public final class ChunkableFile {

  private final String filename;
  private final String content;
  private final List<String> lines;

  public static ChunkableFile from(String filename, String rawContent) {
    String normalized = normalize(rawContent);
    return new ChunkableFile(
        filename != null ? filename : "unknown.txt",
        normalized,
        Collections.unmodifiableList(splitLines(normalized)));
  }

  private ChunkableFile(String filename, String content, List<String> lines) {
    this.filename = filename;
    this.content = content;
    this.lines = lines;
  }

  private static String normalize(String value) {
    if (value == null || value.isEmpty()) {
      return "";
    }
    return value.replace("\r\n", "\n").replace('\r', '\n');
  }

  private static List<String> splitLines(String content) {
    if (content.isEmpty()) {
      return List.of();
    }
    String[] parts = content.split("\n", -1);
    return new ArrayList<>(Arrays.asList(parts));
  }

  public String filename() {
    return filename;
  }

  public String content() {
    return content;
  }

  public List<String> lines() {
    return lines;
  }

  public int lineCount() {
    return lines.size();
  }

  public boolean isEmpty() {
    return lines.isEmpty();
  }
}
