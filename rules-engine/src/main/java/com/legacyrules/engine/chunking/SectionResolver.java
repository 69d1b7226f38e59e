package com.legacyrules.engine.chunking;

import com.legacyrules.engine.detection.LanguageProfile;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.util.StringUtils;

/**
 * Splits a file into named sections using the profile's section markers. A section runs from its
 * marker line up to the next marker or the end of the file; lines before the first marker belong
 * to no section.
 */
public final class SectionResolver {

  private static final int MAX_NAME_LENGTH = 60;

  private final List<SectionBoundary> sections;
  private final String[] sectionByLine;

  public SectionResolver(List<String> lines, LanguageProfile profile) {
    List<Integer> markerLines = new ArrayList<>();
    List<String> names = new ArrayList<>();
    for (int i = 0; i < lines.size(); i++) {
      String name = detectSection(lines.get(i), profile.sectionMarkers());
      if (name != null) {
        markerLines.add(i);
        names.add(name);
      }
    }
    List<SectionBoundary> boundaries = new ArrayList<>(markerLines.size());
    this.sectionByLine = new String[lines.size()];
    for (int s = 0; s < markerLines.size(); s++) {
      int start = markerLines.get(s);
      int end = s + 1 < markerLines.size() ? markerLines.get(s + 1) : lines.size();
      SectionBoundary boundary = new SectionBoundary(names.get(s), start, end);
      boundaries.add(boundary);
      for (int line = start; line < end; line++) {
        sectionByLine[line] = boundary.name();
      }
    }
    this.sections = Collections.unmodifiableList(boundaries);
  }

  public List<SectionBoundary> sections() {
    return sections;
  }

  public int markerCount() {
    return sections.size();
  }

  /** Section containing the zero-based line, or {@code null} before the first marker. */
  public String resolve(int lineIndex) {
    if (lineIndex < 0 || lineIndex >= sectionByLine.length) {
      return null;
    }
    return sectionByLine[lineIndex];
  }

  static String detectSection(String line, List<Pattern> markers) {
    if (!StringUtils.hasText(line)) {
      return null;
    }
    for (Pattern marker : markers) {
      Matcher matcher = marker.matcher(line);
      if (!matcher.find()) {
        continue;
      }
      String name = null;
      if (matcher.groupCount() >= 1 && matcher.group(1) != null) {
        name = matcher.group(1).trim();
      }
      if (!StringUtils.hasText(name)) {
        name = line.trim();
        if (name.endsWith(".")) {
          name = name.substring(0, name.length() - 1).trim();
        }
      }
      return name.length() > MAX_NAME_LENGTH ? name.substring(0, MAX_NAME_LENGTH) : name;
    }
    return null;
  }
}
