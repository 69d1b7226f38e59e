package com.legacyrules.engine.detection;

import com.legacyrules.engine.config.LegacyRulesProperties;
import com.legacyrules.engine.detection.DetectionEvidence.PatternMatch;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

/**
 * Scores file content against every loaded language profile and returns the best match.
 *
 * <p>Only a bounded prefix of the content is scanned. The raw score is the sum of an extension
 * weight and three capped pattern-class weights, normalized by 100 and clamped to [0, 1]. Ties go
 * to the profile declared first.
 */
@Service
public class LanguageDetector {

  private static final Logger log = LoggerFactory.getLogger(LanguageDetector.class);

  private final LanguageProfileStore profileStore;
  private final LegacyRulesProperties.Detection settings;
  private final MeterRegistry meterRegistry;

  public LanguageDetector(
      LanguageProfileStore profileStore,
      LegacyRulesProperties properties,
      @Nullable MeterRegistry meterRegistry) {
    this.profileStore = Objects.requireNonNull(profileStore, "profileStore");
    this.settings = Objects.requireNonNull(properties, "properties").getDetection();
    this.meterRegistry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
  }

  public DetectionResult detect(String filename, String content) {
    List<LanguageProfile> profiles = profileStore.profiles();
    if (profiles.isEmpty()) {
      log.warn("No language profiles loaded, returning fallback detection for {}", filename);
      record(LanguageProfileStore.UNKNOWN_LANGUAGE, false);
      return new DetectionResult(
          LanguageProfileStore.UNKNOWN_LANGUAGE,
          0.0d,
          null,
          DetectionEvidence.none("no_profiles_loaded"),
          List.of("Load language profiles configuration"));
    }

    String extension = LanguageProfileStore.extensionOf(filename);
    String sample = samplePrefix(content, Math.max(1, settings.getSampleLines()));

    LanguageProfile best = null;
    DetectionEvidence bestEvidence = null;
    for (LanguageProfile profile : profiles) {
      DetectionEvidence evidence = score(profile, extension, sample);
      if (bestEvidence == null || evidence.totalScore() > bestEvidence.totalScore()) {
        best = profile;
        bestEvidence = evidence;
      }
    }

    double confidence = Math.min(bestEvidence.totalScore(), 1.0d);
    List<String> recommendations = recommendations(confidence, bestEvidence, best);
    DetectionResult result =
        new DetectionResult(best.key(), confidence, best, bestEvidence, recommendations);
    log.debug(
        "Detected {} for {} (confidence={}, confident={})",
        best.key(),
        filename,
        String.format(Locale.ROOT, "%.2f", confidence),
        result.isConfident());
    record(best.key(), result.isConfident());
    return result;
  }

  public DetectionValidation validate(DetectionResult result, String content) {
    Objects.requireNonNull(result, "result");
    LanguageProfile profile = result.profile();
    if (profile == null) {
      return new DetectionValidation(
          false,
          "no_profile_available",
          result.confidence(),
          0.0d,
          0.0d,
          null,
          List.of("Use fallback chunking strategy"));
    }
    if (!result.isConfident()) {
      return new DetectionValidation(
          false,
          "confidence_too_low",
          result.confidence(),
          profile.confidenceRequired(),
          0.0d,
          profile.ruleDensity(),
          List.of(
              "Consider manual language specification",
              "Use fallback chunking strategy",
              "Verify file type and content"));
    }
    int totalLines = content == null || content.isEmpty() ? 0 : content.split("\n", -1).length;
    int ruleMatches = result.evidence().ruleMatchCount();
    double density = totalLines > 0 ? (ruleMatches * 100.0d) / totalLines : 0.0d;
    RuleDensityRange range = profile.ruleDensity();
    String suggestion;
    if (density < range.expectedMin()) {
      suggestion = "Low rule density - consider larger chunk sizes";
    } else if (density > range.expectedMax()) {
      suggestion = "High rule density - consider smaller chunk sizes for better context";
    } else {
      suggestion = "Rule density within expected range - use standard chunking";
    }
    return new DetectionValidation(
        true,
        "confident",
        result.confidence(),
        profile.confidenceRequired(),
        density,
        range,
        List.of(suggestion));
  }

  public List<String> availableLanguages() {
    return profileStore.availableLanguages();
  }

  DetectionEvidence score(LanguageProfile profile, String extension, String sample) {
    double extensionScore = profile.matchesExtension(extension) ? settings.getExtensionWeight() : 0.0d;

    List<PatternMatch> strong = matches(profile.strongPatterns(), sample);
    int strongCount = strong.stream().mapToInt(PatternMatch::matches).sum();
    double strongScore = 0.0d;
    if (strongCount > 0) {
      double boost =
          strongCount >= settings.getConfidenceBoostThreshold() ? settings.getConfidenceBoost() : 1.0d;
      strongScore =
          Math.min(strongCount * settings.getStrongPatternWeight(), settings.getStrongPatternCap()) * boost;
    }

    List<PatternMatch> supporting = matches(profile.supportingPatterns(), sample);
    int supportingCount = supporting.stream().mapToInt(PatternMatch::matches).sum();
    double supportingScore =
        Math.min(supportingCount * settings.getSupportingPatternWeight(), settings.getSupportingPatternCap());

    List<PatternMatch> rules = matches(profile.rulePatterns(), sample);
    int ruleCount = rules.stream().mapToInt(PatternMatch::matches).sum();
    double ruleScore = Math.min(ruleCount * settings.getRulePatternWeight(), settings.getRulePatternCap());

    double raw = extensionScore + strongScore + supportingScore + ruleScore;
    double normalized = Math.max(0.0d, Math.min(raw / 100.0d, 1.0d));
    return new DetectionEvidence(
        extensionScore,
        strongScore,
        supportingScore,
        ruleScore,
        strong,
        supporting,
        rules,
        normalized,
        null);
  }

  private List<PatternMatch> matches(List<Pattern> patterns, String sample) {
    List<PatternMatch> found = new ArrayList<>();
    for (Pattern pattern : patterns) {
      int count = LanguageProfile.countMatches(pattern, sample);
      if (count > 0) {
        found.add(new PatternMatch(pattern.pattern(), count));
      }
    }
    return found;
  }

  private List<String> recommendations(
      double confidence, DetectionEvidence evidence, LanguageProfile profile) {
    List<String> recommendations = new ArrayList<>();
    if (confidence < profile.confidenceRequired()) {
      recommendations.add(
          "Low confidence (%s) - consider manual verification".formatted(percent(confidence)));
      if (evidence.extensionScore() == 0.0d) {
        recommendations.add(
            "File extension not recognized for %s - verify file type".formatted(profile.name()));
      }
      if (evidence.strongPatternScore() < 10.0d) {
        recommendations.add(
            "Few %s language patterns found - file may be atypical".formatted(profile.name()));
      }
    } else if (confidence >= settings.getHighConfidence()) {
      recommendations.add("High confidence %s detection".formatted(profile.name()));
      int ruleCount = evidence.ruleMatchCount();
      if (ruleCount >= profile.ruleDensity().expectedMin()) {
        recommendations.add(
            "Good rule density detected (%d business logic patterns)".formatted(ruleCount));
      } else {
        recommendations.add(
            "Low rule density (%d patterns) - file may be data-focused".formatted(ruleCount));
      }
    }
    if (recommendations.isEmpty()) {
      recommendations.add("Medium confidence %s detection".formatted(profile.name()));
    }
    return recommendations;
  }

  private void record(String language, boolean confident) {
    meterRegistry
        .counter(
            "legacy_rules_detections_total", "language", language, "confident", String.valueOf(confident))
        .increment();
  }

  private static String percent(double value) {
    return String.format(Locale.ROOT, "%.1f%%", value * 100.0d);
  }

  static String samplePrefix(String content, int maxLines) {
    if (content == null || content.isEmpty()) {
      return "";
    }
    int index = -1;
    for (int line = 0; line < maxLines; line++) {
      index = content.indexOf('\n', index + 1);
      if (index < 0) {
        return content;
      }
    }
    return content.substring(0, index);
  }
}
