package com.legacyrules.engine.detection;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.legacyrules.engine.config.LegacyRulesProperties;
import com.legacyrules.engine.config.LegacyRulesProperties.LanguageDefinition;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Immutable set of compiled language profiles plus the fallback profile. Definitions that cannot be
 * compiled are skipped with a warning; the store is never left without a fallback.
 */
public final class LanguageProfileStore {

  private static final Logger log = LoggerFactory.getLogger(LanguageProfileStore.class);

  public static final String UNKNOWN_LANGUAGE = "unknown";

  private static final ObjectMapper SNAKE_CASE_MAPPER =
      JsonMapper.builder()
          .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
          .build();

  private final Map<String, LanguageProfile> profiles;
  private final LanguageProfile fallback;

  public LanguageProfileStore(LegacyRulesProperties properties) {
    this(properties.getLanguages(), properties.getFallback(), properties.getChunking());
  }

  private LanguageProfileStore(
      Collection<LanguageDefinition> definitions,
      LanguageDefinition fallbackDefinition,
      LegacyRulesProperties.Chunking defaults) {
    Objects.requireNonNull(defaults, "defaults");
    Map<String, LanguageProfile> compiled = new LinkedHashMap<>();
    if (definitions != null) {
      for (LanguageDefinition definition : definitions) {
        try {
          LanguageProfile profile = compile(definition, false, defaults);
          if (compiled.putIfAbsent(profile.key(), profile) != null) {
            log.warn("Duplicate language profile '{}' ignored", profile.key());
          }
        } catch (ProfileConfigurationException ex) {
          log.warn("Skipping language profile: {}", ex.getMessage());
        }
      }
    }
    this.profiles = Collections.unmodifiableMap(compiled);
    this.fallback = compileFallback(fallbackDefinition, defaults);
    log.info(
        "Language profile store initialized (profiles={}, fallback={})",
        profiles.keySet(),
        fallback.name());
  }

  /**
   * Builds a store from opaque key/value data, e.g. a parsed JSON or YAML document with
   * {@code languages} (keyed by language or as a list) and {@code fallback} entries. Keys use
   * snake_case; unknown keys are ignored. Malformed input degrades to the fallback profile alone.
   */
  public static LanguageProfileStore fromConfiguration(
      Map<String, ?> configuration, LegacyRulesProperties.Chunking defaults) {
    List<LanguageDefinition> definitions = new ArrayList<>();
    LanguageDefinition fallbackDefinition = null;
    if (configuration == null) {
      log.warn("Language profile configuration is missing, using fallback profile only");
    } else {
      definitions.addAll(readLanguages(configuration.get("languages")));
      Object rawFallback = configuration.get("fallback");
      if (rawFallback instanceof Map<?, ?> fallbackMap) {
        fallbackDefinition = convert(fallbackMap).orElse(null);
      }
    }
    if (fallbackDefinition == null) {
      fallbackDefinition = new LegacyRulesProperties().getFallback();
    }
    return new LanguageProfileStore(definitions, fallbackDefinition, defaults);
  }

  public static LanguageProfileStore fallbackOnly(LegacyRulesProperties properties) {
    return new LanguageProfileStore(List.of(), properties.getFallback(), properties.getChunking());
  }

  private static List<LanguageDefinition> readLanguages(Object rawLanguages) {
    List<LanguageDefinition> definitions = new ArrayList<>();
    if (rawLanguages instanceof Map<?, ?> byKey) {
      byKey.forEach(
          (key, value) -> {
            if (value instanceof Map<?, ?> entry) {
              convert(entry)
                  .ifPresent(
                      definition -> {
                        if (!StringUtils.hasText(definition.getKey())) {
                          definition.setKey(String.valueOf(key));
                        }
                        definitions.add(definition);
                      });
            } else {
              log.warn("Language profile '{}' is not a key/value structure, skipping", key);
            }
          });
    } else if (rawLanguages instanceof Collection<?> list) {
      for (Object value : list) {
        if (value instanceof Map<?, ?> entry) {
          convert(entry).ifPresent(definitions::add);
        } else {
          log.warn("Language profile entry {} is not a key/value structure, skipping", value);
        }
      }
    } else if (rawLanguages != null) {
      log.warn("Unsupported languages section of type {}", rawLanguages.getClass().getSimpleName());
    }
    return definitions;
  }

  private static Optional<LanguageDefinition> convert(Map<?, ?> raw) {
    try {
      return Optional.ofNullable(SNAKE_CASE_MAPPER.convertValue(raw, LanguageDefinition.class));
    } catch (IllegalArgumentException ex) {
      log.warn("Unable to read language profile definition: {}", ex.getMessage());
      return Optional.empty();
    }
  }

  public List<LanguageProfile> profiles() {
    return List.copyOf(profiles.values());
  }

  public Optional<LanguageProfile> profile(String key) {
    if (!StringUtils.hasText(key)) {
      return Optional.empty();
    }
    return Optional.ofNullable(profiles.get(key.trim().toLowerCase(Locale.ROOT)));
  }

  /** Profile whose extension list contains the extension of {@code filename}, first declared wins. */
  public Optional<LanguageProfile> profileForFilename(String filename) {
    String extension = extensionOf(filename);
    if (extension.isEmpty()) {
      return Optional.empty();
    }
    return profiles.values().stream().filter(profile -> profile.matchesExtension(extension)).findFirst();
  }

  public List<String> availableLanguages() {
    return List.copyOf(profiles.keySet());
  }

  public LanguageProfile fallback() {
    return fallback;
  }

  public boolean isEmpty() {
    return profiles.isEmpty();
  }

  /** Lower-case extension including the leading dot, or an empty string. */
  public static String extensionOf(String filename) {
    if (!StringUtils.hasText(filename)) {
      return "";
    }
    String name = filename.replace('\\', '/');
    name = name.substring(name.lastIndexOf('/') + 1);
    int dot = name.lastIndexOf('.');
    if (dot <= 0 || dot == name.length() - 1) {
      return "";
    }
    return name.substring(dot).toLowerCase(Locale.ROOT);
  }

  private static LanguageProfile compileFallback(
      LanguageDefinition definition, LegacyRulesProperties.Chunking defaults) {
    if (definition != null) {
      try {
        return compile(definition, true, defaults);
      } catch (ProfileConfigurationException ex) {
        log.warn("Configured fallback profile is invalid, using built-in defaults: {}", ex.getMessage());
      }
    }
    return compile(new LegacyRulesProperties().getFallback(), true, defaults);
  }

  private static LanguageProfile compile(
      LanguageDefinition definition, boolean fallback, LegacyRulesProperties.Chunking defaults) {
    if (definition == null) {
      throw new ProfileConfigurationException("profile definition is null");
    }
    String key = definition.getKey();
    if (!StringUtils.hasText(key)) {
      if (!fallback) {
        throw new ProfileConfigurationException("profile key must not be blank");
      }
      key = UNKNOWN_LANGUAGE;
    }
    key = key.trim();
    String name = StringUtils.hasText(definition.getName()) ? definition.getName().trim() : null;
    if (name == null) {
      if (!fallback) {
        throw new ProfileConfigurationException("profile '%s' has no name".formatted(key));
      }
      name = "Generic";
    }
    double threshold;
    if (fallback) {
      threshold = 0.0d;
    } else if (definition.getConfidenceRequired() == null) {
      throw new ProfileConfigurationException(
          "profile '%s' does not declare confidenceRequired".formatted(key));
    } else {
      threshold = definition.getConfidenceRequired();
    }

    LegacyRulesProperties.ChunkingDefaults chunking = definition.getChunking();
    ChunkingParameters parameters =
        new ChunkingParameters(
            valueOrDefault(chunking.getPreferredSize(), defaults.getPreferredSize()),
            valueOrDefault(chunking.getMinSize(), defaults.getMinSize()),
            valueOrDefault(chunking.getMaxSize(), defaults.getMaxSize()),
            valueOrDefault(chunking.getOverlapSize(), defaults.getOverlapSize()),
            chunking.getSectionPriority());

    LegacyRulesProperties.RuleBlock block = definition.getRuleBlock();
    RuleBlockPatterns ruleBlock =
        new RuleBlockPatterns(
            compilePatterns(block.getOpen(), key),
            compilePatterns(block.getClose(), key),
            compilePatterns(block.getTerminators(), key),
            block.getBlockLookahead(),
            block.getStatementLookahead());

    return new LanguageProfile(
        key,
        name,
        definition.getDescription() != null ? definition.getDescription() : "",
        threshold,
        normalizeExtensions(definition.getFileExtensions()),
        compilePatterns(definition.getStrongPatterns(), key),
        compilePatterns(definition.getSupportingPatterns(), key),
        compilePatterns(definition.getRulePatterns(), key),
        compilePatterns(definition.getSectionMarkers(), key),
        compilePatterns(definition.getRuleMarkers(), key),
        ruleBlock,
        compileCategories(definition.getCategoryPatterns(), key),
        parameters,
        new RuleDensityRange(
            definition.getRuleDensity().getExpectedMin(), definition.getRuleDensity().getExpectedMax()));
  }

  private static Map<RuleCategory, List<Pattern>> compileCategories(
      Map<String, List<String>> source, String profileKey) {
    Map<RuleCategory, List<Pattern>> categories = new EnumMap<>(RuleCategory.class);
    if (source == null) {
      return categories;
    }
    source.forEach(
        (tag, patterns) -> {
          Optional<RuleCategory> category = RuleCategory.fromTag(tag);
          if (category.isEmpty()) {
            log.warn("Unknown rule category '{}' in profile '{}' ignored", tag, profileKey);
            return;
          }
          categories.put(category.get(), compilePatterns(patterns, profileKey));
        });
    return categories;
  }

  private static List<Pattern> compilePatterns(List<String> source, String profileKey) {
    if (source == null || source.isEmpty()) {
      return List.of();
    }
    List<Pattern> compiled = new ArrayList<>(source.size());
    for (String expression : source) {
      if (!StringUtils.hasText(expression)) {
        continue;
      }
      try {
        compiled.add(Pattern.compile(expression, LanguageProfile.PATTERN_FLAGS));
      } catch (PatternSyntaxException ex) {
        throw new ProfileConfigurationException(
            "profile '%s' has an invalid pattern '%s'".formatted(profileKey, expression), ex);
      }
    }
    return compiled;
  }

  private static List<String> normalizeExtensions(List<String> extensions) {
    if (extensions == null) {
      return List.of();
    }
    List<String> normalized = new ArrayList<>();
    for (String extension : extensions) {
      if (!StringUtils.hasText(extension)) {
        continue;
      }
      String value = extension.trim().toLowerCase(Locale.ROOT);
      if (!value.startsWith(".")) {
        value = "." + value;
      }
      if (!normalized.contains(value)) {
        normalized.add(value);
      }
    }
    return normalized;
  }

  private static int valueOrDefault(Integer value, int defaultValue) {
    return value != null && value > 0 ? value : defaultValue;
  }
}
