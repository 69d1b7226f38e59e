package com.legacyrules.engine.completeness;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

/**
 * One rule record produced by the external extraction step. {@code conditions}, {@code actions}
 * and {@code business_description} are required; records missing any of them are malformed and
 * are counted as unclassifiable. Unknown fields are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractedRule(
    @JsonProperty("rule_id") @Nullable String ruleId,
    @JsonProperty("conditions") @Nullable String conditions,
    @JsonProperty("actions") @Nullable String actions,
    @JsonProperty("business_description") @Nullable String businessDescription,
    @JsonProperty("source_code_lines") @Nullable String sourceCodeLines) {

  private static final Logger log = LoggerFactory.getLogger(ExtractedRule.class);

  private static final ObjectMapper MAPPER =
      JsonMapper.builder()
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
          .build();

  public static ExtractedRule of(String conditions, String actions, String businessDescription) {
    return new ExtractedRule(null, conditions, actions, businessDescription, null);
  }

  public boolean isWellFormed() {
    return conditions != null && actions != null && businessDescription != null;
  }

  /** Text the classifier looks at: description, conditions and actions joined. */
  String classificationText() {
    return String.join(
        " ",
        businessDescription != null ? businessDescription : "",
        conditions != null ? conditions : "",
        actions != null ? actions : "");
  }

  /**
   * Converts an opaque record. A record that cannot be read at all becomes an empty, malformed
   * rule so that it is counted instead of dropped.
   */
  public static ExtractedRule fromMap(@Nullable Map<String, ?> raw) {
    if (raw == null) {
      return new ExtractedRule(null, null, null, null, null);
    }
    try {
      return MAPPER.convertValue(raw, ExtractedRule.class);
    } catch (IllegalArgumentException ex) {
      log.warn("Unreadable rule record treated as malformed: {}", ex.getMessage());
      return new ExtractedRule(null, null, null, null, null);
    }
  }

  public static List<ExtractedRule> fromMaps(@Nullable List<? extends Map<String, ?>> raw) {
    if (raw == null) {
      return List.of();
    }
    List<ExtractedRule> rules = new ArrayList<>(raw.size());
    for (Map<String, ?> entry : raw) {
      rules.add(fromMap(entry));
    }
    return rules;
  }
}
