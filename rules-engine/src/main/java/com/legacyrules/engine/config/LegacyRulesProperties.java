package com.legacyrules.engine.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "legacy.rules")
public class LegacyRulesProperties {

  private final Detection detection = new Detection();
  private final Chunking chunking = new Chunking();
  private final Completeness completeness = new Completeness();
  private List<LanguageDefinition> languages = new ArrayList<>();
  private LanguageDefinition fallback = LanguageDefinition.genericFallback();

  public Detection getDetection() {
    return detection;
  }

  public Chunking getChunking() {
    return chunking;
  }

  public Completeness getCompleteness() {
    return completeness;
  }

  public List<LanguageDefinition> getLanguages() {
    return languages;
  }

  public void setLanguages(List<LanguageDefinition> languages) {
    this.languages = languages != null ? new ArrayList<>(languages) : new ArrayList<>();
  }

  public LanguageDefinition getFallback() {
    return fallback;
  }

  public void setFallback(LanguageDefinition fallback) {
    this.fallback = fallback != null ? fallback : LanguageDefinition.genericFallback();
  }

  public static class Detection {
    private int sampleLines = 100;
    private int confidenceBoostThreshold = 5;
    private double confidenceBoost = 1.2d;
    private double extensionWeight = 15.0d;
    private double strongPatternWeight = 10.0d;
    private double strongPatternCap = 50.0d;
    private double supportingPatternWeight = 3.0d;
    private double supportingPatternCap = 30.0d;
    private double rulePatternWeight = 5.0d;
    private double rulePatternCap = 25.0d;
    private double highConfidence = 0.8d;

    public int getSampleLines() {
      return sampleLines;
    }

    public void setSampleLines(int sampleLines) {
      this.sampleLines = sampleLines;
    }

    public int getConfidenceBoostThreshold() {
      return confidenceBoostThreshold;
    }

    public void setConfidenceBoostThreshold(int confidenceBoostThreshold) {
      this.confidenceBoostThreshold = confidenceBoostThreshold;
    }

    public double getConfidenceBoost() {
      return confidenceBoost;
    }

    public void setConfidenceBoost(double confidenceBoost) {
      this.confidenceBoost = confidenceBoost;
    }

    public double getExtensionWeight() {
      return extensionWeight;
    }

    public void setExtensionWeight(double extensionWeight) {
      this.extensionWeight = extensionWeight;
    }

    public double getStrongPatternWeight() {
      return strongPatternWeight;
    }

    public void setStrongPatternWeight(double strongPatternWeight) {
      this.strongPatternWeight = strongPatternWeight;
    }

    public double getStrongPatternCap() {
      return strongPatternCap;
    }

    public void setStrongPatternCap(double strongPatternCap) {
      this.strongPatternCap = strongPatternCap;
    }

    public double getSupportingPatternWeight() {
      return supportingPatternWeight;
    }

    public void setSupportingPatternWeight(double supportingPatternWeight) {
      this.supportingPatternWeight = supportingPatternWeight;
    }

    public double getSupportingPatternCap() {
      return supportingPatternCap;
    }

    public void setSupportingPatternCap(double supportingPatternCap) {
      this.supportingPatternCap = supportingPatternCap;
    }

    public double getRulePatternWeight() {
      return rulePatternWeight;
    }

    public void setRulePatternWeight(double rulePatternWeight) {
      this.rulePatternWeight = rulePatternWeight;
    }

    public double getRulePatternCap() {
      return rulePatternCap;
    }

    public void setRulePatternCap(double rulePatternCap) {
      this.rulePatternCap = rulePatternCap;
    }

    public double getHighConfidence() {
      return highConfidence;
    }

    public void setHighConfidence(double highConfidence) {
      this.highConfidence = highConfidence;
    }
  }

  public static class Chunking {
    private int preferredSize = 175;
    private int minSize = 87;
    private int maxSize = 262;
    private int overlapSize = 25;
    private List<String> blockStructuredLanguages =
        new ArrayList<>(List.of("cobol", "pascal", "pli"));
    private int contextMaxLines = 40;
    private int contextCacheSize = 256;

    public int getPreferredSize() {
      return preferredSize;
    }

    public void setPreferredSize(int preferredSize) {
      this.preferredSize = preferredSize;
    }

    public int getMinSize() {
      return minSize;
    }

    public void setMinSize(int minSize) {
      this.minSize = minSize;
    }

    public int getMaxSize() {
      return maxSize;
    }

    public void setMaxSize(int maxSize) {
      this.maxSize = maxSize;
    }

    public int getOverlapSize() {
      return overlapSize;
    }

    public void setOverlapSize(int overlapSize) {
      this.overlapSize = overlapSize;
    }

    public List<String> getBlockStructuredLanguages() {
      return blockStructuredLanguages;
    }

    public void setBlockStructuredLanguages(List<String> blockStructuredLanguages) {
      this.blockStructuredLanguages =
          blockStructuredLanguages != null ? new ArrayList<>(blockStructuredLanguages) : new ArrayList<>();
    }

    public int getContextMaxLines() {
      return contextMaxLines;
    }

    public void setContextMaxLines(int contextMaxLines) {
      this.contextMaxLines = contextMaxLines;
    }

    public int getContextCacheSize() {
      return contextCacheSize;
    }

    public void setContextCacheSize(int contextCacheSize) {
      this.contextCacheSize = contextCacheSize;
    }
  }

  public static class Completeness {
    private double targetPercentage = 90.0d;
    private double gapConfidence = 0.8d;
    private double sectionCallOutPercentage = 90.0d;
    private List<SectionVocabulary> sectionVocabulary = defaultVocabulary();
    private Map<String, List<String>> categoryKeywords = defaultCategoryKeywords();

    public double getTargetPercentage() {
      return targetPercentage;
    }

    public void setTargetPercentage(double targetPercentage) {
      this.targetPercentage = targetPercentage;
    }

    public double getGapConfidence() {
      return gapConfidence;
    }

    public void setGapConfidence(double gapConfidence) {
      this.gapConfidence = gapConfidence;
    }

    public double getSectionCallOutPercentage() {
      return sectionCallOutPercentage;
    }

    public void setSectionCallOutPercentage(double sectionCallOutPercentage) {
      this.sectionCallOutPercentage = sectionCallOutPercentage;
    }

    /** Keywords per rule category, keyed by category tag. Classification order is fixed. */
    public Map<String, List<String>> getCategoryKeywords() {
      return categoryKeywords;
    }

    public void setCategoryKeywords(Map<String, List<String>> categoryKeywords) {
      this.categoryKeywords =
          categoryKeywords != null ? new LinkedHashMap<>(categoryKeywords) : new LinkedHashMap<>();
    }

    public List<SectionVocabulary> getSectionVocabulary() {
      return sectionVocabulary;
    }

    public void setSectionVocabulary(List<SectionVocabulary> sectionVocabulary) {
      this.sectionVocabulary =
          sectionVocabulary != null ? new ArrayList<>(sectionVocabulary) : new ArrayList<>();
    }

    private static Map<String, List<String>> defaultCategoryKeywords() {
      Map<String, List<String>> keywords = new LinkedHashMap<>();
      keywords.put(
          "calculation", List.of("calculate", "compute", "premium", "multiply", "discount", "surcharge"));
      keywords.put("validation", List.of("valid", "check", "verify", "minimum", "maximum", "required"));
      keywords.put("decision", List.of("if", "then", "when", "condition", "evaluate"));
      keywords.put("workflow", List.of("perform", "process", "workflow", "step"));
      keywords.put("data_transformation", List.of("move", "assign", "set", "status", "transform"));
      keywords.put("conditional", List.of("and", "or", "complex", "nested", "multiple"));
      return keywords;
    }

    private static List<SectionVocabulary> defaultVocabulary() {
      List<SectionVocabulary> vocabulary = new ArrayList<>();
      vocabulary.add(
          SectionVocabulary.of(
              "AUTO-VALIDATION", List.of("auto", "driving", "vehicle", "accident", "dui")));
      vocabulary.add(
          SectionVocabulary.of(
              "LIFE-VALIDATION", List.of("life", "smoker", "health", "beneficiary", "medical")));
      vocabulary.add(
          SectionVocabulary.of(
              "CALCULATE-PREMIUM", List.of("premium", "calculate", "surcharge", "discount")));
      vocabulary.add(
          SectionVocabulary.of(
              "VALIDATE-APPLICATION", List.of("age", "credit", "employment", "income", "validate")));
      return vocabulary;
    }
  }

  public static class SectionVocabulary {
    private String section;
    private List<String> keywords = new ArrayList<>();

    static SectionVocabulary of(String section, List<String> keywords) {
      SectionVocabulary vocabulary = new SectionVocabulary();
      vocabulary.setSection(section);
      vocabulary.setKeywords(keywords);
      return vocabulary;
    }

    public String getSection() {
      return section;
    }

    public void setSection(String section) {
      this.section = section;
    }

    public List<String> getKeywords() {
      return keywords;
    }

    public void setKeywords(List<String> keywords) {
      this.keywords = keywords != null ? new ArrayList<>(keywords) : new ArrayList<>();
    }
  }

  /**
   * Raw, unvalidated language profile as it appears in configuration. Sanitized and compiled into
   * a {@code LanguageProfile} by the profile store.
   */
  public static class LanguageDefinition {
    private String key;
    private String name;
    private String description;
    private Double confidenceRequired;
    private List<String> fileExtensions = new ArrayList<>();
    private List<String> strongPatterns = new ArrayList<>();
    private List<String> supportingPatterns = new ArrayList<>();
    private List<String> rulePatterns = new ArrayList<>();
    private List<String> sectionMarkers = new ArrayList<>();
    private List<String> ruleMarkers = new ArrayList<>();
    private RuleBlock ruleBlock = new RuleBlock();
    private Map<String, List<String>> categoryPatterns = new LinkedHashMap<>();
    private ChunkingDefaults chunking = new ChunkingDefaults();
    private RuleDensity ruleDensity = new RuleDensity();

    static LanguageDefinition genericFallback() {
      LanguageDefinition fallback = new LanguageDefinition();
      fallback.setKey("unknown");
      fallback.setName("Generic");
      fallback.setDescription("Language-neutral defaults used when no profile matches");
      fallback.setConfidenceRequired(0.0d);
      fallback.setRulePatterns(
          List.of("\\bif\\b", "\\bswitch\\b", "\\bcase\\b", "\\bwhen\\b", "\\bevaluate\\b"));
      Map<String, List<String>> categories = new LinkedHashMap<>();
      categories.put("validation", List.of("\\bif\\b.*(<|>|<=|>=)"));
      categories.put("calculation", List.of("\\b(compute|calculate)\\b", "[\\w\\]\\)]\\s*[*/]\\s*[\\d.]+"));
      categories.put("decision", List.of("\\b(switch|evaluate|case)\\b"));
      categories.put("conditional", List.of("\\bif\\b.*(\\band\\b|\\bor\\b|&&|\\|\\|)"));
      fallback.setCategoryPatterns(categories);
      return fallback;
    }

    public String getKey() {
      return key;
    }

    public void setKey(String key) {
      this.key = key;
    }

    public String getName() {
      return name;
    }

    public void setName(String name) {
      this.name = name;
    }

    public String getDescription() {
      return description;
    }

    public void setDescription(String description) {
      this.description = description;
    }

    public Double getConfidenceRequired() {
      return confidenceRequired;
    }

    public void setConfidenceRequired(Double confidenceRequired) {
      this.confidenceRequired = confidenceRequired;
    }

    public List<String> getFileExtensions() {
      return fileExtensions;
    }

    public void setFileExtensions(List<String> fileExtensions) {
      this.fileExtensions = copy(fileExtensions);
    }

    public List<String> getStrongPatterns() {
      return strongPatterns;
    }

    public void setStrongPatterns(List<String> strongPatterns) {
      this.strongPatterns = copy(strongPatterns);
    }

    public List<String> getSupportingPatterns() {
      return supportingPatterns;
    }

    public void setSupportingPatterns(List<String> supportingPatterns) {
      this.supportingPatterns = copy(supportingPatterns);
    }

    public List<String> getRulePatterns() {
      return rulePatterns;
    }

    public void setRulePatterns(List<String> rulePatterns) {
      this.rulePatterns = copy(rulePatterns);
    }

    public List<String> getSectionMarkers() {
      return sectionMarkers;
    }

    public void setSectionMarkers(List<String> sectionMarkers) {
      this.sectionMarkers = copy(sectionMarkers);
    }

    public List<String> getRuleMarkers() {
      return ruleMarkers;
    }

    public void setRuleMarkers(List<String> ruleMarkers) {
      this.ruleMarkers = copy(ruleMarkers);
    }

    public RuleBlock getRuleBlock() {
      return ruleBlock;
    }

    public void setRuleBlock(RuleBlock ruleBlock) {
      this.ruleBlock = ruleBlock != null ? ruleBlock : new RuleBlock();
    }

    public Map<String, List<String>> getCategoryPatterns() {
      return categoryPatterns;
    }

    public void setCategoryPatterns(Map<String, List<String>> categoryPatterns) {
      this.categoryPatterns =
          categoryPatterns != null ? new LinkedHashMap<>(categoryPatterns) : new LinkedHashMap<>();
    }

    public ChunkingDefaults getChunking() {
      return chunking;
    }

    public void setChunking(ChunkingDefaults chunking) {
      this.chunking = chunking != null ? chunking : new ChunkingDefaults();
    }

    public RuleDensity getRuleDensity() {
      return ruleDensity;
    }

    public void setRuleDensity(RuleDensity ruleDensity) {
      this.ruleDensity = ruleDensity != null ? ruleDensity : new RuleDensity();
    }

    private static List<String> copy(List<String> source) {
      return source != null ? new ArrayList<>(source) : new ArrayList<>();
    }
  }

  public static class RuleBlock {
    private List<String> open = new ArrayList<>();
    private List<String> close = new ArrayList<>();
    private List<String> terminators = new ArrayList<>();
    private int blockLookahead = 30;
    private int statementLookahead = 15;

    public List<String> getOpen() {
      return open;
    }

    public void setOpen(List<String> open) {
      this.open = open != null ? new ArrayList<>(open) : new ArrayList<>();
    }

    public List<String> getClose() {
      return close;
    }

    public void setClose(List<String> close) {
      this.close = close != null ? new ArrayList<>(close) : new ArrayList<>();
    }

    public List<String> getTerminators() {
      return terminators;
    }

    public void setTerminators(List<String> terminators) {
      this.terminators = terminators != null ? new ArrayList<>(terminators) : new ArrayList<>();
    }

    public int getBlockLookahead() {
      return blockLookahead;
    }

    public void setBlockLookahead(int blockLookahead) {
      this.blockLookahead = blockLookahead;
    }

    public int getStatementLookahead() {
      return statementLookahead;
    }

    public void setStatementLookahead(int statementLookahead) {
      this.statementLookahead = statementLookahead;
    }
  }

  public static class ChunkingDefaults {
    private Integer preferredSize;
    private Integer minSize;
    private Integer maxSize;
    private Integer overlapSize;
    private Map<String, Integer> sectionPriority = new LinkedHashMap<>();

    public Integer getPreferredSize() {
      return preferredSize;
    }

    public void setPreferredSize(Integer preferredSize) {
      this.preferredSize = preferredSize;
    }

    public Integer getMinSize() {
      return minSize;
    }

    public void setMinSize(Integer minSize) {
      this.minSize = minSize;
    }

    public Integer getMaxSize() {
      return maxSize;
    }

    public void setMaxSize(Integer maxSize) {
      this.maxSize = maxSize;
    }

    public Integer getOverlapSize() {
      return overlapSize;
    }

    public void setOverlapSize(Integer overlapSize) {
      this.overlapSize = overlapSize;
    }

    public Map<String, Integer> getSectionPriority() {
      return sectionPriority;
    }

    public void setSectionPriority(Map<String, Integer> sectionPriority) {
      this.sectionPriority =
          sectionPriority != null ? new LinkedHashMap<>(sectionPriority) : new LinkedHashMap<>();
    }
  }

  public static class RuleDensity {
    private int expectedMin = 5;
    private int expectedMax = 20;

    public int getExpectedMin() {
      return expectedMin;
    }

    public void setExpectedMin(int expectedMin) {
      this.expectedMin = expectedMin;
    }

    public int getExpectedMax() {
      return expectedMax;
    }

    public void setExpectedMax(int expectedMax) {
      this.expectedMax = expectedMax;
    }
  }
}
