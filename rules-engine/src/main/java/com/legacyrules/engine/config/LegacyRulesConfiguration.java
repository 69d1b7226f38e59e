package com.legacyrules.engine.config;

import com.legacyrules.engine.chunking.FileContextExtractor;
import com.legacyrules.engine.detection.LanguageProfileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(LegacyRulesProperties.class)
public class LegacyRulesConfiguration {

  private static final Logger log = LoggerFactory.getLogger(LegacyRulesConfiguration.class);

  @Bean
  public LanguageProfileStore languageProfileStore(LegacyRulesProperties properties) {
    LanguageProfileStore store = new LanguageProfileStore(properties);
    if (store.isEmpty()) {
      log.warn("No language profiles configured under legacy.rules.languages, detection will use the fallback profile");
    }
    return store;
  }

  @Bean
  public FileContextExtractor fileContextExtractor(LegacyRulesProperties properties) {
    int cacheSize = properties.getChunking().getContextCacheSize();
    log.info("Creating file context cache (maximumSize={})", cacheSize);
    return new FileContextExtractor(cacheSize);
  }
}
