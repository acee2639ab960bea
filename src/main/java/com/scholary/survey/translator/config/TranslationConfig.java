package com.scholary.survey.translator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.survey.translator.translation.DeepSeekTranslationClient;
import com.scholary.survey.translator.translation.FakeTranslationClient;
import com.scholary.survey.translator.translation.TranslationClient;
import com.scholary.survey.translator.translation.TranslationProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the translation client.
 *
 * <p>Wires the DeepSeek client, or the deterministic fake when {@code translation.test-mode} is
 * set.
 */
@Configuration
@EnableConfigurationProperties(TranslationProperties.class)
public class TranslationConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranslationConfig.class);

  @Bean
  public TranslationClient translationClient(
      TranslationProperties properties, ObjectMapper objectMapper) {
    if (properties.testMode()) {
      LOGGER.warn("Translation test mode is enabled, no upstream calls will be made");
      return new FakeTranslationClient();
    }
    return new DeepSeekTranslationClient(properties, objectMapper);
  }
}
