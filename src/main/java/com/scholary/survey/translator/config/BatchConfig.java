package com.scholary.survey.translator.config;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for batch-related beans.
 *
 * <p>Enables the BatchProperties and ProgressProperties to be loaded from application.yml and
 * provides the clock that time budgets are measured against.
 */
@Configuration
@EnableConfigurationProperties({BatchProperties.class, ProgressProperties.class})
public class BatchConfig {

  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }
}
