package com.scholary.survey.translator.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for batch processing.
 *
 * <p>The chunk budget has to stay below the request ceiling of the hosting platform (about 30
 * seconds). The job store bounds how many batches are kept in memory and for how long.
 */
@ConfigurationProperties(prefix = "batch")
@Validated
public record BatchProperties(
    @Positive int maxQuestions,
    @Positive int chunkSize,
    @NotNull Duration chunkTimeBudget,
    @NotNull Duration autoContinueBudget,
    @NotNull Duration autoContinuePause,
    @Valid @NotNull JobStoreProperties jobStore) {

  public record JobStoreProperties(@Positive int maxSize, @Positive int expireAfterMinutes) {}
}
