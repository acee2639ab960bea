package com.scholary.survey.translator.translation;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the DeepSeek client.
 *
 * <p>The API key is optional at startup so that test mode runs without credentials. A missing key
 * is reported on the first real call.
 */
@ConfigurationProperties(prefix = "translation")
@Validated
public record TranslationProperties(
    @NotBlank String apiUrl,
    String apiKey,
    @NotBlank String model,
    @NotNull Duration connectTimeout,
    @NotNull Duration readTimeout,
    boolean testMode) {}
