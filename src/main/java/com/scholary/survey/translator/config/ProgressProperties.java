package com.scholary.survey.translator.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for progress reporting.
 *
 * <p>A progress stream emits at least one snapshot per heartbeat interval and hands control back
 * to the client after the stream timeout, before the platform closes the connection on its own.
 */
@ConfigurationProperties(prefix = "progress")
@Validated
public record ProgressProperties(
    @NotNull Duration heartbeatInterval,
    @NotNull Duration streamTimeout,
    @Positive int streamExecutorThreads,
    @Positive int streamExecutorQueueSize) {}
