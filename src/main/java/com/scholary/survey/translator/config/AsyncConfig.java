package com.scholary.survey.translator.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for the progress stream executor.
 *
 * <p>Each open progress stream occupies one thread while it waits for changes, so the pool and
 * its queue are bounded to cap how many streams can be served at once.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "progressStreamExecutor")
  public Executor progressStreamExecutor(ProgressProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.streamExecutorThreads());
    executor.setMaxPoolSize(properties.streamExecutorThreads());
    executor.setQueueCapacity(properties.streamExecutorQueueSize());
    executor.setThreadNamePrefix("progress-stream-");
    executor.initialize();
    return executor;
  }
}
