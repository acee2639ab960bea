package com.scholary.survey.translator.progress;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.survey.translator.config.BatchProperties;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Write side of live progress, keyed by job id.
 *
 * <p>The scheduler publishes here; {@link ProgressPublisher} reads. A publish is a map lookup plus
 * a signal, so observers can never hold up processing. Channels are only created by a publish and
 * expire with the same idle window as the jobs they describe.
 */
@Component
public class ProgressBoard {

  private final Cache<String, ProgressChannel> channels;
  private final Clock clock;

  public ProgressBoard(BatchProperties properties, Clock clock) {
    this.channels =
        Caffeine.newBuilder()
            .maximumSize(properties.jobStore().maxSize())
            .expireAfterAccess(Duration.ofMinutes(properties.jobStore().expireAfterMinutes()))
            .build();
    this.clock = clock;
  }

  /** Replace the live snapshot of a job, stamped with the current time. */
  public void publish(String jobId, ProgressSnapshot snapshot) {
    ProgressSnapshot stamped = snapshot.at(clock.instant());
    channels.get(jobId, id -> new ProgressChannel(stamped)).publish(stamped);
  }

  /** Drop the progress of a job that will never be processed. */
  public void remove(String jobId) {
    channels.invalidate(jobId);
  }

  Optional<ProgressChannel> find(String jobId) {
    return Optional.ofNullable(channels.getIfPresent(jobId));
  }
}
