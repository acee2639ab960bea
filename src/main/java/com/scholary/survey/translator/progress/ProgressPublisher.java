package com.scholary.survey.translator.progress;

import com.scholary.survey.translator.config.ProgressProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Read side of live progress.
 *
 * <p>Offers a pull view ({@link #snapshot}) and a push view ({@link #stream}). Neither mutates job
 * state.
 */
@Component
public class ProgressPublisher {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProgressPublisher.class);

  private final ProgressBoard board;
  private final ProgressProperties properties;
  private final Clock clock;

  public ProgressPublisher(ProgressBoard board, ProgressProperties properties, Clock clock) {
    this.board = board;
    this.properties = properties;
    this.clock = clock;
  }

  /** Current progress of a job, or an idle snapshot if it never started or has expired. */
  public ProgressSnapshot snapshot(String jobId) {
    return board
        .find(jobId)
        .map(channel -> channel.observe().snapshot())
        .orElseGet(() -> ProgressSnapshot.idle().at(clock.instant()));
  }

  /**
   * Lazy stream of a job's progress.
   *
   * <p>Emits the current snapshot immediately, then one snapshot per change, and at least one per
   * heartbeat interval while nothing changes. The stream ends right after a {@code completed} or
   * {@code error} snapshot. Once the stream timeout is reached it emits a single {@code timeout}
   * snapshot and ends; the client is expected to reconnect.
   *
   * <p>A job with no progress yields an idle snapshot followed by a timeout.
   */
  public Stream<ProgressSnapshot> stream(String jobId) {
    Optional<ProgressChannel> channel = board.find(jobId);
    if (channel.isEmpty()) {
      LOGGER.debug("No progress for job, closing stream: jobId={}", jobId);
      ProgressSnapshot idle = snapshot(jobId);
      return Stream.of(idle, idle.asStreamTimeout());
    }

    Instant deadline = clock.instant().plus(properties.streamTimeout());
    LOGGER.debug("Opening progress stream: jobId={}, deadline={}", jobId, deadline);

    Iterator<ProgressSnapshot> snapshots =
        new SnapshotIterator(
            board, jobId, channel.get(), properties.heartbeatInterval(), deadline, clock);
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(
            snapshots, Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }

  private static final class SnapshotIterator implements Iterator<ProgressSnapshot> {

    private final ProgressBoard board;
    private final String jobId;
    private final Duration heartbeat;
    private final Instant deadline;
    private final Clock clock;

    private ProgressChannel channel;
    private boolean started;
    private boolean finished;
    private long seenVersion;

    SnapshotIterator(
        ProgressBoard board,
        String jobId,
        ProgressChannel channel,
        Duration heartbeat,
        Instant deadline,
        Clock clock) {
      this.board = board;
      this.jobId = jobId;
      this.channel = channel;
      this.heartbeat = heartbeat;
      this.deadline = deadline;
      this.clock = clock;
    }

    @Override
    public boolean hasNext() {
      return !finished;
    }

    @Override
    public ProgressSnapshot next() {
      if (finished) {
        throw new NoSuchElementException("Progress stream has ended");
      }

      ProgressChannel.Observation observation;
      if (!started) {
        started = true;
        observation = channel.observe();
      } else {
        followReplacedChannel();
        Duration remaining = Duration.between(clock.instant(), deadline);
        if (remaining.isNegative() || remaining.isZero()) {
          return timeout(channel.observe());
        }
        try {
          observation =
              channel.awaitChange(
                  seenVersion, remaining.compareTo(heartbeat) < 0 ? remaining : heartbeat);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return timeout(channel.observe());
        }
        if (observation.version() == seenVersion && !clock.instant().isBefore(deadline)) {
          return timeout(observation);
        }
      }

      seenVersion = observation.version();
      if (observation.snapshot().status().endsStream()) {
        finished = true;
      }
      return observation.snapshot();
    }

    /**
     * Switch to the job's current channel if the one being read was evicted and recreated by a
     * later publish. The seen version is reset so the new channel's snapshot is emitted at once.
     */
    private void followReplacedChannel() {
      Optional<ProgressChannel> current = board.find(jobId);
      if (current.isPresent() && current.get() != channel) {
        channel = current.get();
        seenVersion = -1;
      }
    }

    private ProgressSnapshot timeout(ProgressChannel.Observation observation) {
      finished = true;
      return observation.snapshot().asStreamTimeout();
    }
  }
}
