package com.scholary.survey.translator.progress;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.survey.translator.config.BatchProperties;
import com.scholary.survey.translator.config.ProgressProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

class ProgressPublisherTest {

  private static final String JOB_ID = "job-1";
  private static final Instant PUBLISHED_AT = Instant.parse("2026-01-01T10:00:00Z");

  private ProgressBoard board;

  @BeforeEach
  void setUp() {
    board =
        new ProgressBoard(
            new BatchProperties(
                1000,
                3,
                Duration.ofSeconds(25),
                Duration.ofSeconds(25),
                Duration.ZERO,
                new BatchProperties.JobStoreProperties(100, 60)),
            Clock.fixed(PUBLISHED_AT, ZoneOffset.UTC));
  }

  @Test
  void snapshot_shouldBeIdleForUnknownJob() {
    ProgressSnapshot snapshot =
        publisher(Duration.ofMillis(50), Duration.ofSeconds(1)).snapshot("nope");

    assertThat(snapshot.status()).isEqualTo(ProgressStatus.IDLE);
    assertThat(snapshot.message()).isEqualTo("Waiting to start");
    assertThat(snapshot.updatedAt()).isNotNull();
  }

  @Test
  void snapshot_shouldReturnLatestPublished() {
    board.publish(JOB_ID, ProgressSnapshot.reading(5));
    board.publish(JOB_ID, ProgressSnapshot.processingQuestion(2, 5, 7));

    ProgressSnapshot snapshot =
        publisher(Duration.ofMillis(50), Duration.ofSeconds(1)).snapshot(JOB_ID);

    assertThat(snapshot.status()).isEqualTo(ProgressStatus.PROCESSING_QUESTION);
    assertThat(snapshot.currentQuestion()).isEqualTo(2);
    assertThat(snapshot.currentRow()).isEqualTo(7);
    assertThat(snapshot.updatedAt()).isEqualTo(PUBLISHED_AT);
  }

  @Test
  @Timeout(5)
  void stream_shouldEndAfterCompletedSnapshot() {
    board.publish(JOB_ID, ProgressSnapshot.completed(3, "Completed 3 questions"));

    List<ProgressSnapshot> snapshots =
        publisher(Duration.ofMillis(50), Duration.ofSeconds(2))
            .stream(JOB_ID)
            .collect(Collectors.toList());

    assertThat(snapshots).hasSize(1);
    assertThat(snapshots.get(0).status()).isEqualTo(ProgressStatus.COMPLETED);
  }

  @Test
  @Timeout(5)
  void stream_shouldSendHeartbeatsAndEndWithTimeout() {
    board.publish(JOB_ID, ProgressSnapshot.processingQuestion(1, 3, 1));

    List<ProgressSnapshot> snapshots =
        publisher(Duration.ofMillis(50), Duration.ofMillis(300))
            .stream(JOB_ID)
            .collect(Collectors.toList());

    assertThat(snapshots.size()).isGreaterThan(2);
    ProgressSnapshot last = snapshots.get(snapshots.size() - 1);
    assertThat(last.status()).isEqualTo(ProgressStatus.TIMEOUT);
    assertThat(last.message()).isEqualTo("Stream timeout - reconnect to resume");
    assertThat(last.currentQuestion()).isEqualTo(1);
    assertThat(snapshots.subList(0, snapshots.size() - 1))
        .extracting(ProgressSnapshot::status)
        .containsOnly(ProgressStatus.PROCESSING_QUESTION);
    assertThat(snapshots).extracting(ProgressSnapshot::updatedAt).containsOnly(PUBLISHED_AT);
  }

  @Test
  @Timeout(5)
  void stream_shouldWakeUpOnPublish() {
    board.publish(JOB_ID, ProgressSnapshot.reading(2));
    ProgressPublisher publisher = publisher(Duration.ofSeconds(2), Duration.ofSeconds(4));

    CompletableFuture.runAsync(
        () -> board.publish(JOB_ID, ProgressSnapshot.completed(2, "Completed 2 questions")),
        CompletableFuture.delayedExecutor(100, TimeUnit.MILLISECONDS));
    List<ProgressSnapshot> snapshots = publisher.stream(JOB_ID).collect(Collectors.toList());

    assertThat(snapshots.get(0).status()).isEqualTo(ProgressStatus.READING);
    assertThat(snapshots.get(snapshots.size() - 1).status()).isEqualTo(ProgressStatus.COMPLETED);
  }

  @Test
  @Timeout(5)
  void stream_shouldEndWithTimeoutAtOnceForUnknownJob() {
    List<ProgressSnapshot> snapshots =
        publisher(Duration.ofSeconds(2), Duration.ofSeconds(4))
            .stream("not-started")
            .collect(Collectors.toList());

    assertThat(snapshots)
        .extracting(ProgressSnapshot::status)
        .containsExactly(ProgressStatus.IDLE, ProgressStatus.TIMEOUT);
    assertThat(snapshots.get(1).updatedAt()).isEqualTo(snapshots.get(0).updatedAt()).isNotNull();
  }

  @Test
  @Timeout(5)
  void stream_shouldFollowChannelRecreatedAfterEviction() {
    board.publish(JOB_ID, ProgressSnapshot.reading(2));
    Iterator<ProgressSnapshot> snapshots =
        publisher(Duration.ofSeconds(2), Duration.ofSeconds(4)).stream(JOB_ID).iterator();

    assertThat(snapshots.next().status()).isEqualTo(ProgressStatus.READING);
    board.remove(JOB_ID);
    board.publish(JOB_ID, ProgressSnapshot.completed(2, "Completed 2 questions"));

    assertThat(snapshots.next().status()).isEqualTo(ProgressStatus.COMPLETED);
    assertThat(snapshots.hasNext()).isFalse();
  }

  private ProgressPublisher publisher(Duration heartbeat, Duration streamTimeout) {
    return new ProgressPublisher(
        board, new ProgressProperties(heartbeat, streamTimeout, 1, 1), Clock.systemUTC());
  }
}
