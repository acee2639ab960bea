package com.scholary.survey.translator.batch;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.survey.translator.config.BatchProperties;
import com.scholary.survey.translator.progress.ProgressBoard;
import com.scholary.survey.translator.translation.FakeTranslationClient;
import com.scholary.survey.translator.translation.LanguageDetection;
import com.scholary.survey.translator.translation.TranslationClient;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class AutoContinueDriverTest {

  private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));

  private final BatchProperties properties =
      new BatchProperties(
          1000,
          3,
          Duration.ofSeconds(25),
          Duration.ofSeconds(25),
          Duration.ZERO,
          new BatchProperties.JobStoreProperties(100, 60));

  @Test
  void run_shouldProcessAllChunksWithinBudget() {
    BatchScheduler scheduler = scheduler(new FakeTranslationClient());
    AutoContinueDriver driver = new AutoContinueDriver(scheduler, properties, clock);
    BatchJob job = scheduler.start(items(7));

    AutoContinueResult result = driver.run(job);

    assertThat(result.complete()).isTrue();
    assertThat(result.stopped()).isFalse();
    assertThat(result.stepsProcessed()).isEqualTo(3);
    assertThat(result.results()).hasSize(7);
    assertThat(result.summary()).isEqualTo(new BatchSummary(7, 0, 0));
    assertThat(result.results().get(0).englishTranslation()).isEqualTo("[TEST MODE] q1");
  }

  @Test
  void run_shouldLeaveBatchResumableOnceBudgetIsSpent() {
    BatchScheduler scheduler = scheduler(new SlowTranslationClient(Duration.ofSeconds(10)));
    AutoContinueDriver driver = new AutoContinueDriver(scheduler, properties, clock);
    BatchJob job = scheduler.start(items(7));

    AutoContinueResult first = driver.run(job);

    assertThat(first.complete()).isFalse();
    assertThat(first.stepsProcessed()).isEqualTo(1);
    assertThat(first.results()).hasSize(3);
    assertThat(first.results()).extracting(ItemResult::status).containsOnly(ItemStatus.TRANSLATED);

    AutoContinueResult second = driver.run(job);

    assertThat(second.results()).hasSize(6);
    assertThat(second.results().subList(0, 3)).isEqualTo(first.results());
  }

  @Test
  void run_shouldHonourStopRequest() {
    BatchScheduler scheduler = scheduler(new FakeTranslationClient());
    AutoContinueDriver driver = new AutoContinueDriver(scheduler, properties, clock);
    BatchJob job = scheduler.start(items(7));
    scheduler.stepChunk(job);
    job.requestStop();

    AutoContinueResult stopped = driver.run(job);

    assertThat(stopped.stopped()).isTrue();
    assertThat(stopped.complete()).isFalse();
    assertThat(stopped.stepsProcessed()).isZero();
    assertThat(stopped.results()).hasSize(3);
    assertThat(job.isStopRequested()).isFalse();

    AutoContinueResult resumed = driver.run(job);

    assertThat(resumed.complete()).isTrue();
    assertThat(resumed.results()).hasSize(7);
  }

  @Test
  void run_shouldReturnImmediatelyForCompletedBatch() {
    BatchScheduler scheduler = scheduler(new FakeTranslationClient());
    AutoContinueDriver driver = new AutoContinueDriver(scheduler, properties, clock);
    BatchJob job = scheduler.start(items(2));
    scheduler.stepChunk(job);

    AutoContinueResult result = driver.run(job);

    assertThat(result.complete()).isTrue();
    assertThat(result.stepsProcessed()).isZero();
    assertThat(result.results()).hasSize(2);
  }

  private BatchScheduler scheduler(TranslationClient client) {
    return new BatchScheduler(
        client,
        new BatchJobRepository(properties),
        new ProgressBoard(properties, clock),
        properties,
        clock);
  }

  private static List<Item> items(int count) {
    List<Item> items = new ArrayList<>();
    for (int i = 1; i <= count; i++) {
      items.add(new Item(i, "q" + i));
    }
    return items;
  }

  /** Client whose translations take a fixed amount of clock time. */
  private class SlowTranslationClient implements TranslationClient {

    private final Duration latency;

    SlowTranslationClient(Duration latency) {
      this.latency = latency;
    }

    @Override
    public LanguageDetection detectLanguage(String text) {
      return new LanguageDetection("French", 80, null);
    }

    @Override
    public String translate(String text) {
      clock.advance(latency);
      return "EN " + text;
    }
  }
}
