package com.scholary.survey.translator.batch;

import com.scholary.survey.translator.config.BatchProperties;
import com.scholary.survey.translator.logging.StructuredLogger;
import com.scholary.survey.translator.progress.ProgressBoard;
import com.scholary.survey.translator.progress.ProgressSnapshot;
import com.scholary.survey.translator.translation.LanguageDetection;
import com.scholary.survey.translator.translation.TranslationClient;
import com.scholary.survey.translator.translation.TranslationException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Processes batches in time-bounded chunks.
 *
 * <p>A single request may only run for a limited time, so a batch is worked off over several
 * independent invocations. Each {@link #stepChunk} call takes the next window of {@code
 * chunkSize} items and handles them one at a time, in source order:
 *
 * <ul>
 *   <li>the time budget is checked before each item; an item already calling upstream is allowed
 *       to finish
 *   <li>a {@link TranslationException} turns the item into an errored result and the chunk goes on
 *   <li>items left in the window once the budget is spent become pending results
 * </ul>
 *
 * <p>The whole window is committed at once, so the cursor always moves by the full window and
 * {@code results.size() == cursor} holds between steps. Any other exception aborts the step before
 * commit and leaves the job as it was.
 */
@Service
public class BatchScheduler {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchScheduler.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final TranslationClient translationClient;
  private final BatchJobRepository jobRepository;
  private final ProgressBoard progressBoard;
  private final BatchProperties properties;
  private final Clock clock;

  public BatchScheduler(
      TranslationClient translationClient,
      BatchJobRepository jobRepository,
      ProgressBoard progressBoard,
      BatchProperties properties,
      Clock clock) {
    this.translationClient = translationClient;
    this.jobRepository = jobRepository;
    this.progressBoard = progressBoard;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Create a new job for the given items.
   *
   * @param items the items in source order
   * @return the stored job, with nothing processed yet
   * @throws BatchValidationException if there are no items or more than the configured maximum
   */
  public BatchJob start(List<Item> items) {
    if (items == null || items.isEmpty()) {
      throw new BatchValidationException("No questions found");
    }
    if (items.size() > properties.maxQuestions()) {
      throw new BatchValidationException(
          String.format(
              "Maximum %d questions allowed per file, got %d",
              properties.maxQuestions(), items.size()));
    }

    BatchJob job =
        new BatchJob(
            UUID.randomUUID().toString(), items, properties.chunkSize(), clock.instant());
    jobRepository.save(job);
    progressBoard.publish(job.getJobId(), ProgressSnapshot.reading(job.getTotal()));

    LOGGER.info(
        "Started batch: jobId={}, questions={}, chunkSize={}",
        job.getJobId(),
        job.getTotal(),
        job.getChunkSize());
    return job;
  }

  /** Process the next chunk within the configured chunk budget. */
  public ChunkOutcome stepChunk(BatchJob job) {
    return stepChunk(job, properties.chunkTimeBudget());
  }

  /**
   * Process the next chunk of a job.
   *
   * @param job the job to advance
   * @param timeBudget how long this step may keep starting new items
   * @return the outcome, with the results this step appended
   * @throws BatchStateException if the job is complete or another step on it is running
   */
  public ChunkOutcome stepChunk(BatchJob job, Duration timeBudget) {
    if (!job.tryLockStep()) {
      throw new BatchStateException(
          "A chunk is already being processed for batch " + job.getJobId());
    }
    try {
      if (isComplete(job)) {
        throw new BatchStateException("Batch " + job.getJobId() + " is already complete");
      }
      return processChunk(job, timeBudget);
    } finally {
      job.unlockStep();
    }
  }

  /** Forget a job and its progress, for a batch that failed before any result was committed. */
  public void discard(BatchJob job) {
    jobRepository.remove(job.getJobId());
    progressBoard.remove(job.getJobId());
    LOGGER.info("Discarded batch: jobId={}", job.getJobId());
  }

  public boolean isComplete(BatchJob job) {
    return job.getCursor() >= job.getTotal();
  }

  private ChunkOutcome processChunk(BatchJob job, Duration timeBudget) {
    String jobId = job.getJobId();
    int total = job.getTotal();
    int from = job.getCursor();
    int to = Math.min(from + job.getChunkSize(), total);
    int chunkIndex = job.getStepsProcessed();
    Instant stepStart = clock.instant();

    progressBoard.publish(jobId, ProgressSnapshot.processingBatch(from + 1, to, total));
    structuredLogger.logChunkStarted(jobId, chunkIndex, from + 1, to, total);

    List<ItemResult> chunkResults = new ArrayList<>(to - from);
    int pending = 0;
    try {
      for (int index = from; index < to; index++) {
        Item item = job.getItems().get(index);
        int questionNumber = index + 1;

        Duration elapsed = Duration.between(stepStart, clock.instant());
        if (elapsed.compareTo(timeBudget) > 0) {
          if (pending == 0) {
            structuredLogger.logBudgetExhausted(
                jobId, chunkIndex, questionNumber, elapsed.toMillis(), timeBudget.toMillis());
          }
          chunkResults.add(ItemResult.pending(questionNumber, item));
          pending++;
          continue;
        }

        chunkResults.add(processItem(jobId, questionNumber, total, item));
      }
    } catch (RuntimeException e) {
      LOGGER.error(
          "Chunk aborted, nothing committed: jobId={}, chunk={}, cursor={}",
          jobId,
          chunkIndex,
          from,
          e);
      progressBoard.publish(
          jobId,
          ProgressSnapshot.error(
              "Processing failed: " + e.getMessage(), from + chunkResults.size() + 1, total));
      throw e;
    }

    job.commit(chunkResults);
    int cursor = job.getCursor();
    structuredLogger.logChunkFinished(
        jobId,
        chunkIndex,
        chunkResults.size(),
        pending,
        cursor,
        Duration.between(stepStart, clock.instant()).toMillis());

    if (isComplete(job)) {
      List<ItemResult> allResults = job.getResults();
      BatchSummary summary = BatchSummary.of(allResults);
      progressBoard.publish(
          jobId,
          ProgressSnapshot.completed(
              total,
              String.format(
                  "Completed %d questions: %d translated, %d errors, %d pending",
                  total, summary.processed(), summary.errored(), summary.pending())));
      structuredLogger.logJobProgress(jobId, cursor, total, "completed");
      return ChunkOutcome.complete(chunkResults, allResults);
    }

    progressBoard.publish(jobId, ProgressSnapshot.batchCompleted(cursor, total));
    structuredLogger.logJobProgress(jobId, cursor, total, "batch_completed");
    return ChunkOutcome.moreRemaining(cursor, total - cursor, chunkResults);
  }

  private ItemResult processItem(String jobId, int questionNumber, int total, Item item) {
    ProgressSnapshot progress =
        ProgressSnapshot.processingQuestion(questionNumber, total, item.rowNumber());
    progressBoard.publish(jobId, progress);
    long startTime = clock.millis();

    try {
      LanguageDetection detection = translationClient.detectLanguage(item.text());
      progress = progress.withDetection(detection.language(), detection.confidence());
      progressBoard.publish(jobId, progress);

      String translation = translationClient.translate(item.text());
      progressBoard.publish(jobId, progress.withTranslation(translation));

      structuredLogger.logQuestionTranslated(
          jobId,
          questionNumber,
          item.rowNumber(),
          detection.language(),
          detection.confidence(),
          clock.millis() - startTime);
      return ItemResult.translated(questionNumber, item, detection, translation);

    } catch (TranslationException e) {
      structuredLogger.logQuestionFailed(
          jobId, questionNumber, item.rowNumber(), e.getClass().getSimpleName(), e.getMessage());
      return ItemResult.errored(questionNumber, item, e.getMessage());
    }
  }
}
