package com.scholary.survey.translator.service;

import com.scholary.survey.translator.api.AutoContinueResponse;
import com.scholary.survey.translator.api.BatchStatusResponse;
import com.scholary.survey.translator.api.BatchStepResponse;
import com.scholary.survey.translator.batch.AutoContinueDriver;
import com.scholary.survey.translator.batch.BatchJob;
import com.scholary.survey.translator.batch.BatchJobRepository;
import com.scholary.survey.translator.batch.BatchNotFoundException;
import com.scholary.survey.translator.batch.BatchScheduler;
import com.scholary.survey.translator.batch.BatchStateException;
import com.scholary.survey.translator.batch.BatchStatus;
import com.scholary.survey.translator.batch.BatchSummary;
import com.scholary.survey.translator.batch.BatchValidationException;
import com.scholary.survey.translator.batch.ChunkOutcome;
import com.scholary.survey.translator.batch.Item;
import com.scholary.survey.translator.batch.ItemResult;
import com.scholary.survey.translator.batch.ItemStatus;
import com.scholary.survey.translator.spreadsheet.QuestionReader;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry points for batch translation.
 *
 * <p>Every operation is one bounded unit of work: starting a batch also processes its first
 * chunk, continuing processes one more chunk, auto-continue processes as many chunks as fit into
 * its budget. Clients keep calling until a response reports {@code complete}.
 */
@Service
public class SurveyBatchService {

  private static final Logger LOGGER = LoggerFactory.getLogger(SurveyBatchService.class);

  private final BatchScheduler scheduler;
  private final AutoContinueDriver autoContinueDriver;
  private final BatchJobRepository jobRepository;
  private final QuestionReader questionReader;

  public SurveyBatchService(
      BatchScheduler scheduler,
      AutoContinueDriver autoContinueDriver,
      BatchJobRepository jobRepository,
      QuestionReader questionReader) {
    this.scheduler = scheduler;
    this.autoContinueDriver = autoContinueDriver;
    this.jobRepository = jobRepository;
    this.questionReader = questionReader;
  }

  /**
   * Start a batch from a list of questions; list position {@code i} becomes row {@code i + 1}.
   *
   * <p>Blank entries are skipped. Other entries are kept exactly as given.
   */
  public BatchStepResponse start(List<String> questions) {
    List<Item> items = new ArrayList<>();
    for (int i = 0; i < questions.size(); i++) {
      String text = questions.get(i);
      if (text != null && !text.isBlank()) {
        items.add(new Item(i + 1, text));
      }
    }
    return startItems(items);
  }

  /** Start a batch from the first column of an uploaded spreadsheet. */
  public BatchStepResponse startUpload(String filename, InputStream content) {
    return startItems(questionReader.read(filename, content));
  }

  public BatchStepResponse continueBatch(String jobId) {
    BatchJob job = requireJob(jobId);
    ChunkOutcome outcome = scheduler.stepChunk(job);
    return BatchStepResponse.from(jobId, job.getTotal(), outcome);
  }

  public AutoContinueResponse autoContinue(String jobId) {
    BatchJob job = requireJob(jobId);
    return AutoContinueResponse.from(autoContinueDriver.run(job));
  }

  /** Ask a running auto-continue loop of the job to stop before its next chunk. */
  public void stop(String jobId) {
    requireJob(jobId).requestStop();
    LOGGER.info("Stop requested: jobId={}", jobId);
  }

  /**
   * Start a new batch from the errored and pending items of a completed one.
   *
   * <p>The new batch keeps the original row numbers of its items.
   *
   * @throws BatchStateException if the job is still in progress
   * @throws BatchValidationException if every item of the job was translated
   */
  public BatchStepResponse retryUnfinished(String jobId) {
    BatchJob job = requireJob(jobId);
    if (!scheduler.isComplete(job)) {
      throw new BatchStateException("Batch " + jobId + " is still in progress");
    }

    List<ItemResult> results = job.getResults();
    BatchSummary summary = BatchSummary.of(results);
    if (summary.unfinished() == 0) {
      throw new BatchValidationException("No errored or pending questions to retry");
    }

    List<Item> unfinished =
        results.stream()
            .filter(result -> result.status() != ItemStatus.TRANSLATED)
            .map(ItemResult::toItem)
            .collect(Collectors.toList());
    LOGGER.info(
        "Retrying unfinished questions of batch {}: errors={}, pending={}",
        jobId,
        summary.errored(),
        summary.pending());
    return startItems(unfinished);
  }

  public BatchStatusResponse status(String jobId) {
    return jobRepository
        .findById(jobId)
        .map(
            job ->
                new BatchStatusResponse(
                    jobId, job.getStatus(), job.getCursor(), job.getTotal(), job.getCreatedAt()))
        .orElseGet(() -> new BatchStatusResponse(jobId, BatchStatus.NO_BATCH, 0, 0, null));
  }

  private BatchStepResponse startItems(List<Item> items) {
    BatchJob job = scheduler.start(items);
    ChunkOutcome outcome;
    try {
      outcome = scheduler.stepChunk(job);
    } catch (RuntimeException e) {
      // the caller never learns this job id, so nobody could continue it
      scheduler.discard(job);
      throw e;
    }
    return BatchStepResponse.from(job.getJobId(), job.getTotal(), outcome);
  }

  private BatchJob requireJob(String jobId) {
    return jobRepository.findById(jobId).orElseThrow(() -> new BatchNotFoundException(jobId));
  }
}
