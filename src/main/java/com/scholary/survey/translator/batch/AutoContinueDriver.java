package com.scholary.survey.translator.batch;

import com.scholary.survey.translator.config.BatchProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs as many chunk steps as fit into one aggregate time budget.
 *
 * <p>Each step gets whatever is left of the aggregate budget. The loop ends when the batch is
 * complete, the budget is spent, or a stop was requested for the job; a job that is not complete
 * is simply continued by the next invocation.
 */
@Component
public class AutoContinueDriver {

  private static final Logger LOGGER = LoggerFactory.getLogger(AutoContinueDriver.class);

  private final BatchScheduler scheduler;
  private final BatchProperties properties;
  private final Clock clock;

  public AutoContinueDriver(BatchScheduler scheduler, BatchProperties properties, Clock clock) {
    this.scheduler = scheduler;
    this.properties = properties;
    this.clock = clock;
  }

  public AutoContinueResult run(BatchJob job) {
    Instant deadline = clock.instant().plus(properties.autoContinueBudget());
    int steps = 0;
    boolean stopped = false;

    while (!scheduler.isComplete(job)) {
      if (job.isStopRequested()) {
        job.clearStopRequest();
        stopped = true;
        LOGGER.info(
            "Stop requested, leaving batch at cursor {}: jobId={}",
            job.getCursor(),
            job.getJobId());
        break;
      }

      Duration remaining = Duration.between(clock.instant(), deadline);
      if (remaining.isNegative() || remaining.isZero()) {
        LOGGER.info(
            "Auto-continue budget spent after {} steps: jobId={}, cursor={}/{}",
            steps,
            job.getJobId(),
            job.getCursor(),
            job.getTotal());
        break;
      }

      scheduler.stepChunk(job, remaining);
      steps++;

      if (!scheduler.isComplete(job) && !pauseBetweenChunks()) {
        break;
      }
    }

    List<ItemResult> results = job.getResults();
    BatchSummary summary = BatchSummary.of(results);
    boolean complete = scheduler.isComplete(job);
    if (complete) {
      LOGGER.info(
          "Batch complete: jobId={}, processed={}, errors={}, pending={}",
          job.getJobId(),
          summary.processed(),
          summary.errored(),
          summary.pending());
    }
    return new AutoContinueResult(
        job.getJobId(), complete, results, job.getTotal(), steps, stopped, summary);
  }

  /**
   * Sleep the configured pause between chunks to spare the upstream service.
   *
   * @return false if interrupted, in which case the run should end
   */
  private boolean pauseBetweenChunks() {
    long pauseMs = properties.autoContinuePause().toMillis();
    if (pauseMs <= 0) {
      return true;
    }
    try {
      Thread.sleep(pauseMs);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Auto-continue interrupted between chunks");
      return false;
    }
  }
}
