package com.scholary.survey.translator.batch;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A resumable batch of questions.
 *
 * <p>Holds the items, the results appended so far and the cursor of the next unprocessed item.
 * Results are only ever appended by {@link BatchScheduler} one whole chunk at a time, which keeps
 * {@code results.size() == cursor} between steps. Stored in memory by {@link BatchJobRepository}.
 */
public class BatchJob {

  private final String jobId;
  private final List<Item> items;
  private final int chunkSize;
  private final Instant createdAt;

  private final List<ItemResult> results = new ArrayList<>();
  private final ReentrantLock stepLock = new ReentrantLock();

  private int cursor;
  private int stepsProcessed;
  private volatile boolean stopRequested;

  public BatchJob(String jobId, List<Item> items, int chunkSize, Instant createdAt) {
    this.jobId = jobId;
    this.items = List.copyOf(items);
    this.chunkSize = chunkSize;
    this.createdAt = createdAt;
  }

  public String getJobId() {
    return jobId;
  }

  public List<Item> getItems() {
    return items;
  }

  public int getTotal() {
    return items.size();
  }

  public int getChunkSize() {
    return chunkSize;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public synchronized int getCursor() {
    return cursor;
  }

  public synchronized int getStepsProcessed() {
    return stepsProcessed;
  }

  public synchronized List<ItemResult> getResults() {
    return List.copyOf(results);
  }

  public BatchStatus getStatus() {
    return getCursor() >= items.size() ? BatchStatus.COMPLETE : BatchStatus.IN_PROGRESS;
  }

  public boolean isStopRequested() {
    return stopRequested;
  }

  public void requestStop() {
    this.stopRequested = true;
  }

  void clearStopRequest() {
    this.stopRequested = false;
  }

  boolean tryLockStep() {
    return stepLock.tryLock();
  }

  void unlockStep() {
    stepLock.unlock();
  }

  /** Append the results of one chunk and move the cursor past them. */
  synchronized void commit(List<ItemResult> chunkResults) {
    if (cursor + chunkResults.size() > items.size()) {
      throw new IllegalStateException(
          String.format(
              "Chunk of %d results overruns batch %s at cursor %d/%d",
              chunkResults.size(), jobId, cursor, items.size()));
    }
    results.addAll(chunkResults);
    cursor += chunkResults.size();
    stepsProcessed++;
  }
}
