package com.scholary.survey.translator.batch;

/**
 * Lifecycle of a batch as seen by a caller.
 *
 * <p>{@code NO_BATCH} is reported for job ids that were never started or have expired.
 */
public enum BatchStatus {
  NO_BATCH,
  IN_PROGRESS,
  COMPLETE
}
