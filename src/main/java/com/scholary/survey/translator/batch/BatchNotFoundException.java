package com.scholary.survey.translator.batch;

/** Exception thrown when a job id is unknown or the job has expired. */
public class BatchNotFoundException extends RuntimeException {

  public BatchNotFoundException(String jobId) {
    super("No pending batch found: " + jobId);
  }
}
