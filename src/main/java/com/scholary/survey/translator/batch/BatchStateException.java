package com.scholary.survey.translator.batch;

/**
 * Exception thrown when an operation does not fit the current state of a job.
 *
 * <p>For example continuing a batch that is already complete, or stepping a job while another
 * step on it is still running.
 */
public class BatchStateException extends RuntimeException {

  public BatchStateException(String message) {
    super(message);
  }
}
