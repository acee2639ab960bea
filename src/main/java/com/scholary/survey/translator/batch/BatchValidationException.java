package com.scholary.survey.translator.batch;

/**
 * Exception thrown when a batch cannot be started from the given input.
 *
 * <p>Empty question lists, lists over the configured limit, unsupported or unreadable files. No
 * job exists when this is thrown.
 */
public class BatchValidationException extends RuntimeException {

  public BatchValidationException(String message) {
    super(message);
  }

  public BatchValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
