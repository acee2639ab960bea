package com.scholary.survey.translator.translation;

/**
 * Exception thrown when a call to the text-analysis service fails.
 *
 * <p>Covers network failures, non-success status codes and translation responses without
 * content. The batch scheduler records these as errored items and carries on with the batch.
 */
public class TranslationException extends RuntimeException {

  public TranslationException(String message) {
    super(message);
  }

  public TranslationException(String message, Throwable cause) {
    super(message, cause);
  }
}
