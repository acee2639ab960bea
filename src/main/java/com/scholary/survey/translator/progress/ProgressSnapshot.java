package com.scholary.survey.translator.progress;

import java.time.Instant;

/**
 * Point-in-time view of a job's progress.
 *
 * <p>Immutable. The scheduler replaces the live snapshot of a job on every sub-step; readers
 * always see one whole snapshot. {@code updatedAt} is the time of the publish that produced it;
 * heartbeats repeat it unchanged, so an observer can tell a live job from a stalled one.
 */
public record ProgressSnapshot(
    ProgressStatus status,
    String message,
    int currentQuestion,
    int totalQuestions,
    int currentRow,
    String detectedLanguage,
    int confidence,
    String translation,
    Instant updatedAt) {

  public static ProgressSnapshot idle() {
    return new ProgressSnapshot(
        ProgressStatus.IDLE, "Waiting to start", 0, 0, 0, "", 0, "", null);
  }

  public static ProgressSnapshot reading(int totalQuestions) {
    return new ProgressSnapshot(
        ProgressStatus.READING,
        String.format("Read %d questions", totalQuestions),
        0,
        totalQuestions,
        0,
        "",
        0,
        "",
        null);
  }

  public static ProgressSnapshot processingBatch(
      int firstQuestion, int lastQuestion, int totalQuestions) {
    return new ProgressSnapshot(
        ProgressStatus.PROCESSING_BATCH,
        String.format(
            "Processing questions %d-%d of %d", firstQuestion, lastQuestion, totalQuestions),
        firstQuestion,
        totalQuestions,
        0,
        "",
        0,
        "",
        null);
  }

  public static ProgressSnapshot processingQuestion(
      int questionNumber, int totalQuestions, int rowNumber) {
    return new ProgressSnapshot(
        ProgressStatus.PROCESSING_QUESTION,
        String.format("Processing question %d of %d", questionNumber, totalQuestions),
        questionNumber,
        totalQuestions,
        rowNumber,
        "",
        0,
        "",
        null);
  }

  public static ProgressSnapshot batchCompleted(int processed, int totalQuestions) {
    return new ProgressSnapshot(
        ProgressStatus.BATCH_COMPLETED,
        String.format(
            "Processed %d of %d questions, %d remaining",
            processed, totalQuestions, totalQuestions - processed),
        processed,
        totalQuestions,
        0,
        "",
        0,
        "",
        null);
  }

  public static ProgressSnapshot completed(int totalQuestions, String message) {
    return new ProgressSnapshot(
        ProgressStatus.COMPLETED, message, totalQuestions, totalQuestions, 0, "", 0, "", null);
  }

  public static ProgressSnapshot error(String message, int currentQuestion, int totalQuestions) {
    return new ProgressSnapshot(
        ProgressStatus.ERROR, message, currentQuestion, totalQuestions, 0, "", 0, "", null);
  }

  /** This snapshot with the language detected for the current question. */
  public ProgressSnapshot withDetection(String language, int confidenceScore) {
    return new ProgressSnapshot(
        status,
        String.format("Detected %s for question %d", language, currentQuestion),
        currentQuestion,
        totalQuestions,
        currentRow,
        language,
        confidenceScore,
        translation,
        updatedAt);
  }

  /** This snapshot with the translation of the current question. */
  public ProgressSnapshot withTranslation(String englishTranslation) {
    return new ProgressSnapshot(
        status,
        String.format("Translated question %d of %d", currentQuestion, totalQuestions),
        currentQuestion,
        totalQuestions,
        currentRow,
        detectedLanguage,
        confidence,
        englishTranslation,
        updatedAt);
  }

  /** Terminal snapshot a stream emits when it hands control back to the client. */
  public ProgressSnapshot asStreamTimeout() {
    return new ProgressSnapshot(
        ProgressStatus.TIMEOUT,
        "Stream timeout - reconnect to resume",
        currentQuestion,
        totalQuestions,
        currentRow,
        detectedLanguage,
        confidence,
        translation,
        updatedAt);
  }

  /** This snapshot stamped with the time it was published. */
  public ProgressSnapshot at(Instant publishedAt) {
    return new ProgressSnapshot(
        status,
        message,
        currentQuestion,
        totalQuestions,
        currentRow,
        detectedLanguage,
        confidence,
        translation,
        publishedAt);
  }
}
