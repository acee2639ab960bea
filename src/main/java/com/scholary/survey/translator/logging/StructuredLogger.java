package com.scholary.survey.translator.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each method puts the fields of one event into the MDC, logs a single line and clears the
 * fields again, so log aggregation can filter on {@code event_type} and friends.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log chunk started event. */
  public void logChunkStarted(
      String jobId, int chunkIndex, int firstQuestion, int lastQuestion, int totalQuestions) {
    try {
      MDC.put("event_type", "chunk_started");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("firstQuestion", String.valueOf(firstQuestion));
      MDC.put("lastQuestion", String.valueOf(lastQuestion));
      MDC.put("totalQuestions", String.valueOf(totalQuestions));

      logger.info(
          "Chunk started: jobId={}, chunk={}, questions=[{}-{}] of {}",
          jobId,
          chunkIndex,
          firstQuestion,
          lastQuestion,
          totalQuestions);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk finished event. */
  public void logChunkFinished(
      String jobId, int chunkIndex, int appended, int pending, int cursor, long elapsedMs) {
    try {
      MDC.put("event_type", "chunk_finished");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("appended", String.valueOf(appended));
      MDC.put("pending", String.valueOf(pending));
      MDC.put("cursor", String.valueOf(cursor));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info(
          "Chunk finished: jobId={}, chunk={}, appended={}, pending={}, cursor={}, elapsed={}ms",
          jobId,
          chunkIndex,
          appended,
          pending,
          cursor,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log time budget exhausted event. */
  public void logBudgetExhausted(
      String jobId, int chunkIndex, int questionNumber, long elapsedMs, long budgetMs) {
    try {
      MDC.put("event_type", "budget_exhausted");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("question_number", String.valueOf(questionNumber));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));
      MDC.put("budgetMs", String.valueOf(budgetMs));

      logger.warn(
          "Time budget exhausted: jobId={}, chunk={}, deferring from question {}, "
              + "elapsed={}ms, budget={}ms",
          jobId,
          chunkIndex,
          questionNumber,
          elapsedMs,
          budgetMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log question translated event. */
  public void logQuestionTranslated(
      String jobId,
      int questionNumber,
      int rowNumber,
      String language,
      int confidence,
      long elapsedMs) {
    try {
      MDC.put("event_type", "question_translated");
      MDC.put("question_number", String.valueOf(questionNumber));
      MDC.put("row_number", String.valueOf(rowNumber));
      MDC.put("language", language);
      MDC.put("confidence", String.valueOf(confidence));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.debug(
          "Question translated: jobId={}, question={}, row={}, language={}, confidence={}, "
              + "elapsed={}ms",
          jobId,
          questionNumber,
          rowNumber,
          language,
          confidence,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log question failed event. */
  public void logQuestionFailed(
      String jobId, int questionNumber, int rowNumber, String errorType, String message) {
    try {
      MDC.put("event_type", "question_failed");
      MDC.put("question_number", String.valueOf(questionNumber));
      MDC.put("row_number", String.valueOf(rowNumber));
      MDC.put("errorType", errorType);

      logger.warn(
          "Question failed: jobId={}, question={}, row={}, error={}, message={}",
          jobId,
          questionNumber,
          rowNumber,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event. */
  public void logJobProgress(String jobId, int processed, int total, String phase) {
    int percentComplete = total == 0 ? 0 : (processed * 100) / total;
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("processed", String.valueOf(processed));
      MDC.put("total", String.valueOf(total));
      MDC.put("percentComplete", String.valueOf(percentComplete));
      MDC.put("phase", phase);

      logger.info(
          "Job progress: jobId={}, phase={}, questions={}/{}, progress={}%",
          jobId,
          phase,
          processed,
          total,
          percentComplete);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId) {
    MDC.put("jobId", jobId);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("chunk_index");
    MDC.remove("firstQuestion");
    MDC.remove("lastQuestion");
    MDC.remove("totalQuestions");
    MDC.remove("appended");
    MDC.remove("pending");
    MDC.remove("cursor");
    MDC.remove("elapsedMs");
    MDC.remove("budgetMs");
    MDC.remove("question_number");
    MDC.remove("row_number");
    MDC.remove("language");
    MDC.remove("confidence");
    MDC.remove("errorType");
    MDC.remove("processed");
    MDC.remove("total");
    MDC.remove("percentComplete");
    MDC.remove("phase");
  }
}
