package com.scholary.survey.translator.api;

import com.scholary.survey.translator.batch.AutoContinueResult;
import com.scholary.survey.translator.batch.BatchSummary;
import com.scholary.survey.translator.batch.ItemResult;
import java.util.List;

/**
 * Response for an auto-continue run.
 *
 * <p>{@code results} holds every result accumulated so far. If {@code complete} is false the
 * client calls auto-continue again.
 */
public record AutoContinueResponse(
    String jobId,
    boolean success,
    boolean complete,
    boolean stopped,
    List<ItemResult> results,
    int total,
    int batchesProcessed,
    BatchSummary summary) {

  public static AutoContinueResponse from(AutoContinueResult result) {
    return new AutoContinueResponse(
        result.jobId(),
        true,
        result.complete(),
        result.stopped(),
        result.results(),
        result.total(),
        result.stepsProcessed(),
        result.summary());
  }
}
