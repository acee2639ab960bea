package com.scholary.survey.translator.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scholary.survey.translator.batch.BatchStatus;
import com.scholary.survey.translator.batch.BatchSummary;
import com.scholary.survey.translator.batch.ChunkOutcome;
import com.scholary.survey.translator.batch.ItemResult;
import java.util.List;

/**
 * Response for one processing step of a batch.
 *
 * <p>While more items remain, {@code results} holds only what this step appended and {@code
 * nextCursor}/{@code remaining} tell the client to continue. Once complete, {@code results} holds
 * the whole batch and {@code summary} the outcome counts.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchStepResponse(
    String jobId,
    boolean success,
    boolean complete,
    BatchStatus status,
    List<ItemResult> results,
    int total,
    Integer nextCursor,
    Integer remaining,
    BatchSummary summary) {

  public static BatchStepResponse from(String jobId, int total, ChunkOutcome outcome) {
    if (outcome.complete()) {
      return new BatchStepResponse(
          jobId,
          true,
          true,
          BatchStatus.COMPLETE,
          outcome.allResults(),
          total,
          null,
          null,
          BatchSummary.of(outcome.allResults()));
    }
    return new BatchStepResponse(
        jobId,
        true,
        false,
        BatchStatus.IN_PROGRESS,
        outcome.appended(),
        total,
        outcome.nextCursor(),
        outcome.remaining(),
        null);
  }
}
