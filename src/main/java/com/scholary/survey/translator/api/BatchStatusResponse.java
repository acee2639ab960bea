package com.scholary.survey.translator.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scholary.survey.translator.batch.BatchStatus;
import java.time.Instant;

/**
 * Response for a batch status query.
 *
 * @param processed number of questions with a result so far
 * @param createdAt when the batch was started, absent for {@link BatchStatus#NO_BATCH}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchStatusResponse(
    String jobId, BatchStatus status, int processed, int total, Instant createdAt) {}
