package com.scholary.survey.translator.batch;

import java.util.List;

/**
 * Result of one auto-continue run.
 *
 * @param stepsProcessed chunk steps taken during this run
 * @param stopped whether the run ended because a stop was requested
 */
public record AutoContinueResult(
    String jobId,
    boolean complete,
    List<ItemResult> results,
    int total,
    int stepsProcessed,
    boolean stopped,
    BatchSummary summary) {}
