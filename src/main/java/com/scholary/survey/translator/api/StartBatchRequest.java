package com.scholary.survey.translator.api;

import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * Request for starting a batch from a list of questions.
 *
 * <p>Question {@code i} of the list is row {@code i + 1}. Blank entries are skipped without
 * renumbering the others.
 */
public record StartBatchRequest(@NotNull List<String> questions) {}
