package com.scholary.survey.translator.api;

import com.scholary.survey.translator.batch.ItemResult;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/** Request for exporting results as a spreadsheet. */
public record ExportRequest(@NotNull List<ItemResult> results) {}
