package com.scholary.survey.translator.api;

import com.scholary.survey.translator.spreadsheet.ResultExporter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.LocalDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/** REST API for downloading results as an Excel file. */
@RestController
@Tag(name = "Export", description = "Spreadsheet export of translation results")
public class ExportController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ExportController.class);

  private final ResultExporter resultExporter;
  private final Clock clock;

  public ExportController(ResultExporter resultExporter, Clock clock) {
    this.resultExporter = resultExporter;
    this.clock = clock;
  }

  @PostMapping("/api/export")
  @Operation(summary = "Export results", description = "Download results as an .xlsx workbook")
  public ResponseEntity<byte[]> export(@Valid @RequestBody ExportRequest request) {
    LocalDateTime processedAt = LocalDateTime.now(clock);
    byte[] workbook = resultExporter.export(request.results(), processedAt);
    LOGGER.info("Exported {} results ({} bytes)", request.results().size(), workbook.length);

    return ResponseEntity.ok()
        .contentType(MediaType.parseMediaType(ResultExporter.CONTENT_TYPE))
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment()
                .filename(resultExporter.fileName(processedAt))
                .build()
                .toString())
        .body(workbook);
  }
}
