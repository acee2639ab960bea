package com.scholary.survey.translator.api;

import com.scholary.survey.translator.batch.BatchValidationException;
import com.scholary.survey.translator.logging.StructuredLogger;
import com.scholary.survey.translator.service.SurveyBatchService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.IOException;
import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST API for batch translation of survey questions.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Starting a batch from a JSON list or an uploaded spreadsheet
 *   <li>Continuing a batch one chunk at a time, or auto-continuing within a time budget
 *   <li>Stopping an auto-continue run and retrying unfinished questions
 * </ul>
 *
 * <p>Every call returns within the request time limit of the hosting platform; the client keeps
 * calling continue until the response is complete.
 */
@RestController
@RequestMapping("/api/batches")
@Tag(name = "Batches", description = "Resumable batch translation of survey questions")
public class BatchController {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchController.class);

  private final SurveyBatchService batchService;

  public BatchController(SurveyBatchService batchService) {
    this.batchService = batchService;
  }

  @PostMapping
  @Operation(
      summary = "Start batch",
      description = "Create a batch from a list of questions and process its first chunk")
  public ResponseEntity<BatchStepResponse> start(@Valid @RequestBody StartBatchRequest request) {
    LOGGER.info("Start batch request: questions={}", request.questions().size());
    return ResponseEntity.ok(batchService.start(request.questions()));
  }

  @PostMapping(path = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Start batch from spreadsheet",
      description =
          "Read questions from the first column of an .xlsx or .xls file, create a batch and "
              + "process its first chunk")
  public ResponseEntity<BatchStepResponse> upload(@RequestParam("file") MultipartFile file)
      throws IOException {
    if (file.getOriginalFilename() == null || file.getOriginalFilename().isBlank()) {
      throw new BatchValidationException("No file selected");
    }
    LOGGER.info(
        "Upload request: file={}, size={} bytes", file.getOriginalFilename(), file.getSize());

    try (InputStream content = file.getInputStream()) {
      return ResponseEntity.ok(batchService.startUpload(file.getOriginalFilename(), content));
    }
  }

  @GetMapping("/{jobId}")
  @Operation(
      summary = "Get batch status",
      description = "Report whether a batch exists and how far it got")
  public ResponseEntity<BatchStatusResponse> status(@PathVariable String jobId) {
    return ResponseEntity.ok(batchService.status(jobId));
  }

  @PostMapping("/{jobId}/continue")
  @Operation(summary = "Continue batch", description = "Process the next chunk of a pending batch")
  public ResponseEntity<BatchStepResponse> continueBatch(@PathVariable String jobId) {
    StructuredLogger.setJobContext(jobId);
    try {
      return ResponseEntity.ok(batchService.continueBatch(jobId));
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  @PostMapping("/{jobId}/auto-continue")
  @Operation(
      summary = "Auto-continue batch",
      description = "Process as many chunks as fit into one request and return all results so far")
  public ResponseEntity<AutoContinueResponse> autoContinue(@PathVariable String jobId) {
    StructuredLogger.setJobContext(jobId);
    try {
      return ResponseEntity.ok(batchService.autoContinue(jobId));
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  @PostMapping("/{jobId}/stop")
  @Operation(
      summary = "Stop batch",
      description = "Ask a running auto-continue to stop before its next chunk")
  public ResponseEntity<Void> stop(@PathVariable String jobId) {
    batchService.stop(jobId);
    return ResponseEntity.accepted().build();
  }

  @PostMapping("/{jobId}/retry")
  @Operation(
      summary = "Retry unfinished questions",
      description = "Start a new batch from the errored and pending questions of a completed batch")
  public ResponseEntity<BatchStepResponse> retry(@PathVariable String jobId) {
    StructuredLogger.setJobContext(jobId);
    try {
      return ResponseEntity.ok(batchService.retryUnfinished(jobId));
    } finally {
      StructuredLogger.clearJobContext();
    }
  }
}
