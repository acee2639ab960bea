package com.scholary.survey.translator.api;

import com.scholary.survey.translator.config.ProgressProperties;
import com.scholary.survey.translator.progress.ProgressPublisher;
import com.scholary.survey.translator.progress.ProgressSnapshot;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.io.IOException;
import java.util.Iterator;
import java.util.concurrent.Executor;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * REST API for batch progress.
 *
 * <p>Progress can be polled or streamed as Server-Sent Events. A stream closes itself after a
 * {@code completed}, {@code error} or {@code timeout} event; on {@code timeout} the client opens
 * a new stream.
 */
@RestController
@RequestMapping("/api/batches/{jobId}/progress")
@Tag(name = "Progress", description = "Live progress of a batch")
public class ProgressController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProgressController.class);

  static final String PROGRESS_EVENT = "progress";

  private final ProgressPublisher progressPublisher;
  private final ProgressProperties properties;
  private final Executor streamExecutor;

  public ProgressController(
      ProgressPublisher progressPublisher,
      ProgressProperties properties,
      @Qualifier("progressStreamExecutor") Executor streamExecutor) {
    this.progressPublisher = progressPublisher;
    this.properties = properties;
    this.streamExecutor = streamExecutor;
  }

  @GetMapping
  @Operation(summary = "Get progress", description = "Current progress snapshot of a batch")
  public ResponseEntity<ProgressSnapshot> progress(@PathVariable String jobId) {
    return ResponseEntity.ok(progressPublisher.snapshot(jobId));
  }

  @GetMapping(path = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  @Operation(summary = "Stream progress", description = "Progress snapshots as Server-Sent Events")
  public SseEmitter stream(@PathVariable String jobId) {
    // Outlives the publisher's own cap so the terminal timeout event still gets sent.
    long emitterTimeoutMs =
        properties.streamTimeout().plus(properties.heartbeatInterval()).toMillis() * 2;
    SseEmitter emitter = new SseEmitter(emitterTimeoutMs);
    streamExecutor.execute(() -> pump(jobId, emitter));
    return emitter;
  }

  private void pump(String jobId, SseEmitter emitter) {
    try (Stream<ProgressSnapshot> snapshots = progressPublisher.stream(jobId)) {
      Iterator<ProgressSnapshot> iterator = snapshots.iterator();
      while (iterator.hasNext()) {
        emitter.send(
            SseEmitter.event()
                .name(PROGRESS_EVENT)
                .data(iterator.next(), MediaType.APPLICATION_JSON));
      }
      emitter.complete();
    } catch (IOException e) {
      LOGGER.debug("Progress stream closed by client: jobId={}, reason={}", jobId, e.getMessage());
      emitter.completeWithError(e);
    } catch (RuntimeException e) {
      LOGGER.error("Progress stream failed: jobId={}", jobId, e);
      emitter.completeWithError(e);
    }
  }
}
