package com.scholary.video.summarizer.api;

import com.scholary.video.summarizer.config.PipelineProperties;
import com.scholary.video.summarizer.gemini.GeminiProperties;
import com.scholary.video.summarizer.pipeline.IngestionOrchestrator;
import com.scholary.video.summarizer.pipeline.IngestionRequest;
import com.scholary.video.summarizer.pipeline.SourceMedia;
import com.scholary.video.summarizer.progress.ProgressEmitter;
import com.scholary.video.summarizer.progress.ProgressEvent;
import com.scholary.video.summarizer.progress.SseProgressSink;
import com.scholary.video.summarizer.transcript.VideoIdExtractor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * REST API for video ingestion.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Processing a video from object storage
 *   <li>Summarizing a video from its captions
 *   <li>Summarizing a caller-supplied transcript
 *   <li>Service status
 * </ul>
 *
 * <p>Ingestion endpoints answer immediately with a Server-Sent Events stream; the run itself
 * executes on the task executor and writes progress to that stream until it completes or fails.
 */
@RestController
@RequestMapping("/api/videos")
@Tag(name = "Videos", description = "Video transcription and summarization API")
public class IngestionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(IngestionController.class);

  private final IngestionOrchestrator orchestrator;
  private final Executor taskExecutor;
  private final GeminiProperties geminiProperties;
  private final long streamTimeoutMs;

  public IngestionController(
      IngestionOrchestrator orchestrator,
      @Qualifier("taskExecutor") Executor taskExecutor,
      GeminiProperties geminiProperties,
      PipelineProperties pipelineProperties) {
    this.orchestrator = orchestrator;
    this.taskExecutor = taskExecutor;
    this.geminiProperties = geminiProperties;
    this.streamTimeoutMs = pipelineProperties.streamTimeoutMs();
  }

  @PostMapping("/process-object")
  @Operation(
      summary = "Process a stored video",
      description =
          "Download the video from object storage, stage it with the model's file service and "
              + "generate a transcript and summary. Progress is streamed as Server-Sent Events.")
  public SseEmitter processObject(@Valid @RequestBody ProcessObjectRequest request) {
    LOGGER.info("Process object request: key={}, fileName={}", request.s3Key(), request.fileName());

    return start(
        new IngestionRequest(
            request.s3Key(),
            request.language(),
            request.fileName(),
            "s3://" + request.s3Key(),
            SourceMedia.objectStore(request.s3Key())));
  }

  @PostMapping("/summarize")
  @Operation(
      summary = "Summarize a video from its captions",
      description =
          "Fetch the video's captions, trying several caption languages in order, and summarize "
              + "them. Long transcripts are summarized section by section.")
  public SseEmitter summarize(@Valid @RequestBody SummarizeRequest request) {
    String videoId = VideoIdExtractor.extract(request.url());
    LOGGER.info("Summarize request: videoId={}, language={}", videoId, request.language());

    return start(
        new IngestionRequest(
            videoId,
            request.language(),
            null,
            request.url(),
            SourceMedia.transcriptReference(videoId)));
  }

  @PostMapping("/summarize-transcript")
  @Operation(
      summary = "Summarize a transcript",
      description = "Summarize a transcript supplied in the request body.")
  public SseEmitter summarizeTranscript(@Valid @RequestBody SummarizeTranscriptRequest request) {
    LOGGER.info(
        "Summarize transcript request: sourceId={}, chars={}",
        request.sourceId(),
        request.transcript().length());

    return start(
        new IngestionRequest(
            request.sourceId(),
            request.language(),
            request.title(),
            null,
            SourceMedia.inlineText(request.transcript())));
  }

  @GetMapping("/status")
  @Operation(summary = "Service status", description = "Report whether the model is configured.")
  public StatusResponse status() {
    return new StatusResponse(geminiProperties.hasApiKey());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException e) {
    LOGGER.warn("Rejected request: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new ErrorResponse(e.getMessage()));
  }

  private SseEmitter start(IngestionRequest request) {
    SseEmitter sseEmitter = new SseEmitter(streamTimeoutMs);
    ProgressEmitter emitter = new ProgressEmitter(new SseProgressSink(sseEmitter));

    try {
      taskExecutor.execute(
          () -> {
            try {
              orchestrator.run(request, emitter);
            } finally {
              emitter.close();
            }
          });
    } catch (RejectedExecutionException e) {
      LOGGER.warn("Run rejected, executor is saturated: sourceId={}", request.sourceId());
      emitter.emit(ProgressEvent.error("Server is busy, please try again later"));
      emitter.close();
    }
    return sseEmitter;
  }
}
