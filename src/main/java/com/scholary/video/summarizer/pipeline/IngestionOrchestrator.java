package com.scholary.video.summarizer.pipeline;

import com.scholary.video.summarizer.chunking.TextChunker;
import com.scholary.video.summarizer.chunking.TranscriptChunk;
import com.scholary.video.summarizer.config.PipelineProperties;
import com.scholary.video.summarizer.gemini.ProcessingStatePoller;
import com.scholary.video.summarizer.gemini.RemoteFileHandle;
import com.scholary.video.summarizer.gemini.RemoteFileService;
import com.scholary.video.summarizer.gemini.RemoteFileState;
import com.scholary.video.summarizer.gemini.RemoteFileUploader;
import com.scholary.video.summarizer.logging.StructuredLogger;
import com.scholary.video.summarizer.objectstore.DownloadedObject;
import com.scholary.video.summarizer.objectstore.ObjectStoreClient;
import com.scholary.video.summarizer.progress.ProgressEmitter;
import com.scholary.video.summarizer.progress.ProgressEvent;
import com.scholary.video.summarizer.store.ResultStore;
import com.scholary.video.summarizer.store.StoredResult;
import com.scholary.video.summarizer.summary.GeneratedContent;
import com.scholary.video.summarizer.summary.SummaryGenerator;
import com.scholary.video.summarizer.transcript.FetchedTranscript;
import com.scholary.video.summarizer.transcript.LanguageFallbackTranscriptFetcher;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Runs one ingestion end to end and reports progress.
 *
 * <p>Two paths share the cache check and the save step:
 *
 * <ul>
 *   <li>Object store: download, upload to the remote file service, wait until it is ACTIVE,
 *       generate transcript and summary from the file reference, delete the remote file
 *   <li>Text: optionally fetch captions, then summarize directly or section by section
 * </ul>
 *
 * <p>Every stage emits its progress event before the blocking call it announces. Any failure ends
 * the run with exactly one {@code error} event; a failed save still completes, with a warning. The
 * remote file is deleted exactly once whenever an upload produced a handle, whatever happens after.
 */
@Service
public class IngestionOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(IngestionOrchestrator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final String CACHE_SOURCE = "cache";
  static final String SAVE_WARNING = "Failed to save to history";

  private final ResultStore resultStore;
  private final ObjectStoreClient objectStoreClient;
  private final RemoteFileUploader remoteFileUploader;
  private final ProcessingStatePoller statePoller;
  private final RemoteFileService remoteFileService;
  private final SummaryGenerator summaryGenerator;
  private final TextChunker textChunker;
  private final LanguageFallbackTranscriptFetcher transcriptFetcher;
  private final PipelineProperties properties;
  private final Clock clock;

  @Autowired
  public IngestionOrchestrator(
      ResultStore resultStore,
      ObjectStoreClient objectStoreClient,
      RemoteFileUploader remoteFileUploader,
      ProcessingStatePoller statePoller,
      RemoteFileService remoteFileService,
      SummaryGenerator summaryGenerator,
      TextChunker textChunker,
      LanguageFallbackTranscriptFetcher transcriptFetcher,
      PipelineProperties properties) {
    this(
        resultStore,
        objectStoreClient,
        remoteFileUploader,
        statePoller,
        remoteFileService,
        summaryGenerator,
        textChunker,
        transcriptFetcher,
        properties,
        Clock.systemUTC());
  }

  IngestionOrchestrator(
      ResultStore resultStore,
      ObjectStoreClient objectStoreClient,
      RemoteFileUploader remoteFileUploader,
      ProcessingStatePoller statePoller,
      RemoteFileService remoteFileService,
      SummaryGenerator summaryGenerator,
      TextChunker textChunker,
      LanguageFallbackTranscriptFetcher transcriptFetcher,
      PipelineProperties properties,
      Clock clock) {
    this.resultStore = resultStore;
    this.objectStoreClient = objectStoreClient;
    this.remoteFileUploader = remoteFileUploader;
    this.statePoller = statePoller;
    this.remoteFileService = remoteFileService;
    this.summaryGenerator = summaryGenerator;
    this.textChunker = textChunker;
    this.transcriptFetcher = transcriptFetcher;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Run the pipeline for one request.
   *
   * <p>Never throws for pipeline failures: they are reported on the emitter and reflected in the
   * returned state. The emitter is left open; closing it is the caller's job.
   *
   * @param request what to ingest
   * @param emitter receives progress, then one complete or error event
   * @return DONE or FAILED
   */
  public RunState run(IngestionRequest request, ProgressEmitter emitter) {
    String runId = UUID.randomUUID().toString();
    StructuredLogger.setRunContext(runId, request.sourceId(), request.language());
    RunStateTracker state = new RunStateTracker();
    long startMillis = clock.millis();

    try {
      LOGGER.info(
          "Starting run: sourceId={}, language={}, kind={}",
          request.sourceId(),
          request.language(),
          request.source().kind());

      Optional<StoredResult> cached = lookupCached(request);
      if (cached.isPresent()) {
        emitCacheHit(cached.get(), emitter);
        state.transitionTo(RunState.DONE);
        return state.current();
      }

      ProcessingResult result;
      if (request.source().kind() == SourceMedia.Kind.OBJECT_STORE) {
        result = processObject(request, state, emitter);
      } else {
        result = processText(request, state, emitter);
      }

      state.transitionTo(RunState.SAVING);
      stage(emitter, "saving", "Saving summary to history...", 90);
      Optional<StoredResult> saved = save(request, result);

      state.transitionTo(RunState.DONE);
      emitter.emit(
          ProgressEvent.complete(
              "Video processing completed successfully!",
              result.summary(),
              result.transcript(),
              saved.map(StoredResult::id).orElse(null),
              result.title(),
              request.sourceId(),
              request.source().kind().label(),
              saved.isPresent() ? null : SAVE_WARNING));

      LOGGER.info(
          "Run completed: sourceId={}, duration={}ms, saved={}",
          request.sourceId(),
          clock.millis() - startMillis,
          saved.isPresent());
      return state.current();

    } catch (RuntimeException e) {
      LOGGER.error("Run failed in state {}: {}", state.current(), e.getMessage(), e);
      state.fail();
      emitter.emit(ProgressEvent.error(errorMessage(e)));
      return state.current();

    } finally {
      StructuredLogger.clearRunContext();
    }
  }

  private Optional<StoredResult> lookupCached(IngestionRequest request) {
    try {
      return resultStore.find(request.sourceId(), request.language());
    } catch (RuntimeException e) {
      LOGGER.warn("Cache lookup failed, treating as miss: {}", e.getMessage());
      return Optional.empty();
    }
  }

  private void emitCacheHit(StoredResult stored, ProgressEmitter emitter) {
    LOGGER.info("Cache hit: id={}, sourceId={}", stored.id(), stored.sourceId());
    emitter.emit(
        ProgressEvent.complete(
            "Loaded from history",
            stored.summary(),
            stored.transcript(),
            stored.id(),
            stored.title(),
            stored.sourceId(),
            CACHE_SOURCE,
            null));
  }

  private ProcessingResult processObject(
      IngestionRequest request, RunStateTracker state, ProgressEmitter emitter) {
    String displayName = request.title() != null ? request.title() : request.source().key();

    state.transitionTo(RunState.DOWNLOADING);
    stage(emitter, "downloading", "Downloading video from storage...", 10);
    DownloadedObject object = objectStoreClient.download(request.source().key());
    LOGGER.info(
        "Downloaded source: {} bytes, contentType={}",
        object.contentLength(),
        object.contentType());

    state.transitionTo(RunState.UPLOADING);
    stage(emitter, "uploading", "Uploading video for analysis...", 30);
    RemoteFileHandle handle =
        remoteFileUploader.upload(object.bytes(), object.contentType(), displayName);

    try {
      state.transitionTo(RunState.WAITING_REMOTE);
      stage(emitter, "processing", "Waiting for video processing...", 50);
      PipelineProperties.PollingProperties polling = properties.polling();
      statePoller.waitUntilActive(handle.name(), polling.maxWaitMs(), polling.intervalMs());
      handle = handle.withState(RemoteFileState.ACTIVE);

      state.transitionTo(RunState.GENERATING);
      stage(emitter, "generating", "Generating transcript and summary...", 70);
      GeneratedContent content =
          summaryGenerator.generateFromFileReference(
              handle.fileUri(), handle.mimeType(), displayName);

      stage(emitter, "cleanup", "Cleaning up remote file...", 85);
      return new ProcessingResult(displayName, content.transcript(), content.summary(), 0);

    } finally {
      cleanup(handle.name());
    }
  }

  private ProcessingResult processText(
      IngestionRequest request, RunStateTracker state, ProgressEmitter emitter) {
    String title = request.title();
    String transcript;

    if (request.source().kind() == SourceMedia.Kind.TRANSCRIPT_REFERENCE) {
      state.transitionTo(RunState.FETCHING_TRANSCRIPT);
      stage(emitter, "analyzing", "Fetching video transcript...", 20);
      FetchedTranscript fetched = transcriptFetcher.fetch(request.source().videoId());
      transcript = fetched.text();
      if (title == null || title.isBlank()) {
        title = fetched.title();
      }
    } else {
      transcript = request.source().transcript().strip();
    }

    state.transitionTo(RunState.GENERATING);
    String summary = summarizeTranscript(transcript, request.language(), emitter);
    return new ProcessingResult(title, transcript, summary, 0);
  }

  private String summarizeTranscript(String transcript, String language, ProgressEmitter emitter) {
    PipelineProperties.ChunkingProperties chunking = properties.chunking();

    if (transcript.length() <= chunking.thresholdChars()) {
      emitter.emit(
          ProgressEvent.chunkProgress("processing", "Processing video content...", 50, 1, 1));
      return summaryGenerator.summarize(transcript, language);
    }

    List<TranscriptChunk> chunks =
        textChunker.split(transcript, chunking.chunkSizeChars(), chunking.overlapChars());
    if (chunks.size() == 1) {
      emitter.emit(
          ProgressEvent.chunkProgress("processing", "Processing video content...", 50, 1, 1));
      return summaryGenerator.summarize(chunks.get(0).text(), language);
    }

    int total = chunks.size();
    List<String> sectionSummaries = new ArrayList<>(total);
    for (TranscriptChunk chunk : chunks) {
      int current = chunk.index() + 1;
      emitter.emit(
          ProgressEvent.chunkProgress(
              "processing",
              String.format("Processing section %d of %d...", current, total),
              sectionPercent(chunk.index(), total),
              current,
              total));

      long chunkStart = clock.millis();
      String sectionSummary = summaryGenerator.summarizeSection(chunk.text(), language);
      structuredLogger.logChunkSummarized(
          chunk.index(), total, sectionSummary.length(), clock.millis() - chunkStart);
      sectionSummaries.add(sectionSummary);
    }

    emitter.emit(
        ProgressEvent.chunkProgress("finalizing", "Creating final summary...", 80, total, total));
    return textChunker.combine(sectionSummaries, language, summaryGenerator::generateFromText);
  }

  /** Spread section progress over 30-75%. */
  static int sectionPercent(int index, int total) {
    return 30 + (45 * index) / total;
  }

  private Optional<StoredResult> save(IngestionRequest request, ProcessingResult result) {
    StoredResult row =
        new StoredResult(
            UUID.randomUUID().toString(),
            request.sourceId(),
            request.language(),
            result.title(),
            request.sourceLocation(),
            result.transcript(),
            result.summary(),
            result.durationSeconds(),
            summaryGenerator.modelName(),
            clock.instant());
    try {
      return Optional.of(resultStore.insert(row));
    } catch (RuntimeException e) {
      LOGGER.warn(
          "Failed to save result, completing without it: sourceId={}, error={}",
          request.sourceId(),
          e.getMessage());
      return Optional.empty();
    }
  }

  private void cleanup(String remoteName) {
    boolean deleted;
    try {
      deleted = remoteFileService.delete(remoteName);
    } catch (RuntimeException e) {
      LOGGER.warn("Remote file cleanup threw: name={}, error={}", remoteName, e.getMessage());
      deleted = false;
    }
    structuredLogger.logCleanup(remoteName, deleted);
  }

  private void stage(ProgressEmitter emitter, String stage, String message, int percent) {
    structuredLogger.logStageStarted(stage, percent);
    emitter.emit(ProgressEvent.progress(stage, message, percent));
  }

  private static String errorMessage(RuntimeException e) {
    String message = e.getMessage();
    return message == null || message.isBlank() ? "Failed to process video" : message;
  }
}
