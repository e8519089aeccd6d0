package com.scholary.video.summarizer.transcript;

import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Fetches a transcript by trying caption languages in a fixed order.
 *
 * <p>The first language that yields non-blank text wins. If every attempt fails or comes back
 * empty, the last fetch error is rethrown, so the caller sees the most specific reason. This is the
 * only retry the pipeline does on its own.
 */
@Service
public class LanguageFallbackTranscriptFetcher {

  private static final Logger LOGGER =
      LoggerFactory.getLogger(LanguageFallbackTranscriptFetcher.class);

  static final String DEFAULT_TITLE = "YouTube Video Summary";
  private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");
  private static final int TITLE_SCAN_CHARS = 1000;

  private final TranscriptSource source;
  private final List<String> languages;
  private final int minChars;

  @Autowired
  public LanguageFallbackTranscriptFetcher(TranscriptSource source, TranscriptProperties properties) {
    this(source, properties.languages(), properties.minChars());
  }

  LanguageFallbackTranscriptFetcher(TranscriptSource source, List<String> languages, int minChars) {
    this.source = source;
    this.languages = List.copyOf(languages);
    this.minChars = minChars;
  }

  /**
   * @param videoId the video id
   * @return the first non-blank transcript in language order
   * @throws TranscriptFetchException if no language produced a usable transcript
   */
  public FetchedTranscript fetch(String videoId) {
    RuntimeException lastError = null;

    for (String language : languages) {
      try {
        LOGGER.info("Fetching transcript: videoId={}, language={}", videoId, language);
        String text = source.fetch(videoId, language);

        if (text != null && !text.isBlank()) {
          LOGGER.info(
              "Fetched transcript: videoId={}, language={}, chars={}",
              videoId,
              language,
              text.length());
          return accept(text.strip(), language);
        }
        LOGGER.info("No transcript text for language {}", language);

      } catch (RuntimeException e) {
        lastError = e;
        LOGGER.info(
            "Failed to fetch transcript with language {}: {}", language, e.getMessage());
      }
    }

    if (lastError != null) {
      throw lastError;
    }
    throw new TranscriptFetchException(
        "No transcript found after trying all language options: " + languages);
  }

  private FetchedTranscript accept(String text, String language) {
    if (text.length() < minChars) {
      throw new TranscriptFetchException(
          String.format("Transcript too short: only %d characters", text.length()));
    }
    return new FetchedTranscript(text, language, extractTitle(text));
  }

  /** First sentence near the start of the transcript that is a plausible title length. */
  static String extractTitle(String text) {
    String head = text.length() > TITLE_SCAN_CHARS ? text.substring(0, TITLE_SCAN_CHARS) : text;
    for (String sentence : SENTENCE_END.split(head)) {
      String candidate = sentence.strip();
      if (candidate.length() > 20 && candidate.length() < 100) {
        return candidate;
      }
    }
    return DEFAULT_TITLE;
  }
}
