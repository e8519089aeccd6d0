package com.scholary.video.summarizer.summary;

import com.scholary.video.summarizer.config.PipelineProperties;
import com.scholary.video.summarizer.gemini.GenerationException;
import com.scholary.video.summarizer.gemini.GenerativeModel;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Produces transcripts and summaries with the generative model.
 *
 * <p>Two modes:
 *
 * <ul>
 *   <li>File reference: one call over a staged video, output split on the {@code ## TRANSCRIPT} and
 *       {@code ## SUMMARY} headings
 *   <li>Text: one call over a prompt, output passed through {@link OutputCleaner}
 * </ul>
 *
 * <p>Output shorter than {@code pipeline.min-output-chars} is rejected in both modes.
 */
@Service
public class SummaryGenerator {

  private static final Logger LOGGER = LoggerFactory.getLogger(SummaryGenerator.class);

  private static final Pattern TRANSCRIPT_SECTION =
      Pattern.compile(
          Pattern.quote(SummaryPrompts.TRANSCRIPT_HEADING)
              + "\\s*(.*?)(?="
              + Pattern.quote(SummaryPrompts.SUMMARY_HEADING)
              + "|\\z)",
          Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

  private static final Pattern SUMMARY_SECTION =
      Pattern.compile(
          Pattern.quote(SummaryPrompts.SUMMARY_HEADING) + "\\s*(.*)\\z",
          Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

  private final GenerativeModel model;
  private final OutputCleaner outputCleaner;
  private final int minOutputChars;

  @Autowired
  public SummaryGenerator(
      GenerativeModel model, OutputCleaner outputCleaner, PipelineProperties properties) {
    this(model, outputCleaner, properties.minOutputChars());
  }

  SummaryGenerator(GenerativeModel model, OutputCleaner outputCleaner, int minOutputChars) {
    this.model = model;
    this.outputCleaner = outputCleaner;
    this.minOutputChars = minOutputChars;
  }

  /**
   * Generate transcript and summary for a staged video.
   *
   * <p>If either heading is missing from the response, both fields fall back to the full raw
   * response. Malformed structure never throws.
   *
   * @param fileUri the staged file's URI (not its durable name)
   * @throws GenerationException if the call fails or the response is too short
   */
  public GeneratedContent generateFromFileReference(
      String fileUri, String mimeType, String displayName) {
    LOGGER.info("Generating transcript and summary from file: displayName={}", displayName);

    String raw = model.generateFromFile(SummaryPrompts.fileAnalysis(displayName), fileUri, mimeType);
    requireUsable(raw);

    GeneratedContent content = parseSections(raw);
    LOGGER.info(
        "Parsed file response: transcriptChars={}, summaryChars={}",
        content.transcript().length(),
        content.summary().length());
    return content;
  }

  /**
   * Generate text from a prompt and strip conversational preambles.
   *
   * @throws GenerationException if the call fails or the cleaned result is too short
   */
  public String generateFromText(String prompt) {
    String cleaned = outputCleaner.clean(model.generateText(prompt));
    requireUsable(cleaned);
    return cleaned;
  }

  /** Final structured summary of a whole transcript (or of combined section summaries). */
  public String summarize(String text, String language) {
    return generateFromText(SummaryPrompts.summary(text, language));
  }

  /** Summary of one transcript section. */
  public String summarizeSection(String sectionText, String language) {
    return generateFromText(SummaryPrompts.section(sectionText, language));
  }

  public String modelName() {
    return model.modelName();
  }

  static GeneratedContent parseSections(String raw) {
    Matcher transcript = TRANSCRIPT_SECTION.matcher(raw);
    Matcher summary = SUMMARY_SECTION.matcher(raw);

    if (!transcript.find() || !summary.find()) {
      LOGGER.warn("Response is missing section headings, using full text for both fields");
      return new GeneratedContent(raw, raw);
    }

    String transcriptText = transcript.group(1).strip();
    String summaryText = summary.group(1).strip();
    return new GeneratedContent(
        transcriptText.isEmpty() ? raw : transcriptText, summaryText.isEmpty() ? raw : summaryText);
  }

  private void requireUsable(String text) {
    int length = text == null ? 0 : text.strip().length();
    if (length < minOutputChars) {
      throw new GenerationException(
          String.format(
              "AI generated an empty or very short result (%d chars, minimum %d)",
              length, minOutputChars));
    }
  }
}
