package com.scholary.video.summarizer.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Splits long transcripts into overlapping word chunks and recombines section summaries.
 *
 * <p>Chunks are built greedily from whitespace-delimited words. When the next word would push the
 * chunk past {@code chunkSize} characters, the chunk is flushed and the next one is seeded with
 * the last {@code overlapChars / 10} words of the flushed chunk (roughly ten characters per word,
 * separator included).
 *
 * <p>Example with chunkSize=20 and overlapChars=10 (one seed word):
 *
 * <pre>
 * "alpha beta gamma delta epsilon"
 * Chunk 0: "alpha beta gamma"
 * Chunk 1: "gamma delta epsilon"   (overlapWordCount = 1)
 * </pre>
 */
@Component
public class TextChunker {

  private static final Logger LOGGER = LoggerFactory.getLogger(TextChunker.class);

  static final int CHARS_PER_OVERLAP_WORD = 10;

  /**
   * Split text into chunks of at most {@code chunkSize} characters.
   *
   * <p>A single word longer than {@code chunkSize} becomes its own chunk. The last partial chunk is
   * always emitted.
   *
   * @param text the text to split, must contain at least one word
   * @param chunkSize maximum characters per chunk
   * @param overlapChars approximate overlap, converted to {@code overlapChars / 10} words
   * @return the chunks in order, never empty
   */
  public List<TranscriptChunk> split(String text, int chunkSize, int overlapChars) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Text to split must not be empty");
    }
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
    }
    if (overlapChars < 0) {
      throw new IllegalArgumentException("overlapChars must not be negative: " + overlapChars);
    }

    String[] words = text.trim().split("\\s+");
    int overlapWords = overlapChars / CHARS_PER_OVERLAP_WORD;

    List<TranscriptChunk> chunks = new ArrayList<>();
    List<String> current = new ArrayList<>();
    int currentLength = 0;
    int seeded = 0;

    for (String word : words) {
      if (current.size() > seeded && joinedLength(currentLength, current, word) > chunkSize) {
        chunks.add(new TranscriptChunk(chunks.size(), String.join(" ", current), seeded));

        List<String> seed =
            new ArrayList<>(current.subList(Math.max(0, current.size() - overlapWords), current.size()));
        current = seed;
        seeded = seed.size();
        currentLength = String.join(" ", seed).length();
      }

      // Drop seed words until the new word fits, so a seed never forces an oversize chunk
      while (seeded > 0 && joinedLength(currentLength, current, word) > chunkSize) {
        String dropped = current.remove(0);
        seeded--;
        currentLength = current.isEmpty() ? 0 : currentLength - dropped.length() - 1;
      }

      currentLength = joinedLength(currentLength, current, word);
      current.add(word);
    }

    chunks.add(new TranscriptChunk(chunks.size(), String.join(" ", current), seeded));

    LOGGER.info(
        "Split {} chars into {} chunks: chunkSize={}, overlapWords={}",
        text.length(),
        chunks.size(),
        chunkSize,
        overlapWords);
    return chunks;
  }

  /**
   * Merge section summaries into one summary with a single generation call.
   *
   * <p>Sections are listed as {@code **Section 1:**}, {@code **Section 2:**}, ... in the order
   * given; the order is part of the prompt's meaning.
   *
   * @param sectionSummaries summaries in original transcript order
   * @param language the output language code
   * @param generator performs the generation call
   * @return the combined summary
   */
  public String combine(
      List<String> sectionSummaries, String language, UnaryOperator<String> generator) {
    if (sectionSummaries == null || sectionSummaries.isEmpty()) {
      throw new IllegalArgumentException("No section summaries to combine");
    }

    LOGGER.info("Combining {} section summaries", sectionSummaries.size());
    return generator.apply(combinePrompt(sectionSummaries, language));
  }

  static String combinePrompt(List<String> sectionSummaries, String language) {
    StringBuilder sections = new StringBuilder();
    for (int i = 0; i < sectionSummaries.size(); i++) {
      if (i > 0) {
        sections.append("\n\n");
      }
      sections.append("**Section ").append(i + 1).append(":**\n").append(sectionSummaries.get(i));
    }

    return "Please create a comprehensive summary by combining these individual section summaries"
        + " of one video, in the order given:\n\n"
        + sections
        + "\n\nCreate a cohesive summary that flows naturally and covers all the important points"
        + " from every section. Use the language: "
        + language;
  }

  private static int joinedLength(int currentLength, List<String> current, String word) {
    return current.isEmpty() ? word.length() : currentLength + 1 + word.length();
  }
}
