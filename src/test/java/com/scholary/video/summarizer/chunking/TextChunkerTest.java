package com.scholary.video.summarizer.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TextChunkerTest {

  private TextChunker chunker;

  @BeforeEach
  void setUp() {
    chunker = new TextChunker();
  }

  @Test
  void split_shortTranscriptIsOneChunk() {
    String text = words(500, "word");

    List<TranscriptChunk> chunks = chunker.split(text, 7000, 1000);

    assertThat(chunks).hasSize(1);
    assertThat(chunks.get(0).index()).isZero();
    assertThat(chunks.get(0).text()).isEqualTo(text);
    assertThat(chunks.get(0).overlapWordCount()).isZero();
  }

  @Test
  void split_longTranscriptIsSeveralBoundedChunks() {
    String text = numberedWords(7143);
    assertThat(text.length()).isGreaterThanOrEqualTo(50_000);

    List<TranscriptChunk> chunks = chunker.split(text, 7000, 1000);

    assertThat(chunks.size()).isGreaterThan(1);
    for (int i = 0; i < chunks.size(); i++) {
      assertThat(chunks.get(i).index()).isEqualTo(i);
      assertThat(chunks.get(i).text().length()).isLessThanOrEqualTo(7000);
    }
    assertThat(chunks.get(0).overlapWordCount()).isZero();
    assertThat(chunks.get(1).overlapWordCount()).isEqualTo(100);
  }

  @Test
  void split_droppingOverlapReconstructsOriginalWords() {
    String text = numberedWords(7143);

    List<TranscriptChunk> chunks = chunker.split(text, 7000, 1000);

    List<String> rebuilt = new ArrayList<>();
    for (TranscriptChunk chunk : chunks) {
      List<String> chunkWords = Arrays.asList(chunk.text().split(" "));
      rebuilt.addAll(chunkWords.subList(chunk.overlapWordCount(), chunkWords.size()));
    }
    assertThat(rebuilt).containsExactly(text.split(" "));
  }

  @Test
  void split_overlapSeedsNextChunkWithTrailingWords() {
    List<TranscriptChunk> chunks = chunker.split("alpha beta gamma delta epsilon", 20, 10);

    assertThat(chunks).extracting(TranscriptChunk::text)
        .containsExactly("alpha beta gamma", "gamma delta epsilon");
    assertThat(chunks.get(1).overlapWordCount()).isEqualTo(1);
  }

  @Test
  void split_wordLongerThanChunkSizeBecomesItsOwnChunk() {
    String longWord = "x".repeat(30);

    List<TranscriptChunk> chunks = chunker.split("a " + longWord + " b", 10, 10);

    assertThat(chunks).extracting(TranscriptChunk::text).containsExactly("a", longWord, "b");
  }

  @Test
  void split_collapsesWhitespaceBetweenWords() {
    List<TranscriptChunk> chunks = chunker.split("  one\n\ttwo   three ", 100, 0);

    assertThat(chunks).extracting(TranscriptChunk::text).containsExactly("one two three");
  }

  @Test
  void split_rejectsEmptyInput() {
    assertThatThrownBy(() -> chunker.split("   ", 7000, 1000))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> chunker.split(null, 7000, 1000))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void split_rejectsNonPositiveChunkSize() {
    assertThatThrownBy(() -> chunker.split("text", 0, 0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void combine_callsGeneratorOnceWithSectionsInOrder() {
    List<String> prompts = new ArrayList<>();

    String combined =
        chunker.combine(
            List.of("first part", "second part", "third part"),
            "en",
            prompt -> {
              prompts.add(prompt);
              return "combined summary";
            });

    assertThat(combined).isEqualTo("combined summary");
    assertThat(prompts).hasSize(1);
    String prompt = prompts.get(0);
    int first = prompt.indexOf("**Section 1:**\nfirst part");
    int second = prompt.indexOf("**Section 2:**\nsecond part");
    int third = prompt.indexOf("**Section 3:**\nthird part");
    assertThat(first).isNotNegative();
    assertThat(second).isGreaterThan(first);
    assertThat(third).isGreaterThan(second);
    assertThat(prompt).endsWith("Use the language: en");
  }

  @Test
  void combine_rejectsEmptyList() {
    assertThatThrownBy(() -> chunker.combine(List.of(), "en", prompt -> prompt))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static String words(int count, String word) {
    StringBuilder text = new StringBuilder();
    for (int i = 0; i < count; i++) {
      if (i > 0) {
        text.append(' ');
      }
      text.append(word);
    }
    return text.toString();
  }

  private static String numberedWords(int count) {
    StringBuilder text = new StringBuilder();
    for (int i = 0; i < count; i++) {
      if (i > 0) {
        text.append(' ');
      }
      text.append(String.format("w%05d", i));
    }
    return text.toString();
  }
}
