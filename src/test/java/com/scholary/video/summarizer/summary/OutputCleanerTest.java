package com.scholary.video.summarizer.summary;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OutputCleanerTest {

  private OutputCleaner cleaner;

  @BeforeEach
  void setUp() {
    cleaner = new OutputCleaner();
  }

  @Test
  void clean_stripsEnglishSummaryPreamble() {
    String cleaned = cleaner.clean("Here's a summary of the video:\n🎯 TITLE: Rust in production");

    assertThat(cleaned).isEqualTo("🎯 TITLE: Rust in production");
  }

  @Test
  void clean_stripsBasedOnOpener() {
    String cleaned = cleaner.clean("Based on the transcript, the speaker explains ownership.");

    assertThat(cleaned).isEqualTo("the speaker explains ownership.");
  }

  @Test
  void clean_stripsStackedPreambles() {
    String cleaned = cleaner.clean("Sure, here's the summary: Ownership is the core idea.");

    assertThat(cleaned).isEqualTo("Ownership is the core idea.");
  }

  @Test
  void clean_stripsGermanPreambles() {
    assertThat(cleaner.clean("Hier ist die Zusammenfassung des Videos:\n📝 ÜBERBLICK: Text"))
        .isEqualTo("📝 ÜBERBLICK: Text");
    assertThat(cleaner.clean("Ich verstehe. Die Kernpunkte sind klar."))
        .isEqualTo("Die Kernpunkte sind klar.");
  }

  @Test
  void clean_leavesWordsThatOnlyStartWithAnOpener() {
    String text = "Nowhere is safe, they said. The talk covers supply chains.";

    assertThat(cleaner.clean(text)).isEqualTo(text);
    assertThat(cleaner.clean("Hereafter, the speaker moves on.")).startsWith("Hereafter");
    assertThat(cleaner.clean("Ichthyology, a branch of zoology: fish.")).startsWith("Ichthyology");
  }

  @Test
  void clean_stripsStandaloneTransitionWord() {
    assertThat(cleaner.clean("Now, the talk covers ownership."))
        .isEqualTo("the talk covers ownership.");
  }

  @Test
  void clean_keepsMarkdownAndMarkers() {
    String text = "## Key Points\n- **Bold** item\n🔑 KEY POINTS:\n• point one\n• point two";

    assertThat(cleaner.clean(text)).isEqualTo(text);
  }

  @Test
  void clean_isIdempotent() {
    String[] inputs = {
      "Here's a summary of the video:\nNow, let's begin. Content here.",
      "Okay, so the talk covers three topics.",
      "Let me break this down for you:\n\n## Summary\nBody text",
      "Plain text without any preamble."
    };

    for (String input : inputs) {
      String once = cleaner.clean(input);
      assertThat(cleaner.clean(once)).as(input).isEqualTo(once);
    }
  }

  @Test
  void clean_handlesNullAndBlank() {
    assertThat(cleaner.clean(null)).isEmpty();
    assertThat(cleaner.clean("   \n ")).isEmpty();
  }
}
