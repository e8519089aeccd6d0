package com.scholary.video.summarizer.summary;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SummaryPromptsTest {

  @Test
  void fileAnalysis_usesNewlinesOnly() {
    String prompt = SummaryPrompts.fileAnalysis("talk.mp4");

    assertThat(prompt).contains("For the video \"talk.mp4\":\n\nInstructions:");
    assertThat(prompt).doesNotContain("\r");
    assertThat(prompt).contains(SummaryPrompts.TRANSCRIPT_HEADING, SummaryPrompts.SUMMARY_HEADING);
  }

  @Test
  void summary_fallsBackToEnglishHeadings() {
    assertThat(SummaryPrompts.summary("text", "de")).contains("ÜBERBLICK");
    assertThat(SummaryPrompts.summary("text", "fr"))
        .contains("OVERVIEW")
        .endsWith("Use the language: fr");
  }
}
