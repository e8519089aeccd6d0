package com.scholary.video.summarizer.summary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.video.summarizer.config.PipelineProperties;
import com.scholary.video.summarizer.gemini.GenerationException;
import com.scholary.video.summarizer.gemini.GenerativeModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SummaryGeneratorTest {

  private static final String FILE_URI = "https://files.example/v1beta/files/abc";
  private static final String BODY =
      "The talk walks through ownership, borrowing and lifetimes with several examples.";

  @Mock private GenerativeModel model;

  private SummaryGenerator generator;

  @BeforeEach
  void setUp() {
    generator = new SummaryGenerator(model, new OutputCleaner(), 50);
  }

  @Test
  void generateFromFileReference_splitsOnHeadings() {
    when(model.generateFromFile(anyString(), eq(FILE_URI), eq("video/mp4")))
        .thenReturn("## TRANSCRIPT\nHello and welcome to the talk.\n\n## SUMMARY\n" + BODY);

    GeneratedContent content = generator.generateFromFileReference(FILE_URI, "video/mp4", "talk.mp4");

    assertThat(content.transcript()).isEqualTo("Hello and welcome to the talk.");
    assertThat(content.summary()).isEqualTo(BODY);
    verify(model).generateFromFile(contains("talk.mp4"), eq(FILE_URI), eq("video/mp4"));
  }

  @Test
  void generateFromFileReference_fallsBackToRawTextWithoutHeadings() {
    String raw = "No headings here. " + BODY;
    when(model.generateFromFile(anyString(), anyString(), anyString())).thenReturn(raw);

    GeneratedContent content = generator.generateFromFileReference(FILE_URI, "video/mp4", "talk.mp4");

    assertThat(content.transcript()).isEqualTo(raw);
    assertThat(content.summary()).isEqualTo(raw);
  }

  @Test
  void generateFromFileReference_rejectsShortOutput() {
    when(model.generateFromFile(anyString(), anyString(), anyString())).thenReturn("too short");

    assertThatThrownBy(() -> generator.generateFromFileReference(FILE_URI, "video/mp4", "x"))
        .isInstanceOf(GenerationException.class)
        .hasMessageContaining("empty or very short");
  }

  @Test
  void generateFromText_usesConfiguredMinimumLength() {
    PipelineProperties properties =
        new PipelineProperties(
            new PipelineProperties.ChunkingProperties(8000, 7000, 1000),
            new PipelineProperties.PollingProperties(5_000, 300_000),
            new PipelineProperties.StoreProperties(100),
            200,
            900_000,
            2,
            10);
    SummaryGenerator strict = new SummaryGenerator(model, new OutputCleaner(), properties);
    when(model.generateText("prompt")).thenReturn(BODY);

    assertThatThrownBy(() -> strict.generateFromText("prompt"))
        .isInstanceOf(GenerationException.class)
        .hasMessageContaining("empty or very short");
  }

  @Test
  void generateFromText_stripsPreamble() {
    when(model.generateText("prompt")).thenReturn("Here's a summary of the video:\n" + BODY);

    assertThat(generator.generateFromText("prompt")).isEqualTo(BODY);
  }

  @Test
  void generateFromText_rejectsOutputThatIsShortAfterCleaning() {
    when(model.generateText("prompt"))
        .thenReturn("Here's the summary of the video you asked me to look at today:\nShort.");

    assertThatThrownBy(() -> generator.generateFromText("prompt"))
        .isInstanceOf(GenerationException.class);
  }

  @Test
  void summarize_usesLocalisedHeadings() {
    when(model.generateText(anyString())).thenReturn(BODY);

    generator.summarize("Transkript", "de");

    verify(model).generateText(contains("ÜBERBLICK"));
  }

  @Test
  void parseSections_usesRawTextForEmptySection() {
    String raw = "## TRANSCRIPT\n\n## SUMMARY\n" + BODY;

    GeneratedContent content = SummaryGenerator.parseSections(raw);

    assertThat(content.transcript()).isEqualTo(raw);
    assertThat(content.summary()).isEqualTo(BODY);
  }
}
