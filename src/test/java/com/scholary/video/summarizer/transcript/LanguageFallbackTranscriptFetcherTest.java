package com.scholary.video.summarizer.transcript;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LanguageFallbackTranscriptFetcherTest {

  private static final String VIDEO_ID = "dQw4w9WgXcQ";
  private static final String TRANSCRIPT =
      "Welcome back to the channel everyone. Today we look at how ownership works in Rust.";

  @Mock private TranscriptSource source;

  private LanguageFallbackTranscriptFetcher fetcher;

  @BeforeEach
  void setUp() {
    fetcher = new LanguageFallbackTranscriptFetcher(source, List.of("en", "en-US", "en-GB"), 50);
  }

  @Test
  void fetch_returnsFirstLanguageWithText() {
    when(source.fetch(VIDEO_ID, "en")).thenReturn("");
    when(source.fetch(VIDEO_ID, "en-US")).thenReturn(TRANSCRIPT);

    FetchedTranscript fetched = fetcher.fetch(VIDEO_ID);

    assertThat(fetched.text()).isEqualTo(TRANSCRIPT);
    assertThat(fetched.languageCode()).isEqualTo("en-US");
    assertThat(fetched.title()).isEqualTo("Welcome back to the channel everyone");
    verify(source, never()).fetch(VIDEO_ID, "en-GB");
  }

  @Test
  void fetch_continuesAfterErrors() {
    when(source.fetch(VIDEO_ID, "en")).thenThrow(new TranscriptFetchException("no track"));
    when(source.fetch(VIDEO_ID, "en-US")).thenReturn(TRANSCRIPT);

    assertThat(fetcher.fetch(VIDEO_ID).languageCode()).isEqualTo("en-US");
  }

  @Test
  void fetch_rethrowsLastErrorWhenAllLanguagesFail() {
    when(source.fetch(VIDEO_ID, "en")).thenThrow(new TranscriptFetchException("first"));
    when(source.fetch(VIDEO_ID, "en-US")).thenReturn("  ");
    when(source.fetch(VIDEO_ID, "en-GB")).thenThrow(new TranscriptFetchException("last"));

    assertThatThrownBy(() -> fetcher.fetch(VIDEO_ID))
        .isInstanceOf(TranscriptFetchException.class)
        .hasMessage("last");
  }

  @Test
  void fetch_reportsMissingTranscriptWhenAllEmpty() {
    when(source.fetch(anyString(), anyString())).thenReturn("");

    assertThatThrownBy(() -> fetcher.fetch(VIDEO_ID))
        .isInstanceOf(TranscriptFetchException.class)
        .hasMessageContaining("No transcript found");
  }

  @Test
  void fetch_rejectsTooShortTranscript() {
    when(source.fetch(VIDEO_ID, "en")).thenReturn("Too short.");

    assertThatThrownBy(() -> fetcher.fetch(VIDEO_ID))
        .isInstanceOf(TranscriptFetchException.class)
        .hasMessageContaining("too short");
  }

  @Test
  void extractTitle_fallsBackToDefault() {
    assertThat(LanguageFallbackTranscriptFetcher.extractTitle("Hi. Yes. No."))
        .isEqualTo(LanguageFallbackTranscriptFetcher.DEFAULT_TITLE);
  }
}
