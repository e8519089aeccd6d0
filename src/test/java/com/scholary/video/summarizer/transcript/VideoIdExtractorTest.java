package com.scholary.video.summarizer.transcript;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class VideoIdExtractorTest {

  @ParameterizedTest
  @ValueSource(
      strings = {
        "https://www.youtube.com/watch?v=dQw4w9WgXcQ",
        "https://www.youtube.com/watch?v=dQw4w9WgXcQ&t=42s",
        "https://youtu.be/dQw4w9WgXcQ",
        "https://www.youtube.com/embed/dQw4w9WgXcQ",
        "https://www.youtube.com/shorts/dQw4w9WgXcQ",
        "  dQw4w9WgXcQ  "
      })
  void extract_findsIdInCommonUrlShapes(String url) {
    assertThat(VideoIdExtractor.extract(url)).isEqualTo("dQw4w9WgXcQ");
  }

  @ParameterizedTest
  @ValueSource(strings = {"not a video", "https://www.youtube.com/watch?v=short", ""})
  void extract_rejectsUrlsWithoutId(String url) {
    assertThatThrownBy(() -> VideoIdExtractor.extract(url))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Could not extract video ID");
  }
}
