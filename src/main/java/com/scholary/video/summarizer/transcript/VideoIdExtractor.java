package com.scholary.video.summarizer.transcript;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Extracts the 11-character video id from the common YouTube URL shapes. */
public final class VideoIdExtractor {

  private static final List<Pattern> PATTERNS =
      List.of(
          Pattern.compile("(?:v=|/)([0-9A-Za-z_-]{11}).*"), // watch and shared URLs
          Pattern.compile("(?:embed/)([0-9A-Za-z_-]{11})"),
          Pattern.compile("(?:youtu\\.be/)([0-9A-Za-z_-]{11})"),
          Pattern.compile("(?:shorts/)([0-9A-Za-z_-]{11})"),
          Pattern.compile("^([0-9A-Za-z_-]{11})$")); // bare id

  private VideoIdExtractor() {}

  /**
   * @param url a video URL or a bare id
   * @return the video id
   * @throws IllegalArgumentException if no id can be found
   */
  public static String extract(String url) {
    if (url == null) {
      throw new IllegalArgumentException("Could not extract video ID from URL: null");
    }
    String trimmed = url.trim();
    for (Pattern pattern : PATTERNS) {
      Matcher matcher = pattern.matcher(trimmed);
      if (matcher.find()) {
        return matcher.group(1);
      }
    }
    throw new IllegalArgumentException("Could not extract video ID from URL: " + url);
  }
}
