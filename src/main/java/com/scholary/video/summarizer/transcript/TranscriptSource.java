package com.scholary.video.summarizer.transcript;

/**
 * Third-party source of pre-extracted video transcripts.
 *
 * <p>This abstraction lets the fallback logic be tested without the network and lets us swap
 * providers without touching the pipeline.
 */
public interface TranscriptSource {

  /**
   * Fetch the transcript of a video in one language.
   *
   * @param videoId the video id
   * @param languageCode the caption language to request
   * @return the transcript text, empty if the video has no captions in that language
   * @throws TranscriptFetchException if the source cannot be reached or rejects the request
   */
  String fetch(String videoId, String languageCode);
}
