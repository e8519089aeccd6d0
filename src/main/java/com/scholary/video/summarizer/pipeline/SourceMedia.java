package com.scholary.video.summarizer.pipeline;

/**
 * What a run ingests: a video in object storage, a transcript given inline, or a reference to a
 * video whose captions are fetched during the run.
 */
public record SourceMedia(Kind kind, String key, String transcript, String videoId) {

  public enum Kind {
    OBJECT_STORE("s3"),
    INLINE_TEXT("transcript"),
    TRANSCRIPT_REFERENCE("youtube");

    private final String label;

    Kind(String label) {
      this.label = label;
    }

    /** Label reported as {@code source} on completion events. */
    public String label() {
      return label;
    }
  }

  public SourceMedia {
    if (kind == null) {
      throw new IllegalArgumentException("Source kind is required");
    }
    if (kind == Kind.OBJECT_STORE) {
      requireText(key, "Object key");
    } else if (kind == Kind.INLINE_TEXT) {
      requireText(transcript, "Transcript");
    } else {
      requireText(videoId, "Video id");
    }
  }

  public static SourceMedia objectStore(String key) {
    return new SourceMedia(Kind.OBJECT_STORE, key, null, null);
  }

  public static SourceMedia inlineText(String transcript) {
    return new SourceMedia(Kind.INLINE_TEXT, null, transcript, null);
  }

  public static SourceMedia transcriptReference(String videoId) {
    return new SourceMedia(Kind.TRANSCRIPT_REFERENCE, null, null, videoId);
  }

  private static void requireText(String value, String what) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(what + " must not be blank");
    }
  }
}
