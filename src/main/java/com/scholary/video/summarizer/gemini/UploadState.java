package com.scholary.video.summarizer.gemini;

/** States of a single two-phase upload. */
public enum UploadState {
  INIT,
  SESSION_STARTED,
  UPLOADING,
  COMPLETE,
  FAILED
}
