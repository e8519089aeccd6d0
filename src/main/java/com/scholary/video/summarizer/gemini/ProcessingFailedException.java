package com.scholary.video.summarizer.gemini;

/** The remote service reported {@link RemoteFileState#FAILED} for an uploaded file. */
public class ProcessingFailedException extends RuntimeException {

  public ProcessingFailedException(String message) {
    super(message);
  }
}
