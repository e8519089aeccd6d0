package com.scholary.video.summarizer.gemini;

/**
 * Exception thrown when the generative model fails or returns unusable output.
 *
 * <p>Covers non-2xx responses, transport failures and empty or too-short results.
 */
public class GenerationException extends RuntimeException {

  public GenerationException(String message) {
    super(message);
  }

  public GenerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
