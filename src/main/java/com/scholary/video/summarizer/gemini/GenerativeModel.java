package com.scholary.video.summarizer.gemini;

/**
 * Raw access to a generative model.
 *
 * <p>Returns the model's text verbatim; parsing and cleaning happen in the summary layer.
 */
public interface GenerativeModel {

  /**
   * Generate text from a prompt.
   *
   * @throws GenerationException if the call fails
   */
  String generateText(String prompt);

  /**
   * Generate text from a prompt plus a staged file.
   *
   * @param fileUri the file URI of a staged file (not its durable name)
   * @throws GenerationException if the call fails
   */
  String generateFromFile(String prompt, String fileUri, String mimeType);

  /** Model identifier recorded alongside stored results. */
  String modelName();
}
