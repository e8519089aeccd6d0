package com.scholary.video.summarizer.summary;

import java.util.Map;

/**
 * Prompt templates for the generative model.
 *
 * <p>Section headings of the final summary are localised for English and German; any other
 * language gets the English headings and an instruction to answer in the requested language.
 */
public final class SummaryPrompts {

  public static final String TRANSCRIPT_HEADING = "## TRANSCRIPT";
  public static final String SUMMARY_HEADING = "## SUMMARY";

  private record Headings(
      String title,
      String overview,
      String keyPoints,
      String inDetail,
      String takeaways,
      String context) {}

  private static final Headings ENGLISH =
      new Headings(
          "TITLE", "OVERVIEW", "KEY POINTS", "IN DETAIL", "MAIN TAKEAWAYS", "CONTEXT & IMPLICATIONS");

  private static final Map<String, Headings> HEADINGS =
      Map.of(
          "en",
          ENGLISH,
          "de",
          new Headings(
              "TITEL",
              "ÜBERBLICK",
              "KERNPUNKTE",
              "IM DETAIL",
              "HAUPTERKENNTNISSE",
              "KONTEXT & AUSWIRKUNGEN"));

  private SummaryPrompts() {}

  /** Prompt asking for a transcript and a summary of a staged video file, under fixed headings. */
  public static String fileAnalysis(String displayName) {
    return "You are an expert video analyst. Please analyze this video file and provide:\n\n"
        + "1. **Complete Transcript**: Extract all spoken content from the video\n"
        + "2. **Comprehensive Summary**: Create a detailed summary of the key points, insights,"
        + " and conclusions\n\n"
        + "For the video \"" + displayName + "\":\n\n"
        + "Instructions:\n"
        + "- Extract ALL spoken words accurately\n"
        + "- Identify main topics and key points\n"
        + "- Highlight important insights and conclusions\n"
        + "- Structure the summary with clear sections\n"
        + "- Use markdown formatting for readability\n"
        + "- Focus on actionable information and key takeaways\n\n"
        + "Please provide your response in this exact format:\n\n"
        + TRANSCRIPT_HEADING
        + "\n[Complete transcript here]\n\n"
        + SUMMARY_HEADING
        + "\n[Comprehensive summary here]\n";
  }

  /** Prompt for one section of a long transcript. */
  public static String section(String chunkText, String language) {
    return "Summarize this section of a video transcript. Focus on the main points, key"
        + " information, and important details. Keep the original meaning and context.\n\n"
        + "Content to summarize:\n"
        + chunkText
        + "\n\nProvide a clear, comprehensive summary in "
        + language
        + ".";
  }

  /** Prompt for the final structured summary. */
  public static String summary(String text, String language) {
    Headings h = HEADINGS.getOrDefault(language, ENGLISH);
    return "You are an expert content summarizer. Create a comprehensive summary of the following"
        + " video content. Do not include any meta-commentary, introductions, or instructions in"
        + " your response - provide only the summary content.\n\n"
        + "Content to summarize:\n"
        + text
        + "\n\nFormat your response exactly as follows:\n\n"
        + "🎯 " + h.title() + ": [Create a descriptive title based on the actual content]\n\n"
        + "📝 " + h.overview() + ": [2-3 sentences providing brief context and main purpose]\n\n"
        + "🔑 " + h.keyPoints() + ":\n"
        + "• [Main argument or topic 1 with specific examples]\n"
        + "• [Main argument or topic 2 with specific examples]\n"
        + "• [Main argument or topic 3 with specific examples]\n"
        + "• [Additional key points as needed]\n\n"
        + "🔍 " + h.inDetail() + ":\n"
        + "[Specific details, examples and figures mentioned in the content]\n\n"
        + "💡 " + h.takeaways() + ":\n"
        + "• [Practical insight 1 and its significance]\n"
        + "• [Practical insight 2 and its significance]\n"
        + "• [Practical insight 3 and its significance]\n\n"
        + "🔄 " + h.context() + ": [Broader context discussion and future implications]\n\n"
        + "Use the language: "
        + language;
  }
}
