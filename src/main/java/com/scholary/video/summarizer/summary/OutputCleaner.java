package com.scholary.video.summarizer.summary;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Strips conversational preambles from model output.
 *
 * <p>Models often open with "Here's a summary of the video:" or "Based on the transcript, ...".
 * Each rule removes one such opener from the start of the text; English and German openers are
 * covered. Openers must end on a word boundary, so "Nowhere" is not read as "Now". Rules never
 * span a line break, so markdown headings, bullets and marker emoji in the body are left alone.
 *
 * <p>The rule list is applied repeatedly until nothing changes and the result is trimmed, which
 * makes {@code clean(clean(x)).equals(clean(x))} hold for every input.
 */
@Component
public class OutputCleaner {

  private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

  /** A single (pattern, replacement) rewrite. */
  record Rule(Pattern pattern, String replacement) {

    static Rule strip(String regex) {
      return new Rule(Pattern.compile(regex, FLAGS), "");
    }

    String apply(String text) {
      return pattern.matcher(text).replaceFirst(Matcher.quoteReplacement(replacement));
    }
  }

  static final List<Rule> RULES =
      List.of(
          // English
          Rule.strip(
              "^(Okay|Here'?s?( is)?|Let me|I will|I'll|I can|I would|I am going to|Allow me to"
                  + "|Sure|Of course|Certainly|Alright)\\b.*?,\\s*"),
          Rule.strip(
              "^(Here'?s?( is)?|I'?ll?|Let me|I will|I can|I would|I am going to|Allow me to|Sure"
                  + "|Of course|Certainly)\\b.*?(summary|translate|breakdown|analysis).*?:\\s*"),
          Rule.strip("^(Based on|According to)\\b.*?,\\s*"),
          Rule.strip("^I understand\\b.*?[.!]\\s*"),
          Rule.strip("^(Now|First|Let's)\\b,?\\s*"),
          Rule.strip("^(Here are|The following is|This is|Below is)\\b.*?:\\s*"),
          Rule.strip("^(I'll provide|Let me break|I'll break|I'll help|I've structured)\\b.*?:\\s*"),
          Rule.strip("^(As requested|Following your|In response to)\\b.*?:\\s*"),
          // German
          Rule.strip(
              "^(Okay|Hier( ist)?|Lass mich|Ich werde|Ich kann|Ich würde|Ich möchte"
                  + "|Erlauben Sie mir|Sicher|Natürlich|Gewiss|In Ordnung)\\b.*?,\\s*"),
          Rule.strip(
              "^(Hier( ist)?|Ich werde|Lass mich|Ich kann|Ich würde|Ich möchte)\\b.*?"
                  + "(Zusammenfassung|Übersetzung|Analyse).*?:\\s*"),
          Rule.strip("^(Basierend auf|Laut|Gemäß)\\b.*?,\\s*"),
          Rule.strip("^Ich verstehe\\b.*?[.!]\\s*"),
          Rule.strip("^(Jetzt|Zunächst|Lass uns)\\b,?\\s*"),
          Rule.strip("^(Hier sind|Folgendes|Dies ist|Im Folgenden)\\b.*?:\\s*"),
          Rule.strip("^(Ich werde|Lass mich|Ich helfe|Ich habe strukturiert)\\b.*?:\\s*"),
          Rule.strip("^(Wie gewünscht|Entsprechend Ihrer|Als Antwort auf)\\b.*?:\\s*"));

  /**
   * Remove leading preambles.
   *
   * @param text raw model output, may be null
   * @return the cleaned text, never null
   */
  public String clean(String text) {
    if (text == null) {
      return "";
    }

    String current = text.strip();
    while (true) {
      String next = applyRules(current);
      if (next.equals(current)) {
        return current;
      }
      current = next;
    }
  }

  private String applyRules(String text) {
    String result = text;
    for (Rule rule : RULES) {
      result = rule.apply(result);
    }
    return result.strip();
  }
}
