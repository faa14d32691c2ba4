package dev.scriptorium.ingestion.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Size-bounded splitting shared by the chunkers. */
final class TextSplitter {

  private TextSplitter() {}

  /**
   * Splits text into parts that each fit within maxSize. Splits at paragraph boundaries (blank
   * lines) first, then at sentence boundaries. A single sentence longer than maxSize is kept whole.
   */
  static List<String> split(String text, int maxSize) {
    String[] paragraphs = text.split("\n\\s*\n");
    List<String> result = new ArrayList<>();
    StringBuilder current = new StringBuilder();

    for (String para : paragraphs) {
      String trimmed = para.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      if (!current.isEmpty() && current.length() + 2 + trimmed.length() <= maxSize) {
        current.append("\n\n").append(trimmed);
        continue;
      }
      if (!current.isEmpty()) {
        result.add(current.toString());
        current.setLength(0);
      }
      if (trimmed.length() <= maxSize) {
        current.append(trimmed);
      } else {
        result.addAll(splitBySentences(trimmed, maxSize));
      }
    }

    if (!current.isEmpty()) {
      result.add(current.toString());
    }
    return result;
  }

  private static List<String> splitBySentences(String text, int maxSize) {
    String[] sentences = text.split("(?<=[.!?])\\s+");
    List<String> result = new ArrayList<>();
    StringBuilder current = new StringBuilder();

    for (String sentence : sentences) {
      if (current.isEmpty()) {
        current.append(sentence);
      } else if (current.length() + 1 + sentence.length() <= maxSize) {
        current.append(' ').append(sentence);
      } else {
        result.add(current.toString());
        current.setLength(0);
        current.append(sentence);
      }
    }

    if (!current.isEmpty()) {
      result.add(current.toString());
    }
    return result;
  }

  static String slugify(String text) {
    return text.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("^-+|-+$", "");
  }
}
