package dev.scriptorium.ingestion.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * Splits Org-mode documents at headline boundaries.
 *
 * <p>A headline is a line starting with one or more {@code *} followed by a space. Every headline
 * starts a new section; the section path is the slugified chain of enclosing headlines. Text before
 * the first headline forms a section with an empty path.
 */
public class OrgChunker {

  private static final Pattern HEADLINE = Pattern.compile("^(\\*+)\\s+(.*)$");

  private final int maxChunkSize;

  public OrgChunker(int maxChunkSize) {
    if (maxChunkSize < 100) {
      throw new IllegalArgumentException("maxChunkSize must be at least 100");
    }
    this.maxChunkSize = maxChunkSize;
  }

  public List<TextChunk> chunk(@Nullable String org) {
    if (org == null || org.isBlank()) {
      return List.of();
    }

    List<TextChunk> chunks = new ArrayList<>();
    List<String> path = new ArrayList<>();
    StringBuilder section = new StringBuilder();
    String sectionPath = "";
    boolean sectionHasBody = false;

    for (String line : org.split("\n", -1)) {
      Matcher headline = HEADLINE.matcher(line);
      if (headline.matches()) {
        if (sectionHasBody) {
          emit(chunks, section.toString(), sectionPath);
        }
        section.setLength(0);
        sectionHasBody = false;

        int level = headline.group(1).length();
        while (path.size() >= level) {
          path.remove(path.size() - 1);
        }
        path.add(stripKeywords(headline.group(2)));
        sectionPath =
            path.stream()
                .map(TextSplitter::slugify)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.joining("/"));
        section.append(line);
        continue;
      }
      if (!line.isBlank()) {
        sectionHasBody = true;
      }
      if (!section.isEmpty()) {
        section.append('\n');
      }
      section.append(line);
    }
    if (sectionHasBody) {
      emit(chunks, section.toString(), sectionPath);
    }
    return chunks;
  }

  private void emit(List<TextChunk> chunks, String raw, String sectionPath) {
    String text = raw.trim();
    if (text.isEmpty()) {
      return;
    }
    if (text.length() <= maxChunkSize) {
      chunks.add(new TextChunk(text, sectionPath));
    } else {
      TextSplitter.split(text, maxChunkSize)
          .forEach(part -> chunks.add(new TextChunk(part, sectionPath)));
    }
  }

  /** Drops TODO keywords and trailing tags such as {@code :work:urgent:}. */
  private static String stripKeywords(String title) {
    String stripped = title.replaceFirst("^(TODO|DONE)\\s+", "");
    return stripped.replaceFirst("\\s+(:[\\w@#%]+)+:\\s*$", "").trim();
  }
}
