package dev.scriptorium.ingestion.chunking;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.node.Heading;
import org.commonmark.node.Node;
import org.commonmark.node.SourceSpan;
import org.commonmark.parser.IncludeSourceSpans;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.text.TextContentRenderer;
import org.jspecify.annotations.Nullable;

/**
 * AST-based Markdown chunker that splits content at H1/H2/H3 heading boundaries.
 *
 * <p>Each section becomes one chunk holding the heading line followed by the raw Markdown of every
 * block up to the next H1-H3 heading (code fences and tables included). H4+ headings stay inside
 * the enclosing section. Sections longer than the size limit are split at paragraph, then sentence
 * boundaries, and every part keeps the section path.
 */
public class MarkdownChunker {

  private final Parser parser;
  private final TextContentRenderer textRenderer;
  private final int maxChunkSize;

  public MarkdownChunker(int maxChunkSize) {
    if (maxChunkSize < 100) {
      throw new IllegalArgumentException("maxChunkSize must be at least 100");
    }
    this.maxChunkSize = maxChunkSize;
    var extensions = List.of(TablesExtension.create());
    this.parser =
        Parser.builder().extensions(extensions).includeSourceSpans(IncludeSourceSpans.BLOCKS).build();
    this.textRenderer = TextContentRenderer.builder().extensions(extensions).build();
  }

  /**
   * Chunks a Markdown document into section chunks.
   *
   * @param markdown the raw Markdown text
   * @return ordered chunks; empty for blank input
   */
  public List<TextChunk> chunk(@Nullable String markdown) {
    if (markdown == null || markdown.isBlank()) {
      return List.of();
    }

    Node document = parser.parse(markdown);
    String[] lines = markdown.split("\n", -1);
    List<TextChunk> chunks = new ArrayList<>();

    // index 0=H1, 1=H2, 2=H3
    @Nullable String[] headingPath = new @Nullable String[3];
    List<Node> section = new ArrayList<>();

    Node child = document.getFirstChild();
    while (child != null) {
      Node next = child.getNext();
      if (child instanceof Heading heading && heading.getLevel() <= 3) {
        emitSection(chunks, section, headingPath, lines);
        section.clear();
        updateHeadingPath(headingPath, heading);
      }
      section.add(child);
      child = next;
    }
    emitSection(chunks, section, headingPath, lines);

    return chunks;
  }

  private void updateHeadingPath(@Nullable String[] headingPath, Heading heading) {
    int level = heading.getLevel();
    headingPath[level - 1] = textRenderer.render(heading).trim();
    for (int i = level; i < 3; i++) {
      headingPath[i] = null;
    }
  }

  private void emitSection(
      List<TextChunk> chunks, List<Node> nodes, @Nullable String[] headingPath, String[] lines) {
    if (nodes.isEmpty()) {
      return;
    }
    // A heading with nothing under it carries no searchable content of its own.
    if (nodes.size() == 1 && nodes.get(0) instanceof Heading) {
      return;
    }

    StringBuilder sb = new StringBuilder();
    for (Node node : nodes) {
      appendNodeText(node, lines, sb);
    }
    String text = sb.toString().trim();
    if (text.isEmpty()) {
      return;
    }

    String sectionPath = buildSectionPath(headingPath);
    if (text.length() <= maxChunkSize) {
      chunks.add(new TextChunk(text, sectionPath));
    } else {
      TextSplitter.split(text, maxChunkSize)
          .forEach(part -> chunks.add(new TextChunk(part, sectionPath)));
    }
  }

  private void appendNodeText(Node node, String[] lines, StringBuilder sb) {
    var sourceSpans = node.getSourceSpans();
    if (sourceSpans != null && !sourceSpans.isEmpty()) {
      int lastLine = -1;
      for (SourceSpan span : sourceSpans) {
        if (span == null) {
          continue;
        }
        int lineIndex = span.getLineIndex();
        if (lineIndex >= 0 && lineIndex < lines.length && lineIndex != lastLine) {
          if (!sb.isEmpty()) {
            // keep a blank line between blocks so paragraph splitting still works
            sb.append(lastLine < 0 ? "\n\n" : "\n");
          }
          sb.append(lines[lineIndex]);
          lastLine = lineIndex;
        }
      }
    } else {
      String rendered = textRenderer.render(node).trim();
      if (!rendered.isEmpty()) {
        if (!sb.isEmpty()) {
          sb.append("\n\n");
        }
        sb.append(rendered);
      }
    }
  }

  private String buildSectionPath(@Nullable String[] headingPath) {
    return Arrays.stream(headingPath)
        .filter(Objects::nonNull)
        .map(TextSplitter::slugify)
        .collect(Collectors.joining("/"));
  }
}
