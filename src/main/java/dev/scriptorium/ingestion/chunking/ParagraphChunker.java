package dev.scriptorium.ingestion.chunking;

import java.util.List;
import org.jspecify.annotations.Nullable;

/** Chunks unstructured text (plain text, PDF extracts) by packing paragraphs up to the size limit. */
public class ParagraphChunker {

  private final int maxChunkSize;

  public ParagraphChunker(int maxChunkSize) {
    if (maxChunkSize < 100) {
      throw new IllegalArgumentException("maxChunkSize must be at least 100");
    }
    this.maxChunkSize = maxChunkSize;
  }

  public List<TextChunk> chunk(@Nullable String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    String normalized = text.replace("\r\n", "\n");
    return TextSplitter.split(normalized, maxChunkSize).stream()
        .map(part -> new TextChunk(part, ""))
        .toList();
  }
}
