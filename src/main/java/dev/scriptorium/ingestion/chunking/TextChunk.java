package dev.scriptorium.ingestion.chunking;

import java.util.Objects;

/**
 * A piece of extracted text ready for embedding.
 *
 * @param text the chunk body
 * @param sectionPath slugified heading hierarchy joined by {@code /}, empty when the source has no
 *     sections
 */
public record TextChunk(String text, String sectionPath) {

  public TextChunk {
    Objects.requireNonNull(text, "text must not be null");
    Objects.requireNonNull(sectionPath, "sectionPath must not be null");
  }
}
