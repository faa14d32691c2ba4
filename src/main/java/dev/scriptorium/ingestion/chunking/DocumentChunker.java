package dev.scriptorium.ingestion.chunking;

import dev.scriptorium.content.ContentType;
import dev.scriptorium.ingestion.IngestionProperties;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Chooses the chunking strategy for a content type.
 *
 * <p>Markdown splits at headings, Org at headlines, everything else by paragraphs. Image entries
 * are a single chunk holding their descriptive text.
 */
@Component
public class DocumentChunker {

  private final MarkdownChunker markdownChunker;
  private final OrgChunker orgChunker;
  private final ParagraphChunker paragraphChunker;

  @Autowired
  public DocumentChunker(IngestionProperties properties) {
    this(properties.maxChunkSize());
  }

  public DocumentChunker(int maxChunkSize) {
    this.markdownChunker = new MarkdownChunker(maxChunkSize);
    this.orgChunker = new OrgChunker(maxChunkSize);
    this.paragraphChunker = new ParagraphChunker(maxChunkSize);
  }

  public List<TextChunk> chunk(ContentType type, String text) {
    return switch (type) {
      case MARKDOWN -> markdownChunker.chunk(text);
      case ORG -> orgChunker.chunk(text);
      case PLAINTEXT, PDF -> paragraphChunker.chunk(text);
      case IMAGE -> text.isBlank() ? List.of() : List.of(new TextChunk(text.trim(), ""));
    };
  }
}
