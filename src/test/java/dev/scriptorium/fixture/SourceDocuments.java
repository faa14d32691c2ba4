package dev.scriptorium.fixture;

import dev.scriptorium.content.ContentType;
import dev.scriptorium.ingestion.SourceDocument;
import java.time.Instant;
import org.springframework.test.util.ReflectionTestUtils;

/**
 * Builds {@link SourceDocument} entities as if loaded from the database, id included.
 *
 * <pre>{@code
 * SourceDocument doc = SourceDocuments.stored(7, "notes/a.md", "old-model");
 * }</pre>
 */
public final class SourceDocuments {

  private SourceDocuments() {}

  public static SourceDocument stored(long id, String path, String embeddingModel) {
    SourceDocument document = new SourceDocument("alice", path);
    document.recordIngestion(
        ContentType.PLAINTEXT,
        "hash-" + id,
        "Stored text of " + path,
        embeddingModel,
        1,
        null,
        Instant.parse("2026-01-01T00:00:00Z"));
    ReflectionTestUtils.setField(document, "id", id);
    return document;
  }
}
