package dev.scriptorium.index;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.UUID;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Read-only view of a stored index entry.
 *
 * <p>Rows are written by LangChain4j's {@code PgVectorEmbeddingStore}; the embedding vector is not
 * mapped. The view exists so an entry's text can be looked up by id, which the embedding store API
 * does not offer.
 *
 * <p>Maps to the {@code index_entries} table managed by Flyway migrations.
 *
 * @see IndexEntryRepository
 */
@Entity
@Immutable
@Table(name = "index_entries")
public class IndexEntry {

  @Id
  @Column(name = "embedding_id")
  private UUID id;

  @Column(columnDefinition = "TEXT")
  private String text;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(columnDefinition = "JSONB")
  private String metadata;

  protected IndexEntry() {
    // JPA requires no-arg constructor
  }

  public IndexEntry(UUID id, String text, String metadata) {
    this.id = id;
    this.text = text;
    this.metadata = metadata;
  }

  public UUID getId() {
    return id;
  }

  public String getText() {
    return text;
  }

  public String getMetadata() {
    return metadata;
  }
}
