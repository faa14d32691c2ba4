package dev.scriptorium.ingestion;

import dev.scriptorium.content.ContentType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * Server-side record of the last ingested version of one file.
 *
 * <p>Holds the content hash used to recognise unchanged uploads, and the compiled text so the
 * reindex job can re-embed a document without the client sending it again. The unique constraint
 * on {@code (account, source_path)} ensures one record per file per account.
 *
 * <p>Maps to the {@code source_documents} table managed by Flyway migrations.
 */
@Entity
@Table(
    name = "source_documents",
    uniqueConstraints = @UniqueConstraint(columnNames = {"account", "source_path"}))
public class SourceDocument {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false)
  private String account;

  @Column(name = "source_path", nullable = false)
  private String sourcePath;

  @Enumerated(EnumType.STRING)
  @Column(name = "content_type", nullable = false)
  private ContentType contentType;

  @Column(name = "content_hash", nullable = false)
  private String contentHash;

  @Column(name = "compiled_text", nullable = false, columnDefinition = "TEXT")
  private String compiledText;

  @Column(name = "embedding_model", nullable = false)
  private String embeddingModel;

  @Column(name = "chunk_count", nullable = false)
  private int chunkCount;

  @Column(name = "image_file")
  private @Nullable String imageFile;

  @Column(name = "last_ingested_at", nullable = false)
  private Instant lastIngestedAt;

  protected SourceDocument() {
    // JPA requires no-arg constructor
  }

  public SourceDocument(String account, String sourcePath) {
    this.account = account;
    this.sourcePath = sourcePath;
  }

  /** Records a successful ingestion of the given content. */
  public void recordIngestion(
      ContentType contentType,
      String contentHash,
      String compiledText,
      String embeddingModel,
      int chunkCount,
      @Nullable String imageFile,
      Instant ingestedAt) {
    this.contentType = contentType;
    this.contentHash = contentHash;
    this.compiledText = compiledText;
    this.embeddingModel = embeddingModel;
    this.chunkCount = chunkCount;
    this.imageFile = imageFile;
    this.lastIngestedAt = ingestedAt;
  }

  /** Records a re-embedding of the stored text with another model. */
  public void recordReindex(String embeddingModel, int chunkCount, Instant ingestedAt) {
    this.embeddingModel = embeddingModel;
    this.chunkCount = chunkCount;
    this.lastIngestedAt = ingestedAt;
  }

  /** Whether an upload with this hash and model would produce the same index entries. */
  public boolean matches(ContentType contentType, String contentHash, String embeddingModel) {
    return this.contentType == contentType
        && this.contentHash.equals(contentHash)
        && this.embeddingModel.equals(embeddingModel);
  }

  public Long getId() {
    return id;
  }

  public String getAccount() {
    return account;
  }

  public String getSourcePath() {
    return sourcePath;
  }

  public ContentType getContentType() {
    return contentType;
  }

  public String getContentHash() {
    return contentHash;
  }

  public String getCompiledText() {
    return compiledText;
  }

  public String getEmbeddingModel() {
    return embeddingModel;
  }

  public int getChunkCount() {
    return chunkCount;
  }

  public @Nullable String getImageFile() {
    return imageFile;
  }

  public Instant getLastIngestedAt() {
    return lastIngestedAt;
  }
}
