package dev.scriptorium.index;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.segment.TextSegment;
import dev.scriptorium.content.ContentType;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Text and metadata of one searchable index entry, identified by (account, source path, chunk id).
 *
 * <p>The embedding id is derived deterministically from that identity, so storing the same entry
 * twice overwrites it instead of duplicating it.
 *
 * @param account owning account
 * @param sourcePath relative path of the source file
 * @param chunkId position of the chunk within the source file
 * @param text the chunk body text
 * @param contentType content type of the source file
 * @param sectionPath slash-separated heading hierarchy; empty when the type has no sections
 * @param imageUrl server-relative image URL for image entries; null otherwise
 * @param embeddingModel identifier of the model that produced the entry's embedding
 * @param indexedAt ISO-8601 timestamp of ingestion
 */
public record IndexEntryData(
    String account,
    String sourcePath,
    int chunkId,
    String text,
    ContentType contentType,
    String sectionPath,
    @Nullable String imageUrl,
    String embeddingModel,
    String indexedAt) {

  public static final String ACCOUNT = "account";
  public static final String SOURCE_PATH = "source_path";
  public static final String CHUNK_ID = "chunk_id";
  public static final String CONTENT_TYPE = "content_type";
  public static final String SECTION_PATH = "section_path";
  public static final String IMAGE_URL = "image_url";
  public static final String EMBEDDING_MODEL = "embedding_model";
  public static final String INDEXED_AT = "indexed_at";

  public IndexEntryData {
    Objects.requireNonNull(account, "account must not be null");
    Objects.requireNonNull(sourcePath, "sourcePath must not be null");
    Objects.requireNonNull(text, "text must not be null");
    Objects.requireNonNull(contentType, "contentType must not be null");
    Objects.requireNonNull(sectionPath, "sectionPath must not be null");
    Objects.requireNonNull(embeddingModel, "embeddingModel must not be null");
    Objects.requireNonNull(indexedAt, "indexedAt must not be null");
    if (chunkId < 0) {
      throw new IllegalArgumentException("chunkId must not be negative");
    }
  }

  /** Deterministic embedding id for an entry identity. */
  public static String entryId(String account, String sourcePath, int chunkId) {
    String key = account + '\u0000' + sourcePath + '\u0000' + chunkId;
    return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
  }

  public String entryId() {
    return entryId(account, sourcePath, chunkId);
  }

  /** Converts the entry to langchain4j {@link Metadata} with the snake_case keys of the store. */
  public Metadata toMetadata() {
    Metadata metadata =
        Metadata.from(ACCOUNT, account)
            .put(SOURCE_PATH, sourcePath)
            .put(CHUNK_ID, chunkId)
            .put(CONTENT_TYPE, contentType.value())
            .put(SECTION_PATH, sectionPath)
            .put(EMBEDDING_MODEL, embeddingModel)
            .put(INDEXED_AT, indexedAt);
    if (imageUrl != null) {
      metadata.put(IMAGE_URL, imageUrl);
    }
    return metadata;
  }

  /** Converts this entry to a langchain4j {@link TextSegment} ready for embedding. */
  public TextSegment toTextSegment() {
    return TextSegment.from(text, toMetadata());
  }
}
