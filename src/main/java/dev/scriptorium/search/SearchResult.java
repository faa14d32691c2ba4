package dev.scriptorium.search;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.scriptorium.content.ContentType;
import dev.scriptorium.index.IndexEntryData;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * One ranked index entry.
 *
 * @param entryId the entry's embedding id, usable with "find similar"
 * @param text the entry text
 * @param score cosine relevance from the vector search
 * @param rerankScore cross-encoder score; null when the search was not reranked
 * @param sourcePath relative path of the source file
 * @param contentType content type of the source file
 * @param imageUrl server-relative image URL for image entries
 */
public record SearchResult(
    String entryId,
    String text,
    double score,
    @Nullable Double rerankScore,
    String sourcePath,
    ContentType contentType,
    @Nullable String imageUrl) {

  static SearchResult from(EmbeddingMatch<TextSegment> match, @Nullable Double rerankScore) {
    TextSegment segment = match.embedded();
    Metadata metadata = segment.metadata();
    String type = metadata.getString(IndexEntryData.CONTENT_TYPE);
    return new SearchResult(
        match.embeddingId(),
        segment.text(),
        match.score(),
        rerankScore,
        Objects.requireNonNullElse(metadata.getString(IndexEntryData.SOURCE_PATH), ""),
        type == null ? ContentType.PLAINTEXT : ContentType.fromValue(type),
        metadata.getString(IndexEntryData.IMAGE_URL));
  }
}
