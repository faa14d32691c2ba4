package dev.scriptorium.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.scriptorium.search.SearchResult;
import org.jspecify.annotations.Nullable;

/**
 * Wire form of a search hit.
 *
 * @param id entry id, usable with {@code /api/search/similar}
 * @param entry entry text
 * @param score vector similarity
 * @param rerankScore cross-encoder score, omitted when not reranked
 * @param file relative path of the source file
 * @param contentType content type value of the source file
 * @param image image URL, omitted for non-image entries
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SearchHitResponse(
    String id,
    String entry,
    double score,
    @Nullable Double rerankScore,
    String file,
    String contentType,
    @Nullable String image) {

  static SearchHitResponse from(SearchResult result) {
    return new SearchHitResponse(
        result.entryId(),
        result.text(),
        result.score(),
        result.rerankScore(),
        result.sourcePath(),
        result.contentType().value(),
        result.imageUrl());
  }
}
