package dev.scriptorium.search;

import dev.scriptorium.content.ContentType;
import org.jspecify.annotations.Nullable;

/**
 * Domain request for a semantic search.
 *
 * @param query the search query text (must not be null or blank)
 * @param contentType optional content type filter; null searches every type
 * @param maxResults the maximum number of results to return (must be >= 1)
 * @param rerank whether to reorder candidates with the cross-encoder
 */
public record SearchRequest(
    String query, @Nullable ContentType contentType, int maxResults, boolean rerank) {

  /** Compact constructor validating input. */
  public SearchRequest {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    if (maxResults < 1) {
      throw new IllegalArgumentException("maxResults must be at least 1");
    }
  }

  /** Convenience constructor: no filter, no rerank. */
  public SearchRequest(String query, int maxResults) {
    this(query, null, maxResults, false);
  }
}
