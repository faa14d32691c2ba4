package dev.scriptorium.search;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the search pipeline.
 *
 * <p>Properties are bound from {@code scriptorium.search.*} in application.yml.
 *
 * <ul>
 *   <li>{@code rerank-candidates} - candidates fetched from the index before cross-encoder
 *       reranking (default 50, bounded [10, 200])
 *   <li>{@code default-max-results} - result count when the request does not give one (default 5)
 *   <li>{@code max-results-limit} - upper bound on requested result counts (default 100)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "scriptorium.search")
public class SearchProperties {

  private int rerankCandidates = 50;
  private int defaultMaxResults = 5;
  private int maxResultsLimit = 100;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (rerankCandidates < 10 || rerankCandidates > 200) {
      throw new IllegalStateException(
          "scriptorium.search.rerank-candidates must be in [10, 200], got: " + rerankCandidates);
    }
    if (maxResultsLimit < 1) {
      throw new IllegalStateException(
          "scriptorium.search.max-results-limit must be at least 1, got: " + maxResultsLimit);
    }
    if (defaultMaxResults < 1 || defaultMaxResults > maxResultsLimit) {
      throw new IllegalStateException(
          "scriptorium.search.default-max-results must be in [1, "
              + maxResultsLimit
              + "], got: "
              + defaultMaxResults);
    }
  }

  public int getRerankCandidates() {
    return rerankCandidates;
  }

  public void setRerankCandidates(int rerankCandidates) {
    this.rerankCandidates = rerankCandidates;
  }

  public int getDefaultMaxResults() {
    return defaultMaxResults;
  }

  public void setDefaultMaxResults(int defaultMaxResults) {
    this.defaultMaxResults = defaultMaxResults;
  }

  public int getMaxResultsLimit() {
    return maxResultsLimit;
  }

  public void setMaxResultsLimit(int maxResultsLimit) {
    this.maxResultsLimit = maxResultsLimit;
  }
}
