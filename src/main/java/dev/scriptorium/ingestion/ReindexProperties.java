package dev.scriptorium.ingestion;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Reindex job settings bound from {@code scriptorium.reindex.*}.
 *
 * @param mode which documents each run re-embeds
 * @param pageSize documents loaded per keyset page
 * @param interval default delay between runs
 * @param lease default lease length while a run is in progress
 */
@ConfigurationProperties(prefix = "scriptorium.reindex")
public record ReindexProperties(
    @DefaultValue("incremental") Mode mode,
    @DefaultValue("50") int pageSize,
    @DefaultValue("1h") Duration interval,
    @DefaultValue("5m") Duration lease) {

  public ReindexProperties {
    if (pageSize < 1) {
      throw new IllegalStateException(
          "scriptorium.reindex.page-size must be at least 1, got: " + pageSize);
    }
  }

  /** Selection of documents to re-embed. */
  public enum Mode {
    /** Only documents embedded with a model other than the configured one. */
    INCREMENTAL,
    /** Every stored document. */
    FULL
  }
}
