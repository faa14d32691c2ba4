package dev.scriptorium.ingestion;

import java.nio.file.Path;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Ingestion settings bound from {@code scriptorium.ingestion.*}.
 *
 * @param maxChunkSize maximum characters per chunk before splitting
 * @param embedBatchSize number of chunks embedded per model call
 * @param imageDir directory where uploaded images are stored
 * @param rateLimit per-account request limit for the content API
 */
@ConfigurationProperties(prefix = "scriptorium.ingestion")
public record IngestionProperties(
    @DefaultValue("2000") int maxChunkSize,
    @DefaultValue("256") int embedBatchSize,
    @DefaultValue("data/images") Path imageDir,
    @DefaultValue RateLimit rateLimit) {

  public IngestionProperties {
    if (maxChunkSize < 100) {
      throw new IllegalStateException(
          "scriptorium.ingestion.max-chunk-size must be at least 100, got: " + maxChunkSize);
    }
    if (embedBatchSize < 1) {
      throw new IllegalStateException(
          "scriptorium.ingestion.embed-batch-size must be at least 1, got: " + embedBatchSize);
    }
  }

  /**
   * Fixed-window limit on content API requests.
   *
   * @param enabled whether requests are limited at all
   * @param maxRequests requests allowed per account per window
   * @param window window length
   */
  public record RateLimit(
      @DefaultValue("true") boolean enabled,
      @DefaultValue("60") int maxRequests,
      @DefaultValue("1m") Duration window) {

    public RateLimit {
      if (maxRequests < 1) {
        throw new IllegalStateException(
            "scriptorium.ingestion.rate-limit.max-requests must be at least 1, got: "
                + maxRequests);
      }
      if (window.isNegative() || window.isZero()) {
        throw new IllegalStateException(
            "scriptorium.ingestion.rate-limit.window must be positive, got: " + window);
      }
    }
  }
}
