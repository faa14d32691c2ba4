package dev.scriptorium.model;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Model invocation settings bound from {@code scriptorium.model.*}.
 *
 * @param timeout upper bound for a single embedding or scoring call
 * @param concurrency number of model calls allowed to run at once
 * @param embeddingModelId identifier of the embedding model, recorded on every index entry so the
 *     reindex job can find entries embedded with an older model
 */
@ConfigurationProperties(prefix = "scriptorium.model")
public record ModelProperties(
    @DefaultValue("30s") Duration timeout,
    @DefaultValue("4") int concurrency,
    @DefaultValue("bge-small-en-v1.5-q") String embeddingModelId) {

  public ModelProperties {
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalStateException("scriptorium.model.timeout must be positive, got: " + timeout);
    }
    if (concurrency < 1) {
      throw new IllegalStateException(
          "scriptorium.model.concurrency must be at least 1, got: " + concurrency);
    }
  }
}
