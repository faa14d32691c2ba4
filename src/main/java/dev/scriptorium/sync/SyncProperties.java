package dev.scriptorium.sync;

import dev.scriptorium.content.ContentType;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;

/**
 * Sync client settings bound from {@code scriptorium.sync.*}.
 *
 * @param enabled whether this process runs the sync client
 * @param serverUrl base URL of the content server
 * @param account account the corpus belongs to, sent as {@code X-Scriptorium-Account}
 * @param clientId client identifier sent with every request
 * @param roots directories whose files form the corpus
 * @param includeFolders root-relative folders to sync; empty means everything
 * @param excludeFolders root-relative folders never synced; wins over includes
 * @param enabledTypes content types to sync; empty means every type
 * @param maxBatchBytes upper bound on the file bytes of one upload request
 * @param maxBatchItems upper bound on the parts of one upload request
 * @param interval delay between periodic sync cycles
 * @param cursorFile where the sync cursor is persisted
 * @param connectTimeout HTTP connect timeout
 * @param readTimeout HTTP read timeout; indexing a batch can take a while
 * @param retry bounded retry of requests that failed at the connection level
 */
@ConfigurationProperties(prefix = "scriptorium.sync")
public record SyncProperties(
    @DefaultValue("false") boolean enabled,
    @DefaultValue("http://localhost:8080") String serverUrl,
    @DefaultValue("default") String account,
    @DefaultValue("desktop") String clientId,
    @Nullable List<Path> roots,
    @Nullable List<String> includeFolders,
    @Nullable List<String> excludeFolders,
    @Nullable Set<ContentType> enabledTypes,
    @DefaultValue("10MB") DataSize maxBatchBytes,
    @DefaultValue("50") int maxBatchItems,
    @DefaultValue("5m") Duration interval,
    @DefaultValue(".scriptorium/sync-cursor.json") Path cursorFile,
    @DefaultValue("10s") Duration connectTimeout,
    @DefaultValue("2m") Duration readTimeout,
    @DefaultValue Retry retry) {

  public SyncProperties {
    roots = roots == null ? List.of() : List.copyOf(roots);
    includeFolders = includeFolders == null ? List.of() : List.copyOf(includeFolders);
    excludeFolders = excludeFolders == null ? List.of() : List.copyOf(excludeFolders);
    enabledTypes =
        enabledTypes == null || enabledTypes.isEmpty()
            ? EnumSet.allOf(ContentType.class)
            : EnumSet.copyOf(enabledTypes);
    if (maxBatchBytes.toBytes() < 1) {
      throw new IllegalStateException(
          "scriptorium.sync.max-batch-bytes must be positive, got: " + maxBatchBytes);
    }
    if (maxBatchItems < 1) {
      throw new IllegalStateException(
          "scriptorium.sync.max-batch-items must be at least 1, got: " + maxBatchItems);
    }
    if (enabled && roots.isEmpty()) {
      throw new IllegalStateException("scriptorium.sync.roots must name at least one directory");
    }
  }

  /**
   * @param maxAttempts total attempts per request, including the first
   * @param delay wait before the first retry
   * @param multiplier backoff multiplier between retries
   */
  public record Retry(
      @DefaultValue("3") int maxAttempts,
      @DefaultValue("1s") Duration delay,
      @DefaultValue("2.0") double multiplier) {}
}
