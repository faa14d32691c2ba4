package dev.scriptorium.sync;

import java.time.Duration;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Summary of one sync cycle.
 *
 * @param status how the cycle ended
 * @param indexed files the server indexed
 * @param unchanged files the server already had
 * @param deleted deletions the server confirmed
 * @param failedPaths files the server reported as failed
 * @param message detail for cycles that stopped early
 * @param retryAfter for throttled cycles, how long to wait
 */
public record SyncOutcome(
    Status status,
    int indexed,
    int unchanged,
    int deleted,
    List<String> failedPaths,
    @Nullable String message,
    @Nullable Duration retryAfter) {

  /** How a cycle ended. */
  public enum Status {
    /** Every batch was sent and every file acknowledged. */
    COMPLETED,
    /** Nothing had changed. */
    UP_TO_DATE,
    /** Every batch was sent but some files failed on the server. */
    PARTIAL,
    /** A request failed; later batches were not sent. */
    FAILED,
    /** The server rate-limited the client; later batches were not sent. */
    THROTTLED,
    /** The cycle was cancelled between batches. */
    CANCELLED,
    /** Another cycle was already running; this one did nothing. */
    ALREADY_RUNNING
  }

  public SyncOutcome {
    failedPaths = List.copyOf(failedPaths);
  }

  static SyncOutcome of(Status status) {
    return new SyncOutcome(status, 0, 0, 0, List.of(), null, null);
  }

  /** One-line notice for the user. */
  public String summary() {
    return switch (status) {
      case UP_TO_DATE -> "Everything is up to date";
      case ALREADY_RUNNING -> "A sync is already running";
      case THROTTLED ->
          "Server is busy, sync paused"
              + (retryAfter == null ? "" : " for " + retryAfter.toSeconds() + "s")
              + counts();
      case COMPLETED, PARTIAL -> "Sync finished" + counts();
      case CANCELLED -> "Sync cancelled" + counts();
      case FAILED -> "Sync failed: " + message + counts();
    };
  }

  private String counts() {
    StringBuilder sb = new StringBuilder();
    sb.append(": ").append(indexed).append(" indexed, ");
    sb.append(unchanged).append(" unchanged, ");
    sb.append(deleted).append(" deleted");
    if (!failedPaths.isEmpty()) {
      sb.append(", ").append(failedPaths.size()).append(" failed");
    }
    return sb.toString();
  }
}
