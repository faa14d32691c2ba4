package dev.scriptorium.sync;

import java.time.Duration;

/** Raised when the server rate-limited the client; the cycle stops until {@link #getRetryAfter()}. */
public class SyncThrottledException extends RuntimeException {

  private final Duration retryAfter;

  public SyncThrottledException(Duration retryAfter) {
    super("Server is throttling uploads, retry in " + retryAfter.toSeconds() + "s");
    this.retryAfter = retryAfter;
  }

  public Duration getRetryAfter() {
    return retryAfter;
  }
}
