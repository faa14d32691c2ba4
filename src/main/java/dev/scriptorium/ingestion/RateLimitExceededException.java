package dev.scriptorium.ingestion;

import java.time.Duration;

/** Thrown when an account has used up its content API requests for the current window. */
public class RateLimitExceededException extends RuntimeException {

  private final Duration retryAfter;

  public RateLimitExceededException(String account, Duration retryAfter) {
    super("Too many requests for account '" + account + "', retry in " + retryAfter.toSeconds() + "s");
    this.retryAfter = retryAfter;
  }

  public Duration getRetryAfter() {
    return retryAfter;
  }
}
