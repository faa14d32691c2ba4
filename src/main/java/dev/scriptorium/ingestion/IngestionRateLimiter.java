package dev.scriptorium.ingestion;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Per-account fixed-window request limiter for the content API.
 *
 * <p>State lives in memory, so each server process enforces its own limit.
 */
@Component
public class IngestionRateLimiter {

  private static final Logger log = LoggerFactory.getLogger(IngestionRateLimiter.class);

  private final IngestionProperties.RateLimit limit;
  private final Clock clock;
  private final ConcurrentMap<String, Window> windows = new ConcurrentHashMap<>();

  public IngestionRateLimiter(IngestionProperties properties, Clock clock) {
    this.limit = properties.rateLimit();
    this.clock = clock;
  }

  /**
   * Records one request for the account.
   *
   * @throws RateLimitExceededException if the account has no requests left in the current window
   */
  public void acquire(String account) {
    if (!limit.enabled()) {
      return;
    }
    Instant now = clock.instant();
    Window window =
        windows.compute(
            account,
            (key, current) -> {
              if (current == null || !now.isBefore(current.start().plus(limit.window()))) {
                return new Window(now, 1);
              }
              return new Window(current.start(), current.count() + 1);
            });
    if (window.count() > limit.maxRequests()) {
      Duration retryAfter = Duration.between(now, window.start().plus(limit.window()));
      if (retryAfter.isNegative() || retryAfter.isZero()) {
        retryAfter = Duration.ofSeconds(1);
      }
      log.debug("Rate limit hit for account {}: {} requests in window", account, window.count());
      throw new RateLimitExceededException(account, roundUpToSeconds(retryAfter));
    }
  }

  private static Duration roundUpToSeconds(Duration duration) {
    long seconds = duration.toSeconds();
    return duration.equals(Duration.ofSeconds(seconds))
        ? duration
        : Duration.ofSeconds(seconds + 1);
  }

  private record Window(Instant start, int count) {}
}
