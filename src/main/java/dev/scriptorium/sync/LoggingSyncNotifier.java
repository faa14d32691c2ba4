package dev.scriptorium.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Default notifier: writes the cycle summary to the log. */
public class LoggingSyncNotifier implements SyncNotifier {

  private static final Logger log = LoggerFactory.getLogger(LoggingSyncNotifier.class);

  @Override
  public void notify(SyncOutcome outcome) {
    switch (outcome.status()) {
      case FAILED, THROTTLED -> log.warn(outcome.summary());
      case PARTIAL -> log.warn("{} ({})", outcome.summary(), String.join(", ", outcome.failedPaths()));
      case UP_TO_DATE, ALREADY_RUNNING -> log.debug(outcome.summary());
      default -> log.info(outcome.summary());
    }
  }
}
