package dev.scriptorium.scheduler;

import java.time.Duration;

/**
 * A recurring maintenance job run by exactly one worker at a time.
 *
 * <p>Every bean of this type is picked up by {@link JobScheduler}. Interval and lease can be
 * overridden per job under {@code scriptorium.scheduler.jobs.<name>}.
 */
public interface ScheduledJob {

  /** Unique job name, also the lock name. */
  String name();

  /**
   * Runs one pass of the job. Only called while the worker holds the job's lease.
   *
   * @param context lease handle; check {@link JobContext#ensureLeadership()} between units of work
   */
  void run(JobContext context);

  default Duration defaultInterval() {
    return Duration.ofMinutes(10);
  }

  default Duration defaultLease() {
    return Duration.ofMinutes(2);
  }
}
