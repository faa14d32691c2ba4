package dev.scriptorium.scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Grants, extends and releases time-bounded job leases.
 *
 * <p>All lease arithmetic uses the injected {@link Clock}. Losing a race for a lease is the normal
 * outcome for all but one worker, so it is logged at DEBUG only.
 */
@Component
public class JobLockManager {

  private static final Logger log = LoggerFactory.getLogger(JobLockManager.class);

  private final JobLockStore store;
  private final Clock clock;

  public JobLockManager(JobLockStore store, Clock clock) {
    this.store = store;
    this.clock = clock;
  }

  /**
   * Tries to take the lease on a job.
   *
   * @param jobName the job
   * @param candidate the worker asking for the lease
   * @param lease how long the lease lasts without renewal
   * @return true if {@code candidate} now holds the lease
   */
  public boolean acquire(String jobName, String candidate, Duration lease) {
    requirePositive(lease);
    Instant now = clock.instant();
    boolean acquired = store.tryAcquire(jobName, candidate, now, now.plus(lease));
    if (acquired) {
      log.info("Worker {} acquired lock '{}' until {}", candidate, jobName, now.plus(lease));
    } else {
      log.debug("Worker {} did not acquire lock '{}': held by another worker", candidate, jobName);
    }
    return acquired;
  }

  /**
   * Extends a lease the holder still owns.
   *
   * @return false if {@code holder} no longer holds an unexpired lease
   */
  public boolean renew(String jobName, String holder, Duration lease) {
    requirePositive(lease);
    Instant now = clock.instant();
    boolean renewed = store.renew(jobName, holder, now, now.plus(lease));
    if (renewed) {
      log.debug("Worker {} renewed lock '{}' until {}", holder, jobName, now.plus(lease));
    } else {
      log.warn("Worker {} could not renew lock '{}': lease lost", holder, jobName);
    }
    return renewed;
  }

  /**
   * Gives up a lease. A release by a worker that is not the holder changes nothing.
   *
   * @return true if the lease was held by {@code holder} and is now cleared
   */
  public boolean release(String jobName, String holder) {
    boolean released = store.release(jobName, holder);
    if (released) {
      log.info("Worker {} released lock '{}'", holder, jobName);
    } else {
      log.debug("Worker {} did not hold lock '{}' at release", holder, jobName);
    }
    return released;
  }

  /** Current state of every known lock, sorted by job name. */
  public List<JobLockStatus> status() {
    Instant now = clock.instant();
    return store.findAll().stream()
        .sorted(Comparator.comparing(JobLockSnapshot::jobName))
        .map(
            snapshot ->
                new JobLockStatus(
                    snapshot.jobName(),
                    snapshot.stateAt(now),
                    snapshot.holder(),
                    snapshot.leaseExpiresAt(),
                    snapshot.acquiredAt()))
        .toList();
  }

  private static void requirePositive(Duration lease) {
    if (lease.isNegative() || lease.isZero()) {
      throw new IllegalArgumentException("lease must be positive, got: " + lease);
    }
  }
}
