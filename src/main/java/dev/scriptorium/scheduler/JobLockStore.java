package dev.scriptorium.scheduler;

import java.time.Instant;
import java.util.List;

/**
 * Durable storage of job leases. Each operation is atomic with respect to every other worker
 * sharing the store.
 */
public interface JobLockStore {

  /**
   * Grants the lease to {@code holder} iff the job has no holder or its lease expired at or before
   * {@code now}. Creates the lock on first use.
   */
  boolean tryAcquire(String jobName, String holder, Instant now, Instant expiresAt);

  /** Moves the lease end to {@code expiresAt} iff {@code holder} holds an unexpired lease. */
  boolean renew(String jobName, String holder, Instant now, Instant expiresAt);

  /** Clears the lease iff {@code holder} holds it. */
  boolean release(String jobName, String holder);

  List<JobLockSnapshot> findAll();
}
