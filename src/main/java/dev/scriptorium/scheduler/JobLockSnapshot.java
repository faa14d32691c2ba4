package dev.scriptorium.scheduler;

import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * Point-in-time copy of a lock row.
 *
 * @param jobName the job the lock guards
 * @param holder worker currently holding the lease, null when released
 * @param leaseExpiresAt end of the current lease, null when released
 * @param acquiredAt when the current holder acquired the lease
 */
public record JobLockSnapshot(
    String jobName,
    @Nullable String holder,
    @Nullable Instant leaseExpiresAt,
    @Nullable Instant acquiredAt) {

  /** The lock's state as seen at {@code now}. A lease ending exactly at {@code now} is expired. */
  public LockState stateAt(Instant now) {
    if (holder == null || leaseExpiresAt == null) {
      return LockState.UNLOCKED;
    }
    return leaseExpiresAt.isAfter(now) ? LockState.HELD : LockState.EXPIRED;
  }
}
