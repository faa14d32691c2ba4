package dev.scriptorium.scheduler;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * Lease row for one recurring job. At most one worker holds a non-expired lease per job name.
 *
 * <p>Rows are created lazily by the first acquire and never deleted; releasing clears the holder.
 * All writes go through the conditional statements of {@link JobLockRepository}, so this entity
 * has no setters.
 *
 * <p>Maps to the {@code job_locks} table managed by Flyway migrations.
 */
@Entity
@Table(name = "job_locks")
public class JobLock {

  @Id
  @Column(name = "job_name")
  private String jobName;

  @Column(name = "holder")
  private @Nullable String holder;

  @Column(name = "lease_expires_at")
  private @Nullable Instant leaseExpiresAt;

  @Column(name = "acquired_at")
  private @Nullable Instant acquiredAt;

  protected JobLock() {
    // JPA requires no-arg constructor
  }

  public String getJobName() {
    return jobName;
  }

  public @Nullable String getHolder() {
    return holder;
  }

  public @Nullable Instant getLeaseExpiresAt() {
    return leaseExpiresAt;
  }

  public @Nullable Instant getAcquiredAt() {
    return acquiredAt;
  }

  JobLockSnapshot toSnapshot() {
    return new JobLockSnapshot(jobName, holder, leaseExpiresAt, acquiredAt);
  }
}
