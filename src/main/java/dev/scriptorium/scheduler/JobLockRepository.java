package dev.scriptorium.scheduler;

import java.time.Instant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Spring Data repository for {@link JobLock} rows.
 *
 * <p>Every state change is a single conditional statement whose affected-row count tells the caller
 * whether it won, so no read-modify-write race exists between workers.
 */
public interface JobLockRepository extends JpaRepository<JobLock, String> {

  /** Takes the lease if the row exists and is released or expired. Returns rows updated. */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      """
      UPDATE JobLock l
         SET l.holder = :holder, l.leaseExpiresAt = :expiresAt, l.acquiredAt = :now
       WHERE l.jobName = :jobName
         AND (l.holder IS NULL OR l.leaseExpiresAt IS NULL OR l.leaseExpiresAt <= :now)
      """)
  int acquireIfAvailable(
      @Param("jobName") String jobName,
      @Param("holder") String holder,
      @Param("now") Instant now,
      @Param("expiresAt") Instant expiresAt);

  /** Creates the row already held by {@code holder}; does nothing if the row exists. */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      value =
          """
          INSERT INTO job_locks (job_name, holder, lease_expires_at, acquired_at)
          VALUES (:jobName, :holder, :expiresAt, :now)
          ON CONFLICT (job_name) DO NOTHING
          """,
      nativeQuery = true)
  int insertIfAbsent(
      @Param("jobName") String jobName,
      @Param("holder") String holder,
      @Param("now") Instant now,
      @Param("expiresAt") Instant expiresAt);

  /** Extends the lease if {@code holder} still holds it and it has not expired. */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      """
      UPDATE JobLock l
         SET l.leaseExpiresAt = :expiresAt
       WHERE l.jobName = :jobName
         AND l.holder = :holder
         AND l.leaseExpiresAt > :now
      """)
  int renewIfHeld(
      @Param("jobName") String jobName,
      @Param("holder") String holder,
      @Param("now") Instant now,
      @Param("expiresAt") Instant expiresAt);

  /** Clears the lease if {@code holder} holds it, expired or not. */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      """
      UPDATE JobLock l
         SET l.holder = NULL, l.leaseExpiresAt = NULL, l.acquiredAt = NULL
       WHERE l.jobName = :jobName
         AND l.holder = :holder
      """)
  int releaseIfHeld(@Param("jobName") String jobName, @Param("holder") String holder);
}
