package dev.scriptorium.scheduler;

import java.time.Instant;
import java.util.List;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link JobLockStore} over the {@code job_locks} table.
 *
 * <p>Acquire first tries a conditional update of an existing row; when no row changed, it tries to
 * insert the row. Under PostgreSQL's read-committed isolation a concurrent update blocks on the row
 * lock and re-evaluates its condition, and a concurrent insert hits the primary key, so exactly one
 * contender gets a row count of 1.
 */
@Component
public class JpaJobLockStore implements JobLockStore {

  private final JobLockRepository repository;

  public JpaJobLockStore(JobLockRepository repository) {
    this.repository = repository;
  }

  @Override
  @Transactional
  public boolean tryAcquire(String jobName, String holder, Instant now, Instant expiresAt) {
    if (repository.acquireIfAvailable(jobName, holder, now, expiresAt) == 1) {
      return true;
    }
    return repository.insertIfAbsent(jobName, holder, now, expiresAt) == 1;
  }

  @Override
  @Transactional
  public boolean renew(String jobName, String holder, Instant now, Instant expiresAt) {
    return repository.renewIfHeld(jobName, holder, now, expiresAt) == 1;
  }

  @Override
  @Transactional
  public boolean release(String jobName, String holder) {
    return repository.releaseIfHeld(jobName, holder) == 1;
  }

  @Override
  @Transactional(readOnly = true)
  public List<JobLockSnapshot> findAll() {
    return repository.findAll().stream().map(JobLock::toSnapshot).toList();
  }
}
