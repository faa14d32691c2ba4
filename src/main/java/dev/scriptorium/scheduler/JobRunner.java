package dev.scriptorium.scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

/**
 * Per-job state machine driving one {@link ScheduledJob} on this worker.
 *
 * <p>Each {@link #tick()} moves {@code IDLE -> ACQUIRING}; a won lease moves to {@code RUNNING} and
 * hands the body to the job executor; everything else returns to {@code IDLE}. A tick arriving
 * while the job is not idle is skipped. While running, the lease is renewed every half lease; a
 * failed renewal marks the context as having lost leadership and interrupts the body. The lease is
 * released when the body ends, however it ends.
 */
public class JobRunner {

  private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

  /** Lifecycle of the job on this worker. */
  public enum State {
    IDLE,
    ACQUIRING,
    RUNNING
  }

  private final ScheduledJob job;
  private final JobLockManager lockManager;
  private final String workerId;
  private final Duration lease;
  private final TaskScheduler taskScheduler;
  private final Executor jobExecutor;
  private final Clock clock;
  private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);

  public JobRunner(
      ScheduledJob job,
      JobLockManager lockManager,
      String workerId,
      Duration lease,
      TaskScheduler taskScheduler,
      Executor jobExecutor,
      Clock clock) {
    if (lease.isNegative() || lease.isZero()) {
      throw new IllegalArgumentException("lease for job '" + job.name() + "' must be positive");
    }
    this.job = job;
    this.lockManager = lockManager;
    this.workerId = workerId;
    this.lease = lease;
    this.taskScheduler = taskScheduler;
    this.jobExecutor = jobExecutor;
    this.clock = clock;
  }

  public String jobName() {
    return job.name();
  }

  public State state() {
    return state.get();
  }

  /** One scheduling attempt: acquire the lease and start the body, or do nothing. */
  public void tick() {
    if (!state.compareAndSet(State.IDLE, State.ACQUIRING)) {
      log.debug("Job '{}' still {} on {}, skipping tick", job.name(), state.get(), workerId);
      return;
    }

    boolean acquired;
    try {
      acquired = lockManager.acquire(job.name(), workerId, lease);
    } catch (RuntimeException e) {
      log.warn("Could not reach lock store for job '{}': {}", job.name(), e.getMessage());
      state.set(State.IDLE);
      return;
    }
    if (!acquired) {
      state.set(State.IDLE);
      return;
    }

    state.set(State.RUNNING);
    JobContext context = new JobContext(job.name(), workerId);
    try {
      jobExecutor.execute(() -> runLeased(context));
    } catch (RejectedExecutionException e) {
      log.warn("Job executor rejected job '{}', releasing lock", job.name());
      releaseQuietly();
      state.set(State.IDLE);
    }
  }

  void runLeased(JobContext context) {
    context.bindThread(Thread.currentThread());
    ScheduledFuture<?> renewal = scheduleRenewal(context);
    long started = clock.millis();
    try {
      log.info("Job '{}' started on {}", job.name(), workerId);
      job.run(context);
      log.info("Job '{}' finished in {}ms", job.name(), clock.millis() - started);
    } catch (LeadershipLostException e) {
      log.warn("Job '{}' aborted: {}", job.name(), e.getMessage());
    } catch (RuntimeException e) {
      if (!context.isLeader()) {
        log.warn("Job '{}' aborted after losing its lease: {}", job.name(), e.getMessage());
      } else {
        log.error("Job '{}' failed", job.name(), e);
      }
    } finally {
      if (renewal != null) {
        renewal.cancel(false);
      }
      context.bindThread(null);
      // clear an interrupt delivered by a failed renewal so it does not leak into the pool thread
      Thread.interrupted();
      releaseQuietly();
      state.set(State.IDLE);
    }
  }

  /** Renews the lease once; on failure marks leadership lost. */
  void renewLease(JobContext context) {
    if (!context.isLeader()) {
      return;
    }
    boolean renewed;
    try {
      renewed = lockManager.renew(job.name(), workerId, lease);
    } catch (RuntimeException e) {
      log.warn("Renewing lock '{}' failed: {}", job.name(), e.getMessage());
      renewed = false;
    }
    if (!renewed) {
      context.markLeadershipLost();
    }
  }

  private @Nullable ScheduledFuture<?> scheduleRenewal(JobContext context) {
    Duration period = lease.dividedBy(2);
    if (period.isZero()) {
      period = lease;
    }
    return taskScheduler.scheduleAtFixedRate(
        () -> renewLease(context), clock.instant().plus(period), period);
  }

  private void releaseQuietly() {
    try {
      lockManager.release(job.name(), workerId);
    } catch (RuntimeException e) {
      log.warn(
          "Releasing lock '{}' failed, it will expire on its own: {}", job.name(), e.getMessage());
    }
  }
}
