package dev.scriptorium.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.scriptorium.fixture.InMemoryJobLockStore;
import dev.scriptorium.fixture.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.TaskScheduler;

class JobRunnerTest {

  private static final Duration LEASE = Duration.ofSeconds(60);

  private final MutableClock clock = MutableClock.at("2026-03-01T12:00:00Z");
  private JobLockManager lockManager;
  private TaskScheduler taskScheduler;

  @BeforeEach
  void setUp() {
    lockManager = new JobLockManager(new InMemoryJobLockStore(), clock);
    taskScheduler = mock(TaskScheduler.class);
  }

  private static ScheduledJob job(Consumer<JobContext> body) {
    return new ScheduledJob() {
      @Override
      public String name() {
        return "reindex";
      }

      @Override
      public void run(JobContext context) {
        body.accept(context);
      }
    };
  }

  private JobRunner runner(ScheduledJob job, Executor executor) {
    return new JobRunner(job, lockManager, "worker-a", LEASE, taskScheduler, executor, clock);
  }

  private LockState lockState() {
    return lockManager.status().get(0).state();
  }

  @Test
  void runsBodyWhileHoldingLeaseAndReleasesAfterwards() {
    AtomicReference<LockState> stateDuringRun = new AtomicReference<>();
    JobRunner runner = runner(job(ctx -> stateDuringRun.set(lockState())), Runnable::run);

    runner.tick();

    assertThat(stateDuringRun.get()).isEqualTo(LockState.HELD);
    assertThat(lockState()).isEqualTo(LockState.UNLOCKED);
    assertThat(runner.state()).isEqualTo(JobRunner.State.IDLE);
  }

  @Test
  void schedulesRenewalEveryHalfLease() {
    JobRunner runner = runner(job(ctx -> {}), Runnable::run);

    runner.tick();

    verify(taskScheduler)
        .scheduleAtFixedRate(
            any(Runnable.class), any(Instant.class), eq(LEASE.dividedBy(2)));
  }

  @Test
  void doesNotRunWhenAnotherWorkerHoldsTheLease() {
    lockManager.acquire("reindex", "worker-b", LEASE);
    AtomicInteger runs = new AtomicInteger();
    JobRunner runner = runner(job(ctx -> runs.incrementAndGet()), Runnable::run);

    runner.tick();

    assertThat(runs).hasValue(0);
    assertThat(lockManager.status().get(0).holder()).isEqualTo("worker-b");
    assertThat(runner.state()).isEqualTo(JobRunner.State.IDLE);
  }

  @Test
  void tickWhileRunningIsSkipped() {
    List<Runnable> submitted = new ArrayList<>();
    AtomicInteger runs = new AtomicInteger();
    JobRunner runner = runner(job(ctx -> runs.incrementAndGet()), submitted::add);

    runner.tick();
    runner.tick();

    assertThat(submitted).hasSize(1);
    assertThat(runner.state()).isEqualTo(JobRunner.State.RUNNING);

    submitted.get(0).run();

    assertThat(runs).hasValue(1);
    assertThat(runner.state()).isEqualTo(JobRunner.State.IDLE);
  }

  @Test
  void failingBodyStillReleasesLease() {
    JobRunner runner =
        runner(
            job(
                ctx -> {
                  throw new IllegalStateException("boom");
                }),
            Runnable::run);

    runner.tick();

    assertThat(lockState()).isEqualTo(LockState.UNLOCKED);
    assertThat(runner.state()).isEqualTo(JobRunner.State.IDLE);
  }

  @Test
  void failedRenewalStopsBodyAndLeavesNewLeaderInPlace() {
    ArgumentCaptor<Runnable> renewal = ArgumentCaptor.forClass(Runnable.class);
    AtomicBoolean interrupted = new AtomicBoolean();
    AtomicBoolean reachedSecondUnit = new AtomicBoolean();
    JobRunner runner =
        runner(
            job(
                ctx -> {
                  // lease runs out while the first unit of work is still going
                  clock.advance(LEASE);
                  lockManager.acquire("reindex", "worker-b", LEASE);
                  verify(taskScheduler)
                      .scheduleAtFixedRate(renewal.capture(), any(Instant.class), any(Duration.class));
                  renewal.getValue().run();
                  interrupted.set(Thread.currentThread().isInterrupted());
                  ctx.ensureLeadership();
                  reachedSecondUnit.set(true);
                }),
            Runnable::run);

    runner.tick();

    assertThat(interrupted).isTrue();
    assertThat(reachedSecondUnit).isFalse();
    assertThat(Thread.currentThread().isInterrupted()).isFalse();
    assertThat(lockManager.status().get(0).holder()).isEqualTo("worker-b");
    assertThat(runner.state()).isEqualTo(JobRunner.State.IDLE);
  }

  @Test
  void lockStoreOutageLeavesRunnerIdle() {
    JobLockManager failing = mock(JobLockManager.class);
    when(failing.acquire(anyString(), anyString(), any(Duration.class)))
        .thenThrow(new IllegalStateException("connection refused"));
    AtomicInteger runs = new AtomicInteger();
    JobRunner runner =
        new JobRunner(
            job(ctx -> runs.incrementAndGet()),
            failing,
            "worker-a",
            LEASE,
            taskScheduler,
            Runnable::run,
            clock);

    runner.tick();

    assertThat(runs).hasValue(0);
    assertThat(runner.state()).isEqualTo(JobRunner.State.IDLE);
    verify(failing, never()).release(anyString(), anyString());
  }

  @Test
  void rejectedSubmissionReleasesLease() {
    JobRunner runner =
        runner(
            job(ctx -> {}),
            task -> {
              throw new RejectedExecutionException("pool full");
            });

    runner.tick();

    assertThat(lockState()).isEqualTo(LockState.UNLOCKED);
    assertThat(runner.state()).isEqualTo(JobRunner.State.IDLE);
  }

  @Test
  void leaseIsRenewedThroughALongRunAndHandedOverAfterRelease() {
    Instant start = clock.instant();
    Duration lease = Duration.ofSeconds(90);
    TaskScheduler schedulerA = mock(TaskScheduler.class);
    TaskScheduler schedulerB = mock(TaskScheduler.class);
    AtomicInteger runsOnB = new AtomicInteger();
    JobRunner workerB =
        new JobRunner(
            job(ctx -> runsOnB.incrementAndGet()),
            lockManager,
            "worker-b",
            lease,
            schedulerB,
            Runnable::run,
            clock);
    ArgumentCaptor<Runnable> renewal = ArgumentCaptor.forClass(Runnable.class);
    List<Instant> expiries = new ArrayList<>();
    AtomicBoolean leaderThroughout = new AtomicBoolean(true);
    JobRunner workerA =
        new JobRunner(
            job(
                ctx -> {
                  verify(schedulerA)
                      .scheduleAtFixedRate(
                          renewal.capture(), any(Instant.class), eq(Duration.ofSeconds(45)));

                  clock.set(start.plusSeconds(30));
                  workerB.tick();

                  clock.set(start.plusSeconds(45));
                  renewal.getValue().run();
                  expiries.add(lockManager.status().get(0).leaseExpiresAt());

                  clock.set(start.plusSeconds(60));
                  workerB.tick();

                  clock.set(start.plusSeconds(90));
                  renewal.getValue().run();
                  expiries.add(lockManager.status().get(0).leaseExpiresAt());

                  clock.set(start.plusSeconds(120));
                  leaderThroughout.set(ctx.isLeader());
                  assertThat(lockManager.status().get(0).holder()).isEqualTo("worker-a");
                }),
            lockManager,
            "worker-a",
            lease,
            schedulerA,
            Runnable::run,
            clock);

    workerA.tick();

    assertThat(leaderThroughout).isTrue();
    assertThat(expiries).containsExactly(start.plusSeconds(135), start.plusSeconds(180));
    assertThat(runsOnB).hasValue(0);
    assertThat(lockState()).isEqualTo(LockState.UNLOCKED);

    clock.set(start.plusSeconds(121));
    workerB.tick();

    assertThat(runsOnB).hasValue(1);
  }
}
