package dev.scriptorium.scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Registers one {@link JobRunner} per {@link ScheduledJob} bean and ticks each at its interval.
 *
 * <p>Ticks run on the shared {@link TaskScheduler}; job bodies run on the separate job executor, so
 * a long job never delays another job's tick.
 */
@Component
@ConditionalOnProperty(
    name = "scriptorium.scheduler.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class JobScheduler implements SmartLifecycle {

  private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

  private final List<JobRunner> runners;
  private final List<Duration> intervals;
  private final TaskScheduler taskScheduler;
  private final Duration initialDelay;
  private final Clock clock;
  private final List<ScheduledFuture<?>> ticks = new ArrayList<>();
  private volatile boolean running;

  public JobScheduler(
      List<ScheduledJob> jobs,
      JobLockManager lockManager,
      SchedulerProperties properties,
      TaskScheduler taskScheduler,
      @Qualifier("jobExecutor") Executor jobExecutor,
      Clock clock) {
    this.taskScheduler = taskScheduler;
    this.initialDelay = properties.initialDelay();
    this.clock = clock;
    this.runners = new ArrayList<>(jobs.size());
    this.intervals = new ArrayList<>(jobs.size());
    for (ScheduledJob job : jobs) {
      runners.add(
          new JobRunner(
              job,
              lockManager,
              properties.workerId(),
              properties.leaseFor(job),
              taskScheduler,
              jobExecutor,
              clock));
      intervals.add(properties.intervalFor(job));
    }
    log.info("Scheduler worker id: {}", properties.workerId());
  }

  @Override
  public synchronized void start() {
    for (int i = 0; i < runners.size(); i++) {
      JobRunner runner = runners.get(i);
      Duration interval = intervals.get(i);
      ticks.add(
          taskScheduler.scheduleWithFixedDelay(
              runner::tick, clock.instant().plus(initialDelay), interval));
      log.info("Scheduled job '{}' every {}", runner.jobName(), interval);
    }
    running = true;
  }

  @Override
  public synchronized void stop() {
    ticks.forEach(tick -> tick.cancel(false));
    ticks.clear();
    running = false;
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  public List<JobRunner> runners() {
    return List.copyOf(runners);
  }
}
