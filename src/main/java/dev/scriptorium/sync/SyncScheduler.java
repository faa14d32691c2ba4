package dev.scriptorium.sync;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;

/** Starts periodic sync cycles once the application is ready. */
public class SyncScheduler {

  private static final Logger log = LoggerFactory.getLogger(SyncScheduler.class);

  private final SyncService syncService;
  private final TaskScheduler taskScheduler;
  private final Duration interval;
  private @Nullable ScheduledFuture<?> scheduled;

  public SyncScheduler(SyncService syncService, TaskScheduler taskScheduler, Duration interval) {
    this.syncService = syncService;
    this.taskScheduler = taskScheduler;
    this.interval = interval;
  }

  @EventListener(ApplicationReadyEvent.class)
  public synchronized void start() {
    if (scheduled != null) {
      return;
    }
    log.info("Periodic sync every {}", interval);
    scheduled = taskScheduler.scheduleWithFixedDelay(this::runCycle, interval);
  }

  void runCycle() {
    try {
      syncService.syncIfDue();
    } catch (RuntimeException e) {
      log.error("Sync cycle failed unexpectedly", e);
    }
  }

  @PreDestroy
  public synchronized void stop() {
    syncService.cancel();
    if (scheduled != null) {
      scheduled.cancel(false);
      scheduled = null;
    }
  }
}
