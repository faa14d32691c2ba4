package dev.scriptorium.sync;

import dev.scriptorium.content.ContentType;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs sync cycles: scan, diff against the cursor, upload in batches, advance the cursor.
 *
 * <p>One cycle runs at a time; a request arriving during a cycle returns {@link
 * SyncOutcome.Status#ALREADY_RUNNING}. Batches are sent one after another and the first failed
 * request ends the cycle. The cursor is saved after every batch, and it only moves for files the
 * server explicitly acknowledged, so a cycle that stops early never loses confirmed progress and
 * never claims unconfirmed progress.
 *
 * <p>{@link #cancel()} interrupts the request in flight, so an aborted cycle does not wait out the
 * read timeout.
 */
public class SyncService {

  private static final Logger log = LoggerFactory.getLogger(SyncService.class);

  private final ChangeDetector changeDetector;
  private final SyncCursorStore cursorStore;
  private final ContentApiClient apiClient;
  private final SyncNotifier notifier;
  private final SyncProperties properties;
  private final Clock clock;
  private final ReentrantLock cycleLock = new ReentrantLock();
  private final Object callGuard = new Object();
  private volatile boolean cancelRequested;
  private @Nullable Thread callThread;
  private volatile @Nullable Instant pausedUntil;

  public SyncService(
      ChangeDetector changeDetector,
      SyncCursorStore cursorStore,
      ContentApiClient apiClient,
      SyncNotifier notifier,
      SyncProperties properties,
      Clock clock) {
    this.changeDetector = changeDetector;
    this.cursorStore = cursorStore;
    this.apiClient = apiClient;
    this.notifier = notifier;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Runs one cycle.
   *
   * @param force purge every enabled type on the server, then upload every file regardless of the
   *     cursor
   */
  public SyncOutcome sync(boolean force) {
    if (!cycleLock.tryLock()) {
      SyncOutcome outcome = SyncOutcome.of(SyncOutcome.Status.ALREADY_RUNNING);
      notifier.notify(outcome);
      return outcome;
    }
    SyncOutcome outcome;
    try {
      cancelRequested = false;
      outcome = runCycle(force);
    } finally {
      cycleLock.unlock();
    }
    notifier.notify(outcome);
    return outcome;
  }

  /** Periodic entry point: runs an incremental cycle unless the server asked to back off. */
  public @Nullable SyncOutcome syncIfDue() {
    Instant until = pausedUntil;
    if (until != null && clock.instant().isBefore(until)) {
      log.debug("Sync paused by server until {}", until);
      return null;
    }
    return sync(false);
  }

  /** Stops the running cycle, aborting the request in flight. */
  public void cancel() {
    synchronized (callGuard) {
      cancelRequested = true;
      if (callThread != null) {
        callThread.interrupt();
      }
    }
  }

  public boolean isRunning() {
    return cycleLock.isLocked();
  }

  private SyncOutcome runCycle(boolean force) {
    Progress progress = new Progress();
    try {
      List<TrackedFile> files =
          changeDetector.scan(
              properties.roots(),
              properties.includeFolders(),
              properties.excludeFolders(),
              properties.enabledTypes());
      SyncCursor cursor = cursorStore.load();

      if (force) {
        Set<ContentType> purged = properties.enabledTypes();
        for (ContentType type : purged) {
          abortable(
              () -> {
                apiClient.purge(type);
                return null;
              });
        }
        log.info("Purged {} on server before full upload", purged);
        // the server no longer has these files, whatever happens to the uploads below
        for (String path : cursor.paths()) {
          if (ContentType.fromFileName(path).map(purged::contains).orElse(false)) {
            cursor.remove(path);
          }
        }
        cursorStore.save(cursor);
      }

      SyncDelta delta = DeltaCalculator.compute(files, cursor, force);
      if (delta.isEmpty()) {
        return SyncOutcome.of(SyncOutcome.Status.UP_TO_DATE);
      }
      List<UploadBatch> batches =
          BatchBuilder.build(
              delta.toUpload(),
              delta.toDelete(),
              properties.maxBatchBytes().toBytes(),
              properties.maxBatchItems());
      log.info(
          "Syncing {} changed and {} deleted files in {} batches",
          delta.toUpload().size(),
          delta.toDelete().size(),
          batches.size());

      for (int i = 0; i < batches.size(); i++) {
        if (cancelRequested || Thread.currentThread().isInterrupted()) {
          log.info("Sync cancelled after {} of {} batches", i, batches.size());
          return progress.toOutcome(SyncOutcome.Status.CANCELLED, null, null);
        }
        UploadBatch batch = batches.get(i);
        UploadResponse response = abortable(() -> apiClient.upload(batch, force));
        progress.apply(batch, response, cursor);
        cursorStore.save(cursor);
      }
      pausedUntil = null;
      return progress.toOutcome(
          progress.failedPaths.isEmpty()
              ? SyncOutcome.Status.COMPLETED
              : SyncOutcome.Status.PARTIAL,
          null,
          null);
    } catch (SyncThrottledException e) {
      pausedUntil = clock.instant().plus(e.getRetryAfter());
      return progress.toOutcome(SyncOutcome.Status.THROTTLED, e.getMessage(), e.getRetryAfter());
    } catch (SyncTransportException e) {
      if (cancelRequested) {
        log.info("Sync cancelled during a request: {}", e.getMessage());
        return progress.toOutcome(SyncOutcome.Status.CANCELLED, null, null);
      }
      log.warn("Sync stopped: {}", e.getMessage());
      return progress.toOutcome(SyncOutcome.Status.FAILED, e.getMessage(), null);
    } catch (IOException e) {
      log.warn("Could not save sync cursor {}: {}", cursorStore.file(), e.getMessage());
      return progress.toOutcome(
          SyncOutcome.Status.FAILED, "could not save sync cursor: " + e.getMessage(), null);
    }
  }

  /** Runs one server call that {@link #cancel()} can interrupt. */
  private <T> T abortable(Supplier<T> call) {
    synchronized (callGuard) {
      if (cancelRequested) {
        throw new SyncTransportException("Sync cancelled");
      }
      callThread = Thread.currentThread();
    }
    try {
      return call.get();
    } finally {
      synchronized (callGuard) {
        callThread = null;
        if (cancelRequested) {
          // drop the interrupt sent by cancel() so it does not reach the cursor write
          Thread.interrupted();
        }
      }
    }
  }

  /** Counters and cursor updates of the running cycle. */
  private static final class Progress {

    private int indexed;
    private int unchanged;
    private int deleted;
    private final List<String> failedPaths = new ArrayList<>();

    void apply(UploadBatch batch, UploadResponse response, SyncCursor cursor) {
      Map<String, UploadItem> sent = new HashMap<>();
      for (UploadItem item : batch.items()) {
        sent.put(item.path(), item);
      }
      for (FileAck ack : response.acks()) {
        UploadItem item = sent.get(ack.path());
        if (item == null) {
          log.warn("Server acknowledged {} which was not in the batch", ack.path());
          continue;
        }
        switch (ack.status()) {
          case FileAck.INDEXED, FileAck.UNCHANGED -> {
            if (!item.isDeletion()) {
              cursor.record(item.path(), item.modifiedAt());
              if (FileAck.INDEXED.equals(ack.status())) {
                indexed++;
              } else {
                unchanged++;
              }
            }
          }
          case FileAck.DELETED -> {
            cursor.remove(item.path());
            deleted++;
          }
          case FileAck.FAILED -> {
            failedPaths.add(item.path());
            log.warn("Server failed to index {}: {}", item.path(), ack.message());
          }
          default -> log.debug("Server reported {} for {}", ack.status(), item.path());
        }
      }
    }

    SyncOutcome toOutcome(
        SyncOutcome.Status status,
        @Nullable String message,
        @Nullable Duration retryAfter) {
      return new SyncOutcome(
          status, indexed, unchanged, deleted, failedPaths, message, retryAfter);
    }
  }
}
