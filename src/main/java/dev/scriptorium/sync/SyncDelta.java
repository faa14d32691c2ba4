package dev.scriptorium.sync;

import java.util.List;

/**
 * What one sync cycle has to send.
 *
 * @param toUpload files that are new or changed since the cursor, in sync order
 * @param toDelete paths the cursor knows that no longer exist, sorted
 */
public record SyncDelta(List<TrackedFile> toUpload, List<String> toDelete) {

  public SyncDelta {
    toUpload = List.copyOf(toUpload);
    toDelete = List.copyOf(toDelete);
  }

  public boolean isEmpty() {
    return toUpload.isEmpty() && toDelete.isEmpty();
  }
}
