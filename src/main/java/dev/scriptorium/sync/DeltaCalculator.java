package dev.scriptorium.sync;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;

/** Compares a scan with the cursor. Both sides come from the same scan snapshot. */
public final class DeltaCalculator {

  private DeltaCalculator() {}

  /**
   * Computes the delta.
   *
   * <p>A file is uploaded when {@code force} is set, when the cursor has no entry for it, or when
   * it was modified after the recorded timestamp. A path is deleted when the cursor has it and the
   * scan does not.
   */
  public static SyncDelta compute(List<TrackedFile> files, SyncCursor cursor, boolean force) {
    List<TrackedFile> toUpload = new ArrayList<>();
    Set<String> scanned = new HashSet<>();
    for (TrackedFile file : files) {
      scanned.add(file.path());
      OptionalLong lastSynced = cursor.lastSynced(file.path());
      if (force || lastSynced.isEmpty() || file.modifiedAt() > lastSynced.getAsLong()) {
        toUpload.add(file);
      }
    }
    List<String> toDelete =
        cursor.paths().stream().filter(path -> !scanned.contains(path)).sorted().toList();
    return new SyncDelta(toUpload, toDelete);
  }
}
