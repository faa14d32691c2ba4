package dev.scriptorium.sync;

import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeMap;

/**
 * Last-synced timestamp per path.
 *
 * <p>An entry is written only when the server acknowledged the file, and removed only when the
 * server confirmed its deletion. Not thread-safe; a cursor belongs to one sync cycle at a time.
 */
public class SyncCursor {

  private final Map<String, Long> entries;

  public SyncCursor() {
    this(Map.of());
  }

  public SyncCursor(Map<String, Long> entries) {
    this.entries = new TreeMap<>(entries);
  }

  /** The timestamp recorded for a path, or empty if the path was never synced. */
  public OptionalLong lastSynced(String path) {
    Long value = entries.get(path);
    return value == null ? OptionalLong.empty() : OptionalLong.of(value);
  }

  public void record(String path, long modifiedAt) {
    entries.put(path, modifiedAt);
  }

  public void remove(String path) {
    entries.remove(path);
  }

  public Set<String> paths() {
    return Set.copyOf(entries.keySet());
  }

  public Map<String, Long> snapshot() {
    return Map.copyOf(entries);
  }

  public int size() {
    return entries.size();
  }
}
