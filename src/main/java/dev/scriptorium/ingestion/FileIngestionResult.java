package dev.scriptorium.ingestion;

import org.jspecify.annotations.Nullable;

/**
 * Per-file entry of an {@link IngestionReport}.
 *
 * @param path relative path as uploaded
 * @param status what happened to the file
 * @param chunks number of index entries now stored for the file
 * @param message failure detail; null unless {@code status} is FAILED or SKIPPED
 */
public record FileIngestionResult(
    String path, FileStatus status, int chunks, @Nullable String message) {

  static FileIngestionResult indexed(String path, int chunks) {
    return new FileIngestionResult(path, FileStatus.INDEXED, chunks, null);
  }

  static FileIngestionResult unchanged(String path, int chunks) {
    return new FileIngestionResult(path, FileStatus.UNCHANGED, chunks, null);
  }

  static FileIngestionResult deleted(String path) {
    return new FileIngestionResult(path, FileStatus.DELETED, 0, null);
  }

  static FileIngestionResult skipped(String path, String reason) {
    return new FileIngestionResult(path, FileStatus.SKIPPED, 0, reason);
  }

  static FileIngestionResult failed(String path, String message) {
    return new FileIngestionResult(path, FileStatus.FAILED, 0, message);
  }
}
