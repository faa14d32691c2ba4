package dev.scriptorium.ingestion;

import java.util.List;

/**
 * Result of one content upload request.
 *
 * @param results per-file outcomes, updates first, then deletions
 * @param succeeded files that were indexed, unchanged or deleted
 * @param failed files that failed
 */
public record IngestionReport(List<FileIngestionResult> results, int succeeded, int failed) {

  public IngestionReport {
    results = List.copyOf(results);
  }

  static IngestionReport of(List<FileIngestionResult> results) {
    int succeeded = 0;
    int failed = 0;
    for (FileIngestionResult result : results) {
      switch (result.status()) {
        case INDEXED, UNCHANGED, DELETED -> succeeded++;
        case FAILED -> failed++;
        case SKIPPED -> {}
      }
    }
    return new IngestionReport(results, succeeded, failed);
  }
}
