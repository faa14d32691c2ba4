package dev.scriptorium.ingestion;

/** Outcome of ingesting one file of a batch. */
public enum FileStatus {
  /** Content was extracted, embedded and stored. */
  INDEXED,
  /** Content matched the stored version; nothing was done. */
  UNCHANGED,
  /** The file's entries were removed. */
  DELETED,
  /** The file's type did not match the request's type filter. */
  SKIPPED,
  /** The file could not be processed; see the result message. */
  FAILED
}
