package dev.scriptorium.sync;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/**
 * Server acknowledgement for one uploaded part.
 *
 * @param path the part's path
 * @param status {@code INDEXED}, {@code UNCHANGED}, {@code DELETED}, {@code SKIPPED} or {@code
 *     FAILED}
 * @param chunks index entries stored for the file
 * @param message failure detail
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FileAck(String path, String status, int chunks, @Nullable String message) {

  static final String INDEXED = "INDEXED";
  static final String UNCHANGED = "UNCHANGED";
  static final String DELETED = "DELETED";
  static final String FAILED = "FAILED";
}
