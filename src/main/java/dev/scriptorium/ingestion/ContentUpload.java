package dev.scriptorium.ingestion;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * One multipart part of a content upload. Empty content marks the path as deleted.
 *
 * @param path relative path of the file, {@code /} separated
 * @param mimeType declared MIME type of the part, if any
 * @param content the file bytes
 */
public record ContentUpload(String path, @Nullable String mimeType, byte[] content) {

  public ContentUpload {
    Objects.requireNonNull(path, "path must not be null");
    Objects.requireNonNull(content, "content must not be null");
    path = normalizePath(path);
  }

  public boolean isDeletion() {
    return content.length == 0;
  }

  /**
   * Normalizes a client path to {@code /} separators without a leading slash.
   *
   * @throws IllegalArgumentException if the path is blank or contains {@code .} or {@code ..}
   *     segments
   */
  static String normalizePath(String raw) {
    String path = raw.replace('\\', '/');
    while (path.startsWith("/")) {
      path = path.substring(1);
    }
    if (path.isBlank()) {
      throw new IllegalArgumentException("File path must not be blank");
    }
    for (String segment : path.split("/", -1)) {
      if (segment.equals("..") || segment.equals(".") || segment.isEmpty()) {
        throw new IllegalArgumentException("Invalid file path: " + raw);
      }
    }
    return path;
  }
}
