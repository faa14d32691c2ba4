package dev.scriptorium.sync;

import java.nio.file.Path;
import org.jspecify.annotations.Nullable;

/**
 * One part of an upload request.
 *
 * @param path root-relative path, sent as the part's filename
 * @param mimeType MIME type of the part
 * @param size content length; 0 for deletions
 * @param modifiedAt modification time from the scan, recorded in the cursor once acknowledged
 * @param source file to stream the content from; null for deletions
 */
public record UploadItem(
    String path, String mimeType, long size, long modifiedAt, @Nullable Path source) {

  static UploadItem upload(TrackedFile file) {
    return new UploadItem(
        file.path(),
        file.contentType().mimeTypeFor(file.path()),
        file.size(),
        file.modifiedAt(),
        file.location());
  }

  static UploadItem deletion(String path, String mimeType) {
    return new UploadItem(path, mimeType, 0, 0, null);
  }

  public boolean isDeletion() {
    return source == null;
  }
}
