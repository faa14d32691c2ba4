package dev.scriptorium.sync;

import dev.scriptorium.content.ContentType;
import java.util.ArrayList;
import java.util.List;

/**
 * Packs a delta into upload batches.
 *
 * <p>Files are packed greedily in delta order; a batch closes when the next file would push it past
 * the byte or item limit. A file larger than the byte limit travels alone. Deletions follow the
 * last file batch and spill into further batches when the item limit is reached. Content is not
 * read here.
 */
public final class BatchBuilder {

  private BatchBuilder() {}

  public static List<UploadBatch> build(
      List<TrackedFile> filesToUpload,
      List<String> pathsToDelete,
      long maxBatchBytes,
      int maxBatchItems) {
    if (maxBatchBytes < 1 || maxBatchItems < 1) {
      throw new IllegalArgumentException("batch limits must be positive");
    }
    List<UploadBatch> batches = new ArrayList<>();
    List<UploadItem> current = new ArrayList<>();
    long currentBytes = 0;

    for (TrackedFile file : filesToUpload) {
      boolean overBytes = currentBytes + file.size() > maxBatchBytes;
      boolean overItems = current.size() + 1 > maxBatchItems;
      if (!current.isEmpty() && (overBytes || overItems)) {
        batches.add(new UploadBatch(current));
        current = new ArrayList<>();
        currentBytes = 0;
      }
      current.add(UploadItem.upload(file));
      currentBytes += file.size();
    }

    for (String path : pathsToDelete) {
      // an oversized file keeps its batch to itself
      boolean holdsOversized = currentBytes > maxBatchBytes;
      if (!current.isEmpty() && (current.size() >= maxBatchItems || holdsOversized)) {
        batches.add(new UploadBatch(current));
        current = new ArrayList<>();
        currentBytes = 0;
      }
      current.add(UploadItem.deletion(path, ContentType.mimeTypeForPath(path)));
    }

    if (!current.isEmpty()) {
      batches.add(new UploadBatch(current));
    }
    return batches;
  }
}
