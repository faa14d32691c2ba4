package dev.scriptorium.sync;

import java.util.List;

/** Items sent in one upload request, in send order. */
public record UploadBatch(List<UploadItem> items) {

  public UploadBatch {
    items = List.copyOf(items);
  }

  public long totalBytes() {
    long total = 0;
    for (UploadItem item : items) {
      total += item.size();
    }
    return total;
  }

  public int size() {
    return items.size();
  }
}
