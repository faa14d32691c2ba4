package dev.scriptorium.sync;

import static org.assertj.core.api.Assertions.assertThat;

import dev.scriptorium.content.ContentType;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DeltaCalculatorTest {

  private static TrackedFile file(String path, long modifiedAt) {
    return new TrackedFile(
        path, ContentType.fromFileName(path).orElseThrow(), modifiedAt, 10, Path.of("/r", path));
  }

  @Test
  void uploadsNewAndModifiedFilesAndDeletesVanishedOnes() {
    SyncCursor cursor =
        new SyncCursor(Map.of("same.md", 100L, "changed.md", 100L, "gone.md", 100L, "old.pdf", 5L));
    List<TrackedFile> scan =
        List.of(file("changed.md", 200), file("new.md", 50), file("same.md", 100));

    SyncDelta delta = DeltaCalculator.compute(scan, cursor, false);

    assertThat(delta.toUpload()).extracting(TrackedFile::path).containsExactly("changed.md", "new.md");
    assertThat(delta.toDelete()).containsExactly("gone.md", "old.pdf");
  }

  @Test
  void olderModificationTimeThanCursorIsNotUploaded() {
    SyncCursor cursor = new SyncCursor(Map.of("a.md", 500L));

    SyncDelta delta = DeltaCalculator.compute(List.of(file("a.md", 400)), cursor, false);

    assertThat(delta.isEmpty()).isTrue();
  }

  @Test
  void forceUploadsEverythingScanned() {
    SyncCursor cursor = new SyncCursor(Map.of("a.md", 100L, "b.md", 100L));

    SyncDelta delta =
        DeltaCalculator.compute(List.of(file("a.md", 100), file("b.md", 100)), cursor, true);

    assertThat(delta.toUpload()).hasSize(2);
    assertThat(delta.toDelete()).isEmpty();
  }

  @Test
  void deltaIsEmptyOnceEveryUploadAndDeletionIsRecorded() {
    SyncCursor cursor = new SyncCursor(Map.of("a.md", 100L, "gone.md", 100L));
    List<TrackedFile> scan = List.of(file("a.md", 300), file("b.org", 20));

    SyncDelta first = DeltaCalculator.compute(scan, cursor, false);
    first.toUpload().forEach(f -> cursor.record(f.path(), f.modifiedAt()));
    first.toDelete().forEach(cursor::remove);

    assertThat(DeltaCalculator.compute(scan, cursor, false).isEmpty()).isTrue();
  }
}
