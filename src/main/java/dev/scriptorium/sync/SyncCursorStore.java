package dev.scriptorium.sync;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists the {@link SyncCursor} as JSON.
 *
 * <p>Writes go to a temporary file in the same directory that is then atomically moved over the
 * previous cursor, so a crash never leaves a half-written cursor behind.
 */
public class SyncCursorStore {

  private static final Logger log = LoggerFactory.getLogger(SyncCursorStore.class);

  static final int FORMAT_VERSION = 1;

  private final Path file;
  private final ObjectMapper objectMapper;

  public SyncCursorStore(Path file, ObjectMapper objectMapper) {
    this.file = file.toAbsolutePath();
    this.objectMapper = objectMapper;
  }

  /**
   * Loads the cursor. A missing file yields an empty cursor; so does an unreadable one, which
   * makes the next cycle upload everything again.
   */
  public SyncCursor load() {
    if (!Files.exists(file)) {
      return new SyncCursor();
    }
    try {
      CursorFile stored = objectMapper.readValue(file.toFile(), CursorFile.class);
      if (stored.version() != FORMAT_VERSION || stored.entries() == null) {
        log.warn("Ignoring sync cursor {} with unsupported format {}", file, stored.version());
        return new SyncCursor();
      }
      return new SyncCursor(stored.entries());
    } catch (JacksonException e) {
      log.warn("Sync cursor {} is corrupt, starting from scratch: {}", file, e.getOriginalMessage());
      return new SyncCursor();
    } catch (IOException e) {
      log.warn("Sync cursor {} is unreadable, starting from scratch: {}", file, e.getMessage());
      return new SyncCursor();
    }
  }

  /**
   * Writes the cursor.
   *
   * @throws IOException if the cursor cannot be written
   */
  public void save(SyncCursor cursor) throws IOException {
    Path dir = file.getParent();
    Files.createDirectories(dir);
    Path temp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
    try {
      objectMapper
          .writerWithDefaultPrettyPrinter()
          .writeValue(temp.toFile(), new CursorFile(FORMAT_VERSION, new TreeMap<>(cursor.snapshot())));
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  public Path file() {
    return file;
  }

  record CursorFile(int version, Map<String, Long> entries) {}
}
