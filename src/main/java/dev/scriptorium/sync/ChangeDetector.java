package dev.scriptorium.sync;

import dev.scriptorium.content.ContentType;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scans sync roots and returns the files eligible for sync.
 *
 * <p>A file is eligible when its extension maps to an enabled {@link ContentType}, it lies in an
 * included folder (or no include folders are set) and it lies in no excluded folder. Exclusion
 * always wins. Results are ordered text-first by {@link ContentType#syncPriority()}, then by path,
 * so cheap text content reaches the server before PDFs and images.
 */
public class ChangeDetector {

  private static final Logger log = LoggerFactory.getLogger(ChangeDetector.class);

  static final Comparator<TrackedFile> SYNC_ORDER =
      Comparator.comparingInt((TrackedFile f) -> f.contentType().syncPriority())
          .thenComparing(TrackedFile::path);

  /**
   * Scans the roots. Unreadable entries are skipped with a warning, empty files silently.
   *
   * @param roots directories to walk; when two roots contain the same relative path the first wins
   * @param includeFolders root-relative folders to keep; empty keeps everything
   * @param excludeFolders root-relative folders to drop
   * @param enabledTypes content types to keep
   */
  public List<TrackedFile> scan(
      List<Path> roots,
      Collection<String> includeFolders,
      Collection<String> excludeFolders,
      Set<ContentType> enabledTypes) {
    List<String> includes = normalizeFolders(includeFolders);
    List<String> excludes = normalizeFolders(excludeFolders);
    Map<String, TrackedFile> found = new LinkedHashMap<>();

    for (Path root : roots) {
      Path base = root.toAbsolutePath().normalize();
      if (!Files.isDirectory(base)) {
        log.warn("Sync root {} is not a readable directory, skipping", base);
        continue;
      }
      try {
        Files.walkFileTree(base, new Collector(base, includes, excludes, enabledTypes, found));
      } catch (IOException e) {
        log.warn("Scanning {} stopped early: {}", base, e.getMessage());
      }
    }

    List<TrackedFile> files = new ArrayList<>(found.values());
    files.sort(SYNC_ORDER);
    return files;
  }

  /** Whether {@code path} equals {@code folder} or lies below it. An empty folder is the root. */
  static boolean inFolder(String path, String folder) {
    return folder.isEmpty() || path.equals(folder) || path.startsWith(folder + "/");
  }

  static boolean isSelected(String path, List<String> includes, List<String> excludes) {
    for (String exclude : excludes) {
      if (inFolder(path, exclude)) {
        return false;
      }
    }
    if (includes.isEmpty()) {
      return true;
    }
    for (String include : includes) {
      if (inFolder(path, include)) {
        return true;
      }
    }
    return false;
  }

  private static List<String> normalizeFolders(Collection<String> folders) {
    List<String> normalized = new ArrayList<>(folders.size());
    for (String folder : folders) {
      String trimmed = folder.trim().replace('\\', '/');
      while (trimmed.startsWith("/")) {
        trimmed = trimmed.substring(1);
      }
      while (trimmed.endsWith("/")) {
        trimmed = trimmed.substring(0, trimmed.length() - 1);
      }
      normalized.add(trimmed);
    }
    return normalized;
  }

  private static final class Collector extends SimpleFileVisitor<Path> {

    private final Path base;
    private final List<String> includes;
    private final List<String> excludes;
    private final Set<ContentType> enabledTypes;
    private final Map<String, TrackedFile> found;

    Collector(
        Path base,
        List<String> includes,
        List<String> excludes,
        Set<ContentType> enabledTypes,
        Map<String, TrackedFile> found) {
      this.base = base;
      this.includes = includes;
      this.excludes = excludes;
      this.enabledTypes = enabledTypes;
      this.found = found;
    }

    @Override
    public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
      if (!dir.equals(base)) {
        String relative = relativize(dir);
        for (String exclude : excludes) {
          if (inFolder(relative, exclude)) {
            return FileVisitResult.SKIP_SUBTREE;
          }
        }
      }
      return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
      if (!attrs.isRegularFile()) {
        return FileVisitResult.CONTINUE;
      }
      String relative = relativize(file);
      Optional<ContentType> type = ContentType.fromFileName(relative);
      if (type.isEmpty()
          || !enabledTypes.contains(type.get())
          || !isSelected(relative, includes, excludes)) {
        return FileVisitResult.CONTINUE;
      }
      if (attrs.size() == 0) {
        // an empty part means deletion on the wire
        log.debug("Skipping empty file {}", relative);
        return FileVisitResult.CONTINUE;
      }
      if (!Files.isReadable(file)) {
        log.warn("Skipping unreadable file {}", file);
        return FileVisitResult.CONTINUE;
      }
      TrackedFile tracked =
          new TrackedFile(
              relative, type.get(), attrs.lastModifiedTime().toMillis(), attrs.size(), file);
      TrackedFile previous = found.putIfAbsent(relative, tracked);
      if (previous != null) {
        log.warn(
            "{} exists under several roots, keeping {}", relative, previous.location());
      }
      return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult visitFileFailed(Path file, IOException e) {
      log.warn("Skipping unreadable path {}: {}", file, e.getMessage());
      return FileVisitResult.CONTINUE;
    }

    private String relativize(Path path) {
      return base.relativize(path).toString().replace('\\', '/');
    }
  }
}
