package dev.scriptorium.ingestion;

import dev.scriptorium.content.ContentHasher;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Content-addressed storage for uploaded images, one directory per account.
 *
 * <p>A stored file is named after the SHA-256 of its bytes plus the original extension, so the same
 * image uploaded under two paths is stored once.
 */
@Component
public class ImageStore {

  private static final Logger log = LoggerFactory.getLogger(ImageStore.class);

  private static final Pattern ACCOUNT = Pattern.compile("[A-Za-z0-9._@-]{1,128}");
  private static final Pattern STORED_FILE = Pattern.compile("[0-9a-f]{64}\\.(png|jpg|jpeg|webp)");

  private final Path root;

  @Autowired
  public ImageStore(IngestionProperties properties) {
    this(properties.imageDir());
  }

  public ImageStore(Path root) {
    this.root = root.toAbsolutePath().normalize();
  }

  /**
   * Stores image bytes for an account.
   *
   * @param account the owning account
   * @param path the image's relative path, used only for its extension
   * @param content the image bytes
   * @return the stored file name
   * @throws IOException if the file cannot be written
   */
  public String store(String account, String path, byte[] content) throws IOException {
    String fileName = ContentHasher.sha256(content) + "." + extensionOf(path);
    Path dir = accountDir(account);
    Path target = dir.resolve(fileName);
    if (Files.exists(target)) {
      return fileName;
    }
    Files.createDirectories(dir);
    Path temp = Files.createTempFile(dir, "upload-", ".tmp");
    try {
      Files.write(temp, content);
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } finally {
      Files.deleteIfExists(temp);
    }
    log.debug("Stored image {} for account {}", fileName, account);
    return fileName;
  }

  /**
   * Resolves a stored image.
   *
   * @return the file, or empty if the name is not a stored image name or the file does not exist
   */
  public Optional<Path> resolve(String account, String fileName) {
    if (!ACCOUNT.matcher(account).matches() || !STORED_FILE.matcher(fileName).matches()) {
      return Optional.empty();
    }
    Path file = accountDir(account).resolve(fileName);
    return Files.isRegularFile(file) ? Optional.of(file) : Optional.empty();
  }

  /** Deletes a stored image; a missing file is not an error. */
  public void delete(String account, String fileName) throws IOException {
    if (!STORED_FILE.matcher(fileName).matches()) {
      throw new IllegalArgumentException("Not a stored image name: " + fileName);
    }
    if (Files.deleteIfExists(accountDir(account).resolve(fileName))) {
      log.debug("Deleted image {} for account {}", fileName, account);
    }
  }

  /** Server-relative URL under which a stored image is served. */
  public static String urlFor(String account, String fileName) {
    return "/api/images/" + account + "/" + fileName;
  }

  private Path accountDir(String account) {
    if (!ACCOUNT.matcher(account).matches()) {
      throw new IllegalArgumentException("Invalid account name: " + account);
    }
    return root.resolve(account);
  }

  private static String extensionOf(String path) {
    int dot = path.lastIndexOf('.');
    String extension = dot < 0 ? "" : path.substring(dot + 1).toLowerCase(Locale.ROOT);
    return switch (extension) {
      case "jpg", "jpeg", "webp" -> extension;
      default -> "png";
    };
  }
}
