package dev.scriptorium.api;

import dev.scriptorium.ingestion.ImageStore;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Serves stored images referenced by image index entries. */
@RestController
@RequestMapping("/api/images")
public class ImageController {

  private final ImageStore imageStore;

  public ImageController(ImageStore imageStore) {
    this.imageStore = imageStore;
  }

  @GetMapping("/{account}/{file:.+}")
  public ResponseEntity<Resource> image(@PathVariable String account, @PathVariable String file) {
    Optional<Path> stored = imageStore.resolve(account, file);
    if (stored.isEmpty()) {
      return ResponseEntity.notFound().build();
    }
    // stored names are content hashes, so the bytes behind a URL never change
    return ResponseEntity.ok()
        .contentType(mediaTypeOf(file))
        .cacheControl(CacheControl.maxAge(Duration.ofDays(365)).cachePublic())
        .body(new FileSystemResource(stored.get()));
  }

  private static MediaType mediaTypeOf(String file) {
    String lower = file.toLowerCase(Locale.ROOT);
    if (lower.endsWith(".jpg") || lower.endsWith(".jpeg")) {
      return MediaType.IMAGE_JPEG;
    }
    if (lower.endsWith(".webp")) {
      return MediaType.parseMediaType("image/webp");
    }
    return MediaType.IMAGE_PNG;
  }
}
