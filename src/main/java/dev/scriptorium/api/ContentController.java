package dev.scriptorium.api;

import dev.scriptorium.content.ContentType;
import dev.scriptorium.ingestion.ContentUpload;
import dev.scriptorium.ingestion.IngestionRateLimiter;
import dev.scriptorium.ingestion.IngestionReport;
import dev.scriptorium.ingestion.IngestionService;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * Content upload API driven by sync clients.
 *
 * <p>Each multipart part named {@code files} carries one file: its {@code filename} is the file's
 * relative path and an empty part marks the path as deleted. {@code PATCH} indexes changed files
 * only, {@code PUT} re-indexes every file it receives.
 */
@RestController
@RequestMapping("/api/content")
public class ContentController {

  private static final Logger log = LoggerFactory.getLogger(ContentController.class);

  private final IngestionService ingestionService;
  private final IngestionRateLimiter rateLimiter;

  public ContentController(IngestionService ingestionService, IngestionRateLimiter rateLimiter) {
    this.ingestionService = ingestionService;
    this.rateLimiter = rateLimiter;
  }

  @PatchMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public IngestionReport update(
      @RequestHeader(name = Accounts.HEADER, defaultValue = Accounts.DEFAULT) String account,
      @RequestParam(name = "type", required = false) @Nullable String type,
      @RequestParam(name = "client", required = false) @Nullable String client,
      @RequestPart("files") List<MultipartFile> files) {
    return ingest(account, type, client, files, false);
  }

  @PutMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public IngestionReport replace(
      @RequestHeader(name = Accounts.HEADER, defaultValue = Accounts.DEFAULT) String account,
      @RequestParam(name = "type", required = false) @Nullable String type,
      @RequestParam(name = "client", required = false) @Nullable String client,
      @RequestPart("files") List<MultipartFile> files) {
    return ingest(account, type, client, files, true);
  }

  @DeleteMapping("/type/{contentType}")
  public PurgeResponse purge(
      @RequestHeader(name = Accounts.HEADER, defaultValue = Accounts.DEFAULT) String account,
      @PathVariable String contentType,
      @RequestParam(name = "client", required = false) @Nullable String client) {
    Accounts.requireValid(account);
    rateLimiter.acquire(account);
    ContentType type = ContentType.parseFilter(contentType);
    log.info("Purge of {} requested by client {} for account {}", contentType, client, account);
    if (type != null) {
      return new PurgeResponse(type.value(), ingestionService.purge(account, type));
    }
    int removed = 0;
    for (ContentType each : ContentType.values()) {
      removed += ingestionService.purge(account, each);
    }
    return new PurgeResponse(ContentType.ALL, removed);
  }

  private IngestionReport ingest(
      String account,
      @Nullable String type,
      @Nullable String client,
      List<MultipartFile> files,
      boolean force) {
    Accounts.requireValid(account);
    rateLimiter.acquire(account);
    ContentType filter = ContentType.parseFilter(type);
    List<ContentUpload> uploads = toUploads(files);
    log.info(
        "Received {} files from client {} for account {} (force={})",
        uploads.size(),
        client,
        account,
        force);
    return ingestionService.ingest(account, uploads, filter, force);
  }

  /** Converts every part up front so a malformed batch is rejected before anything is indexed. */
  private static List<ContentUpload> toUploads(List<MultipartFile> files) {
    if (files.isEmpty()) {
      throw new IllegalArgumentException("Upload contains no files");
    }
    List<ContentUpload> uploads = new ArrayList<>(files.size());
    for (MultipartFile file : files) {
      String path = file.getOriginalFilename();
      if (path == null || path.isBlank()) {
        throw new IllegalArgumentException("Every uploaded part needs a filename");
      }
      try {
        uploads.add(new ContentUpload(path, file.getContentType(), file.getBytes()));
      } catch (IOException e) {
        throw new IllegalArgumentException("Unreadable part for " + path, e);
      }
    }
    return uploads;
  }
}
