package dev.scriptorium.ingestion;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.filter.Filter;
import dev.scriptorium.content.ContentHasher;
import dev.scriptorium.content.ContentType;
import dev.scriptorium.index.IndexEntryData;
import dev.scriptorium.ingestion.chunking.DocumentChunker;
import dev.scriptorium.ingestion.chunking.TextChunk;
import dev.scriptorium.ingestion.extraction.ExtractionException;
import dev.scriptorium.ingestion.extraction.TextExtractors;
import dev.scriptorium.model.ModelCallGuard;
import dev.scriptorium.model.ModelProperties;
import dev.scriptorium.model.ModelUnavailableException;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Orchestrates the ingestion pipeline: upload -> extract -> chunk -> embed -> store.
 *
 * <p>Within one request, updates are applied before deletions, so a file that was renamed (new
 * path uploaded, old path deleted) is searchable under its new path before the old one disappears.
 *
 * <p><strong>Failure semantics:</strong> files are processed independently. A file that cannot be
 * extracted, embedded or stored is reported as {@link FileStatus#FAILED} and the rest of the batch
 * proceeds. Embeddings are computed before the file's old entries are removed, so a model failure
 * leaves the previously indexed version searchable.
 */
@Service
public class IngestionService {

  private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

  private final TextExtractors extractors;
  private final DocumentChunker chunker;
  private final EmbeddingStore<TextSegment> embeddingStore;
  private final EmbeddingModel embeddingModel;
  private final ModelCallGuard modelCallGuard;
  private final SourceDocumentRepository sourceDocumentRepository;
  private final ImageStore imageStore;
  private final Clock clock;
  private final String embeddingModelId;
  private final int embedBatchSize;

  public IngestionService(
      TextExtractors extractors,
      DocumentChunker chunker,
      EmbeddingStore<TextSegment> embeddingStore,
      EmbeddingModel embeddingModel,
      ModelCallGuard modelCallGuard,
      SourceDocumentRepository sourceDocumentRepository,
      ImageStore imageStore,
      Clock clock,
      ModelProperties modelProperties,
      IngestionProperties ingestionProperties) {
    this.extractors = extractors;
    this.chunker = chunker;
    this.embeddingStore = embeddingStore;
    this.embeddingModel = embeddingModel;
    this.modelCallGuard = modelCallGuard;
    this.sourceDocumentRepository = sourceDocumentRepository;
    this.imageStore = imageStore;
    this.clock = clock;
    this.embeddingModelId = modelProperties.embeddingModelId();
    this.embedBatchSize = ingestionProperties.embedBatchSize();
  }

  /**
   * Ingests one upload batch for an account.
   *
   * @param account the owning account
   * @param uploads the batch's parts; empty parts are deletions
   * @param typeFilter when set, updates of any other content type are skipped
   * @param force re-index files even when their content is unchanged
   * @return per-file results, updates first, then deletions
   */
  public IngestionReport ingest(
      String account, List<ContentUpload> uploads, @Nullable ContentType typeFilter, boolean force) {
    List<FileIngestionResult> results = new ArrayList<>(uploads.size());
    for (ContentUpload upload : uploads) {
      if (!upload.isDeletion()) {
        results.add(ingestFile(account, upload, typeFilter, force));
      }
    }
    for (ContentUpload upload : uploads) {
      if (upload.isDeletion()) {
        results.add(deleteFile(account, upload.path()));
      }
    }
    IngestionReport report = IngestionReport.of(results);
    log.info(
        "Ingested batch for account {}: {} files, {} succeeded, {} failed",
        account,
        uploads.size(),
        report.succeeded(),
        report.failed());
    return report;
  }

  /**
   * Removes every entry and source document of one content type for an account.
   *
   * @return number of source documents removed
   */
  public int purge(String account, ContentType contentType) {
    embeddingStore.removeAll(
        metadataKey(IndexEntryData.ACCOUNT)
            .isEqualTo(account)
            .and(metadataKey(IndexEntryData.CONTENT_TYPE).isEqualTo(contentType.value())));
    List<SourceDocument> documents =
        sourceDocumentRepository.findAllByAccountAndContentType(account, contentType);
    sourceDocumentRepository.deleteAll(documents);
    for (SourceDocument document : documents) {
      deleteImageIfUnreferenced(account, document.getImageFile());
    }
    log.info("Purged {} {} documents for account {}", documents.size(), contentType, account);
    return documents.size();
  }

  /**
   * Re-embeds a stored document from its compiled text with the current embedding model.
   *
   * @return number of entries stored
   * @throws ModelUnavailableException if embedding fails
   */
  public int reindex(SourceDocument document) {
    String account = document.getAccount();
    List<TextChunk> chunks = chunker.chunk(document.getContentType(), document.getCompiledText());
    String imageUrl =
        document.getImageFile() == null
            ? null
            : ImageStore.urlFor(account, document.getImageFile());
    Instant now = clock.instant();
    int count =
        replaceEntries(
            account, document.getSourcePath(), document.getContentType(), chunks, imageUrl, now);
    document.recordReindex(embeddingModelId, count, now);
    sourceDocumentRepository.save(document);
    return count;
  }

  private FileIngestionResult ingestFile(
      String account, ContentUpload upload, @Nullable ContentType typeFilter, boolean force) {
    String path = upload.path();
    ContentType type = ContentType.classify(upload.mimeType(), path);
    if (typeFilter != null && type != typeFilter) {
      return FileIngestionResult.skipped(path, "content type " + type.value() + " not requested");
    }

    String hash = ContentHasher.sha256(upload.content());
    Optional<SourceDocument> existing =
        sourceDocumentRepository.findByAccountAndSourcePath(account, path);
    if (!force && existing.isPresent() && existing.get().matches(type, hash, embeddingModelId)) {
      log.debug("Content unchanged for {}:{}, skipping ingestion", account, path);
      return FileIngestionResult.unchanged(path, existing.get().getChunkCount());
    }

    try {
      String text = extractors.extract(type, path, upload.content());
      String imageFile = null;
      String imageUrl = null;
      if (type == ContentType.IMAGE) {
        imageFile = imageStore.store(account, path, upload.content());
        imageUrl = ImageStore.urlFor(account, imageFile);
      }
      List<TextChunk> chunks = chunker.chunk(type, text);
      Instant now = clock.instant();
      int count = replaceEntries(account, path, type, chunks, imageUrl, now);

      SourceDocument document = existing.orElseGet(() -> new SourceDocument(account, path));
      String previousImage = document.getImageFile();
      document.recordIngestion(type, hash, text, embeddingModelId, count, imageFile, now);
      sourceDocumentRepository.save(document);
      if (previousImage != null && !previousImage.equals(imageFile)) {
        deleteImageIfUnreferenced(account, previousImage);
      }

      log.debug("Indexed {} chunks for {}:{}", count, account, path);
      return FileIngestionResult.indexed(path, count);
    } catch (ExtractionException e) {
      log.warn("Extraction failed for {}:{}: {}", account, path, e.getMessage());
      return FileIngestionResult.failed(path, e.getMessage());
    } catch (ModelUnavailableException e) {
      log.warn("Embedding unavailable for {}:{}: {}", account, path, e.getMessage());
      return FileIngestionResult.failed(path, e.getMessage());
    } catch (IOException | RuntimeException e) {
      log.warn("Storing {}:{} failed", account, path, e);
      return FileIngestionResult.failed(path, "Storage failure: " + e.getMessage());
    }
  }

  private FileIngestionResult deleteFile(String account, String path) {
    try {
      embeddingStore.removeAll(sourceFilter(account, path));
      Optional<SourceDocument> existing =
          sourceDocumentRepository.findByAccountAndSourcePath(account, path);
      if (existing.isPresent()) {
        sourceDocumentRepository.delete(existing.get());
        deleteImageIfUnreferenced(account, existing.get().getImageFile());
      }
      log.debug("Deleted {}:{}", account, path);
      return FileIngestionResult.deleted(path);
    } catch (RuntimeException e) {
      log.warn("Deleting {}:{} failed", account, path, e);
      return FileIngestionResult.failed(path, "Storage failure: " + e.getMessage());
    }
  }

  /**
   * Embeds the chunks, then replaces the path's stored entries with them. Entry ids are derived
   * from (account, path, chunk id), so concurrent writers of the same file converge on one set.
   */
  private int replaceEntries(
      String account,
      String path,
      ContentType type,
      List<TextChunk> chunks,
      @Nullable String imageUrl,
      Instant indexedAt) {
    List<IndexEntryData> entries = new ArrayList<>(chunks.size());
    for (int i = 0; i < chunks.size(); i++) {
      TextChunk chunk = chunks.get(i);
      entries.add(
          new IndexEntryData(
              account,
              path,
              i,
              chunk.text(),
              type,
              chunk.sectionPath(),
              imageUrl,
              embeddingModelId,
              indexedAt.toString()));
    }
    List<TextSegment> segments = entries.stream().map(IndexEntryData::toTextSegment).toList();
    List<String> ids = entries.stream().map(IndexEntryData::entryId).toList();

    List<Embedding> embeddings = new ArrayList<>(segments.size());
    for (int i = 0; i < segments.size(); i += embedBatchSize) {
      List<TextSegment> batch = segments.subList(i, Math.min(i + embedBatchSize, segments.size()));
      embeddings.addAll(
          modelCallGuard.call("embed " + path, () -> embeddingModel.embedAll(batch).content()));
    }

    embeddingStore.removeAll(sourceFilter(account, path));
    if (!segments.isEmpty()) {
      embeddingStore.addAll(ids, embeddings, segments);
    }
    return segments.size();
  }

  private void deleteImageIfUnreferenced(String account, @Nullable String imageFile) {
    if (imageFile == null || sourceDocumentRepository.existsByAccountAndImageFile(account, imageFile)) {
      return;
    }
    try {
      imageStore.delete(account, imageFile);
    } catch (IOException e) {
      log.warn("Could not delete image {} of account {}: {}", imageFile, account, e.getMessage());
    }
  }

  private static Filter sourceFilter(String account, String path) {
    return metadataKey(IndexEntryData.ACCOUNT)
        .isEqualTo(account)
        .and(metadataKey(IndexEntryData.SOURCE_PATH).isEqualTo(path));
  }
}
