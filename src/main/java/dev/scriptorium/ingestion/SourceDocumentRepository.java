package dev.scriptorium.ingestion;

import dev.scriptorium.content.ContentType;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Spring Data repository for {@link SourceDocument} entities.
 *
 * <p>Besides lookups by file, offers keyset-paged scans (ordered by id) for the reindex job.
 */
public interface SourceDocumentRepository extends JpaRepository<SourceDocument, Long> {

  Optional<SourceDocument> findByAccountAndSourcePath(String account, String sourcePath);

  List<SourceDocument> findAllByAccountAndContentType(String account, ContentType contentType);

  /** Whether any document of the account still references the stored image file. */
  boolean existsByAccountAndImageFile(String account, String imageFile);

  /** Next page of all documents after {@code afterId}. */
  List<SourceDocument> findByIdGreaterThanOrderByIdAsc(long afterId, Pageable page);

  /** Next page of documents embedded with a model other than {@code embeddingModel}. */
  List<SourceDocument> findByEmbeddingModelNotAndIdGreaterThanOrderByIdAsc(
      String embeddingModel, long afterId, Pageable page);
}
