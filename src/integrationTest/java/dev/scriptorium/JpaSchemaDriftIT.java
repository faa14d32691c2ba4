package dev.scriptorium;

import static org.assertj.core.api.Assertions.assertThat;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.scriptorium.content.ContentType;
import dev.scriptorium.index.IndexEntry;
import dev.scriptorium.index.IndexEntryData;
import dev.scriptorium.index.IndexEntryRepository;
import dev.scriptorium.ingestion.SourceDocument;
import dev.scriptorium.scheduler.JobLockSnapshot;
import dev.scriptorium.scheduler.JpaJobLockStore;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

/**
 * Compensates for ddl-auto=validate only checking columns by verifying each JPA entity can be
 * written and read back against the Flyway schema.
 */
class JpaSchemaDriftIT extends BaseIntegrationTest {

  @Autowired private EmbeddingModel embeddingModel;

  @Autowired private IndexEntryRepository indexEntryRepository;

  @Autowired private JpaJobLockStore jobLockStore;

  @Test
  void sourceDocumentRoundtripsAgainstFlywaySchema() {
    SourceDocument document = new SourceDocument("alice", "notes/a.md");
    document.recordIngestion(
        ContentType.MARKDOWN,
        "sha256-abc",
        "# A\n\nbody",
        "bge-small-en-v1.5-q",
        2,
        null,
        Instant.parse("2026-03-01T09:00:00Z"));

    SourceDocument saved = sourceDocumentRepository.saveAndFlush(document);
    SourceDocument found = sourceDocumentRepository.findById(saved.getId()).orElseThrow();

    assertThat(found.getAccount()).isEqualTo("alice");
    assertThat(found.getSourcePath()).isEqualTo("notes/a.md");
    assertThat(found.getContentType()).isEqualTo(ContentType.MARKDOWN);
    assertThat(found.getCompiledText()).isEqualTo("# A\n\nbody");
    assertThat(found.getChunkCount()).isEqualTo(2);
    assertThat(found.getLastIngestedAt()).isEqualTo(Instant.parse("2026-03-01T09:00:00Z"));
  }

  @Test
  void indexEntryReadableViaJpaAfterLangchain4jInsert() {
    IndexEntryData data =
        new IndexEntryData(
            "alice",
            "notes/a.md",
            0,
            "Schema drift check",
            ContentType.MARKDOWN,
            "a",
            null,
            "bge-small-en-v1.5-q",
            "2026-03-01T09:00:00Z");
    TextSegment segment = data.toTextSegment();
    Embedding embedding = embeddingModel.embed(segment).content();
    embeddingStore.addAll(List.of(data.entryId()), List.of(embedding), List.of(segment));

    UUID id = UUID.fromString(data.entryId());
    IndexEntry found = indexEntryRepository.findByIdAndAccount(id, "alice").orElseThrow();

    assertThat(found.getText()).isEqualTo("Schema drift check");
    assertThat(indexEntryRepository.findByIdAndAccount(id, "bob")).isEmpty();
    assertThat(indexEntryRepository.countByAccount("alice")).isEqualTo(1);
  }

  @Test
  void jobLockRoundtripsAgainstFlywaySchema() {
    Instant now = Instant.parse("2026-03-01T09:00:00Z");
    jobLockStore.tryAcquire("reindex", "worker-a", now, now.plusSeconds(300));

    JobLockSnapshot snapshot = jobLockStore.findAll().get(0);

    assertThat(snapshot.jobName()).isEqualTo("reindex");
    assertThat(snapshot.holder()).isEqualTo("worker-a");
    assertThat(snapshot.leaseExpiresAt()).isEqualTo(now.plusSeconds(300));
    assertThat(snapshot.acquiredAt()).isEqualTo(now);
  }
}
