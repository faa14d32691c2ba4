package dev.scriptorium.ingestion;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.groups.Tuple.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import dev.scriptorium.content.ContentHasher;
import dev.scriptorium.content.ContentType;
import dev.scriptorium.fixture.TestPdfs;
import dev.scriptorium.index.IndexEntryData;
import dev.scriptorium.ingestion.chunking.DocumentChunker;
import dev.scriptorium.ingestion.extraction.TextExtractors;
import dev.scriptorium.model.ModelCallGuard;
import dev.scriptorium.model.ModelProperties;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@SuppressWarnings("NullAway.Init")
@ExtendWith(MockitoExtension.class)
class IngestionServiceTest {

  private static final String ACCOUNT = "alice";
  private static final String MODEL_ID = "bge-small-en-v1.5-q";
  private static final Embedding VECTOR = Embedding.from(new float[] {1f, 0.5f, 0.25f});
  private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

  @Mock EmbeddingModel embeddingModel;

  @Mock SourceDocumentRepository sourceDocumentRepository;

  @TempDir Path imageDir;

  InMemoryEmbeddingStore<TextSegment> embeddingStore;

  IngestionService ingestionService;

  @BeforeEach
  void setUp() {
    embeddingStore = new InMemoryEmbeddingStore<>();
    IngestionProperties properties =
        new IngestionProperties(
            2000, 2, imageDir, new IngestionProperties.RateLimit(true, 60, Duration.ofMinutes(1)));
    ingestionService =
        new IngestionService(
            new TextExtractors(),
            new DocumentChunker(properties),
            embeddingStore,
            embeddingModel,
            new ModelCallGuard(Duration.ofSeconds(5), 2),
            sourceDocumentRepository,
            new ImageStore(imageDir),
            Clock.fixed(NOW, ZoneOffset.UTC),
            new ModelProperties(Duration.ofSeconds(5), 2, MODEL_ID),
            properties);

    lenient()
        .when(embeddingModel.embedAll(anyList()))
        .thenAnswer(
            invocation -> {
              List<TextSegment> segments = invocation.getArgument(0);
              return Response.from(segments.stream().map(s -> VECTOR).toList());
            });
    lenient()
        .when(sourceDocumentRepository.findByAccountAndSourcePath(anyString(), anyString()))
        .thenReturn(Optional.empty());
    lenient()
        .when(sourceDocumentRepository.save(any(SourceDocument.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));
  }

  private static ContentUpload upload(String path, String mime, String text) {
    return new ContentUpload(path, mime, text.getBytes(StandardCharsets.UTF_8));
  }

  private static ContentUpload deletion(String path) {
    return new ContentUpload(path, "text/plain", new byte[0]);
  }

  private List<TextSegment> entriesFor(String account, String path) {
    EmbeddingSearchRequest request =
        EmbeddingSearchRequest.builder()
            .queryEmbedding(VECTOR)
            .maxResults(1000)
            .minScore(0.0)
            .filter(
                metadataKey(IndexEntryData.ACCOUNT)
                    .isEqualTo(account)
                    .and(metadataKey(IndexEntryData.SOURCE_PATH).isEqualTo(path)))
            .build();
    return embeddingStore.search(request).matches().stream().map(EmbeddingMatch::embedded).toList();
  }

  @Test
  void corruptPdfFailsAloneWhileTheRestOfTheBatchIsIndexed() {
    List<ContentUpload> batch =
        List.of(
            upload("notes/plan.md", "text/markdown", "## Plan\nShip the release."),
            upload("notes/agenda.org", "text/org", "* Monday\nStandup at nine."),
            upload("notes/todo.txt", "text/plain", "Buy milk.\n\nCall the plumber."),
            new ContentUpload("papers/good.pdf", "application/pdf", TestPdfs.withPages("Results")),
            new ContentUpload("papers/broken.pdf", "application/pdf", TestPdfs.corrupt()));

    IngestionReport report = ingestionService.ingest(ACCOUNT, batch, null, false);

    assertThat(report.succeeded()).isEqualTo(4);
    assertThat(report.failed()).isEqualTo(1);
    FileIngestionResult broken = report.results().get(4);
    assertThat(broken.path()).isEqualTo("papers/broken.pdf");
    assertThat(broken.status()).isEqualTo(FileStatus.FAILED);
    assertThat(broken.message()).contains("broken.pdf");
    assertThat(entriesFor(ACCOUNT, "notes/plan.md")).hasSize(1);
    assertThat(entriesFor(ACCOUNT, "papers/good.pdf")).hasSize(1);
    assertThat(entriesFor(ACCOUNT, "papers/broken.pdf")).isEmpty();
  }

  @Test
  void storedEntriesCarryIdentityAndModelMetadata() {
    ingestionService.ingest(
        ACCOUNT, List.of(upload("guide.md", "text/markdown", "# Guide\n## Setup\nRun it.")), null, false);

    TextSegment entry = entriesFor(ACCOUNT, "guide.md").get(0);
    assertThat(entry.metadata().getString(IndexEntryData.CONTENT_TYPE)).isEqualTo("markdown");
    assertThat(entry.metadata().getString(IndexEntryData.SECTION_PATH)).isEqualTo("guide/setup");
    assertThat(entry.metadata().getString(IndexEntryData.EMBEDDING_MODEL)).isEqualTo(MODEL_ID);
    assertThat(entry.metadata().getInteger(IndexEntryData.CHUNK_ID)).isZero();
    assertThat(entry.metadata().getString(IndexEntryData.INDEXED_AT)).isEqualTo(NOW.toString());
  }

  @Test
  void unchangedContentIsNotReembedded() {
    String text = "Same content.";
    SourceDocument existing = new SourceDocument(ACCOUNT, "same.txt");
    existing.recordIngestion(
        ContentType.PLAINTEXT, ContentHasher.sha256(text), text, MODEL_ID, 1, null, NOW);
    when(sourceDocumentRepository.findByAccountAndSourcePath(ACCOUNT, "same.txt"))
        .thenReturn(Optional.of(existing));

    IngestionReport report =
        ingestionService.ingest(ACCOUNT, List.of(upload("same.txt", "text/plain", text)), null, false);

    assertThat(report.results().get(0).status()).isEqualTo(FileStatus.UNCHANGED);
    assertThat(report.results().get(0).chunks()).isEqualTo(1);
    verify(embeddingModel, never()).embedAll(anyList());
  }

  @Test
  void forceReindexesUnchangedContent() {
    String text = "Same content.";
    SourceDocument existing = new SourceDocument(ACCOUNT, "same.txt");
    existing.recordIngestion(
        ContentType.PLAINTEXT, ContentHasher.sha256(text), text, MODEL_ID, 1, null, NOW);
    when(sourceDocumentRepository.findByAccountAndSourcePath(ACCOUNT, "same.txt"))
        .thenReturn(Optional.of(existing));

    IngestionReport report =
        ingestionService.ingest(ACCOUNT, List.of(upload("same.txt", "text/plain", text)), null, true);

    assertThat(report.results().get(0).status()).isEqualTo(FileStatus.INDEXED);
    verify(embeddingModel).embedAll(anyList());
  }

  @Test
  void contentEmbeddedWithAnotherModelIsReindexed() {
    String text = "Same content.";
    SourceDocument existing = new SourceDocument(ACCOUNT, "same.txt");
    existing.recordIngestion(
        ContentType.PLAINTEXT, ContentHasher.sha256(text), text, "old-model", 1, null, NOW);
    when(sourceDocumentRepository.findByAccountAndSourcePath(ACCOUNT, "same.txt"))
        .thenReturn(Optional.of(existing));

    IngestionReport report =
        ingestionService.ingest(ACCOUNT, List.of(upload("same.txt", "text/plain", text)), null, false);

    assertThat(report.results().get(0).status()).isEqualTo(FileStatus.INDEXED);
    assertThat(existing.getEmbeddingModel()).isEqualTo(MODEL_ID);
  }

  @Test
  void updatesAreAppliedBeforeDeletionsRegardlessOfPartOrder() {
    ingestionService.ingest(ACCOUNT, List.of(upload("old.md", "text/markdown", "Old body.")), null, false);

    IngestionReport report =
        ingestionService.ingest(
            ACCOUNT,
            List.of(deletion("old.md"), upload("new.md", "text/markdown", "New body.")),
            null,
            false);

    assertThat(report.results())
        .extracting(FileIngestionResult::path, FileIngestionResult::status)
        .containsExactly(
            tuple("new.md", FileStatus.INDEXED),
            tuple("old.md", FileStatus.DELETED));
    assertThat(entriesFor(ACCOUNT, "old.md")).isEmpty();
    assertThat(entriesFor(ACCOUNT, "new.md")).hasSize(1);
  }

  @Test
  void typeFilterSkipsOtherUpdatesButHonoursDeletions() {
    IngestionReport report =
        ingestionService.ingest(
            ACCOUNT,
            List.of(
                upload("a.md", "text/markdown", "Markdown body."),
                upload("b.txt", "text/plain", "Plain body."),
                deletion("c.txt")),
            ContentType.MARKDOWN,
            false);

    assertThat(report.results())
        .extracting(FileIngestionResult::status)
        .containsExactly(FileStatus.INDEXED, FileStatus.SKIPPED, FileStatus.DELETED);
    assertThat(report.succeeded()).isEqualTo(2);
    assertThat(report.failed()).isZero();
  }

  @Test
  void reingestReplacesEntriesWithoutLeavingStaleChunks() {
    ingestionService.ingest(
        ACCOUNT, List.of(upload("doc.md", "text/markdown", "## A\none\n## B\ntwo\n## C\nthree")), null, false);
    assertThat(entriesFor(ACCOUNT, "doc.md")).hasSize(3);

    ingestionService.ingest(ACCOUNT, List.of(upload("doc.md", "text/markdown", "## A\nonly")), null, false);

    assertThat(entriesFor(ACCOUNT, "doc.md")).extracting(TextSegment::text).containsExactly("## A\n\nonly");
  }

  @Test
  void modelFailureKeepsPreviouslyIndexedEntries() {
    ingestionService.ingest(ACCOUNT, List.of(upload("doc.txt", "text/plain", "Version one.")), null, false);
    when(embeddingModel.embedAll(anyList())).thenThrow(new IllegalStateException("onnx crashed"));

    IngestionReport report =
        ingestionService.ingest(ACCOUNT, List.of(upload("doc.txt", "text/plain", "Version two.")), null, false);

    assertThat(report.results().get(0).status()).isEqualTo(FileStatus.FAILED);
    assertThat(entriesFor(ACCOUNT, "doc.txt")).extracting(TextSegment::text).containsExactly("Version one.");
  }

  @Test
  void accountsAreIsolated() {
    ingestionService.ingest("alice", List.of(upload("shared.txt", "text/plain", "Alice text.")), null, false);
    ingestionService.ingest("bob", List.of(upload("shared.txt", "text/plain", "Bob text.")), null, false);

    ingestionService.ingest("bob", List.of(deletion("shared.txt")), null, false);

    assertThat(entriesFor("alice", "shared.txt")).hasSize(1);
    assertThat(entriesFor("bob", "shared.txt")).isEmpty();
  }

  @Test
  void imageIsStoredAndEntryLinksToIt() throws Exception {
    byte[] png = {(byte) 0x89, 'P', 'N', 'G', 1, 2, 3};

    IngestionReport report =
        ingestionService.ingest(
            ACCOUNT, List.of(new ContentUpload("trips/beach-day.png", "image/png", png)), null, false);

    assertThat(report.results().get(0).status()).isEqualTo(FileStatus.INDEXED);
    TextSegment entry = entriesFor(ACCOUNT, "trips/beach-day.png").get(0);
    String imageFile = ContentHasher.sha256(png) + ".png";
    assertThat(entry.text()).isEqualTo("beach day (image in trips)");
    assertThat(entry.metadata().getString(IndexEntryData.IMAGE_URL))
        .isEqualTo("/api/images/alice/" + imageFile);
    assertThat(Files.readAllBytes(imageDir.resolve(ACCOUNT).resolve(imageFile))).isEqualTo(png);
  }

  @Test
  void purgeRemovesOnlyTheRequestedType() {
    ingestionService.ingest(
        ACCOUNT,
        List.of(upload("a.md", "text/markdown", "Markdown."), upload("b.txt", "text/plain", "Text.")),
        null,
        false);
    SourceDocument markdownDoc = new SourceDocument(ACCOUNT, "a.md");
    when(sourceDocumentRepository.findAllByAccountAndContentType(ACCOUNT, ContentType.MARKDOWN))
        .thenReturn(List.of(markdownDoc));

    int removed = ingestionService.purge(ACCOUNT, ContentType.MARKDOWN);

    assertThat(removed).isEqualTo(1);
    verify(sourceDocumentRepository).deleteAll(eq(List.of(markdownDoc)));
    assertThat(entriesFor(ACCOUNT, "a.md")).isEmpty();
    assertThat(entriesFor(ACCOUNT, "b.txt")).hasSize(1);
  }

  @Test
  void reindexReembedsStoredTextWithCurrentModel() {
    SourceDocument document = new SourceDocument(ACCOUNT, "notes.org");
    document.recordIngestion(
        ContentType.ORG, "hash", "* One\nfirst\n* Two\nsecond", "old-model", 2, null, NOW);

    int count = ingestionService.reindex(document);

    assertThat(count).isEqualTo(2);
    assertThat(document.getEmbeddingModel()).isEqualTo(MODEL_ID);
    assertThat(entriesFor(ACCOUNT, "notes.org")).hasSize(2);
    verify(sourceDocumentRepository).save(document);
  }
}
