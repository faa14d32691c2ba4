package dev.scriptorium.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.output.Response;
import dev.scriptorium.BaseIntegrationTest;
import dev.scriptorium.content.ContentType;
import dev.scriptorium.search.SearchRequest;
import dev.scriptorium.search.SearchResult;
import dev.scriptorium.search.SearchService;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class IngestionServiceIT extends BaseIntegrationTest {

  @Autowired IngestionService ingestionService;

  @Autowired SearchService searchService;

  private static ContentUpload upload(String path, String text) {
    return new ContentUpload(
        path, ContentType.mimeTypeForPath(path), text.getBytes(StandardCharsets.UTF_8));
  }

  private static ContentUpload deletion(String path) {
    return new ContentUpload(path, ContentType.mimeTypeForPath(path), new byte[0]);
  }

  @Test
  void ingestedMarkdownIsSearchableWithMetadata() {
    IngestionReport report =
        ingestionService.ingest(
            "alice",
            List.of(
                upload(
                    "garden/tomatoes.md",
                    "## Watering\n\nTomato plants need deep watering twice a week in summer."),
                upload("kitchen/bread.org", "* Sourdough\nFeed the starter with flour and water.")),
            null,
            false);

    assertThat(report.succeeded()).isEqualTo(2);
    List<SearchResult> results =
        searchService.search("alice", new SearchRequest("how often to water tomatoes", 5));
    assertThat(results).isNotEmpty();
    SearchResult top = results.get(0);
    assertThat(top.sourcePath()).isEqualTo("garden/tomatoes.md");
    assertThat(top.contentType()).isEqualTo(ContentType.MARKDOWN);
    assertThat(top.rerankScore()).isNull();
  }

  @Test
  void unchangedUploadIsNotReembedded() {
    ContentUpload notes = upload("notes.txt", "Meeting notes about the quarterly budget.");
    ingestionService.ingest("alice", List.of(notes), null, false);

    IngestionReport second = ingestionService.ingest("alice", List.of(notes), null, false);

    assertThat(second.results())
        .singleElement()
        .satisfies(result -> assertThat(result.status()).isEqualTo(FileStatus.UNCHANGED));
  }

  @Test
  void accountsNeverSeeEachOthersEntries() {
    ingestionService.ingest(
        "alice", List.of(upload("secret.md", "Alice keeps her bicycle in the shed.")), null, false);

    assertThat(searchService.search("bob", new SearchRequest("bicycle shed", 5))).isEmpty();
  }

  @Test
  void deletionRemovesEntriesAndSourceDocument() {
    ingestionService.ingest(
        "alice", List.of(upload("trip.md", "Packing list for the mountain trip.")), null, false);

    IngestionReport report =
        ingestionService.ingest("alice", List.of(deletion("trip.md")), null, false);

    assertThat(report.results().get(0).status()).isEqualTo(FileStatus.DELETED);
    assertThat(sourceDocumentRepository.findByAccountAndSourcePath("alice", "trip.md")).isEmpty();
    assertThat(searchService.search("alice", new SearchRequest("mountain trip", 5))).isEmpty();
  }

  @Test
  void purgeRemovesOnlyTheRequestedType() {
    ingestionService.ingest(
        "alice",
        List.of(
            upload("a.md", "Markdown about astronomy and telescopes."),
            upload("b.txt", "Plain text about astronomy and stargazing.")),
        null,
        false);

    int removed = ingestionService.purge("alice", ContentType.MARKDOWN);

    assertThat(removed).isEqualTo(1);
    assertThat(searchService.search("alice", new SearchRequest("astronomy", 5)))
        .extracting(SearchResult::sourcePath)
        .containsOnly("b.txt");
  }

  @Test
  void rerankedSearchOrdersByCrossEncoderScore() {
    ingestionService.ingest(
        "alice",
        List.of(
            upload("one.md", "Cats sleep for most of the day."),
            upload("two.md", "Dogs enjoy long walks in the park.")),
        null,
        false);
    when(scoringModel.scoreAll(anyList(), anyString()))
        .thenAnswer(
            invocation -> {
              List<?> segments = invocation.getArgument(0);
              List<Double> scores = new ArrayList<>();
              for (Object segment : segments) {
                String text = ((TextSegment) segment).text();
                scores.add(text.contains("Dogs") ? 5.0 : -5.0);
              }
              return Response.from(scores);
            });

    List<SearchResult> results =
        searchService.search("alice", new SearchRequest("pets", null, 2, true));

    assertThat(results).extracting(SearchResult::sourcePath).containsExactly("two.md", "one.md");
    assertThat(results.get(0).rerankScore()).isEqualTo(5.0);
  }
}
