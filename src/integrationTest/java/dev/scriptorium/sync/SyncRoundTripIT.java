package dev.scriptorium.sync;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.scriptorium.BaseIntegrationTest;
import dev.scriptorium.content.ContentType;
import dev.scriptorium.search.SearchRequest;
import dev.scriptorium.search.SearchResult;
import dev.scriptorium.search.SearchService;
import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.util.unit.DataSize;
import org.springframework.web.client.RestClient;

/** Runs the sync client against the server of the same test context over real HTTP. */
@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = "scriptorium.scheduler.enabled=false")
class SyncRoundTripIT extends BaseIntegrationTest {

  @LocalServerPort int port;

  @Autowired SearchService searchService;

  @Autowired ObjectMapper objectMapper;

  @TempDir Path dir;

  private Path corpus;
  private SyncService syncService;

  @BeforeEach
  void setUp() throws IOException {
    corpus = Files.createDirectories(dir.resolve("corpus"));
    SyncProperties properties =
        new SyncProperties(
            true,
            "http://localhost:" + port,
            "carol",
            "it-laptop",
            List.of(corpus),
            List.of(),
            List.of("private"),
            EnumSet.allOf(ContentType.class),
            DataSize.ofKilobytes(64),
            2,
            Duration.ofMinutes(5),
            dir.resolve("cursor.json"),
            Duration.ofSeconds(5),
            Duration.ofMinutes(1),
            new SyncProperties.Retry(1, Duration.ofMillis(10), 2.0));
    RestClient restClient =
        RestClient.builder()
            .baseUrl(properties.serverUrl())
            .requestFactory(new JdkClientHttpRequestFactory(HttpClient.newHttpClient()))
            .build();
    ContentApiClient apiClient =
        new ContentApiClient(
            restClient,
            RetryTemplate.builder().maxAttempts(1).build(),
            properties.account(),
            properties.clientId(),
            Clock.systemUTC());
    syncService =
        new SyncService(
            new ChangeDetector(),
            new SyncCursorStore(properties.cursorFile(), objectMapper),
            apiClient,
            outcome -> {},
            properties,
            Clock.systemUTC());
  }

  private void write(String relative, String content) throws IOException {
    Path file = corpus.resolve(relative);
    Files.createDirectories(file.getParent());
    Files.writeString(file, content);
  }

  private List<String> searchPaths(String query) {
    return searchService.search("carol", new SearchRequest(query, 10)).stream()
        .map(SearchResult::sourcePath)
        .distinct()
        .toList();
  }

  @Test
  void changedAndDeletedFilesReachTheServer() throws IOException {
    write("garden/roses.md", "## Pruning\n\nPrune roses in late winter before new growth.");
    write("garden/notes.txt", "Compost needs greens and browns in balance.");
    write("recipes/soup.org", "* Lentil soup\nSimmer lentils with cumin for forty minutes.");
    write("private/diary.md", "Nobody should index this diary entry.");
    write("garden/empty.md", "");

    SyncOutcome first = syncService.sync(false);

    assertThat(first.status()).isEqualTo(SyncOutcome.Status.COMPLETED);
    assertThat(first.indexed()).isEqualTo(3);
    assertThat(searchPaths("pruning roses")).contains("garden/roses.md");
    assertThat(searchPaths("diary entry")).doesNotContain("private/diary.md");

    assertThat(syncService.sync(false).status()).isEqualTo(SyncOutcome.Status.UP_TO_DATE);

    Files.delete(corpus.resolve("recipes/soup.org"));
    SyncOutcome afterDelete = syncService.sync(false);

    assertThat(afterDelete.status()).isEqualTo(SyncOutcome.Status.COMPLETED);
    assertThat(afterDelete.deleted()).isEqualTo(1);
    assertThat(searchPaths("lentil soup")).doesNotContain("recipes/soup.org");
  }

  @Test
  void forceSyncReplacesServerContent() throws IOException {
    write("a.md", "Bees pollinate the orchard in spring.");
    syncService.sync(false);

    SyncOutcome forced = syncService.sync(true);

    assertThat(forced.status()).isEqualTo(SyncOutcome.Status.COMPLETED);
    assertThat(forced.indexed()).isEqualTo(1);
    assertThat(searchPaths("orchard bees")).containsExactly("a.md");
  }
}
