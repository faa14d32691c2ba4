package dev.scriptorium.api;

import dev.scriptorium.content.ContentType;
import dev.scriptorium.search.SearchProperties;
import dev.scriptorium.search.SearchRequest;
import dev.scriptorium.search.SearchService;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Semantic search API.
 *
 * <p>Query parameters: {@code q} query text, {@code t} content type filter ({@code all} for none),
 * {@code r} rerank flag, {@code n} result count.
 */
@RestController
@RequestMapping("/api/search")
public class SearchController {

  private final SearchService searchService;
  private final SearchProperties searchProperties;

  public SearchController(SearchService searchService, SearchProperties searchProperties) {
    this.searchService = searchService;
    this.searchProperties = searchProperties;
  }

  @GetMapping
  public List<SearchHitResponse> search(
      @RequestHeader(name = Accounts.HEADER, defaultValue = Accounts.DEFAULT) String account,
      @RequestParam("q") @NotBlank String query,
      @RequestParam(name = "t", required = false) @Nullable String type,
      @RequestParam(name = "r", defaultValue = "false") boolean rerank,
      @RequestParam(name = "n", required = false) @Nullable Integer maxResults) {
    Accounts.requireValid(account);
    SearchRequest request =
        new SearchRequest(query, ContentType.parseFilter(type), resultCount(maxResults), rerank);
    return searchService.search(account, request).stream().map(SearchHitResponse::from).toList();
  }

  @GetMapping("/similar")
  public List<SearchHitResponse> similar(
      @RequestHeader(name = Accounts.HEADER, defaultValue = Accounts.DEFAULT) String account,
      @RequestParam("id") @NotBlank String entryId,
      @RequestParam(name = "t", required = false) @Nullable String type,
      @RequestParam(name = "r", defaultValue = "false") boolean rerank,
      @RequestParam(name = "n", required = false) @Nullable Integer maxResults) {
    Accounts.requireValid(account);
    return searchService
        .findSimilar(
            account, entryId, ContentType.parseFilter(type), resultCount(maxResults), rerank)
        .stream()
        .map(SearchHitResponse::from)
        .toList();
  }

  private int resultCount(@Nullable Integer requested) {
    if (requested == null) {
      return searchProperties.getDefaultMaxResults();
    }
    if (requested < 1 || requested > searchProperties.getMaxResultsLimit()) {
      throw new IllegalArgumentException(
          "n must be in [1, " + searchProperties.getMaxResultsLimit() + "], got: " + requested);
    }
    return requested;
  }
}
