package dev.scriptorium.search;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.filter.Filter;
import dev.scriptorium.content.ContentType;
import dev.scriptorium.index.IndexEntry;
import dev.scriptorium.index.IndexEntryData;
import dev.scriptorium.index.IndexEntryRepository;
import dev.scriptorium.model.ModelCallGuard;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Search orchestration: embed the query, retrieve candidates from the index scoped to the account,
 * optionally rerank them with the cross-encoder, and return the top results.
 *
 * <p>Without rerank the index is asked for exactly {@code maxResults} matches, ordered by
 * similarity. With rerank it over-fetches {@code max(maxResults, rerank-candidates)} matches so the
 * cross-encoder can promote entries the vector search ranked lower.
 */
@Service
public class SearchService {

  private static final Logger log = LoggerFactory.getLogger(SearchService.class);

  /**
   * BGE query prefix recommended by the bge-small-en-v1.5 model documentation. Prepended to search
   * queries (NOT to documents at ingestion time) to improve retrieval relevance.
   */
  static final String BGE_QUERY_PREFIX =
      "Represent this sentence for searching relevant passages: ";

  private final EmbeddingStore<TextSegment> embeddingStore;
  private final EmbeddingModel embeddingModel;
  private final RerankerService rerankerService;
  private final IndexEntryRepository indexEntryRepository;
  private final ModelCallGuard modelCallGuard;
  private final SearchProperties searchProperties;

  public SearchService(
      EmbeddingStore<TextSegment> embeddingStore,
      EmbeddingModel embeddingModel,
      RerankerService rerankerService,
      IndexEntryRepository indexEntryRepository,
      ModelCallGuard modelCallGuard,
      SearchProperties searchProperties) {
    this.embeddingStore = embeddingStore;
    this.embeddingModel = embeddingModel;
    this.rerankerService = rerankerService;
    this.indexEntryRepository = indexEntryRepository;
    this.modelCallGuard = modelCallGuard;
    this.searchProperties = searchProperties;
  }

  /**
   * Searches the account's index.
   *
   * @param account the account whose entries are searched
   * @param request query, filter, result count and rerank flag
   * @return results ordered by rerank score (when reranked) or similarity, at most maxResults
   * @throws dev.scriptorium.model.ModelUnavailableException if a model call fails or times out
   */
  public List<SearchResult> search(String account, SearchRequest request) {
    Embedding queryEmbedding =
        modelCallGuard.call(
            "embed query", () -> embeddingModel.embed(BGE_QUERY_PREFIX + request.query()).content());
    List<EmbeddingMatch<TextSegment>> candidates =
        retrieve(
            queryEmbedding,
            buildFilter(account, request.contentType()),
            candidateCount(request.maxResults(), request.rerank()));
    log.debug(
        "Search for account {} returned {} candidates (rerank={})",
        account,
        candidates.size(),
        request.rerank());
    return rank(request.query(), candidates, request.maxResults(), request.rerank());
  }

  /**
   * Finds entries similar to an existing one, using its text as the query. The reference entry is
   * never part of the results.
   *
   * @param account the account owning the entry
   * @param entryId the reference entry's id
   * @param contentType optional type filter for the results
   * @param maxResults the maximum number of results
   * @param rerank whether to rerank candidates against the reference text
   * @throws EntryNotFoundException if the entry does not exist for this account
   * @throws IllegalArgumentException if the id is not a valid entry id or maxResults is below 1
   */
  public List<SearchResult> findSimilar(
      String account,
      String entryId,
      @Nullable ContentType contentType,
      int maxResults,
      boolean rerank) {
    if (maxResults < 1) {
      throw new IllegalArgumentException("maxResults must be at least 1");
    }
    UUID id = parseEntryId(entryId);
    IndexEntry reference =
        indexEntryRepository
            .findByIdAndAccount(id, account)
            .orElseThrow(() -> new EntryNotFoundException(entryId));

    String text = reference.getText();
    Embedding embedding =
        modelCallGuard.call("embed reference", () -> embeddingModel.embed(text).content());
    // one extra so dropping the reference still leaves enough matches
    List<EmbeddingMatch<TextSegment>> candidates =
        retrieve(
                embedding,
                buildFilter(account, contentType),
                candidateCount(maxResults, rerank) + 1)
            .stream()
            .filter(match -> !id.toString().equals(match.embeddingId()))
            .toList();
    return rank(text, candidates, maxResults, rerank);
  }

  int candidateCount(int maxResults, boolean rerank) {
    return rerank ? Math.max(maxResults, searchProperties.getRerankCandidates()) : maxResults;
  }

  private List<EmbeddingMatch<TextSegment>> retrieve(
      Embedding queryEmbedding, Filter filter, int maxResults) {
    EmbeddingSearchRequest request =
        EmbeddingSearchRequest.builder()
            .queryEmbedding(queryEmbedding)
            .filter(filter)
            .maxResults(maxResults)
            .build();
    return embeddingStore.search(request).matches();
  }

  private List<SearchResult> rank(
      String query, List<EmbeddingMatch<TextSegment>> candidates, int maxResults, boolean rerank) {
    if (rerank) {
      return rerankerService.rerank(query, candidates, maxResults);
    }
    return candidates.stream()
        .map(match -> SearchResult.from(match, null))
        .sorted(Comparator.comparingDouble(SearchResult::score).reversed())
        .limit(maxResults)
        .toList();
  }

  /**
   * Builds the metadata filter: always the account, plus the content type when one is requested.
   */
  static Filter buildFilter(String account, @Nullable ContentType contentType) {
    Filter filter = metadataKey(IndexEntryData.ACCOUNT).isEqualTo(account);
    if (contentType != null) {
      filter = filter.and(metadataKey(IndexEntryData.CONTENT_TYPE).isEqualTo(contentType.value()));
    }
    return filter;
  }

  private static UUID parseEntryId(String entryId) {
    try {
      return UUID.fromString(entryId);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid entry id: " + entryId, e);
    }
  }
}
