package dev.scriptorium.search;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.scoring.ScoringModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.scriptorium.model.ModelCallGuard;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;
import org.springframework.stereotype.Service;

/**
 * Cross-encoder reranking service that re-scores search candidates using an ONNX-based scoring
 * model (ms-marco-MiniLM-L-6-v2).
 *
 * <p>Scores each query-passage pair, then returns results sorted by reranking score descending,
 * ties broken by vector similarity descending.
 *
 * <p>The scoring call runs through {@link ModelCallGuard}; a failing or slow model surfaces as
 * {@link dev.scriptorium.model.ModelUnavailableException} (no silent fallback).
 */
@Service
public class RerankerService {

  static final Comparator<SearchResult> BY_RERANK_THEN_SIMILARITY =
      Comparator.comparingDouble((SearchResult r) -> r.rerankScore() == null ? 0 : r.rerankScore())
          .thenComparingDouble(SearchResult::score)
          .reversed();

  private final ScoringModel scoringModel;
  private final ModelCallGuard modelCallGuard;

  public RerankerService(ScoringModel scoringModel, ModelCallGuard modelCallGuard) {
    this.scoringModel = scoringModel;
    this.modelCallGuard = modelCallGuard;
  }

  /**
   * Reranks search candidates using the cross-encoder scoring model.
   *
   * @param query the original search query text
   * @param candidates vector search candidates to rerank
   * @param maxResults maximum number of results to return after reranking
   * @return search results sorted by reranking score descending, limited to maxResults
   */
  public List<SearchResult> rerank(
      String query, List<EmbeddingMatch<TextSegment>> candidates, int maxResults) {
    if (candidates.isEmpty()) {
      return List.of();
    }

    List<TextSegment> segments = candidates.stream().map(EmbeddingMatch::embedded).toList();
    List<Double> scores =
        modelCallGuard.call("rerank", () -> scoringModel.scoreAll(segments, query).content());

    return IntStream.range(0, candidates.size())
        .mapToObj(i -> SearchResult.from(candidates.get(i), scores.get(i)))
        .sorted(BY_RERANK_THEN_SIMILARITY)
        .limit(maxResults)
        .toList();
  }
}
