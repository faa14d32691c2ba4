package dev.scriptorium.config;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.model.scoring.ScoringModel;
import dev.langchain4j.model.scoring.onnx.OnnxScoringModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.pgvector.DefaultMetadataStorageConfig;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore;
import javax.sql.DataSource;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the embedding model, the cross-encoder and the vector store beans.
 *
 * <p>Uses the ONNX-based bge-small-en-v1.5 quantized model (384 dimensions) running in-process,
 * avoiding any external embedding API. The {@link PgVectorEmbeddingStore} shares the application's
 * HikariCP {@link DataSource} to avoid duplicate connection pools.
 *
 * @see dev.scriptorium.search.SearchService
 * @see dev.scriptorium.ingestion.IngestionService
 */
@Configuration
public class EmbeddingConfig {

  /** Embedding dimension of bge-small-en-v1.5; must match the V1 migration's vector column. */
  static final int DIMENSION = 384;

  @Bean
  public EmbeddingModel embeddingModel() {
    return new BgeSmallEnV15QuantizedEmbeddingModel();
  }

  /**
   * Provides the in-process ONNX cross-encoder scoring model (ms-marco-MiniLM-L-6-v2) for reranking
   * search results.
   *
   * @param modelPath path to the ONNX model file
   * @param tokenizerPath path to the tokenizer JSON file
   */
  @Bean
  public ScoringModel scoringModel(
      @Value("${scriptorium.reranker.model-path}") String modelPath,
      @Value("${scriptorium.reranker.tokenizer-path}") String tokenizerPath) {
    return new OnnxScoringModel(modelPath, tokenizerPath);
  }

  /**
   * Configures the pgvector embedding store over the {@code index_entries} table.
   *
   * <p>Schema and HNSW index are managed by Flyway; {@code createTable} and {@code useIndex} are
   * disabled to avoid conflicts. Metadata is stored in a single JSONB column so the account and
   * source-path filters can use the migration's expression indexes.
   */
  @Bean
  public EmbeddingStore<TextSegment> embeddingStore(DataSource dataSource) {
    return PgVectorEmbeddingStore.datasourceBuilder()
        .datasource(dataSource)
        .table("index_entries")
        .dimension(DIMENSION)
        .createTable(false) // Schema managed by Flyway migrations
        .useIndex(false) // HNSW index managed by Flyway V1
        .metadataStorageConfig(DefaultMetadataStorageConfig.combinedJsonb())
        .build();
  }
}
