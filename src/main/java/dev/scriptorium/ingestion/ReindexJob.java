package dev.scriptorium.ingestion;

import dev.scriptorium.model.ModelProperties;
import dev.scriptorium.model.ModelUnavailableException;
import dev.scriptorium.scheduler.JobContext;
import dev.scriptorium.scheduler.LeadershipLostException;
import dev.scriptorium.scheduler.ScheduledJob;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

/**
 * Re-embeds stored source documents from their compiled text.
 *
 * <p>Documents are visited in id order, one keyset page at a time, and leadership is checked
 * before each one, so a worker that loses its lease stops within one document.
 */
@Component
public class ReindexJob implements ScheduledJob {

  static final String NAME = "reindex";

  private static final Logger log = LoggerFactory.getLogger(ReindexJob.class);

  private final SourceDocumentRepository repository;
  private final IngestionService ingestionService;
  private final ReindexProperties properties;
  private final String embeddingModelId;

  public ReindexJob(
      SourceDocumentRepository repository,
      IngestionService ingestionService,
      ReindexProperties properties,
      ModelProperties modelProperties) {
    this.repository = repository;
    this.ingestionService = ingestionService;
    this.properties = properties;
    this.embeddingModelId = modelProperties.embeddingModelId();
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public Duration defaultInterval() {
    return properties.interval();
  }

  @Override
  public Duration defaultLease() {
    return properties.lease();
  }

  @Override
  public void run(JobContext context) {
    long afterId = 0;
    int reindexed = 0;
    int failed = 0;
    while (true) {
      context.ensureLeadership();
      List<SourceDocument> page = nextPage(afterId);
      if (page.isEmpty()) {
        break;
      }
      for (SourceDocument document : page) {
        context.ensureLeadership();
        try {
          int chunks = ingestionService.reindex(document);
          reindexed++;
          log.debug(
              "Reindexed {}:{} ({} chunks)",
              document.getAccount(),
              document.getSourcePath(),
              chunks);
        } catch (ModelUnavailableException e) {
          if (!context.isLeader()) {
            throw new LeadershipLostException(context.jobName(), context.holder());
          }
          failed++;
          log.warn(
              "Reindex of {}:{} failed: {}",
              document.getAccount(),
              document.getSourcePath(),
              e.getMessage());
        }
        afterId = document.getId();
      }
    }
    log.info(
        "Reindex ({}) complete: {} documents re-embedded, {} failed",
        properties.mode(),
        reindexed,
        failed);
  }

  private List<SourceDocument> nextPage(long afterId) {
    PageRequest page = PageRequest.of(0, properties.pageSize());
    return switch (properties.mode()) {
      case FULL -> repository.findByIdGreaterThanOrderByIdAsc(afterId, page);
      case INCREMENTAL ->
          repository.findByEmbeddingModelNotAndIdGreaterThanOrderByIdAsc(
              embeddingModelId, afterId, page);
    };
  }
}
