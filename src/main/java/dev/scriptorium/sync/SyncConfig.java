package dev.scriptorium.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.http.HttpClient;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

/**
 * Wires the sync client when {@code scriptorium.sync.enabled=true}.
 *
 * <p>The JDK request factory is used because the simple factory cannot send {@code PATCH}.
 */
@Configuration
@ConditionalOnProperty(prefix = "scriptorium.sync", name = "enabled", havingValue = "true")
public class SyncConfig {

  @Bean
  public RestClient syncRestClient(RestClient.Builder builder, SyncProperties properties) {
    HttpClient httpClient =
        HttpClient.newBuilder().connectTimeout(properties.connectTimeout()).build();
    var requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.baseUrl(properties.serverUrl()).requestFactory(requestFactory).build();
  }

  @Bean
  public RetryTemplate syncRetryTemplate(SyncProperties properties) {
    SyncProperties.Retry retry = properties.retry();
    return RetryTemplate.builder()
        .maxAttempts(retry.maxAttempts())
        .exponentialBackoff(
            retry.delay().toMillis(),
            retry.multiplier(),
            retry.delay().toMillis() * (long) Math.pow(retry.multiplier(), retry.maxAttempts()))
        .retryOn(ResourceAccessException.class)
        .build();
  }

  @Bean
  public ContentApiClient contentApiClient(
      RestClient syncRestClient,
      RetryTemplate syncRetryTemplate,
      SyncProperties properties,
      Clock clock) {
    return new ContentApiClient(
        syncRestClient, syncRetryTemplate, properties.account(), properties.clientId(), clock);
  }

  @Bean
  public SyncCursorStore syncCursorStore(SyncProperties properties, ObjectMapper objectMapper) {
    return new SyncCursorStore(properties.cursorFile(), objectMapper);
  }

  @Bean
  public ChangeDetector changeDetector() {
    return new ChangeDetector();
  }

  @Bean
  @ConditionalOnMissingBean
  public SyncNotifier syncNotifier() {
    return new LoggingSyncNotifier();
  }

  @Bean
  public SyncService syncService(
      ChangeDetector changeDetector,
      SyncCursorStore syncCursorStore,
      ContentApiClient contentApiClient,
      SyncNotifier syncNotifier,
      SyncProperties properties,
      Clock clock) {
    return new SyncService(
        changeDetector, syncCursorStore, contentApiClient, syncNotifier, properties, clock);
  }

  @Bean
  public SyncScheduler syncScheduler(
      SyncService syncService, TaskScheduler taskScheduler, SyncProperties properties) {
    return new SyncScheduler(syncService, taskScheduler, properties.interval());
  }
}
