package dev.scriptorium.sync;

import dev.scriptorium.content.ContentType;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Client of the server's content API.
 *
 * <p>Each {@link UploadBatch} becomes one multipart request whose parts are all named {@code files},
 * each carrying the file's relative path as its filename. File content is streamed from disk; a
 * file that can no longer be read is left out of the request and picked up by the next scan.
 * Connection-level failures are retried with backoff; an HTTP 429 is never retried here and
 * surfaces as {@link SyncThrottledException}. Interrupting the calling thread aborts the request in
 * flight and any further attempt.
 */
public class ContentApiClient {

  private static final Logger log = LoggerFactory.getLogger(ContentApiClient.class);

  static final String ACCOUNT_HEADER = "X-Scriptorium-Account";
  static final String PART_NAME = "files";
  static final Duration DEFAULT_RETRY_AFTER = Duration.ofMinutes(1);

  private final RestClient restClient;
  private final RetryTemplate retryTemplate;
  private final String account;
  private final String clientId;
  private final Clock clock;

  public ContentApiClient(
      RestClient restClient,
      RetryTemplate retryTemplate,
      String account,
      String clientId,
      Clock clock) {
    this.restClient = restClient;
    this.retryTemplate = retryTemplate;
    this.account = account;
    this.clientId = clientId;
    this.clock = clock;
  }

  /**
   * Sends one batch.
   *
   * @param batch the items to send
   * @param force ask the server to re-index unchanged files ({@code PUT} instead of {@code PATCH})
   * @return the server's per-file acknowledgements
   * @throws SyncThrottledException if the server rate-limited the request
   * @throws SyncTransportException if the request failed
   */
  public UploadResponse upload(UploadBatch batch, boolean force) {
    MultiValueMap<String, HttpEntity<?>> body = multipartBody(batch);
    int parts = body.getOrDefault(PART_NAME, List.of()).size();
    if (parts == 0) {
      return new UploadResponse(List.of(), 0, 0);
    }
    HttpMethod method = force ? HttpMethod.PUT : HttpMethod.PATCH;
    UploadResponse response =
        execute(
            "upload of " + parts + " files",
            () ->
                restClient
                    .method(method)
                    .uri(
                        builder ->
                            builder
                                .path("/api/content")
                                .queryParam("type", ContentType.ALL)
                                .queryParam("client", clientId)
                                .build())
                    .header(ACCOUNT_HEADER, account)
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(body)
                    .retrieve()
                    .onStatus(
                        status -> status.value() == HttpStatus.TOO_MANY_REQUESTS.value(),
                        (request, reply) -> {
                          throw new SyncThrottledException(
                              retryAfter(reply.getHeaders(), clock));
                        })
                    .body(UploadResponse.class));
    if (response == null) {
      throw new SyncTransportException("Server returned an empty upload response");
    }
    return response;
  }

  /**
   * Removes every indexed file of one type for this account.
   *
   * @throws SyncThrottledException if the server rate-limited the request
   * @throws SyncTransportException if the request failed
   */
  public void purge(ContentType type) {
    execute(
        "purge of " + type.value(),
        () ->
            restClient
                .delete()
                .uri(
                    builder ->
                        builder
                            .path("/api/content/type/{type}")
                            .queryParam("client", clientId)
                            .build(type.value()))
                .header(ACCOUNT_HEADER, account)
                .retrieve()
                .onStatus(
                    status -> status.value() == HttpStatus.TOO_MANY_REQUESTS.value(),
                    (request, reply) -> {
                      throw new SyncThrottledException(retryAfter(reply.getHeaders(), clock));
                    })
                .toBodilessEntity());
  }

  private <T> T execute(String description, Supplier<T> call) {
    try {
      return retryTemplate.execute(
          context -> {
            if (Thread.currentThread().isInterrupted()) {
              throw new SyncTransportException(description + " interrupted");
            }
            if (context.getRetryCount() > 0) {
              log.info("Retrying {} (attempt {})", description, context.getRetryCount() + 1);
            }
            return call.get();
          });
    } catch (SyncThrottledException e) {
      throw e;
    } catch (BackOffInterruptedException e) {
      throw new SyncTransportException(description + " interrupted", e);
    } catch (ResourceAccessException e) {
      throw new SyncTransportException("Server unreachable during " + description, e);
    } catch (RestClientResponseException e) {
      throw new SyncTransportException(
          "Server rejected " + description + " with status " + e.getStatusCode().value(), e);
    } catch (RestClientException e) {
      throw new SyncTransportException(description + " failed: " + e.getMessage(), e);
    }
  }

  static MultiValueMap<String, HttpEntity<?>> multipartBody(UploadBatch batch) {
    MultiValueMap<String, HttpEntity<?>> body = new LinkedMultiValueMap<>();
    for (UploadItem item : batch.items()) {
      Path source = item.source();
      Resource content;
      if (source == null) {
        content = new ByteArrayResource(new byte[0]);
      } else if (Files.isReadable(source)) {
        content = new FileSystemResource(source);
      } else {
        log.warn("{} is no longer readable, leaving it out of this upload", item.path());
        continue;
      }
      HttpHeaders headers = new HttpHeaders();
      headers.setContentDisposition(
          ContentDisposition.formData().name(PART_NAME).filename(item.path()).build());
      headers.setContentType(MediaType.parseMediaType(item.mimeType()));
      body.add(PART_NAME, new HttpEntity<>(content, headers));
    }
    return body;
  }

  /** Parses {@code Retry-After} as delta-seconds or an HTTP date. */
  static Duration retryAfter(HttpHeaders headers, Clock clock) {
    String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
    if (value == null || value.isBlank()) {
      return DEFAULT_RETRY_AFTER;
    }
    try {
      return Duration.ofSeconds(Math.max(0, Long.parseLong(value.trim())));
    } catch (NumberFormatException e) {
      try {
        ZonedDateTime at = ZonedDateTime.parse(value.trim(), DateTimeFormatter.RFC_1123_DATE_TIME);
        Duration until = Duration.between(clock.instant(), at.toInstant());
        return until.isNegative() ? Duration.ZERO : until;
      } catch (DateTimeParseException unparseable) {
        log.debug("Unparseable Retry-After header '{}'", value);
        return DEFAULT_RETRY_AFTER;
      }
    }
  }
}
