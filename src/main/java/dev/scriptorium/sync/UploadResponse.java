package dev.scriptorium.sync;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Body of the server's reply to an upload request. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UploadResponse(@Nullable List<FileAck> results, int succeeded, int failed) {

  public List<FileAck> acks() {
    return results == null ? List.of() : results;
  }
}
