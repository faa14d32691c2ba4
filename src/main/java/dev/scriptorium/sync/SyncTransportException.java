package dev.scriptorium.sync;

/** Raised when a request to the content server fails; the current sync cycle stops. */
public class SyncTransportException extends RuntimeException {

  public SyncTransportException(String message, Throwable cause) {
    super(message, cause);
  }

  public SyncTransportException(String message) {
    super(message);
  }
}
