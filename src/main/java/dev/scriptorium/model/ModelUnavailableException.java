package dev.scriptorium.model;

/**
 * Raised when an embedding or scoring model call fails or exceeds its time budget. Callers report
 * the backend as unavailable instead of returning empty results.
 */
public class ModelUnavailableException extends RuntimeException {

  private final String operation;

  public ModelUnavailableException(String operation, String message, Throwable cause) {
    super(message, cause);
    this.operation = operation;
  }

  public ModelUnavailableException(String operation, String message) {
    super(message);
    this.operation = operation;
  }

  /** Name of the model operation that failed, e.g. {@code "embed query"}. */
  public String getOperation() {
    return operation;
  }
}
