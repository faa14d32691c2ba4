package dev.scriptorium.ingestion.extraction;

/** Thrown when an uploaded file's text cannot be extracted, typically because it is corrupt. */
public class ExtractionException extends Exception {

  public ExtractionException(String message) {
    super(message);
  }

  public ExtractionException(String message, Throwable cause) {
    super(message, cause);
  }
}
