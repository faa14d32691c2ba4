package dev.scriptorium.ingestion.extraction;

/** Turns the raw bytes of one uploaded file into indexable text. */
@FunctionalInterface
public interface TextExtractor {

  /**
   * Extracts text from a file.
   *
   * @param path the file's relative path
   * @param content the file's bytes, never empty
   * @return the extracted text, possibly blank
   * @throws ExtractionException if the content cannot be read as this type
   */
  String extract(String path, byte[] content) throws ExtractionException;
}
