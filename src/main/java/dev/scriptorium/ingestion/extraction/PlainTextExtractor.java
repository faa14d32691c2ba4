package dev.scriptorium.ingestion.extraction;

import java.nio.charset.StandardCharsets;

/**
 * Decodes text content as UTF-8. Malformed sequences are replaced rather than rejected, and a
 * leading byte order mark is dropped.
 */
public class PlainTextExtractor implements TextExtractor {

  private static final char BOM = '\uFEFF';

  @Override
  public String extract(String path, byte[] content) {
    String text = new String(content, StandardCharsets.UTF_8);
    if (!text.isEmpty() && text.charAt(0) == BOM) {
      text = text.substring(1);
    }
    return text.replace("\r\n", "\n");
  }
}
