package dev.scriptorium.ingestion.extraction;

import dev.scriptorium.content.ContentType;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Extractor table: one {@link TextExtractor} per {@link ContentType}. */
@Component
public class TextExtractors {

  private final Map<ContentType, TextExtractor> extractors = new EnumMap<>(ContentType.class);

  public TextExtractors() {
    TextExtractor plain = new PlainTextExtractor();
    extractors.put(ContentType.MARKDOWN, plain);
    extractors.put(ContentType.ORG, plain);
    extractors.put(ContentType.PLAINTEXT, plain);
    extractors.put(ContentType.PDF, new PdfTextExtractor());
    extractors.put(ContentType.IMAGE, new ImageTextExtractor());
  }

  public String extract(ContentType type, String path, byte[] content)
      throws ExtractionException {
    return extractors.get(type).extract(path, content);
  }
}
