package dev.scriptorium.fixture;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

/** Builds small PDFs in memory for extraction and ingestion tests. */
public final class TestPdfs {

  private TestPdfs() {}

  /** One page per argument, each holding a single line of Helvetica text. */
  public static byte[] withPages(String... pageTexts) {
    try (PDDocument document = new PDDocument();
        ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
      for (String text : pageTexts) {
        PDPage page = new PDPage();
        document.addPage(page);
        try (PDPageContentStream stream = new PDPageContentStream(document, page)) {
          stream.beginText();
          stream.setFont(font, 12);
          stream.newLineAtOffset(72, 700);
          stream.showText(text);
          stream.endText();
        }
      }
      document.save(out);
      return out.toByteArray();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Bytes that start like a PDF but are not one. */
  public static byte[] corrupt() {
    return "%PDF-1.7\nthis is not really a pdf".getBytes(StandardCharsets.US_ASCII);
  }
}
