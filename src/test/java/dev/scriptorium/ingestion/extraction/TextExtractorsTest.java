package dev.scriptorium.ingestion.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.scriptorium.content.ContentType;
import dev.scriptorium.fixture.TestPdfs;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class TextExtractorsTest {

  private final TextExtractors extractors = new TextExtractors();

  @Test
  void plainTextDropsByteOrderMarkAndCarriageReturns() throws ExtractionException {
    byte[] content = "\uFEFFline one\r\nline two".getBytes(StandardCharsets.UTF_8);

    assertThat(extractors.extract(ContentType.MARKDOWN, "a.md", content))
        .isEqualTo("line one\nline two");
  }

  @Test
  void pdfPagesAreExtractedInOrder() throws ExtractionException {
    byte[] pdf = TestPdfs.withPages("Quarterly revenue grew", "Outlook remains stable");

    String text = extractors.extract(ContentType.PDF, "reports/q3.pdf", pdf);

    assertThat(text).contains("Quarterly revenue grew").contains("Outlook remains stable");
    assertThat(text.indexOf("Quarterly")).isLessThan(text.indexOf("Outlook"));
  }

  @Test
  void corruptPdfRaisesExtractionException() {
    assertThatThrownBy(() -> extractors.extract(ContentType.PDF, "broken.pdf", TestPdfs.corrupt()))
        .isInstanceOf(ExtractionException.class)
        .hasMessageContaining("broken.pdf");
  }

  @Test
  void imageIsDescribedByFileNameAndFolder() throws ExtractionException {
    assertThat(extractors.extract(ContentType.IMAGE, "trips/2024/beach_sunset-v2.jpg", new byte[] {1}))
        .isEqualTo("beach sunset v2 (image in trips/2024)");
    assertThat(extractors.extract(ContentType.IMAGE, "Whiteboard.PNG", new byte[] {1}))
        .isEqualTo("whiteboard (image)");
  }
}
