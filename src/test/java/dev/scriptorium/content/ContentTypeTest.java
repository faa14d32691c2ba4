package dev.scriptorium.content;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ContentTypeTest {

  @ParameterizedTest
  @CsvSource({
    "notes/todo.md, MARKDOWN",
    "notes/README.MARKDOWN, MARKDOWN",
    "agenda.org, ORG",
    "log.txt, PLAINTEXT",
    "papers/attention.pdf, PDF",
    "photos/cat.JPG, IMAGE",
    "photos/diagram.webp, IMAGE"
  })
  void fromFileNameClassifiesByExtension(String fileName, ContentType expected) {
    assertThat(ContentType.fromFileName(fileName)).contains(expected);
  }

  @Test
  void fromFileNameIgnoresDotsInFolderNames() {
    assertThat(ContentType.fromFileName("v1.2/Makefile")).isEmpty();
  }

  @Test
  void fromFileNameRejectsUnsupportedExtension() {
    assertThat(ContentType.fromFileName("build.gradle")).isEmpty();
  }

  @Test
  void classifyPrefersRecognisedMimeType() {
    assertThat(ContentType.classify("application/pdf", "scan.txt")).isEqualTo(ContentType.PDF);
    assertThat(ContentType.classify("text/markdown; charset=UTF-8", "a.txt"))
        .isEqualTo(ContentType.MARKDOWN);
    assertThat(ContentType.classify("image/jpeg", "photo")).isEqualTo(ContentType.IMAGE);
  }

  @Test
  void classifyFallsBackToExtensionThenPlainText() {
    assertThat(ContentType.classify("application/octet-stream", "agenda.org"))
        .isEqualTo(ContentType.ORG);
    assertThat(ContentType.classify(null, "notes.md")).isEqualTo(ContentType.MARKDOWN);
    assertThat(ContentType.classify("text/plain", "LICENSE")).isEqualTo(ContentType.PLAINTEXT);
  }

  @Test
  void parseFilterTreatsAllAndBlankAsNoFilter() {
    assertThat(ContentType.parseFilter("all")).isNull();
    assertThat(ContentType.parseFilter("ALL")).isNull();
    assertThat(ContentType.parseFilter(" ")).isNull();
    assertThat(ContentType.parseFilter(null)).isNull();
    assertThat(ContentType.parseFilter("Pdf")).isEqualTo(ContentType.PDF);
  }

  @Test
  void parseFilterRejectsUnknownValue() {
    assertThatThrownBy(() -> ContentType.parseFilter("spreadsheet"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("spreadsheet");
  }

  @Test
  void textTypesUploadWithUtf8Charset() {
    assertThat(ContentType.MARKDOWN.mimeTypeFor("a.md")).isEqualTo("text/markdown; charset=UTF-8");
    assertThat(ContentType.PDF.mimeTypeFor("a.pdf")).isEqualTo("application/pdf");
    assertThat(ContentType.IMAGE.mimeTypeFor("a.jpeg")).isEqualTo("image/jpeg");
    assertThat(ContentType.IMAGE.mimeTypeFor("a.png")).isEqualTo("image/png");
  }

  @Test
  void textIsSyncedBeforePdfAndImages() {
    assertThat(ContentType.MARKDOWN.syncPriority()).isLessThan(ContentType.PDF.syncPriority());
    assertThat(ContentType.PDF.syncPriority()).isLessThan(ContentType.IMAGE.syncPriority());
  }

  @Test
  void mimeTypeForPathDefaultsToPlainText() {
    assertThat(ContentType.mimeTypeForPath("gone/notes.org")).isEqualTo("text/org; charset=UTF-8");
    assertThat(ContentType.mimeTypeForPath("gone/unknown.xyz")).isEqualTo("text/plain");
  }
}
