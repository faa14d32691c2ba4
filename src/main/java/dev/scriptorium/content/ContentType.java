package dev.scriptorium.content;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Closed set of content types the corpus can hold.
 *
 * <p>Each variant carries its wire value (used in query parameters and index metadata), the file
 * extensions that classify a file as this type, the MIME type sent when uploading it, and its sync
 * priority. Cheaper text content has a lower priority number and is uploaded first.
 */
public enum ContentType {
  MARKDOWN("markdown", List.of("md", "markdown"), "text/markdown", 0),
  ORG("org", List.of("org"), "text/org", 1),
  PLAINTEXT("plaintext", List.of("txt", "text"), "text/plain", 2),
  PDF("pdf", List.of("pdf"), "application/pdf", 3),
  IMAGE("image", List.of("png", "jpg", "jpeg", "webp"), "image/png", 4);

  /** Filter value meaning "every content type". */
  public static final String ALL = "all";

  private final String value;
  private final List<String> extensions;
  private final String defaultMimeType;
  private final int syncPriority;

  ContentType(String value, List<String> extensions, String defaultMimeType, int syncPriority) {
    this.value = value;
    this.extensions = extensions;
    this.defaultMimeType = defaultMimeType;
    this.syncPriority = syncPriority;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public List<String> extensions() {
    return extensions;
  }

  public int syncPriority() {
    return syncPriority;
  }

  /** Whether this type's content is text that can be decoded as UTF-8. */
  public boolean isText() {
    return this == MARKDOWN || this == ORG || this == PLAINTEXT;
  }

  /**
   * MIME type to upload a file with. Images keep their concrete subtype; text types carry a UTF-8
   * charset parameter.
   */
  public String mimeTypeFor(String fileName) {
    if (this == IMAGE) {
      String extension = extensionOf(fileName);
      return switch (extension) {
        case "jpg", "jpeg" -> "image/jpeg";
        case "webp" -> "image/webp";
        default -> defaultMimeType;
      };
    }
    if (isText()) {
      return defaultMimeType + "; charset=UTF-8";
    }
    return defaultMimeType;
  }

  @JsonCreator
  public static ContentType fromValue(String value) {
    for (ContentType type : values()) {
      if (type.value.equalsIgnoreCase(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Invalid content type: " + value);
  }

  /**
   * Parses a content-type filter, treating {@code "all"} (and null/blank) as no filter.
   *
   * @param value the filter value (e.g. "markdown", "PDF", "all", or null)
   * @return the matching ContentType, or null when every type is accepted
   */
  public static @Nullable ContentType parseFilter(@Nullable String value) {
    if (value == null || value.isBlank() || ALL.equalsIgnoreCase(value)) {
      return null;
    }
    return fromValue(value);
  }

  /** Classifies a file by its extension. Empty for unsupported extensions. */
  public static Optional<ContentType> fromFileName(String fileName) {
    String extension = extensionOf(fileName);
    for (ContentType type : values()) {
      if (type.extensions.contains(extension)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }

  /**
   * Classifies an uploaded part. The MIME type wins when it is recognised; otherwise the file name
   * extension decides, and anything else is plain text.
   *
   * @param mimeType the part's MIME type, possibly with parameters such as {@code charset}
   * @param fileName the part's file name (relative path)
   */
  public static ContentType classify(@Nullable String mimeType, String fileName) {
    String baseType = mimeType == null ? "" : stripParameters(mimeType);
    if (baseType.equals("text/markdown") || baseType.equals("text/x-markdown")) {
      return MARKDOWN;
    }
    if (baseType.equals("text/org")) {
      return ORG;
    }
    if (baseType.equals("application/pdf")) {
      return PDF;
    }
    if (baseType.startsWith("image/")) {
      return IMAGE;
    }
    return fromFileName(fileName).orElse(PLAINTEXT);
  }

  /** MIME type for a path, used for deletion entries whose content is gone. */
  public static String mimeTypeForPath(String path) {
    return fromFileName(path).map(type -> type.mimeTypeFor(path)).orElse("text/plain");
  }

  static String stripParameters(String mimeType) {
    int separator = mimeType.indexOf(';');
    String base = separator < 0 ? mimeType : mimeType.substring(0, separator);
    return base.trim().toLowerCase(Locale.ROOT);
  }

  private static String extensionOf(String fileName) {
    int dot = fileName.lastIndexOf('.');
    int slash = fileName.lastIndexOf('/');
    if (dot < 0 || dot < slash) {
      return "";
    }
    return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
  }
}
