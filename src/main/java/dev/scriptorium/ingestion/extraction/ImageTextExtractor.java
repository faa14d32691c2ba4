package dev.scriptorium.ingestion.extraction;

import java.util.Locale;

/**
 * Describes an image by its location, since no vision model is available in-process.
 *
 * <p>The text combines the words of the file name with its folder path, e.g. {@code
 * trips/2024/beach-sunset.jpg} becomes {@code "beach sunset (image in trips/2024)"}.
 */
public class ImageTextExtractor implements TextExtractor {

  @Override
  public String extract(String path, byte[] content) {
    int slash = path.lastIndexOf('/');
    String fileName = slash < 0 ? path : path.substring(slash + 1);
    int dot = fileName.lastIndexOf('.');
    String baseName = dot > 0 ? fileName.substring(0, dot) : fileName;
    String words = baseName.replaceAll("[_\\-.]+", " ").trim().toLowerCase(Locale.ROOT);
    if (slash < 0) {
      return words + " (image)";
    }
    return words + " (image in " + path.substring(0, slash) + ")";
  }
}
