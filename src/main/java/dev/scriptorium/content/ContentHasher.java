package dev.scriptorium.content;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Static utility for computing SHA-256 content hashes. The ingestion pipeline compares them to
 * skip unchanged uploads; the image store uses them as file names.
 */
public final class ContentHasher {

  private ContentHasher() {
    // utility class
  }

  /**
   * Compute the SHA-256 hash of raw content bytes.
   *
   * @param content the content to hash
   * @return lowercase hex string of the SHA-256 hash
   */
  public static String sha256(byte[] content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(content));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }

  /** Compute the SHA-256 hash of a string encoded as UTF-8. */
  public static String sha256(String content) {
    return sha256(content.getBytes(StandardCharsets.UTF_8));
  }
}
