package dev.scriptorium.sync;

import dev.scriptorium.content.ContentType;
import java.nio.file.Path;

/**
 * A file found by the latest scan.
 *
 * @param path root-relative path with {@code /} separators; the file's identity
 * @param contentType type derived from the extension
 * @param modifiedAt last modification time in epoch milliseconds
 * @param size size in bytes
 * @param location absolute location to read the content from
 */
public record TrackedFile(
    String path, ContentType contentType, long modifiedAt, long size, Path location) {}
