package dev.scriptorium.api;

/**
 * Response of a purge request.
 *
 * @param contentType the purged type, or {@code all}
 * @param removed number of source documents removed
 */
public record PurgeResponse(String contentType, int removed) {}
