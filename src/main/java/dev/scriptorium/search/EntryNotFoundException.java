package dev.scriptorium.search;

/** Thrown when a referenced index entry does not exist for the requesting account. */
public class EntryNotFoundException extends RuntimeException {

  public EntryNotFoundException(String entryId) {
    super("Index entry not found: " + entryId);
  }
}
