package dev.scriptorium.sync;

/** Receives the single summary notice of each sync cycle. */
@FunctionalInterface
public interface SyncNotifier {

  void notify(SyncOutcome outcome);
}
