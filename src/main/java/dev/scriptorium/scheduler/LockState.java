package dev.scriptorium.scheduler;

/** Derived state of a job lock at a point in time. */
public enum LockState {
  UNLOCKED,
  HELD,
  EXPIRED
}
