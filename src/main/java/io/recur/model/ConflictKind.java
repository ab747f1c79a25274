package io.recur.model;

/** Whether two overlapping occurrences share the exact same span. */
public enum ConflictKind {
  /** Identical start and end. */
  HARD,
  /** Overlapping but not identical. */
  SOFT
}
