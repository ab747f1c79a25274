package io.recur.zone;

/** How a wall-clock time maps onto the timeline of a zone. */
public enum LocalTimeKind {
  /** Exactly one instant. */
  NORMAL,
  /** No instant: the time was skipped by a spring-forward transition. */
  GAP,
  /** Two instants: the time was repeated by a fall-back transition. */
  OVERLAP
}
