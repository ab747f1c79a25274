package io.recur.zone;

/** Which instant an ambiguous wall-clock time (DST fall-back overlap) resolves to. */
public enum OverlapPolicy {
  /** The first occurrence of the wall-clock time, i.e. the pre-transition offset. */
  EARLIER,
  /** The second occurrence of the wall-clock time, i.e. the post-transition offset. */
  LATER
}
