package io.recur.model;

import java.util.List;
import java.util.Optional;

/**
 * A transitively-closed set of overlapping occurrences.
 *
 * @param members occurrence ids ordered by start, then input position
 * @param kind HARD when every member has the same span, SOFT otherwise
 * @param pairs every directly overlapping pair within the group
 * @param span the union of the members' intervals
 * @param dominant the advisory dominant event id, or null when no priorities were supplied
 */
public record ConflictGroup(
    List<String> members,
    ConflictKind kind,
    List<ConflictPair> pairs,
    TimeInterval span,
    String dominant) {

  public ConflictGroup {
    members = List.copyOf(members);
    pairs = List.copyOf(pairs);
  }

  /**
   * Returns the advisory dominant event, if priorities were supplied.
   *
   * @return the event id with the highest priority
   */
  public Optional<String> dominantEventId() {
    return Optional.ofNullable(dominant);
  }
}
