package io.recur.conflict;

import com.google.common.base.Preconditions;
import io.recur.RecurException;
import io.recur.availability.AvailabilityEngine;
import io.recur.model.ConflictGroup;
import io.recur.model.ConflictKind;
import io.recur.model.ConflictPair;
import io.recur.model.EventPriority;
import io.recur.model.Occurrence;
import io.recur.model.TimeInterval;
import io.recur.model.WorkingHoursRule;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Partitions occurrences into groups of transitively overlapping intervals.
 *
 * <p>Groups are found with a single sweep over the occurrences sorted by start: an occurrence
 * joins the open group while it starts before the latest end seen in that group. Overlap is
 * half-open, so abutting occurrences never conflict.
 *
 * <p>Priorities only annotate groups with a dominant event. The detector never drops or changes
 * an occurrence.
 */
public final class ConflictDetector {
  private static final Logger log = LoggerFactory.getLogger(ConflictDetector.class);

  private final AvailabilityEngine availability;

  /** Creates a detector whose alternatives come from a default availability engine. */
  public ConflictDetector() {
    this(new AvailabilityEngine());
  }

  /**
   * Creates a detector.
   *
   * @param availability the engine used to search for alternative slots
   */
  public ConflictDetector(AvailabilityEngine availability) {
    this.availability = Preconditions.checkNotNull(availability, "'availability' must not be null");
  }

  /**
   * Returns whether two intervals overlap. Symmetric; abutting intervals do not conflict.
   *
   * @param a the first interval
   * @param b the second interval
   * @return true iff {@code a.start < b.end && b.start < a.end}
   */
  public boolean hasConflict(TimeInterval a, TimeInterval b) {
    return a.overlaps(b);
  }

  /**
   * Finds conflict groups without priority annotation.
   *
   * @param occurrences the occurrences to check
   * @param rangeFilter only occurrences overlapping this interval are considered, or null for all
   * @return the groups of two or more members, ordered by earliest start
   */
  public List<ConflictGroup> findConflicts(List<Occurrence> occurrences, TimeInterval rangeFilter) {
    return findConflicts(occurrences, rangeFilter, List.of());
  }

  /**
   * Finds conflict groups and marks each group's dominant event.
   *
   * <p>The dominant event has the highest priority; ties go to the earlier {@code createdAt},
   * then to the earlier input position. Members without a priority never dominate.
   *
   * @param occurrences the occurrences to check
   * @param rangeFilter only occurrences overlapping this interval are considered, or null for all
   * @param priorities priorities by event id, may be empty
   * @return the groups of two or more members, ordered by earliest start
   */
  public List<ConflictGroup> findConflicts(
      List<Occurrence> occurrences, TimeInterval rangeFilter, List<EventPriority> priorities) {
    Preconditions.checkNotNull(occurrences, "'occurrences' must not be null");
    Preconditions.checkNotNull(priorities, "'priorities' must not be null");

    List<Indexed> candidates = new ArrayList<>();
    for (int i = 0; i < occurrences.size(); i++) {
      Occurrence o = occurrences.get(i);
      if (rangeFilter == null || o.interval().overlaps(rangeFilter)) {
        candidates.add(new Indexed(i, o));
      }
    }
    // List.sort is stable, so equal starts keep input order
    candidates.sort(Comparator.comparing(c -> c.occurrence().interval().start()));

    Map<String, EventPriority> byEvent = new HashMap<>();
    for (EventPriority p : priorities) {
      byEvent.put(p.eventId(), p);
    }

    List<ConflictGroup> groups = new ArrayList<>();
    List<Indexed> current = new ArrayList<>();
    Instant maxEnd = null;
    for (Indexed c : candidates) {
      TimeInterval interval = c.occurrence().interval();
      if (maxEnd != null && !interval.start().isBefore(maxEnd)) {
        close(current, maxEnd, byEvent, groups);
        current = new ArrayList<>();
        maxEnd = null;
      }
      current.add(c);
      if (maxEnd == null || interval.end().isAfter(maxEnd)) {
        maxEnd = interval.end();
      }
    }
    if (!current.isEmpty()) {
      close(current, maxEnd, byEvent, groups);
    }

    log.debug(
        "Found {} conflict group(s) among {} occurrence(s)", groups.size(), candidates.size());
    return groups;
  }

  /**
   * Suggests free slots of the same length as an occurrence, closest to its original start first.
   *
   * <p>Every other occurrence counts as busy, and so does the occurrence's own interval, so the
   * conflicting window itself is never suggested.
   *
   * @param occurrenceId the occurrence id, or the source event id of its first occurrence
   * @param occurrences all occurrences in play
   * @param workingHours the working-hour rules; empty means the whole range is working time
   * @param range the range to search
   * @return candidate slots by distance from the original start, ties to the earlier start
   * @throws RecurException with kind INVALID_TIMEZONE if a working-hours timezone is unknown
   * @throws IllegalArgumentException if no occurrence matches the id
   */
  public List<TimeInterval> suggestAlternatives(
      String occurrenceId,
      List<Occurrence> occurrences,
      List<WorkingHoursRule> workingHours,
      TimeInterval range)
      throws RecurException {
    Preconditions.checkNotNull(occurrenceId, "'occurrenceId' must not be null");
    Occurrence target = find(occurrenceId, occurrences);
    Preconditions.checkArgument(target != null, "no occurrence with id '%s'", occurrenceId);

    List<TimeInterval> busy = new ArrayList<>();
    for (Occurrence o : occurrences) {
      busy.add(o.interval());
    }
    Instant original = target.interval().start();
    List<TimeInterval> slots =
        new ArrayList<>(
            availability.findFreeSlots(busy, workingHours, range, target.interval().duration()));
    slots.sort(
        Comparator.comparing((TimeInterval s) -> Duration.between(original, s.start()).abs())
            .thenComparing(TimeInterval::start));
    return slots;
  }

  private static Occurrence find(String id, List<Occurrence> occurrences) {
    for (Occurrence o : occurrences) {
      if (o.id().equals(id)) {
        return o;
      }
    }
    for (Occurrence o : occurrences) {
      if (o.sourceEventId().equals(id)) {
        return o;
      }
    }
    return null;
  }

  private static void close(
      List<Indexed> members,
      Instant maxEnd,
      Map<String, EventPriority> priorities,
      List<ConflictGroup> groups) {
    if (members.size() < 2) {
      return;
    }
    TimeInterval first = members.get(0).occurrence().interval();
    boolean allIdentical = true;
    List<String> ids = new ArrayList<>(members.size());
    List<ConflictPair> pairs = new ArrayList<>();
    for (int i = 0; i < members.size(); i++) {
      Occurrence a = members.get(i).occurrence();
      ids.add(a.id());
      allIdentical &= a.interval().equals(first);
      for (int j = i + 1; j < members.size(); j++) {
        Occurrence b = members.get(j).occurrence();
        if (a.interval().overlaps(b.interval())) {
          ConflictKind kind =
              a.interval().equals(b.interval()) ? ConflictKind.HARD : ConflictKind.SOFT;
          pairs.add(new ConflictPair(a.id(), b.id(), kind));
        }
      }
    }
    ConflictKind kind = allIdentical ? ConflictKind.HARD : ConflictKind.SOFT;
    TimeInterval span = new TimeInterval(first.start(), maxEnd);
    groups.add(new ConflictGroup(ids, kind, pairs, span, dominant(members, priorities)));
  }

  private static String dominant(List<Indexed> members, Map<String, EventPriority> priorities) {
    Indexed best = null;
    EventPriority bestPriority = null;
    for (Indexed m : members) {
      EventPriority p = priorities.get(m.occurrence().sourceEventId());
      if (p == null) {
        continue;
      }
      if (bestPriority == null || outranks(m, p, best, bestPriority)) {
        best = m;
        bestPriority = p;
      }
    }
    return best == null ? null : best.occurrence().sourceEventId();
  }

  private static boolean outranks(Indexed m, EventPriority p, Indexed best, EventPriority bp) {
    if (p.priority() != bp.priority()) {
      return p.priority() > bp.priority();
    }
    if (!p.createdAt().equals(bp.createdAt())) {
      return p.createdAt().isBefore(bp.createdAt());
    }
    return m.index() < best.index();
  }

  private record Indexed(int index, Occurrence occurrence) {}
}
