package io.recur.availability;

import com.google.common.base.Preconditions;
import com.google.common.collect.Range;
import com.google.common.collect.RangeMap;
import com.google.common.collect.RangeSet;
import com.google.common.collect.TreeRangeMap;
import com.google.common.collect.TreeRangeSet;
import io.recur.RecurException;
import io.recur.model.AvailabilityStatus;
import io.recur.model.AvailabilityWindow;
import io.recur.model.Booking;
import io.recur.model.TimeInterval;
import io.recur.model.WorkingHoursRule;
import io.recur.zone.TimezoneResolver;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives free/busy windows from busy intervals and working hours, searches for slots and books
 * them.
 *
 * <h2>Booking races</h2>
 *
 * <p>The engine holds no state between calls, so it cannot lock a slot between reporting it free
 * and booking it. {@link #bookSlot} re-checks the slot against the busy set the caller passes at
 * commit time and fails with {@code SLOT_NO_LONGER_FREE} when something landed there in the
 * meantime. Callers that need a single-booker guarantee serialize their calls or retry with a
 * freshly fetched busy set.
 */
public final class AvailabilityEngine {
  private static final Logger log = LoggerFactory.getLogger(AvailabilityEngine.class);

  private final TimezoneResolver resolver;

  /** Creates an engine over the system resolver. */
  public AvailabilityEngine() {
    this(TimezoneResolver.system());
  }

  /**
   * Creates an engine.
   *
   * @param resolver the resolver used to place working hours on the timeline
   */
  public AvailabilityEngine(TimezoneResolver resolver) {
    this.resolver = Preconditions.checkNotNull(resolver, "'resolver' must not be null");
  }

  /**
   * Computes the free/busy windows of a range.
   *
   * <p>Free time is the part of the working hours not covered by any busy interval. Busy time is
   * every busy interval, clipped to the range. Explicit windows then override that inference for
   * their own span, with {@code OUT_OF_OFFICE > BUSY > TENTATIVE > FREE} where they overlap each
   * other. Time outside working hours that no busy interval or explicit window covers is not
   * reported.
   *
   * @param busyIntervals the busy intervals
   * @param availabilityWindows explicit status windows
   * @param workingHours the working-hour rules; empty means the whole range is working time
   * @param range the range to report on
   * @return windows ordered by start, adjacent windows of equal status coalesced
   * @throws RecurException with kind INVALID_TIMEZONE if a working-hours timezone is unknown
   */
  public List<AvailabilityWindow> getAvailability(
      List<TimeInterval> busyIntervals,
      List<AvailabilityWindow> availabilityWindows,
      List<WorkingHoursRule> workingHours,
      TimeInterval range)
      throws RecurException {
    Preconditions.checkNotNull(busyIntervals, "'busyIntervals' must not be null");
    Preconditions.checkNotNull(availabilityWindows, "'availabilityWindows' must not be null");
    Preconditions.checkNotNull(workingHours, "'workingHours' must not be null");
    Preconditions.checkNotNull(range, "'range' must not be null");

    Range<Instant> bounds = range.toRange();
    RangeSet<Instant> busy = toRangeSet(busyIntervals).subRangeSet(bounds);
    RangeSet<Instant> free = workingTime(workingHours, range);
    free.removeAll(busy);

    RangeMap<Instant, AvailabilityStatus> statuses = TreeRangeMap.create();
    for (Range<Instant> r : free.asRanges()) {
      statuses.putCoalescing(r, AvailabilityStatus.FREE);
    }
    for (Range<Instant> r : busy.asRanges()) {
      statuses.putCoalescing(r, AvailabilityStatus.BUSY);
    }

    List<AvailabilityWindow> explicit = new ArrayList<>(availabilityWindows);
    explicit.sort(Comparator.comparing(AvailabilityWindow::status));
    for (AvailabilityWindow window : explicit) {
      Range<Instant> r = window.interval().toRange();
      if (r.isConnected(bounds) && !r.intersection(bounds).isEmpty()) {
        statuses.putCoalescing(r.intersection(bounds), window.status());
      }
    }

    List<AvailabilityWindow> result = new ArrayList<>();
    for (Map.Entry<Range<Instant>, AvailabilityStatus> e : statuses.asMapOfRanges().entrySet()) {
      result.add(new AvailabilityWindow(TimeInterval.fromRange(e.getKey()), e.getValue()));
    }
    log.debug("Availability over {} has {} window(s)", range, result.size());
    return result;
  }

  /**
   * Finds every free window at least {@code duration} long, clipped to {@code duration} at the
   * window's start.
   *
   * @param busyIntervals the busy intervals
   * @param workingHours the working-hour rules; empty means the whole range is working time
   * @param range the range to search
   * @param duration the requested positive slot length
   * @return candidate slots ordered by start, empty when none fits
   * @throws RecurException with kind INVALID_TIMEZONE if a working-hours timezone is unknown
   */
  public List<TimeInterval> findFreeSlots(
      List<TimeInterval> busyIntervals,
      List<WorkingHoursRule> workingHours,
      TimeInterval range,
      Duration duration)
      throws RecurException {
    return findFreeSlots(busyIntervals, List.of(), workingHours, range, duration);
  }

  /**
   * Finds free slots, honoring explicit availability windows.
   *
   * @param busyIntervals the busy intervals
   * @param availabilityWindows explicit status windows
   * @param workingHours the working-hour rules; empty means the whole range is working time
   * @param range the range to search
   * @param duration the requested positive slot length
   * @return candidate slots ordered by start, empty when none fits
   * @throws RecurException with kind INVALID_TIMEZONE if a working-hours timezone is unknown
   */
  public List<TimeInterval> findFreeSlots(
      List<TimeInterval> busyIntervals,
      List<AvailabilityWindow> availabilityWindows,
      List<WorkingHoursRule> workingHours,
      TimeInterval range,
      Duration duration)
      throws RecurException {
    Preconditions.checkNotNull(duration, "'duration' must not be null");
    Preconditions.checkArgument(
        !duration.isNegative() && !duration.isZero(), "'duration' must be positive");

    List<TimeInterval> slots = new ArrayList<>();
    for (AvailabilityWindow window :
        getAvailability(busyIntervals, availabilityWindows, workingHours, range)) {
      if (window.status() == AvailabilityStatus.FREE
          && window.interval().duration().compareTo(duration) >= 0) {
        slots.add(TimeInterval.of(window.interval().start(), duration));
      }
    }
    log.debug("Found {} free slot(s) of {} in {}", slots.size(), duration, range);
    return slots;
  }

  /**
   * Books a slot after re-checking it against the busy set current at call time.
   *
   * @param slot the slot previously reported free
   * @param busyIntervals the busy intervals fetched immediately before this call
   * @param ownerId who is booking
   * @return a new PENDING booking
   * @throws RecurException with kind SLOT_NO_LONGER_FREE if any busy interval overlaps the slot
   */
  public Booking bookSlot(TimeInterval slot, List<TimeInterval> busyIntervals, String ownerId)
      throws RecurException {
    Preconditions.checkNotNull(slot, "'slot' must not be null");
    Preconditions.checkNotNull(busyIntervals, "'busyIntervals' must not be null");
    Preconditions.checkNotNull(ownerId, "'ownerId' must not be null");

    for (TimeInterval busy : busyIntervals) {
      if (busy.overlaps(slot)) {
        log.warn("Slot {} for {} is no longer free, overlaps {}", slot, ownerId, busy);
        throw RecurException.slotNoLongerFree(
            "slot " + slot.start() + ".." + slot.end() + " overlaps busy interval "
                + busy.start() + ".." + busy.end());
      }
    }
    Booking booking = Booking.pending(slot, ownerId);
    log.info("Booked {} for {}", slot, ownerId);
    return booking;
  }

  private RangeSet<Instant> workingTime(List<WorkingHoursRule> workingHours, TimeInterval range)
      throws RecurException {
    RangeSet<Instant> working = TreeRangeSet.create();
    if (workingHours.isEmpty()) {
      working.add(range.toRange());
      return working;
    }
    for (WorkingHoursRule rule : workingHours) {
      for (TimeInterval window : rule.windows(range.start(), range.end(), resolver)) {
        working.add(window.toRange());
      }
    }
    return TreeRangeSet.create(working.subRangeSet(range.toRange()));
  }

  private static RangeSet<Instant> toRangeSet(List<TimeInterval> intervals) {
    RangeSet<Instant> set = TreeRangeSet.create();
    for (TimeInterval interval : intervals) {
      set.add(interval.toRange());
    }
    return set;
  }
}
