package io.recur.ast;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Typed form of an RRULE. Absent parts are null; a BY* list that is present but empty is kept as
 * an empty list so validation can reject it.
 *
 * <p>{@code order} records the sequence in which parts were written so that rendering reproduces
 * parsed text byte for byte. It does not take part in equality.
 *
 * @param frequency the base frequency
 * @param interval the number of frequency units per step (1 when absent)
 * @param byWeekday the BYDAY entries, or null
 * @param byMonthDay the BYMONTHDAY values, or null
 * @param byMonth the BYMONTH values, or null
 * @param until the inclusive UNTIL bound, or null
 * @param count the COUNT bound, or null
 * @param weekStart the WKST value, or null for Monday
 * @param exceptions dates excluded from the generated sequence
 * @param order the rendering order of the parts present in this rule
 */
public record RecurrenceRule(
    Frequency frequency,
    int interval,
    List<WeekdayNum> byWeekday,
    List<Integer> byMonthDay,
    List<Integer> byMonth,
    UntilSpec until,
    Integer count,
    Weekday weekStart,
    Set<LocalDate> exceptions,
    List<RulePart> order) {

  /** Creates a new RecurrenceRule with defensive copies and a normalized part order. */
  public RecurrenceRule {
    Objects.requireNonNull(frequency, "frequency");
    byWeekday = byWeekday == null ? null : List.copyOf(byWeekday);
    byMonthDay = byMonthDay == null ? null : List.copyOf(byMonthDay);
    byMonth = byMonth == null ? null : List.copyOf(byMonth);
    exceptions = exceptions == null ? Set.of() : Set.copyOf(exceptions);
    Set<RulePart> present =
        present(interval, byWeekday, byMonthDay, byMonth, until, count, weekStart, order);
    order = normalizeOrder(order, present);
  }

  /**
   * Creates a rule with just a frequency.
   *
   * @param frequency the base frequency
   * @return a new rule with interval 1 and no other parts
   */
  public static RecurrenceRule of(Frequency frequency) {
    return new RecurrenceRule(frequency, 1, null, null, null, null, null, null, Set.of(), null);
  }

  /**
   * Returns a copy with the specified interval. The INTERVAL part is rendered even when 1.
   *
   * @param interval the interval
   * @return a new rule with the updated interval
   */
  public RecurrenceRule withInterval(int interval) {
    return new RecurrenceRule(
        frequency,
        interval,
        byWeekday,
        byMonthDay,
        byMonth,
        until,
        count,
        weekStart,
        exceptions,
        append(RulePart.INTERVAL));
  }

  /**
   * Returns a copy with the specified count.
   *
   * @param count the count, or null to remove it
   * @return a new rule with the updated count
   */
  public RecurrenceRule withCount(Integer count) {
    return new RecurrenceRule(
        frequency,
        interval,
        byWeekday,
        byMonthDay,
        byMonth,
        until,
        count,
        weekStart,
        exceptions,
        append(RulePart.COUNT));
  }

  /**
   * Returns a copy with the specified until bound.
   *
   * @param until the bound, or null to remove it
   * @return a new rule with the updated bound
   */
  public RecurrenceRule withUntil(UntilSpec until) {
    return new RecurrenceRule(
        frequency,
        interval,
        byWeekday,
        byMonthDay,
        byMonth,
        until,
        count,
        weekStart,
        exceptions,
        append(RulePart.UNTIL));
  }

  /**
   * Returns a copy with the specified BYDAY entries.
   *
   * @param byWeekday the entries, or null to remove the part
   * @return a new rule with the updated entries
   */
  public RecurrenceRule withByWeekday(List<WeekdayNum> byWeekday) {
    return new RecurrenceRule(
        frequency,
        interval,
        byWeekday,
        byMonthDay,
        byMonth,
        until,
        count,
        weekStart,
        exceptions,
        append(RulePart.BYDAY));
  }

  /**
   * Returns a copy with the specified BYMONTHDAY values.
   *
   * @param byMonthDay the values, or null to remove the part
   * @return a new rule with the updated values
   */
  public RecurrenceRule withByMonthDay(List<Integer> byMonthDay) {
    return new RecurrenceRule(
        frequency,
        interval,
        byWeekday,
        byMonthDay,
        byMonth,
        until,
        count,
        weekStart,
        exceptions,
        append(RulePart.BYMONTHDAY));
  }

  /**
   * Returns a copy with the specified BYMONTH values.
   *
   * @param byMonth the values, or null to remove the part
   * @return a new rule with the updated values
   */
  public RecurrenceRule withByMonth(List<Integer> byMonth) {
    return new RecurrenceRule(
        frequency,
        interval,
        byWeekday,
        byMonthDay,
        byMonth,
        until,
        count,
        weekStart,
        exceptions,
        append(RulePart.BYMONTH));
  }

  /**
   * Returns a copy with the specified week start.
   *
   * @param weekStart the week start, or null to remove the part
   * @return a new rule with the updated week start
   */
  public RecurrenceRule withWeekStart(Weekday weekStart) {
    return new RecurrenceRule(
        frequency,
        interval,
        byWeekday,
        byMonthDay,
        byMonth,
        until,
        count,
        weekStart,
        exceptions,
        append(RulePart.WKST));
  }

  /**
   * Returns a copy with the specified exception dates.
   *
   * @param exceptions the dates to exclude
   * @return a new rule with the updated exceptions
   */
  public RecurrenceRule withExceptions(Set<LocalDate> exceptions) {
    return new RecurrenceRule(
        frequency,
        interval,
        byWeekday,
        byMonthDay,
        byMonth,
        until,
        count,
        weekStart,
        exceptions,
        order);
  }

  /**
   * Returns the week start, defaulting to Monday.
   *
   * @return the effective week start
   */
  public Weekday effectiveWeekStart() {
    return weekStart == null ? Weekday.MO : weekStart;
  }

  /**
   * Returns whether generation stops by itself through UNTIL or COUNT.
   *
   * @return true if the rule is bounded
   */
  public boolean isBounded() {
    return until != null || count != null;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RecurrenceRule other)) {
      return false;
    }
    return frequency == other.frequency
        && interval == other.interval
        && Objects.equals(byWeekday, other.byWeekday)
        && Objects.equals(byMonthDay, other.byMonthDay)
        && Objects.equals(byMonth, other.byMonth)
        && Objects.equals(until, other.until)
        && Objects.equals(count, other.count)
        && Objects.equals(weekStart, other.weekStart)
        && exceptions.equals(other.exceptions);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        frequency, interval, byWeekday, byMonthDay, byMonth, until, count, weekStart, exceptions);
  }

  private List<RulePart> append(RulePart part) {
    List<RulePart> next = new ArrayList<>(order);
    if (!next.contains(part)) {
      next.add(part);
    }
    return next;
  }

  private static Set<RulePart> present(
      int interval,
      List<WeekdayNum> byWeekday,
      List<Integer> byMonthDay,
      List<Integer> byMonth,
      UntilSpec until,
      Integer count,
      Weekday weekStart,
      List<RulePart> order) {
    Set<RulePart> parts = EnumSet.of(RulePart.FREQ);
    if (interval != 1 || (order != null && order.contains(RulePart.INTERVAL))) {
      parts.add(RulePart.INTERVAL);
    }
    if (byWeekday != null) {
      parts.add(RulePart.BYDAY);
    }
    if (byMonthDay != null) {
      parts.add(RulePart.BYMONTHDAY);
    }
    if (byMonth != null) {
      parts.add(RulePart.BYMONTH);
    }
    if (until != null) {
      parts.add(RulePart.UNTIL);
    }
    if (count != null) {
      parts.add(RulePart.COUNT);
    }
    if (weekStart != null) {
      parts.add(RulePart.WKST);
    }
    return parts;
  }

  /** Keeps the given order for present parts, then appends any others in declaration order. */
  private static List<RulePart> normalizeOrder(List<RulePart> order, Set<RulePart> present) {
    List<RulePart> result = new ArrayList<>(present.size());
    if (order != null) {
      for (RulePart part : order) {
        if (present.contains(part) && !result.contains(part)) {
          result.add(part);
        }
      }
    }
    for (RulePart part : present) {
      if (!result.contains(part)) {
        result.add(part);
      }
    }
    return List.copyOf(result);
  }
}
