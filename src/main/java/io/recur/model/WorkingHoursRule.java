package io.recur.model;

import com.google.common.base.Preconditions;
import io.recur.RecurException;
import io.recur.zone.TimezoneResolver;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Daily working hours on selected weekdays, interpreted in a timezone.
 *
 * @param dailyStart the local start of the working day
 * @param dailyEnd the local end of the working day, after dailyStart
 * @param daysOfWeek the weekdays the hours apply on
 * @param timezone the IANA timezone the hours are expressed in
 */
public record WorkingHoursRule(
    LocalTime dailyStart, LocalTime dailyEnd, Set<DayOfWeek> daysOfWeek, String timezone) {

  public WorkingHoursRule {
    Preconditions.checkNotNull(dailyStart, "'dailyStart' must not be null");
    Preconditions.checkNotNull(dailyEnd, "'dailyEnd' must not be null");
    Preconditions.checkNotNull(daysOfWeek, "'daysOfWeek' must not be null");
    Preconditions.checkNotNull(timezone, "'timezone' must not be null");
    Preconditions.checkArgument(
        dailyStart.isBefore(dailyEnd), "'dailyStart' must be before 'dailyEnd'");
    daysOfWeek = Set.copyOf(daysOfWeek);
  }

  /**
   * Expands the rule into absolute working windows touching {@code [from, to)}. Windows are not
   * clipped to the range.
   *
   * @param from the range start
   * @param to the range end
   * @param resolver the resolver for wall-clock conversion
   * @return working windows ordered by start
   * @throws RecurException with kind INVALID_TIMEZONE if the timezone is unknown
   */
  public List<TimeInterval> windows(Instant from, Instant to, TimezoneResolver resolver)
      throws RecurException {
    ZoneId zone = resolver.resolveZone(timezone);
    LocalDate firstDate = resolver.toLocal(from, zone).toLocalDate();
    LocalDate lastDate = resolver.toLocal(to, zone).toLocalDate();

    List<TimeInterval> result = new ArrayList<>();
    for (LocalDate date = firstDate; !date.isAfter(lastDate); date = date.plusDays(1)) {
      if (!daysOfWeek.contains(date.getDayOfWeek())) {
        continue;
      }
      Instant start = resolver.toInstant(date.atTime(dailyStart), zone);
      Instant end = resolver.toInstant(date.atTime(dailyEnd), zone);
      // both ends can land in the same DST gap
      if (start.isBefore(end)) {
        result.add(new TimeInterval(start, end));
      }
    }
    return result;
  }
}
