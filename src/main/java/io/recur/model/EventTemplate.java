package io.recur.model;

import com.google.common.base.Preconditions;
import io.recur.RecurException;
import io.recur.ast.RecurrenceRule;
import io.recur.parser.Parser;
import io.recur.zone.TimezoneResolver;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The first occurrence of an event in wall-clock terms, plus an optional recurrence.
 *
 * <p>The wall-clock duration {@code endLocal - startLocal} is kept for every generated
 * occurrence, whatever DST transitions the series crosses.
 *
 * @param id the event id
 * @param startLocal the wall-clock start of the first occurrence
 * @param endLocal the wall-clock end of the first occurrence
 * @param timezone the IANA timezone both are expressed in
 * @param recurrence the rule, or null for a single event
 * @param additions extra wall-clock starts outside the rule pattern
 */
public record EventTemplate(
    String id,
    LocalDateTime startLocal,
    LocalDateTime endLocal,
    String timezone,
    RecurrenceRule recurrence,
    List<LocalDateTime> additions) {

  public EventTemplate {
    Preconditions.checkNotNull(id, "'id' must not be null");
    Preconditions.checkNotNull(startLocal, "'startLocal' must not be null");
    Preconditions.checkNotNull(endLocal, "'endLocal' must not be null");
    Preconditions.checkNotNull(timezone, "'timezone' must not be null");
    additions = additions == null ? List.of() : List.copyOf(additions);
  }

  /**
   * Creates a single, non-recurring event.
   *
   * @param id the event id
   * @param startLocal the wall-clock start
   * @param endLocal the wall-clock end
   * @param timezone the IANA timezone
   * @return a new template without recurrence
   */
  public static EventTemplate of(
      String id, LocalDateTime startLocal, LocalDateTime endLocal, String timezone) {
    return new EventTemplate(id, startLocal, endLocal, timezone, null, List.of());
  }

  /**
   * Returns a copy with the specified recurrence.
   *
   * @param recurrence the rule, or null to make the event single
   * @return a new template with the updated recurrence
   */
  public EventTemplate withRecurrence(RecurrenceRule recurrence) {
    return new EventTemplate(id, startLocal, endLocal, timezone, recurrence, additions);
  }

  /**
   * Returns a copy with the specified additional starts.
   *
   * @param additions extra wall-clock starts
   * @return a new template with the updated additions
   */
  public EventTemplate withAdditions(List<LocalDateTime> additions) {
    return new EventTemplate(id, startLocal, endLocal, timezone, recurrence, additions);
  }

  /**
   * Returns whether this template carries a recurrence rule.
   *
   * @return true if recurring
   */
  public boolean isRecurring() {
    return recurrence != null;
  }

  /**
   * Returns the wall-clock length of every occurrence.
   *
   * @return {@code endLocal - startLocal}
   */
  public Duration wallDuration() {
    return Duration.between(startLocal, endLocal);
  }

  /**
   * Converts an object store record into a template, checking the timezone and rule syntax.
   *
   * @param record the record
   * @param resolver the resolver used to validate the timezone
   * @return the template
   * @throws RecurException INVALID_TIMEZONE for an unknown zone, INVALID_TEMPLATE for unreadable
   *     times or dates, LEX or PARSE for malformed RRULE text
   */
  public static EventTemplate fromRecord(EventRecord record, TimezoneResolver resolver)
      throws RecurException {
    if (record.id() == null || record.startTime() == null || record.endTime() == null) {
      throw RecurException.invalidTemplate("record needs id, startTime and endTime", null);
    }
    resolver.resolveZone(record.timezone());

    LocalDateTime start = parseLocal(record.id(), "startTime", record.startTime());
    LocalDateTime end = parseLocal(record.id(), "endTime", record.endTime());

    RecurrenceRule rule = null;
    if (record.rrule() != null && !record.rrule().isEmpty()) {
      Set<LocalDate> exdates = new LinkedHashSet<>();
      for (String exdate : record.exdates()) {
        try {
          exdates.add(LocalDate.parse(exdate));
        } catch (DateTimeParseException e) {
          throw RecurException.invalidTemplate(
              "event '" + record.id() + "' has unreadable exdate '" + exdate + "'", e);
        }
      }
      rule = Parser.parse(record.rrule()).withExceptions(exdates);
    }

    return new EventTemplate(record.id(), start, end, record.timezone(), rule, List.of());
  }

  private static LocalDateTime parseLocal(String id, String field, String value)
      throws RecurException {
    try {
      return LocalDateTime.parse(value);
    } catch (DateTimeParseException e) {
      throw RecurException.invalidTemplate(
          "event '" + id + "' has unreadable " + field + " '" + value + "'", e);
    }
  }
}
