package io.recur.ast;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;

/**
 * Represents an UNTIL bound. The bound is inclusive on occurrence start.
 *
 * @param kind the form the bound was written in
 * @param date the date part
 * @param time the time part (null for DATE)
 */
public record UntilSpec(Kind kind, LocalDate date, LocalTime time) {

  /** The form of an UNTIL value. */
  public enum Kind {
    /** A date, e.g. 20261231. */
    DATE,
    /** A local date-time without zone, e.g. 20261231T090000. */
    FLOATING,
    /** A UTC date-time, e.g. 20261231T090000Z. */
    UTC
  }

  /**
   * Creates a date-only bound.
   *
   * @param date the last date an occurrence may start on
   * @return a new DATE until specification
   */
  public static UntilSpec date(LocalDate date) {
    return new UntilSpec(Kind.DATE, date, null);
  }

  /**
   * Creates a floating date-time bound, compared against occurrence wall-clock starts.
   *
   * @param dateTime the last local start
   * @return a new FLOATING until specification
   */
  public static UntilSpec floating(LocalDateTime dateTime) {
    return new UntilSpec(Kind.FLOATING, dateTime.toLocalDate(), dateTime.toLocalTime());
  }

  /**
   * Creates a UTC date-time bound, compared against occurrence instants.
   *
   * @param instant the last start instant
   * @return a new UTC until specification
   */
  public static UntilSpec utc(Instant instant) {
    LocalDateTime ldt = LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    return new UntilSpec(Kind.UTC, ldt.toLocalDate(), ldt.toLocalTime());
  }

  /**
   * Returns the bound as a local date-time (DATE bounds extend to the end of the day).
   *
   * @return the latest permitted local start
   */
  public LocalDateTime toLocalDateTime() {
    return time == null ? date.atTime(LocalTime.MAX) : date.atTime(time);
  }

  /**
   * Returns the bound as an instant. Only meaningful for {@link Kind#UTC}.
   *
   * @return the latest permitted start instant
   */
  public Instant toInstant() {
    return toLocalDateTime().toInstant(ZoneOffset.UTC);
  }
}
