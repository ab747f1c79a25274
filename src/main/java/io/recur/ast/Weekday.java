package io.recur.ast;

import java.time.DayOfWeek;
import java.util.Map;
import java.util.Optional;

/** Represents a day of the week by its two-letter RRULE code. */
public enum Weekday {
  MO(DayOfWeek.MONDAY),
  TU(DayOfWeek.TUESDAY),
  WE(DayOfWeek.WEDNESDAY),
  TH(DayOfWeek.THURSDAY),
  FR(DayOfWeek.FRIDAY),
  SA(DayOfWeek.SATURDAY),
  SU(DayOfWeek.SUNDAY);

  private final DayOfWeek dayOfWeek;

  Weekday(DayOfWeek dayOfWeek) {
    this.dayOfWeek = dayOfWeek;
  }

  /**
   * Returns the ISO 8601 day number (Monday=1, Sunday=7).
   *
   * @return the ISO day number
   */
  public int number() {
    return dayOfWeek.getValue();
  }

  /**
   * Converts this Weekday to a java.time.DayOfWeek.
   *
   * @return the corresponding DayOfWeek
   */
  public DayOfWeek toDayOfWeek() {
    return dayOfWeek;
  }

  private static final Map<String, Weekday> PARSE_MAP =
      Map.of("MO", MO, "TU", TU, "WE", WE, "TH", TH, "FR", FR, "SA", SA, "SU", SU);

  /**
   * Parses a two-letter weekday code (case insensitive).
   *
   * @param s the string to parse
   * @return the weekday if valid
   */
  public static Optional<Weekday> parse(String s) {
    return Optional.ofNullable(PARSE_MAP.get(s.toUpperCase()));
  }

  /**
   * Returns a Weekday from a java.time.DayOfWeek.
   *
   * @param dow the DayOfWeek
   * @return the corresponding Weekday
   */
  public static Weekday fromDayOfWeek(DayOfWeek dow) {
    return values()[dow.getValue() - 1];
  }
}
