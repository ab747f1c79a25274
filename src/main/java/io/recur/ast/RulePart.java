package io.recur.ast;

import java.util.Map;
import java.util.Optional;

/** The RRULE parts this library understands, by their wire names. */
public enum RulePart {
  FREQ,
  UNTIL,
  COUNT,
  INTERVAL,
  BYDAY,
  BYMONTHDAY,
  BYMONTH,
  WKST;

  private static final Map<String, RulePart> PARSE_MAP =
      Map.of(
          "FREQ", FREQ,
          "UNTIL", UNTIL,
          "COUNT", COUNT,
          "INTERVAL", INTERVAL,
          "BYDAY", BYDAY,
          "BYMONTHDAY", BYMONTHDAY,
          "BYMONTH", BYMONTH,
          "WKST", WKST);

  /**
   * Parses a part name (case insensitive).
   *
   * @param s the string to parse
   * @return the part if supported
   */
  public static Optional<RulePart> parse(String s) {
    return Optional.ofNullable(PARSE_MAP.get(s.toUpperCase()));
  }
}
