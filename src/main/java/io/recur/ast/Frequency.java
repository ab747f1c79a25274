package io.recur.ast;

import java.util.Map;
import java.util.Optional;

/** The base unit a recurrence rule advances by. */
public enum Frequency {
  DAILY("DAILY"),
  WEEKLY("WEEKLY"),
  MONTHLY("MONTHLY"),
  YEARLY("YEARLY");

  private final String token;

  Frequency(String token) {
    this.token = token;
  }

  /**
   * Returns the RRULE token for this frequency.
   *
   * @return the upper-case token, e.g. {@code WEEKLY}
   */
  public String token() {
    return token;
  }

  @Override
  public String toString() {
    return token;
  }

  private static final Map<String, Frequency> PARSE_MAP =
      Map.of("DAILY", DAILY, "WEEKLY", WEEKLY, "MONTHLY", MONTHLY, "YEARLY", YEARLY);

  /**
   * Parses a FREQ value (case insensitive).
   *
   * @param s the string to parse
   * @return the frequency if supported
   */
  public static Optional<Frequency> parse(String s) {
    return Optional.ofNullable(PARSE_MAP.get(s.toUpperCase()));
  }
}
