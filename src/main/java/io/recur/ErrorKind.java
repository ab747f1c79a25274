package io.recur;

/** The type of error raised while parsing rules, expanding events or booking slots. */
public enum ErrorKind {
  /** Lexer error - invalid characters in RRULE text. */
  LEX("lex"),
  /** Parser error - invalid RRULE syntax or unsupported part. */
  PARSE("parse"),
  /** Both UNTIL and COUNT are set. */
  CONFLICTING_TERMINATORS("conflicting-terminators"),
  /** INTERVAL is less than 1. */
  INVALID_INTERVAL("invalid-interval"),
  /** COUNT is less than 1. */
  INVALID_COUNT("invalid-count"),
  /** BYDAY is present but lists no weekday. */
  EMPTY_BY_WEEKDAY("empty-by-weekday"),
  /** A BYMONTHDAY value lies outside [-31,-1] and [1,31]. */
  INVALID_MONTH_DAY("invalid-month-day"),
  /** A BYMONTH value lies outside [1,12]. */
  INVALID_MONTH("invalid-month"),
  /** A BYDAY ordinal is out of range or not allowed for the frequency. */
  INVALID_ORDINAL("invalid-ordinal"),
  /** Not a recognized IANA timezone identifier. */
  INVALID_TIMEZONE("invalid-timezone"),
  /** The event template is structurally inconsistent. */
  INVALID_TEMPLATE("invalid-template"),
  /** Expansion was requested with no range end, UNTIL or COUNT. */
  UNBOUNDED_EXPANSION("unbounded-expansion"),
  /** A busy interval overlaps the slot at booking time. */
  SLOT_NO_LONGER_FREE("slot-no-longer-free"),
  /** The booking cannot move to the requested status. */
  INVALID_BOOKING_TRANSITION("invalid-booking-transition");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  /**
   * Returns true for the malformed-rule family, which the caller fixes by correcting the rule.
   *
   * @return whether this kind describes a malformed recurrence rule
   */
  public boolean isRuleError() {
    return switch (this) {
      case CONFLICTING_TERMINATORS,
          INVALID_INTERVAL,
          INVALID_COUNT,
          EMPTY_BY_WEEKDAY,
          INVALID_MONTH_DAY,
          INVALID_MONTH,
          INVALID_ORDINAL -> true;
      default -> false;
    };
  }

  @Override
  public String toString() {
    return value;
  }
}
