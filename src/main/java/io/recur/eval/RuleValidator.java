package io.recur.eval;

import io.recur.ErrorKind;
import io.recur.RecurException;
import io.recur.ast.Frequency;
import io.recur.ast.RecurrenceRule;
import io.recur.ast.WeekdayNum;

/** Semantic checks on a parsed or hand-built rule. Never corrects a rule, only rejects it. */
public final class RuleValidator {
  private RuleValidator() {}

  /**
   * Checks the rule and throws on the first problem found.
   *
   * @param rule the rule to check
   * @throws RecurException with a rule error kind describing the problem
   */
  public static void validate(RecurrenceRule rule) throws RecurException {
    if (rule.until() != null && rule.count() != null) {
      throw RecurException.rule(
          ErrorKind.CONFLICTING_TERMINATORS, "UNTIL and COUNT must not both be set");
    }
    if (rule.interval() < 1) {
      throw RecurException.rule(
          ErrorKind.INVALID_INTERVAL, "INTERVAL must be at least 1, found " + rule.interval());
    }
    if (rule.count() != null && rule.count() < 1) {
      throw RecurException.rule(
          ErrorKind.INVALID_COUNT, "COUNT must be at least 1, found " + rule.count());
    }
    if (rule.byWeekday() != null) {
      if (rule.byWeekday().isEmpty()) {
        throw RecurException.rule(ErrorKind.EMPTY_BY_WEEKDAY, "BYDAY lists no weekday");
      }
      for (WeekdayNum day : rule.byWeekday()) {
        checkOrdinal(rule, day);
      }
    }
    if (rule.byMonthDay() != null) {
      if (rule.byMonthDay().isEmpty()) {
        throw RecurException.rule(ErrorKind.INVALID_MONTH_DAY, "BYMONTHDAY lists no day");
      }
      for (int day : rule.byMonthDay()) {
        if (day == 0 || day < -31 || day > 31) {
          throw RecurException.rule(
              ErrorKind.INVALID_MONTH_DAY, "BYMONTHDAY value " + day + " is outside 1..31");
        }
      }
    }
    if (rule.byMonth() != null) {
      if (rule.byMonth().isEmpty()) {
        throw RecurException.rule(ErrorKind.INVALID_MONTH, "BYMONTH lists no month");
      }
      for (int month : rule.byMonth()) {
        if (month < 1 || month > 12) {
          throw RecurException.rule(
              ErrorKind.INVALID_MONTH, "BYMONTH value " + month + " is outside 1..12");
        }
      }
    }
  }

  /**
   * Checks a rule and reports success as a boolean.
   *
   * @param rule the rule to check
   * @return true if {@link #validate} would not throw
   */
  public static boolean isValid(RecurrenceRule rule) {
    try {
      validate(rule);
      return true;
    } catch (RecurException e) {
      return false;
    }
  }

  private static void checkOrdinal(RecurrenceRule rule, WeekdayNum day) throws RecurException {
    if (!day.hasOrdinal()) {
      return;
    }
    Frequency freq = rule.frequency();
    if (freq == Frequency.DAILY || freq == Frequency.WEEKLY) {
      throw RecurException.rule(
          ErrorKind.INVALID_ORDINAL, "BYDAY ordinal " + day + " is not allowed with FREQ=" + freq);
    }
    // yearly rules without BYMONTH count weekdays through the whole year
    int limit = freq == Frequency.YEARLY && rule.byMonth() == null ? 53 : 5;
    if (Math.abs(day.ordinal()) > limit) {
      throw RecurException.rule(
          ErrorKind.INVALID_ORDINAL,
          "BYDAY ordinal " + day + " is outside -" + limit + ".." + limit);
    }
  }
}
