package io.recur.display;

import io.recur.ast.RecurrenceRule;
import io.recur.ast.RulePart;
import io.recur.ast.UntilSpec;
import io.recur.ast.WeekdayNum;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

/** Renders recurrence rules as RRULE text. */
public final class Display {
  private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("uuuuMMdd");
  private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HHmmss");

  private Display() {}

  /**
   * Renders a rule as RRULE text, emitting parts in the order recorded on the rule. Exception
   * dates are not part of RRULE and are not rendered.
   *
   * @param rule the rule to render
   * @return the RRULE value, e.g. {@code FREQ=WEEKLY;BYDAY=MO;COUNT=3}
   */
  public static String render(RecurrenceRule rule) {
    StringBuilder sb = new StringBuilder();
    for (RulePart part : rule.order()) {
      if (sb.length() > 0) {
        sb.append(';');
      }
      sb.append(part.name()).append('=').append(renderValue(rule, part));
    }
    return sb.toString();
  }

  private static String renderValue(RecurrenceRule rule, RulePart part) {
    return switch (part) {
      case FREQ -> rule.frequency().token();
      case INTERVAL -> Integer.toString(rule.interval());
      case COUNT -> Integer.toString(rule.count());
      case UNTIL -> renderUntil(rule.until());
      case WKST -> rule.weekStart().name();
      case BYDAY -> renderWeekdays(rule.byWeekday());
      case BYMONTHDAY -> joinInts(rule.byMonthDay());
      case BYMONTH -> joinInts(rule.byMonth());
    };
  }

  /**
   * Renders an UNTIL value in the form it was written.
   *
   * @param until the bound
   * @return the RRULE date or date-time text
   */
  public static String renderUntil(UntilSpec until) {
    String date = DATE.format(until.date());
    return switch (until.kind()) {
      case DATE -> date;
      case FLOATING -> date + "T" + TIME.format(until.time());
      case UTC -> date + "T" + TIME.format(until.time()) + "Z";
    };
  }

  private static String renderWeekdays(List<WeekdayNum> days) {
    return days.stream().map(WeekdayNum::toString).collect(Collectors.joining(","));
  }

  private static String joinInts(List<Integer> values) {
    return values.stream().map(String::valueOf).collect(Collectors.joining(","));
  }
}
