package io.recur;

import io.recur.ast.RecurrenceRule;
import io.recur.display.Display;
import io.recur.eval.RuleValidator;
import io.recur.parser.Parser;

/**
 * The entry point for reading and writing RFC 5545 RRULE values.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Rrule rrule = Rrule.parse("FREQ=WEEKLY;BYDAY=MO;COUNT=3");
 * EventTemplate template =
 *     EventTemplate.of("standup", start, end, "America/New_York").withRecurrence(rrule.rule());
 * String text = rrule.toString(); // "FREQ=WEEKLY;BYDAY=MO;COUNT=3"
 * }</pre>
 */
public final class Rrule {
  private final RecurrenceRule rule;

  private Rrule(RecurrenceRule rule) {
    this.rule = rule;
  }

  /**
   * Parses and validates an RRULE value.
   *
   * @param input the rule text without the {@code RRULE:} property name
   * @return the parsed rule
   * @throws RecurException if the text is malformed or the rule is invalid
   */
  public static Rrule parse(String input) throws RecurException {
    RecurrenceRule rule = Parser.parse(input);
    RuleValidator.validate(rule);
    return new Rrule(rule);
  }

  /**
   * Wraps a rule built in code.
   *
   * @param rule the rule
   * @return the wrapped rule
   * @throws RecurException if the rule is invalid
   */
  public static Rrule of(RecurrenceRule rule) throws RecurException {
    RuleValidator.validate(rule);
    return new Rrule(rule);
  }

  /**
   * Validates an RRULE value without throwing.
   *
   * @param input the rule text
   * @return true if the text parses into a valid rule
   */
  public static boolean validate(String input) {
    try {
      parse(input);
      return true;
    } catch (RecurException e) {
      return false;
    }
  }

  /**
   * Returns the typed rule.
   *
   * @return the rule
   */
  public RecurrenceRule rule() {
    return rule;
  }

  /** Renders the rule as RRULE text, parts in the order they were read or set. */
  @Override
  public String toString() {
    return Display.render(rule);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof Rrule other && rule.equals(other.rule);
  }

  @Override
  public int hashCode() {
    return rule.hashCode();
  }
}
