package io.recur.ast;

/**
 * One BYDAY entry: a weekday with an optional ordinal, e.g. {@code 2TU} or {@code -1FR}.
 *
 * @param ordinal the position within the month or year (negative counts from the end), or 0 for
 *     every such weekday
 * @param weekday the weekday
 */
public record WeekdayNum(int ordinal, Weekday weekday) {

  /**
   * Creates an entry matching every occurrence of the weekday.
   *
   * @param weekday the weekday
   * @return a new entry without ordinal
   */
  public static WeekdayNum every(Weekday weekday) {
    return new WeekdayNum(0, weekday);
  }

  /**
   * Creates an entry matching the nth occurrence of the weekday.
   *
   * @param ordinal the position, negative to count from the end
   * @param weekday the weekday
   * @return a new entry with ordinal
   */
  public static WeekdayNum nth(int ordinal, Weekday weekday) {
    return new WeekdayNum(ordinal, weekday);
  }

  /**
   * Returns whether this entry carries an ordinal.
   *
   * @return true if the ordinal is non-zero
   */
  public boolean hasOrdinal() {
    return ordinal != 0;
  }

  @Override
  public String toString() {
    return ordinal == 0 ? weekday.name() : ordinal + weekday.name();
  }
}
