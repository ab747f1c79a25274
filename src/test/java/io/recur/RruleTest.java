package io.recur;

import static org.junit.jupiter.api.Assertions.*;

import io.recur.ast.Frequency;
import io.recur.ast.RecurrenceRule;
import io.recur.ast.UntilSpec;
import io.recur.ast.Weekday;
import io.recur.ast.WeekdayNum;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Unit tests for reading and writing RRULE values. */
public class RruleTest {

  @Test
  void testParseWeekly() throws RecurException {
    Rrule r = Rrule.parse("FREQ=WEEKLY;BYDAY=MO;COUNT=3");
    RecurrenceRule rule = r.rule();
    assertEquals(Frequency.WEEKLY, rule.frequency());
    assertEquals(List.of(WeekdayNum.every(Weekday.MO)), rule.byWeekday());
    assertEquals(3, rule.count());
    assertNull(rule.until());
    assertEquals(1, rule.interval());
    assertEquals("FREQ=WEEKLY;BYDAY=MO;COUNT=3", r.toString());
  }

  @Test
  void testPartOrderIsKept() throws RecurException {
    assertEquals("COUNT=3;FREQ=DAILY", Rrule.parse("COUNT=3;FREQ=DAILY").toString());
    assertEquals(
        "BYMONTHDAY=-1;FREQ=MONTHLY;INTERVAL=2",
        Rrule.parse("BYMONTHDAY=-1;FREQ=MONTHLY;INTERVAL=2").toString());
  }

  @Test
  void testExplicitIntervalOneIsKept() throws RecurException {
    assertEquals("FREQ=DAILY;INTERVAL=1", Rrule.parse("FREQ=DAILY;INTERVAL=1").toString());
  }

  @Test
  void testOrderDoesNotAffectEquality() throws RecurException {
    Rrule a = Rrule.parse("FREQ=DAILY;COUNT=3");
    Rrule b = Rrule.parse("COUNT=3;FREQ=DAILY");
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a.toString(), b.toString());
  }

  @Test
  void testLowerCaseIsNormalized() throws RecurException {
    assertEquals("FREQ=WEEKLY;BYDAY=MO,FR", Rrule.parse("freq=weekly;byday=mo,fr").toString());
  }

  @Test
  void testPlusSignIsDropped() throws RecurException {
    assertEquals("FREQ=MONTHLY;BYDAY=1MO", Rrule.parse("FREQ=MONTHLY;BYDAY=+1MO").toString());
  }

  @Test
  void testOrdinals() throws RecurException {
    RecurrenceRule rule = Rrule.parse("FREQ=MONTHLY;BYDAY=2TU,-1FR").rule();
    assertEquals(
        List.of(WeekdayNum.nth(2, Weekday.TU), WeekdayNum.nth(-1, Weekday.FR)), rule.byWeekday());
    assertEquals("FREQ=MONTHLY;BYDAY=2TU,-1FR", Rrule.of(rule).toString());
  }

  @Test
  void testUntilForms() throws RecurException {
    RecurrenceRule date = Rrule.parse("FREQ=DAILY;UNTIL=20260301").rule();
    assertEquals(UntilSpec.Kind.DATE, date.until().kind());
    assertEquals(LocalDate.of(2026, 3, 1), date.until().date());

    RecurrenceRule floating = Rrule.parse("FREQ=DAILY;UNTIL=20260301T090000").rule();
    assertEquals(UntilSpec.Kind.FLOATING, floating.until().kind());

    RecurrenceRule utc = Rrule.parse("FREQ=DAILY;UNTIL=20260301T090000Z").rule();
    assertEquals(UntilSpec.Kind.UTC, utc.until().kind());
    assertEquals(Instant.parse("2026-03-01T09:00:00Z"), utc.until().toInstant());
    assertEquals("FREQ=DAILY;UNTIL=20260301T090000Z", Rrule.of(utc).toString());
  }

  @Test
  void testBuiltRuleRendersInSetOrder() throws RecurException {
    RecurrenceRule rule =
        RecurrenceRule.of(Frequency.WEEKLY)
            .withByWeekday(List.of(WeekdayNum.every(Weekday.MO)))
            .withCount(3);
    assertEquals("FREQ=WEEKLY;BYDAY=MO;COUNT=3", Rrule.of(rule).toString());
    assertEquals(rule, Rrule.parse("FREQ=WEEKLY;BYDAY=MO;COUNT=3").rule());
  }

  @Test
  void testWeekStart() throws RecurException {
    RecurrenceRule rule = Rrule.parse("FREQ=WEEKLY;INTERVAL=2;WKST=SU").rule();
    assertEquals(Weekday.SU, rule.effectiveWeekStart());
    assertEquals(Weekday.MO, RecurrenceRule.of(Frequency.WEEKLY).effectiveWeekStart());
  }

  @Test
  void testPropertyPrefixRejected() {
    RecurException e =
        assertThrows(RecurException.class, () -> Rrule.parse("RRULE:FREQ=DAILY;COUNT=2"));
    assertEquals(ErrorKind.PARSE, e.kind());
    assertEquals("FREQ=DAILY;COUNT=2", e.suggestion().orElseThrow());
    assertEquals(new Span(0, 6), e.span().orElseThrow());
  }

  @Test
  void testUnsupportedPart() {
    RecurException e =
        assertThrows(RecurException.class, () -> Rrule.parse("FREQ=DAILY;BYHOUR=9"));
    assertEquals(ErrorKind.PARSE, e.kind());
    assertEquals(new Span(11, 17), e.span().orElseThrow());
    String rich = e.displayRich();
    assertTrue(rich.startsWith("error: unsupported rule part 'BYHOUR'"), rich);
    assertTrue(rich.endsWith(" ".repeat(13) + "^^^^^^"), rich);
  }

  @Test
  void testMissingFreq() {
    RecurException e = assertThrows(RecurException.class, () -> Rrule.parse("COUNT=3"));
    assertEquals(ErrorKind.PARSE, e.kind());
    assertEquals("FREQ=DAILY;COUNT=3", e.suggestion().orElseThrow());
  }

  @Test
  void testMalformedText() {
    assertEquals(ErrorKind.PARSE, assertThrows(RecurException.class, () -> Rrule.parse("")).kind());
    assertEquals(
        ErrorKind.LEX,
        assertThrows(RecurException.class, () -> Rrule.parse("FREQ=DAILY; COUNT=3")).kind());
    assertEquals(
        ErrorKind.PARSE,
        assertThrows(RecurException.class, () -> Rrule.parse("FREQ=DAILY;FREQ=WEEKLY")).kind());
    assertEquals(
        ErrorKind.PARSE,
        assertThrows(RecurException.class, () -> Rrule.parse("FREQ=DAILY;")).kind());
    assertEquals(
        ErrorKind.PARSE,
        assertThrows(RecurException.class, () -> Rrule.parse("FREQ=HOURLY")).kind());
    assertEquals(
        ErrorKind.PARSE,
        assertThrows(RecurException.class, () -> Rrule.parse("FREQ=DAILY;UNTIL=20260230")).kind());
    assertEquals(
        ErrorKind.PARSE,
        assertThrows(RecurException.class, () -> Rrule.parse("FREQ=MONTHLY;BYDAY=0MO")).kind());
  }

  @Test
  void testSemanticErrors() {
    assertEquals(
        ErrorKind.CONFLICTING_TERMINATORS,
        assertThrows(
                RecurException.class, () -> Rrule.parse("FREQ=DAILY;COUNT=3;UNTIL=20260301"))
            .kind());
    assertEquals(
        ErrorKind.EMPTY_BY_WEEKDAY,
        assertThrows(RecurException.class, () -> Rrule.parse("FREQ=WEEKLY;BYDAY=")).kind());
    assertEquals(
        ErrorKind.INVALID_MONTH_DAY,
        assertThrows(RecurException.class, () -> Rrule.parse("FREQ=MONTHLY;BYMONTHDAY=32"))
            .kind());
  }

  @Test
  void testValidate() {
    assertTrue(Rrule.validate("FREQ=YEARLY;BYMONTH=2;BYMONTHDAY=29"));
    assertFalse(Rrule.validate("FREQ=DAILY;INTERVAL=0"));
    assertFalse(Rrule.validate("RRULE:FREQ=DAILY"));
  }
}
