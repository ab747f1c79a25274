package io.recur.eval;

import static org.junit.jupiter.api.Assertions.*;

import io.recur.ErrorKind;
import io.recur.RecurException;
import io.recur.RecurSettings;
import io.recur.Rrule;
import io.recur.ast.Frequency;
import io.recur.ast.RecurrenceRule;
import io.recur.model.EventTemplate;
import io.recur.model.Occurrence;
import io.recur.zone.OverlapPolicy;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class RecurrenceEngineTest {
  private static final String NEW_YORK = "America/New_York";

  private final RecurrenceEngine engine = new RecurrenceEngine();

  private static EventTemplate template(
      String start, Duration length, String zone, String rrule) throws RecurException {
    LocalDateTime s = LocalDateTime.parse(start);
    EventTemplate t = EventTemplate.of("evt", s, s.plus(length), zone);
    return rrule == null ? t : t.withRecurrence(Rrule.parse(rrule).rule());
  }

  private static List<Instant> starts(List<Occurrence> occurrences) {
    List<Instant> result = new ArrayList<>();
    for (Occurrence o : occurrences) {
      result.add(o.interval().start());
    }
    return result;
  }

  private static List<LocalDate> localDates(List<Occurrence> occurrences, String zone) {
    List<LocalDate> result = new ArrayList<>();
    for (Occurrence o : occurrences) {
      result.add(LocalDate.ofInstant(o.interval().start(), ZoneId.of(zone)));
    }
    return result;
  }

  private static Instant utc(String text) {
    return Instant.parse(text);
  }

  @Test
  void testWeeklyMondaysScenario() throws RecurException {
    EventTemplate t =
        template(
            "2026-02-02T09:00", Duration.ofMinutes(30), NEW_YORK, "FREQ=WEEKLY;BYDAY=MO;COUNT=3");
    List<Occurrence> result =
        engine.occurrencesBetween(t, utc("2026-02-01T00:00:00Z"), utc("2026-03-01T00:00:00Z"));

    assertEquals(
        List.of(
            utc("2026-02-02T14:00:00Z"), utc("2026-02-09T14:00:00Z"), utc("2026-02-16T14:00:00Z")),
        starts(result));
    for (Occurrence o : result) {
      assertEquals(Duration.ofMinutes(30), o.interval().duration());
      assertEquals(
          LocalTime.of(9, 0),
          LocalDateTime.ofInstant(o.interval().start(), ZoneId.of(NEW_YORK)).toLocalTime());
      assertEquals("evt", o.sourceEventId());
      assertFalse(o.isException());
    }
    assertEquals("evt@2026-02-02T14:00:00Z", result.get(0).id());
  }

  @Test
  void testDailyAcrossSpringForwardKeepsWallClock() throws RecurException {
    EventTemplate t =
        template("2026-03-06T09:00", Duration.ofHours(1), NEW_YORK, "FREQ=DAILY;COUNT=4");
    List<Occurrence> result = engine.expand(t, null, null).toList();

    assertEquals(
        List.of(
            utc("2026-03-06T14:00:00Z"),
            utc("2026-03-07T14:00:00Z"),
            utc("2026-03-08T13:00:00Z"),
            utc("2026-03-09T13:00:00Z")),
        starts(result));
    Duration acrossTransition =
        Duration.between(result.get(1).interval().start(), result.get(2).interval().start());
    assertEquals(Duration.ofHours(23), acrossTransition);
  }

  @Test
  void testDailyAcrossFallBack() throws RecurException {
    EventTemplate t =
        template("2026-10-31T09:00", Duration.ofHours(1), NEW_YORK, "FREQ=DAILY;COUNT=2");
    assertEquals(
        List.of(utc("2026-10-31T13:00:00Z"), utc("2026-11-01T14:00:00Z")),
        starts(engine.expand(t, null, null).toList()));
  }

  @Test
  void testCountIsCumulativeAcrossWindows() throws RecurException {
    EventTemplate t =
        template("2026-02-02T09:00", Duration.ofMinutes(30), NEW_YORK, "FREQ=DAILY;COUNT=5");

    List<Occurrence> first =
        engine.occurrencesBetween(t, utc("2026-02-04T00:00:00Z"), utc("2026-02-05T00:00:00Z"));
    List<Occurrence> second =
        engine.occurrencesBetween(t, utc("2026-02-05T00:00:00Z"), utc("2026-03-01T00:00:00Z"));
    List<Occurrence> all = engine.expand(t, null, null).toList();

    assertEquals(List.of(utc("2026-02-04T14:00:00Z")), starts(first));
    assertEquals(List.of(utc("2026-02-05T14:00:00Z"), utc("2026-02-06T14:00:00Z")), starts(second));
    assertEquals(5, all.size());
    assertEquals(utc("2026-02-06T14:00:00Z"), all.get(4).interval().start());
  }

  @Test
  void testUnboundedRuleWithFarRange() throws RecurException {
    EventTemplate t = template("2026-01-01T09:00", Duration.ofMinutes(30), NEW_YORK, "FREQ=DAILY");
    List<Occurrence> result =
        engine.occurrencesBetween(t, utc("2026-06-01T00:00:00Z"), utc("2026-06-03T00:00:00Z"));
    assertEquals(
        List.of(utc("2026-06-01T13:00:00Z"), utc("2026-06-02T13:00:00Z")), starts(result));
  }

  @Test
  void testOverlappingOccurrenceAtRangeStartIsIncluded() throws RecurException {
    EventTemplate t = template("2026-02-02T09:00", Duration.ofHours(2), "UTC", "FREQ=DAILY");
    List<Occurrence> result =
        engine.occurrencesBetween(t, utc("2026-02-03T10:00:00Z"), utc("2026-02-03T12:00:00Z"));
    assertEquals(List.of(utc("2026-02-03T09:00:00Z")), starts(result));
  }

  @Test
  void testMonthlyDay31SkipsShortMonths() throws RecurException {
    EventTemplate t =
        template(
            "2026-01-31T10:00", Duration.ofHours(1), "UTC", "FREQ=MONTHLY;COUNT=4");
    assertEquals(
        List.of(
            LocalDate.of(2026, 1, 31),
            LocalDate.of(2026, 3, 31),
            LocalDate.of(2026, 5, 31),
            LocalDate.of(2026, 7, 31)),
        localDates(engine.expand(t, null, null).toList(), "UTC"));
  }

  @Test
  void testNegativeMonthDayFollowsMonthLength() throws RecurException {
    EventTemplate t =
        template(
            "2026-01-31T10:00", Duration.ofHours(1), "UTC", "FREQ=MONTHLY;BYMONTHDAY=-1;COUNT=4");
    assertEquals(
        List.of(
            LocalDate.of(2026, 1, 31),
            LocalDate.of(2026, 2, 28),
            LocalDate.of(2026, 3, 31),
            LocalDate.of(2026, 4, 30)),
        localDates(engine.expand(t, null, null).toList(), "UTC"));
  }

  @Test
  void testFifthMondaySkipsMonthsWithout() throws RecurException {
    EventTemplate t =
        template("2026-03-30T10:00", Duration.ofHours(1), "UTC", "FREQ=MONTHLY;BYDAY=5MO;COUNT=3");
    assertEquals(
        List.of(LocalDate.of(2026, 3, 30), LocalDate.of(2026, 6, 29), LocalDate.of(2026, 8, 31)),
        localDates(engine.expand(t, null, null).toList(), "UTC"));
  }

  @Test
  void testSecondTuesday() throws RecurException {
    EventTemplate t =
        template("2026-01-13T10:00", Duration.ofHours(1), "UTC", "FREQ=MONTHLY;BYDAY=2TU;COUNT=3");
    assertEquals(
        List.of(LocalDate.of(2026, 1, 13), LocalDate.of(2026, 2, 10), LocalDate.of(2026, 3, 10)),
        localDates(engine.expand(t, null, null).toList(), "UTC"));
  }

  @Test
  void testLeapDayYearly() throws RecurException {
    EventTemplate t =
        template(
            "2024-02-29T10:00",
            Duration.ofHours(1),
            "UTC",
            "FREQ=YEARLY;BYMONTH=2;BYMONTHDAY=29;COUNT=2");
    assertEquals(
        List.of(LocalDate.of(2024, 2, 29), LocalDate.of(2028, 2, 29)),
        localDates(engine.expand(t, null, null).toList(), "UTC"));
  }

  @Test
  void testExceptionsDoNotCount() throws RecurException {
    EventTemplate t =
        template("2026-02-02T09:00", Duration.ofMinutes(30), "UTC", "FREQ=DAILY;COUNT=3");
    t = t.withRecurrence(t.recurrence().withExceptions(Set.of(LocalDate.of(2026, 2, 3))));
    assertEquals(
        List.of(LocalDate.of(2026, 2, 2), LocalDate.of(2026, 2, 4), LocalDate.of(2026, 2, 5)),
        localDates(engine.expand(t, null, null).toList(), "UTC"));
  }

  @Test
  void testBiweeklyAnchoredToStartWeekday() throws RecurException {
    EventTemplate t =
        template(
            "2026-02-02T09:00", Duration.ofMinutes(30), "UTC", "FREQ=WEEKLY;INTERVAL=2;COUNT=3");
    assertEquals(
        List.of(LocalDate.of(2026, 2, 2), LocalDate.of(2026, 2, 16), LocalDate.of(2026, 3, 2)),
        localDates(engine.expand(t, null, null).toList(), "UTC"));
  }

  @Test
  void testWeeklySeveralDays() throws RecurException {
    EventTemplate t =
        template(
            "2026-02-02T09:00",
            Duration.ofMinutes(30),
            "UTC",
            "FREQ=WEEKLY;BYDAY=MO,WE,FR;COUNT=5");
    assertEquals(
        List.of(
            LocalDate.of(2026, 2, 2),
            LocalDate.of(2026, 2, 4),
            LocalDate.of(2026, 2, 6),
            LocalDate.of(2026, 2, 9),
            LocalDate.of(2026, 2, 11)),
        localDates(engine.expand(t, null, null).toList(), "UTC"));
  }

  @Test
  void testUntilIsInclusive() throws RecurException {
    EventTemplate byDate =
        template("2026-02-02T09:00", Duration.ofMinutes(30), NEW_YORK, "FREQ=DAILY;UNTIL=20260204");
    assertEquals(3, engine.expand(byDate, null, null).count());

    EventTemplate byInstant =
        template(
            "2026-02-02T09:00",
            Duration.ofMinutes(30),
            NEW_YORK,
            "FREQ=DAILY;UNTIL=20260204T140000Z");
    assertEquals(3, engine.expand(byInstant, null, null).count());

    EventTemplate beforeStart =
        template(
            "2026-02-02T09:00",
            Duration.ofMinutes(30),
            NEW_YORK,
            "FREQ=DAILY;UNTIL=20260204T135959Z");
    assertEquals(2, engine.expand(beforeStart, null, null).count());
  }

  @Test
  void testUnboundedExpansionRejected() throws RecurException {
    EventTemplate t = template("2026-02-02T09:00", Duration.ofMinutes(30), NEW_YORK, "FREQ=DAILY");
    RecurException e =
        assertThrows(
            RecurException.class, () -> engine.expand(t, utc("2026-02-01T00:00:00Z"), null));
    assertEquals(ErrorKind.UNBOUNDED_EXPANSION, e.kind());
  }

  @Test
  void testSingleEvent() throws RecurException {
    EventTemplate t = template("2026-02-02T09:00", Duration.ofMinutes(45), NEW_YORK, null);
    List<Occurrence> result =
        engine.occurrencesBetween(t, utc("2026-02-01T00:00:00Z"), utc("2026-03-01T00:00:00Z"));
    assertEquals(1, result.size());
    assertEquals(utc("2026-02-02T14:00:00Z"), result.get(0).interval().start());
    assertEquals(utc("2026-02-02T14:45:00Z"), result.get(0).interval().end());

    assertEquals(1, engine.expand(t, null, null).count());
    assertTrue(
        engine
            .occurrencesBetween(t, utc("2026-02-03T00:00:00Z"), utc("2026-03-01T00:00:00Z"))
            .isEmpty());
  }

  @Test
  void testStartInsideGapKeepsPositiveLength() throws RecurException {
    EventTemplate t =
        EventTemplate.of(
            "gap",
            LocalDateTime.of(2026, 3, 8, 2, 30),
            LocalDateTime.of(2026, 3, 8, 3, 0),
            NEW_YORK);
    Occurrence o = engine.expand(t, null, null).findFirst().orElseThrow();
    assertEquals(utc("2026-03-08T07:30:00Z"), o.interval().start());
    assertEquals(utc("2026-03-08T08:00:00Z"), o.interval().end());
  }

  @Test
  void testAdditionsAreMergedAndNotCounted() throws RecurException {
    EventTemplate t =
        template("2026-02-02T09:00", Duration.ofMinutes(30), "UTC", "FREQ=DAILY;COUNT=2")
            .withAdditions(
                List.of(LocalDateTime.of(2026, 2, 10, 9, 0), LocalDateTime.of(2026, 2, 3, 9, 0)));
    List<Occurrence> result = engine.expand(t, null, null).toList();
    assertEquals(
        List.of(
            utc("2026-02-02T09:00:00Z"), utc("2026-02-03T09:00:00Z"), utc("2026-02-10T09:00:00Z")),
        starts(result));
    assertFalse(result.get(1).isException());
    assertTrue(result.get(2).isException());
  }

  @Test
  void testNextOccurrence() throws RecurException {
    EventTemplate t =
        template(
            "2026-02-02T09:00", Duration.ofMinutes(30), NEW_YORK, "FREQ=WEEKLY;BYDAY=MO;COUNT=3");
    Optional<Occurrence> next = engine.nextOccurrence(t, utc("2026-02-09T14:00:00Z"));
    assertEquals(utc("2026-02-16T14:00:00Z"), next.orElseThrow().interval().start());
    assertTrue(engine.nextOccurrence(t, utc("2026-02-16T14:00:00Z")).isEmpty());
    assertEquals(
        utc("2026-02-02T14:00:00Z"),
        engine.nextOccurrence(t, utc("2026-01-01T00:00:00Z")).orElseThrow().interval().start());
  }

  @Test
  void testNextOccurrenceOfEndlessSeries() throws RecurException {
    EventTemplate t = template("2026-02-02T09:00", Duration.ofMinutes(30), "UTC", "FREQ=DAILY");
    assertEquals(
        utc("2030-05-06T09:00:00Z"),
        engine.nextOccurrence(t, utc("2030-05-05T12:00:00Z")).orElseThrow().interval().start());
  }

  @Test
  void testExpansionIsRestartable() throws RecurException {
    EventTemplate t =
        template("2026-02-02T09:00", Duration.ofMinutes(30), NEW_YORK, "FREQ=MONTHLY;BYDAY=-1FR");
    Instant from = utc("2026-01-01T00:00:00Z");
    Instant to = utc("2027-01-01T00:00:00Z");
    List<Occurrence> first = engine.expand(t, from, to).toList();
    List<Occurrence> second = engine.expand(t, from, to).toList();
    assertEquals(first, second);
    assertEquals(12, first.size());
  }

  @Test
  void testInvalidTemplate() throws RecurException {
    EventTemplate backwards =
        EventTemplate.of(
            "bad",
            LocalDateTime.of(2026, 2, 2, 10, 0),
            LocalDateTime.of(2026, 2, 2, 9, 0),
            NEW_YORK);
    assertEquals(
        ErrorKind.INVALID_TEMPLATE,
        assertThrows(RecurException.class, () -> engine.expand(backwards, null, null)).kind());

    EventTemplate badRule =
        template("2026-02-02T09:00", Duration.ofMinutes(30), NEW_YORK, null)
            .withRecurrence(RecurrenceRule.of(Frequency.DAILY).withCount(0));
    RecurException e =
        assertThrows(
            RecurException.class,
            () ->
                engine.occurrencesBetween(
                    badRule, utc("2026-02-01T00:00:00Z"), utc("2026-03-01T00:00:00Z")));
    assertEquals(ErrorKind.INVALID_TEMPLATE, e.kind());
    assertEquals(ErrorKind.INVALID_COUNT, ((RecurException) e.getCause()).kind());
  }

  @Test
  void testInvalidTimezone() throws RecurException {
    EventTemplate t = template("2026-02-02T09:00", Duration.ofMinutes(30), "Nowhere/City", null);
    assertEquals(
        ErrorKind.INVALID_TIMEZONE,
        assertThrows(RecurException.class, () -> engine.expand(t, null, null)).kind());
  }

  @Test
  void testNeverMatchingRuleStops() throws RecurException {
    EventTemplate t =
        template(
            "2026-01-30T09:00",
            Duration.ofMinutes(30),
            "UTC",
            "FREQ=MONTHLY;BYMONTHDAY=30;BYMONTH=2");
    List<Occurrence> result =
        engine.occurrencesBetween(t, utc("2026-01-01T00:00:00Z"), utc("2100-01-01T00:00:00Z"));
    assertEquals(List.of(utc("2026-01-30T09:00:00Z")), starts(result));
  }

  @Test
  void testSparseDailyRuleKeepsFullCount() throws RecurException {
    EventTemplate t =
        template(
            "2024-02-29T09:00",
            Duration.ofMinutes(30),
            "UTC",
            "FREQ=DAILY;BYMONTH=2;BYMONTHDAY=29;COUNT=3");
    assertEquals(
        List.of(
            utc("2024-02-29T09:00:00Z"), utc("2028-02-29T09:00:00Z"), utc("2032-02-29T09:00:00Z")),
        starts(engine.expand(t, null, null).toList()));
  }

  @Test
  void testLeapDayAcrossCenturyGap() throws RecurException {
    EventTemplate t =
        template(
            "2096-02-29T09:00",
            Duration.ofMinutes(30),
            "UTC",
            "FREQ=YEARLY;BYMONTH=2;BYMONTHDAY=29;COUNT=2");
    assertEquals(
        List.of(utc("2096-02-29T09:00:00Z"), utc("2104-02-29T09:00:00Z")),
        starts(engine.expand(t, null, null).toList()));
  }

  @Test
  void testPeriodsPerCycle() {
    assertEquals(146_097, OccurrenceGenerator.periodsPerCycle(RecurrenceRule.of(Frequency.DAILY)));
    assertEquals(20_871, OccurrenceGenerator.periodsPerCycle(RecurrenceRule.of(Frequency.WEEKLY)));
    RecurrenceRule yearly = RecurrenceRule.of(Frequency.YEARLY);
    assertEquals(100, OccurrenceGenerator.periodsPerCycle(yearly.withInterval(4)));
    assertEquals(1, OccurrenceGenerator.periodsPerCycle(yearly.withInterval(800)));
  }

  @Test
  void testOverlapPolicyFromSettings() throws RecurException {
    EventTemplate t =
        template("2026-11-01T01:30", Duration.ofMinutes(30), NEW_YORK, "FREQ=DAILY;COUNT=1");

    RecurrenceEngine later = new RecurrenceEngine(new RecurSettings(OverlapPolicy.LATER));
    assertEquals(
        utc("2026-11-01T06:30:00Z"),
        later.expand(t, null, null).findFirst().orElseThrow().interval().start());

    RecurrenceEngine earlier = new RecurrenceEngine(RecurSettings.defaults());
    assertEquals(
        utc("2026-11-01T05:30:00Z"),
        earlier.expand(t, null, null).findFirst().orElseThrow().interval().start());
  }

  @Test
  void testOverlapPolicyFromClasspathSettings() throws RecurException {
    EventTemplate t = template("2026-11-01T01:30", Duration.ofMinutes(30), NEW_YORK, null);
    RecurrenceEngine configured = new RecurrenceEngine(RecurSettings.load());
    assertEquals(
        utc("2026-11-01T06:30:00Z"),
        configured.expand(t, null, null).findFirst().orElseThrow().interval().start());
  }

  @Test
  void testAdditionsOrderedByResolvedStart() throws RecurException {
    LocalDateTime s = LocalDateTime.parse("2026-03-07T09:00");
    EventTemplate t =
        EventTemplate.of("evt", s, s.plusMinutes(30), NEW_YORK)
            .withAdditions(
                List.of(
                    LocalDateTime.of(2026, 3, 8, 2, 30), LocalDateTime.of(2026, 3, 8, 3, 15)));

    assertEquals(
        List.of(
            utc("2026-03-07T14:00:00Z"), utc("2026-03-08T07:15:00Z"), utc("2026-03-08T07:30:00Z")),
        starts(engine.expand(t, null, null).toList()));
    assertEquals(
        List.of(utc("2026-03-08T07:15:00Z")),
        starts(
            engine.occurrencesBetween(
                t, utc("2026-03-08T07:00:00Z"), utc("2026-03-08T07:20:00Z"))));
  }

  @Test
  void testExpandAllMergesInStartOrder() throws RecurException {
    EventTemplate daily =
        template("2026-02-02T09:00", Duration.ofMinutes(30), "UTC", "FREQ=DAILY;COUNT=3");
    LocalDateTime s = LocalDateTime.parse("2026-02-03T08:00");
    EventTemplate single = EventTemplate.of("review", s, s.plusHours(1), "UTC");

    List<Occurrence> result =
        engine.expandAll(
            List.of(daily, single), utc("2026-02-01T00:00:00Z"), utc("2026-02-10T00:00:00Z"));

    assertEquals(
        List.of(
            utc("2026-02-02T09:00:00Z"),
            utc("2026-02-03T08:00:00Z"),
            utc("2026-02-03T09:00:00Z"),
            utc("2026-02-04T09:00:00Z")),
        starts(result));
    assertEquals("review", result.get(1).sourceEventId());
  }
}
