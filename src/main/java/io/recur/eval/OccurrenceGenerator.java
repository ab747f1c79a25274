package io.recur.eval;

import io.recur.ast.RecurrenceRule;
import io.recur.ast.UntilSpec;
import io.recur.ast.Weekday;
import io.recur.ast.WeekdayNum;
import io.recur.model.EventTemplate;
import io.recur.model.Occurrence;
import io.recur.model.TimeInterval;
import io.recur.zone.TimezoneResolver;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.Year;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks one template's occurrences in start order.
 *
 * <p>Candidates are generated as local dates, one frequency period at a time ({@code interval}
 * days, weeks, months or years from the period holding the first start). Each candidate date is
 * combined with the template's wall-clock start time and only then resolved to an instant, so
 * every occurrence keeps its local start time across DST transitions.
 *
 * <p>The first start always counts as the first occurrence. Candidates on exception dates are
 * dropped without counting toward COUNT. Additional starts are merged in by instant and never
 * count toward COUNT.
 *
 * <p>The Gregorian calendar repeats every 400 years, weekdays included. Once a full cycle of
 * consecutive periods yields no candidate, no later period can, and the rule is exhausted.
 *
 * <p>Not thread-safe; each expansion builds its own generator.
 */
final class OccurrenceGenerator implements Iterator<Occurrence> {
  private static final Logger log = LoggerFactory.getLogger(OccurrenceGenerator.class);

  private static final List<Integer> ALL_MONTHS = List.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12);

  // Length of the 400-year Gregorian cycle in each frequency's unit.
  private static final long CYCLE_DAYS = 146_097;
  private static final long CYCLE_WEEKS = CYCLE_DAYS / 7;
  private static final long CYCLE_MONTHS = 4_800;
  private static final long CYCLE_YEARS = 400;

  private final EventTemplate template;
  private final RecurrenceRule rule;
  private final ZoneId zone;
  private final TimezoneResolver resolver;
  private final long maxEmptyPeriods;

  private final LocalDate anchor;
  private final LocalTime startTime;
  private final Duration wallDuration;
  private final Set<LocalDate> exceptions;

  private final Deque<LocalDate> pending = new ArrayDeque<>();
  private long period;
  private boolean anchorVisited;
  private boolean ruleExhausted;
  private int counted;

  private final List<Occurrence> additions;
  private int additionIndex;

  private Occurrence ruleHead;
  private Occurrence additionHead;
  private boolean primed;

  /**
   * Creates a generator.
   *
   * @param template a template already checked by the engine
   * @param zone the template's resolved zone
   * @param resolver the resolver for wall-clock conversion
   * @param skipBefore a local date before which whole periods may be skipped, or null; honoured
   *     only for rules without COUNT, where skipping cannot change which occurrences are counted
   */
  OccurrenceGenerator(
      EventTemplate template,
      ZoneId zone,
      TimezoneResolver resolver,
      LocalDate skipBefore) {
    this.template = template;
    this.rule = template.recurrence();
    this.zone = zone;
    this.resolver = resolver;
    this.maxEmptyPeriods = rule == null ? 0 : periodsPerCycle(rule);
    this.anchor = template.startLocal().toLocalDate();
    this.startTime = template.startLocal().toLocalTime();
    this.wallDuration = template.wallDuration();
    this.exceptions = rule == null ? Set.of() : rule.exceptions();

    // ordered by resolved instant; a gap can move a start past a later wall-clock time
    List<Occurrence> resolved = new ArrayList<>();
    for (LocalDateTime ldt : new TreeSet<>(template.additions())) {
      if (!exceptions.contains(ldt.toLocalDate())) {
        resolved.add(materialize(ldt, true));
      }
    }
    resolved.sort(Comparator.comparing(o -> o.interval().start()));
    this.additions = new ArrayList<>(resolved.size());
    for (Occurrence o : resolved) {
      if (additions.isEmpty()
          || !additions.get(additions.size() - 1).interval().start().equals(o.interval().start())) {
        additions.add(o);
      }
    }

    if (rule != null && rule.count() == null && skipBefore != null) {
      long skip = periodsBefore(skipBefore);
      if (skip > 0) {
        // the first start lies in period 0, well before skipBefore
        period = skip;
        anchorVisited = true;
      }
    }
  }

  @Override
  public boolean hasNext() {
    prime();
    return ruleHead != null || additionHead != null;
  }

  @Override
  public Occurrence next() {
    prime();
    if (ruleHead == null && additionHead == null) {
      throw new NoSuchElementException();
    }

    Occurrence result;
    if (additionHead == null) {
      result = ruleHead;
      ruleHead = nextRuleOccurrence();
    } else if (ruleHead == null) {
      result = additionHead;
      additionHead = nextAddition();
    } else {
      int cmp = ruleHead.interval().start().compareTo(additionHead.interval().start());
      if (cmp <= 0) {
        result = ruleHead;
        if (cmp == 0) {
          // an addition duplicating a rule occurrence is dropped
          additionHead = nextAddition();
        }
        ruleHead = nextRuleOccurrence();
      } else {
        result = additionHead;
        additionHead = nextAddition();
      }
    }
    return result;
  }

  private void prime() {
    if (!primed) {
      primed = true;
      ruleHead = nextRuleOccurrence();
      additionHead = nextAddition();
    }
  }

  private Occurrence nextAddition() {
    if (additionIndex >= additions.size()) {
      return null;
    }
    return additions.get(additionIndex++);
  }

  private Occurrence nextRuleOccurrence() {
    while (!ruleExhausted) {
      if (rule != null && rule.count() != null && counted >= rule.count()) {
        ruleExhausted = true;
        break;
      }

      LocalDate date = nextCandidateDate();
      if (date == null) {
        ruleExhausted = true;
        break;
      }

      Occurrence occurrence = materialize(date.atTime(startTime), false);
      if (pastUntil(date, occurrence)) {
        ruleExhausted = true;
        break;
      }
      if (exceptions.contains(date)) {
        continue;
      }
      counted++;
      return occurrence;
    }
    return null;
  }

  /** Returns the next candidate date in order, or null when the rule can yield no more. */
  private LocalDate nextCandidateDate() {
    if (!anchorVisited) {
      anchorVisited = true;
      return anchor;
    }
    if (rule == null) {
      return null;
    }

    long empty = 0;
    while (pending.isEmpty()) {
      if (empty >= maxEmptyPeriods) {
        log.debug(
            "Event {} has no match in a full calendar cycle of {} periods; rule exhausted",
            template.id(),
            empty);
        return null;
      }
      try {
        for (LocalDate d : candidatesFor(period)) {
          if (d.isAfter(anchor)) {
            pending.add(d);
          }
        }
      } catch (DateTimeException | ArithmeticException e) {
        log.warn("Stopping expansion of event {} at the end of the calendar", template.id());
        return null;
      }
      period++;
      if (pending.isEmpty()) {
        empty++;
      }
    }
    return pending.poll();
  }

  private boolean pastUntil(LocalDate date, Occurrence occurrence) {
    if (rule == null || rule.until() == null) {
      return false;
    }
    UntilSpec until = rule.until();
    return switch (until.kind()) {
      case DATE -> date.isAfter(until.date());
      case FLOATING -> date.atTime(startTime).isAfter(until.toLocalDateTime());
      case UTC -> occurrence.interval().start().isAfter(until.toInstant());
    };
  }

  /**
   * Resolves a wall-clock start into an occurrence. The end is the wall-clock end resolved on
   * its own; if a DST gap pushes the start past that end, the end falls back to start plus the
   * wall-clock duration.
   */
  private Occurrence materialize(LocalDateTime localStart, boolean addition) {
    Instant start = resolver.toInstant(localStart, zone);
    Instant end = resolver.toInstant(localStart.plus(wallDuration), zone);
    if (!end.isAfter(start)) {
      end = start.plus(wallDuration);
    }
    return new Occurrence(template.id(), new TimeInterval(start, end), addition);
  }

  // Period expansion

  private SortedSet<LocalDate> candidatesFor(long k) {
    long step = k * rule.interval();
    return switch (rule.frequency()) {
      case DAILY -> dailyCandidates(anchor.plusDays(step));
      case WEEKLY -> weeklyCandidates(weekStartOf(anchor).plusWeeks(step));
      case MONTHLY -> monthlyCandidates(YearMonth.from(anchor).plusMonths(step));
      case YEARLY -> yearlyCandidates(Math.addExact(anchor.getYear(), Math.toIntExact(step)));
    };
  }

  private SortedSet<LocalDate> dailyCandidates(LocalDate day) {
    SortedSet<LocalDate> result = new TreeSet<>();
    if (monthAllowed(day) && monthDayAllowed(day) && weekdayAllowed(day)) {
      result.add(day);
    }
    return result;
  }

  private SortedSet<LocalDate> weeklyCandidates(LocalDate weekStart) {
    Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
    if (rule.byWeekday() != null) {
      for (WeekdayNum wd : rule.byWeekday()) {
        days.add(wd.weekday().toDayOfWeek());
      }
    } else {
      days.add(anchor.getDayOfWeek());
    }

    SortedSet<LocalDate> result = new TreeSet<>();
    for (int i = 0; i < 7; i++) {
      LocalDate d = weekStart.plusDays(i);
      if (days.contains(d.getDayOfWeek()) && monthAllowed(d) && monthDayAllowed(d)) {
        result.add(d);
      }
    }
    return result;
  }

  private SortedSet<LocalDate> monthlyCandidates(YearMonth ym) {
    SortedSet<LocalDate> result = new TreeSet<>();
    if (rule.byMonth() != null && !rule.byMonth().contains(ym.getMonthValue())) {
      return result;
    }
    result.addAll(daysInMonth(ym));
    return result;
  }

  private SortedSet<LocalDate> yearlyCandidates(int year) {
    SortedSet<LocalDate> result = new TreeSet<>();
    if (rule.byMonthDay() == null && rule.byWeekday() != null && rule.byMonth() == null) {
      for (WeekdayNum wd : rule.byWeekday()) {
        result.addAll(weekdaysInYear(year, wd));
      }
      return result;
    }

    List<Integer> months;
    if (rule.byMonth() != null) {
      months = rule.byMonth();
    } else if (rule.byMonthDay() != null) {
      months = ALL_MONTHS;
    } else {
      months = List.of(anchor.getMonthValue());
    }
    for (int month : months) {
      result.addAll(daysInMonth(YearMonth.of(year, month)));
    }
    return result;
  }

  /**
   * Expands the day-level parts within one month. BYMONTHDAY expands and BYDAY limits when both
   * are present; without either the first start's day of month is used, and the month is
   * skipped if it is too short.
   */
  private List<LocalDate> daysInMonth(YearMonth ym) {
    List<LocalDate> result = new ArrayList<>();
    if (rule.byMonthDay() != null) {
      for (int md : rule.byMonthDay()) {
        LocalDate d = resolveMonthDay(ym, md);
        if (d != null && (rule.byWeekday() == null || matchesWeekdayInMonth(d))) {
          result.add(d);
        }
      }
    } else if (rule.byWeekday() != null) {
      for (WeekdayNum wd : rule.byWeekday()) {
        result.addAll(weekdaysInMonth(ym, wd));
      }
    } else if (ym.isValidDay(anchor.getDayOfMonth())) {
      result.add(ym.atDay(anchor.getDayOfMonth()));
    }
    return result;
  }

  private boolean matchesWeekdayInMonth(LocalDate d) {
    YearMonth ym = YearMonth.from(d);
    for (WeekdayNum wd : rule.byWeekday()) {
      if (wd.weekday().toDayOfWeek() != d.getDayOfWeek()) {
        continue;
      }
      if (!wd.hasOrdinal() || d.equals(nthWeekdayOfMonth(ym, wd.weekday(), wd.ordinal()))) {
        return true;
      }
    }
    return false;
  }

  private List<LocalDate> weekdaysInMonth(YearMonth ym, WeekdayNum wd) {
    if (wd.hasOrdinal()) {
      LocalDate d = nthWeekdayOfMonth(ym, wd.weekday(), wd.ordinal());
      return d == null ? List.of() : List.of(d);
    }
    List<LocalDate> result = new ArrayList<>(5);
    LocalDate d = ym.atDay(1).with(TemporalAdjusters.nextOrSame(wd.weekday().toDayOfWeek()));
    while (d.getMonth() == ym.getMonth()) {
      result.add(d);
      d = d.plusWeeks(1);
    }
    return result;
  }

  private List<LocalDate> weekdaysInYear(int year, WeekdayNum wd) {
    DayOfWeek dow = wd.weekday().toDayOfWeek();
    LocalDate first = LocalDate.of(year, 1, 1).with(TemporalAdjusters.nextOrSame(dow));
    if (wd.hasOrdinal()) {
      LocalDate d;
      if (wd.ordinal() > 0) {
        d = first.plusWeeks(wd.ordinal() - 1L);
      } else {
        LocalDate last = LocalDate.of(year, 12, 31).with(TemporalAdjusters.previousOrSame(dow));
        d = last.minusWeeks(-wd.ordinal() - 1L);
      }
      return d.getYear() == year ? List.of(d) : List.of();
    }
    List<LocalDate> result = new ArrayList<>(53);
    for (LocalDate d = first; d.getYear() == year; d = d.plusWeeks(1)) {
      result.add(d);
    }
    return result;
  }

  /** Returns the nth weekday of the month (negative counts from the end), or null if missing. */
  static LocalDate nthWeekdayOfMonth(YearMonth ym, Weekday weekday, int ordinal) {
    DayOfWeek dow = weekday.toDayOfWeek();
    LocalDate d;
    if (ordinal > 0) {
      d = ym.atDay(1).with(TemporalAdjusters.nextOrSame(dow)).plusWeeks(ordinal - 1L);
    } else {
      d = ym.atEndOfMonth().with(TemporalAdjusters.previousOrSame(dow)).minusWeeks(-ordinal - 1L);
    }
    return YearMonth.from(d).equals(ym) ? d : null;
  }

  /** Resolves a BYMONTHDAY value in the month, or null if the month has no such day. */
  static LocalDate resolveMonthDay(YearMonth ym, int monthDay) {
    int length = ym.lengthOfMonth();
    int day = monthDay > 0 ? monthDay : length + monthDay + 1;
    if (day < 1 || day > length) {
      return null;
    }
    return ym.atDay(day);
  }

  private boolean monthAllowed(LocalDate d) {
    return rule.byMonth() == null || rule.byMonth().contains(d.getMonthValue());
  }

  private boolean monthDayAllowed(LocalDate d) {
    if (rule.byMonthDay() == null) {
      return true;
    }
    YearMonth ym = YearMonth.from(d);
    for (int md : rule.byMonthDay()) {
      if (d.equals(resolveMonthDay(ym, md))) {
        return true;
      }
    }
    return false;
  }

  private boolean weekdayAllowed(LocalDate d) {
    if (rule.byWeekday() == null) {
      return true;
    }
    for (WeekdayNum wd : rule.byWeekday()) {
      if (wd.weekday().toDayOfWeek() == d.getDayOfWeek()) {
        return true;
      }
    }
    return false;
  }

  private LocalDate weekStartOf(LocalDate d) {
    return d.with(TemporalAdjusters.previousOrSame(rule.effectiveWeekStart().toDayOfWeek()));
  }

  /** Returns how many consecutive periods visit every position in the 400-year cycle. */
  static long periodsPerCycle(RecurrenceRule rule) {
    long cycle =
        switch (rule.frequency()) {
          case DAILY -> CYCLE_DAYS;
          case WEEKLY -> CYCLE_WEEKS;
          case MONTHLY -> CYCLE_MONTHS;
          case YEARLY -> CYCLE_YEARS;
        };
    return cycle / gcd(cycle, rule.interval());
  }

  private static long gcd(long a, long b) {
    return b == 0 ? a : gcd(b, a % b);
  }

  /** Returns how many whole periods can be skipped and still reach {@code target} safely. */
  private long periodsBefore(LocalDate target) {
    if (!target.isAfter(anchor)) {
      return 0;
    }
    long units =
        switch (rule.frequency()) {
          case DAILY -> ChronoUnit.DAYS.between(anchor, target);
          case WEEKLY -> ChronoUnit.WEEKS.between(weekStartOf(anchor), weekStartOf(target));
          case MONTHLY -> ChronoUnit.MONTHS.between(YearMonth.from(anchor), YearMonth.from(target));
          case YEARLY -> ChronoUnit.YEARS.between(Year.from(anchor), Year.from(target));
        };
    return Math.max(0, units / rule.interval() - 1);
  }
}
