package io.recur.eval;

import com.google.common.base.Preconditions;
import io.recur.RecurException;
import io.recur.RecurSettings;
import io.recur.ast.RecurrenceRule;
import io.recur.model.EventTemplate;
import io.recur.model.Occurrence;
import io.recur.zone.TimezoneResolver;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands event templates into timezone-resolved occurrences.
 *
 * <h2>Ranges</h2>
 *
 * <p>An occurrence belongs to a range {@code [rangeStart, rangeEnd)} when its interval overlaps
 * it. A null rangeStart means the start of the series; a null rangeEnd means no upper bound, which
 * is only accepted when the rule carries UNTIL or COUNT.
 *
 * <h2>COUNT</h2>
 *
 * <p>COUNT is cumulative from the template's first start, never from the range start: generation
 * always begins at the first start, and only rules without COUNT may skip whole periods ahead.
 *
 * <p>The engine is stateless. Every call returns a fresh sequence, so re-invoking with the same
 * arguments replays the same occurrences.
 */
public final class RecurrenceEngine {
  private static final Logger log = LoggerFactory.getLogger(RecurrenceEngine.class);

  private final TimezoneResolver resolver;

  /** Creates an engine over the system resolver, which uses the EARLIER overlap policy. */
  public RecurrenceEngine() {
    this(TimezoneResolver.system());
  }

  /**
   * Creates an engine whose resolver follows the settings' overlap policy.
   *
   * @param settings the engine settings, for example {@link RecurSettings#load()}
   */
  public RecurrenceEngine(RecurSettings settings) {
    this(
        new TimezoneResolver(
            Preconditions.checkNotNull(settings, "'settings' must not be null").overlapPolicy()));
  }

  /**
   * Creates an engine over an existing resolver.
   *
   * @param resolver the timezone resolver
   */
  public RecurrenceEngine(TimezoneResolver resolver) {
    this.resolver = Preconditions.checkNotNull(resolver, "'resolver' must not be null");
  }

  /**
   * Checks a rule.
   *
   * @param rule the rule
   * @throws RecurException with a rule error kind if the rule is malformed
   */
  public void validate(RecurrenceRule rule) throws RecurException {
    RuleValidator.validate(rule);
  }

  /**
   * Returns a lazy, ordered stream of the template's occurrences overlapping the range.
   *
   * @param template the event
   * @param rangeStart the inclusive range start, or null for the start of the series
   * @param rangeEnd the exclusive range end, or null for none
   * @return the occurrences in start order
   * @throws RecurException INVALID_TIMEZONE, INVALID_TEMPLATE or UNBOUNDED_EXPANSION
   */
  public Stream<Occurrence> expand(EventTemplate template, Instant rangeStart, Instant rangeEnd)
      throws RecurException {
    ZoneId zone = checkTemplate(template);
    if (rangeStart != null && rangeEnd != null) {
      Preconditions.checkArgument(
          rangeStart.isBefore(rangeEnd), "'rangeStart' must be before 'rangeEnd'");
    }
    if (rangeEnd == null && template.isRecurring() && !template.recurrence().isBounded()) {
      throw RecurException.unbounded(template.id());
    }

    log.debug("Expanding event {} in {} over [{}, {})", template.id(), zone, rangeStart, rangeEnd);

    Stream<Occurrence> occurrences = stream(generator(template, zone, rangeStart));
    if (rangeEnd != null) {
      occurrences = occurrences.takeWhile(o -> o.interval().start().isBefore(rangeEnd));
    }
    if (rangeStart != null) {
      occurrences = occurrences.filter(o -> o.interval().end().isAfter(rangeStart));
    }
    return occurrences;
  }

  /**
   * Returns the template's occurrences overlapping a closed window, collected into a list.
   *
   * @param template the event
   * @param rangeStart the inclusive window start
   * @param rangeEnd the exclusive window end
   * @return the occurrences in start order
   * @throws RecurException INVALID_TIMEZONE or INVALID_TEMPLATE
   */
  public List<Occurrence> occurrencesBetween(
      EventTemplate template, Instant rangeStart, Instant rangeEnd) throws RecurException {
    Preconditions.checkNotNull(rangeStart, "'rangeStart' must not be null");
    Preconditions.checkNotNull(rangeEnd, "'rangeEnd' must not be null");
    List<Occurrence> result = expand(template, rangeStart, rangeEnd).toList();
    log.debug(
        "Event {} has {} occurrence(s) in [{}, {})",
        template.id(),
        result.size(),
        rangeStart,
        rangeEnd);
    return result;
  }

  /**
   * Returns the first occurrence starting strictly after the given instant.
   *
   * @param template the event
   * @param after the exclusive lower bound on start
   * @return the next occurrence, or empty if the series has ended
   * @throws RecurException INVALID_TIMEZONE or INVALID_TEMPLATE
   */
  public Optional<Occurrence> nextOccurrence(EventTemplate template, Instant after)
      throws RecurException {
    Preconditions.checkNotNull(after, "'after' must not be null");
    ZoneId zone = checkTemplate(template);
    return stream(generator(template, zone, after))
        .filter(o -> o.interval().start().isAfter(after))
        .findFirst();
  }

  /**
   * Expands several templates over one range and merges the results in start order.
   *
   * @param templates the events
   * @param rangeStart the inclusive range start
   * @param rangeEnd the exclusive range end
   * @return all occurrences in start order, ties kept in template order
   * @throws RecurException if any template fails to expand
   */
  public List<Occurrence> expandAll(
      List<EventTemplate> templates, Instant rangeStart, Instant rangeEnd) throws RecurException {
    List<Occurrence> all = new ArrayList<>();
    for (EventTemplate template : templates) {
      all.addAll(occurrencesBetween(template, rangeStart, rangeEnd));
    }
    all.sort(Comparator.comparing(o -> o.interval().start()));
    return all;
  }

  /**
   * Returns the resolver used by this engine.
   *
   * @return the timezone resolver
   */
  public TimezoneResolver resolver() {
    return resolver;
  }

  private ZoneId checkTemplate(EventTemplate template) throws RecurException {
    Preconditions.checkNotNull(template, "'template' must not be null");
    ZoneId zone = resolver.resolveZone(template.timezone());
    if (!template.endLocal().isAfter(template.startLocal())) {
      throw RecurException.invalidTemplate(
          "event '" + template.id() + "' must end after it starts", null);
    }
    if (template.isRecurring()) {
      try {
        RuleValidator.validate(template.recurrence());
      } catch (RecurException e) {
        throw RecurException.invalidTemplate(
            "event '" + template.id() + "' has an invalid rule: " + e.getMessage(), e);
      }
    }
    return zone;
  }

  private OccurrenceGenerator generator(EventTemplate template, ZoneId zone, Instant rangeStart) {
    LocalDate skipBefore = null;
    if (rangeStart != null) {
      long spanDays = template.wallDuration().toDays() + 2;
      skipBefore = resolver.toLocal(rangeStart, zone).toLocalDate().minusDays(spanDays);
    }
    return new OccurrenceGenerator(template, zone, resolver, skipBefore);
  }

  private static Stream<Occurrence> stream(OccurrenceGenerator generator) {
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(
            generator, Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }
}
