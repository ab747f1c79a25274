package io.recur.model;

import java.util.List;

/**
 * Plain event record as handed over by the object store.
 *
 * @param id the event id
 * @param startTime ISO local date-time of the first start, e.g. {@code 2026-02-02T09:00}
 * @param endTime ISO local date-time of the first end
 * @param timezone the IANA timezone
 * @param rrule the RRULE value, or null for a single event
 * @param exdates ISO dates excluded from the series, may be null
 */
public record EventRecord(
    String id,
    String startTime,
    String endTime,
    String timezone,
    String rrule,
    List<String> exdates) {

  public EventRecord {
    exdates = exdates == null ? List.of() : List.copyOf(exdates);
  }
}
