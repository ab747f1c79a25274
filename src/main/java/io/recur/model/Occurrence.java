package io.recur.model;

import com.google.common.base.Preconditions;

/**
 * One concrete, timezone-resolved instance of an event.
 *
 * @param sourceEventId the id of the template this instance was generated from
 * @param interval the absolute span of the instance
 * @param isException true for instances added outside the rule pattern
 */
public record Occurrence(String sourceEventId, TimeInterval interval, boolean isException) {

  public Occurrence {
    Preconditions.checkNotNull(sourceEventId, "'sourceEventId' must not be null");
    Preconditions.checkNotNull(interval, "'interval' must not be null");
  }

  /**
   * Returns the instance id: the source event id and the ISO start instant, joined by {@code @}.
   *
   * @return an id unique per event and start
   */
  public String id() {
    return sourceEventId + "@" + interval.start();
  }
}
