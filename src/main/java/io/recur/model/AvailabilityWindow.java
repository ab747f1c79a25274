package io.recur.model;

import com.google.common.base.Preconditions;

/**
 * A span of time with a uniform availability status.
 *
 * @param interval the span
 * @param status the status
 */
public record AvailabilityWindow(TimeInterval interval, AvailabilityStatus status) {

  public AvailabilityWindow {
    Preconditions.checkNotNull(interval, "'interval' must not be null");
    Preconditions.checkNotNull(status, "'status' must not be null");
  }
}
