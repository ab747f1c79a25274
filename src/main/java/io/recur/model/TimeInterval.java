package io.recur.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.Range;
import java.time.Duration;
import java.time.Instant;

/**
 * A half-open span {@code [start, end)} on the UTC timeline.
 *
 * @param start the inclusive start
 * @param end the exclusive end, strictly after start
 */
public record TimeInterval(Instant start, Instant end) {

  public TimeInterval {
    Preconditions.checkNotNull(start, "'start' must not be null");
    Preconditions.checkNotNull(end, "'end' must not be null");
    Preconditions.checkArgument(start.isBefore(end), "'start' must be before 'end'");
  }

  /**
   * Creates an interval of the given length.
   *
   * @param start the start
   * @param duration the positive length
   * @return a new interval
   */
  public static TimeInterval of(Instant start, Duration duration) {
    return new TimeInterval(start, start.plus(duration));
  }

  /**
   * Creates an interval from a Guava range with closed lower and open upper bounds.
   *
   * @param range the range
   * @return a new interval
   */
  public static TimeInterval fromRange(Range<Instant> range) {
    return new TimeInterval(range.lowerEndpoint(), range.upperEndpoint());
  }

  /**
   * Returns the length of this interval.
   *
   * @return the duration between start and end
   */
  public Duration duration() {
    return Duration.between(start, end);
  }

  /**
   * Returns whether the two intervals share any instant. Abutting intervals do not overlap.
   *
   * @param other the other interval
   * @return true if {@code start < other.end && other.start < end}
   */
  public boolean overlaps(TimeInterval other) {
    return start.isBefore(other.end) && other.start.isBefore(end);
  }

  /**
   * Returns whether the instant lies inside this interval.
   *
   * @param instant the instant
   * @return true if {@code start <= instant < end}
   */
  public boolean contains(Instant instant) {
    return !instant.isBefore(start) && instant.isBefore(end);
  }

  /**
   * Converts to a closed-open Guava range.
   *
   * @return the equivalent range
   */
  public Range<Instant> toRange() {
    return Range.closedOpen(start, end);
  }
}
