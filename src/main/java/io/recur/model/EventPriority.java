package io.recur.model;

import com.google.common.base.Preconditions;
import java.time.Instant;

/**
 * Caller-supplied ranking used to annotate conflicts. Higher priority wins; ties go to the
 * earlier {@code createdAt}.
 *
 * @param eventId the event this priority applies to
 * @param priority the priority, higher is more important
 * @param createdAt when the event was created
 */
public record EventPriority(String eventId, int priority, Instant createdAt) {

  public EventPriority {
    Preconditions.checkNotNull(eventId, "'eventId' must not be null");
    Preconditions.checkNotNull(createdAt, "'createdAt' must not be null");
  }
}
