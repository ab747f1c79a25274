package io.recur.model;

/** Lifecycle of a booking: PENDING to CONFIRMED or CANCELLED, CONFIRMED to CANCELLED. */
public enum BookingStatus {
  PENDING,
  CONFIRMED,
  CANCELLED;

  /**
   * Returns whether a booking in this status may move to the target status.
   *
   * @param target the requested status
   * @return true if the transition is allowed
   */
  public boolean canTransitionTo(BookingStatus target) {
    return switch (this) {
      case PENDING -> target == CONFIRMED || target == CANCELLED;
      case CONFIRMED -> target == CANCELLED;
      case CANCELLED -> false;
    };
  }

  /**
   * Returns whether no transition leaves this status.
   *
   * @return true for CANCELLED
   */
  public boolean isTerminal() {
    return this == CANCELLED;
  }
}
