package io.recur.model;

import com.google.common.base.Preconditions;
import io.recur.RecurException;

/**
 * A reservation of a slot by an owner. Transitions return new values.
 *
 * @param interval the booked slot
 * @param ownerId who booked it
 * @param status the lifecycle status
 */
public record Booking(TimeInterval interval, String ownerId, BookingStatus status) {

  public Booking {
    Preconditions.checkNotNull(interval, "'interval' must not be null");
    Preconditions.checkNotNull(ownerId, "'ownerId' must not be null");
    Preconditions.checkNotNull(status, "'status' must not be null");
  }

  /**
   * Creates a pending booking.
   *
   * @param interval the slot
   * @param ownerId the owner
   * @return a new PENDING booking
   */
  public static Booking pending(TimeInterval interval, String ownerId) {
    return new Booking(interval, ownerId, BookingStatus.PENDING);
  }

  /**
   * Confirms a pending booking.
   *
   * @return the booking in CONFIRMED status
   * @throws RecurException with kind INVALID_BOOKING_TRANSITION unless this booking is PENDING
   */
  public Booking confirm() throws RecurException {
    return transitionTo(BookingStatus.CONFIRMED);
  }

  /**
   * Cancels a pending or confirmed booking.
   *
   * @return the booking in CANCELLED status
   * @throws RecurException with kind INVALID_BOOKING_TRANSITION if already cancelled
   */
  public Booking cancel() throws RecurException {
    return transitionTo(BookingStatus.CANCELLED);
  }

  private Booking transitionTo(BookingStatus target) throws RecurException {
    if (!status.canTransitionTo(target)) {
      throw RecurException.invalidTransition(
          "cannot move booking from " + status + " to " + target);
    }
    return new Booking(interval, ownerId, target);
  }
}
