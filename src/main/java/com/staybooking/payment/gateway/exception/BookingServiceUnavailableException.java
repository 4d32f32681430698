package com.staybooking.payment.gateway.exception;

/**
 * Thrown when the booking service is unreachable or returns a server error (5xx) while a
 * payment is being recorded. Handled by {@link CommonExceptionHandler} to produce a
 * 502 Bad Gateway response, so the gateway retries its notification.
 */
public class BookingServiceUnavailableException extends RuntimeException {

  public BookingServiceUnavailableException(String message) {
    super(message);
  }
}
