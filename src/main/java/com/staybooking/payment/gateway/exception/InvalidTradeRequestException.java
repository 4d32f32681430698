package com.staybooking.payment.gateway.exception;

import java.util.List;

/**
 * Thrown when a checkout or trade request fails validation before signing.
 * Carries a list of all validation errors so they can be reported together.
 * Handled by {@link CommonExceptionHandler} to produce a 400 response.
 */
public class InvalidTradeRequestException extends RuntimeException {

  private final List<String> errors;

  public InvalidTradeRequestException(List<String> errors) {
    super("Invalid trade request: " + String.join(", ", errors));
    this.errors = List.copyOf(errors);
  }

  public List<String> getErrors() {
    return errors;
  }
}
