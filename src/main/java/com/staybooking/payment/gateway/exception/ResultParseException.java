package com.staybooking.payment.gateway.exception;

/**
 * Thrown when a verified callback lacks a required field or carries a value that cannot be
 * coerced. The gateway response shape was unexpected; no booking state is changed.
 */
public class ResultParseException extends RuntimeException {

  private final String field;

  public ResultParseException(String field, String message) {
    super(message);
    this.field = field;
  }

  public String getField() {
    return field;
  }
}
