package com.staybooking.payment.gateway.model;

public class ErrorResponse {

  private final String message;

  public ErrorResponse(String message) {
    this.message = message;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public String toString() {
    return "ErrorResponse{"
        + "message='" + message + '\''
        + '}';
  }
}
