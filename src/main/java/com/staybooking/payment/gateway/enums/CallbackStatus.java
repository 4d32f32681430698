package com.staybooking.payment.gateway.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CallbackStatus {
  PAID("Paid"),
  NOT_PAID("NotPaid"),
  REJECTED("Rejected"),
  UNPROCESSABLE("Unprocessable");

  private final String name;

  CallbackStatus(String name) {
    this.name = name;
  }

  @JsonValue
  public String getName() {
    return this.name;
  }
}
