package com.staybooking.payment.gateway.enums;

/**
 * Reasons an inbound gateway callback is not trusted. None of them may lead to a booking or
 * payment state change.
 */
public enum VerificationError {
  /** The callback carried no {@code CheckMacValue} field. */
  MISSING_SIGNATURE("Callback has no CheckMacValue"),
  /** The recomputed check value differs from the one received. */
  SIGNATURE_MISMATCH("CheckMacValue does not match"),
  /** No configured credential set could be bound to the callback. */
  UNKNOWN_MERCHANT("Callback merchant is not configured");

  private final String description;

  VerificationError(String description) {
    this.description = description;
  }

  public String getDescription() {
    return description;
  }
}
