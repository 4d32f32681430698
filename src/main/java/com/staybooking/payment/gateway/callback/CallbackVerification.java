package com.staybooking.payment.gateway.callback;

import com.staybooking.payment.gateway.enums.VerificationError;
import java.util.Optional;

/**
 * Either a verified payload or the reason verification failed. Verification failures are
 * expected input from an untrusted sender, so they are returned rather than thrown.
 */
public final class CallbackVerification {

  private final VerifiedPayload payload;
  private final VerificationError error;

  private CallbackVerification(VerifiedPayload payload, VerificationError error) {
    this.payload = payload;
    this.error = error;
  }

  static CallbackVerification verified(VerifiedPayload payload) {
    return new CallbackVerification(payload, null);
  }

  public static CallbackVerification failed(VerificationError error) {
    return new CallbackVerification(null, error);
  }

  public boolean isVerified() {
    return payload != null;
  }

  public Optional<VerifiedPayload> getPayload() {
    return Optional.ofNullable(payload);
  }

  public Optional<VerificationError> getError() {
    return Optional.ofNullable(error);
  }

  @Override
  public String toString() {
    return isVerified() ? "CallbackVerification{verified}" : "CallbackVerification{" + error + "}";
  }
}
