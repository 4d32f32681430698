package com.staybooking.payment.gateway.model;

import com.staybooking.payment.gateway.enums.GatewayEnvironment;
import java.time.Instant;

/**
 * What was signed for a trade number: the amount and the credential environment. Callbacks
 * for the trade are verified with the same environment.
 */
public record TradeAttempt(
    String tradeNumber,
    int amount,
    String merchantId,
    GatewayEnvironment environment,
    Instant createdAt,
    boolean settled) {

  public TradeAttempt settle() {
    return new TradeAttempt(tradeNumber, amount, merchantId, environment, createdAt, true);
  }
}
