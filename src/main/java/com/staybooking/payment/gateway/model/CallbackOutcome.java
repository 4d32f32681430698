package com.staybooking.payment.gateway.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.staybooking.payment.gateway.enums.CallbackStatus;

/**
 * Result of processing one inbound gateway callback. {@code tradeResult} is only present when
 * the callback passed verification and parsing.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CallbackOutcome(
    CallbackStatus status,
    @JsonProperty("trade_result") TradeResult tradeResult,
    String reason) {

  public static CallbackOutcome paid(TradeResult tradeResult) {
    return new CallbackOutcome(CallbackStatus.PAID, tradeResult, null);
  }

  public static CallbackOutcome notPaid(TradeResult tradeResult, String reason) {
    return new CallbackOutcome(CallbackStatus.NOT_PAID, tradeResult, reason);
  }

  public static CallbackOutcome rejected(String reason) {
    return new CallbackOutcome(CallbackStatus.REJECTED, null, reason);
  }

  public static CallbackOutcome unprocessable(String reason) {
    return new CallbackOutcome(CallbackStatus.UNPROCESSABLE, null, reason);
  }
}
