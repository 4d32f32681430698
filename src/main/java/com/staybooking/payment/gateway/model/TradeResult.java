package com.staybooking.payment.gateway.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Typed trade outcome extracted from a verified gateway callback.
 */
public record TradeResult(
    @JsonProperty("merchant_trade_no") String merchantTradeNumber,
    @JsonProperty("gateway_trade_no") String gatewayTradeNumber,
    @JsonProperty("return_code") int returnCode,
    @JsonProperty("return_message") String returnMessage,
    @JsonProperty("trade_amount") int tradeAmount,
    @JsonProperty("payment_date") String paymentDate,
    @JsonProperty("payment_type") String paymentType,
    @JsonProperty("payment_type_charge_fee") String paymentTypeChargeFee,
    @JsonProperty("trade_date") String tradeDate,
    @JsonProperty("simulate_paid") boolean simulatePaid) {

  /** Return code the gateway uses for a successful authorisation. */
  public static final int SUCCESS_CODE = 1;

  public boolean isSuccessful() {
    return returnCode == SUCCESS_CODE;
  }
}
