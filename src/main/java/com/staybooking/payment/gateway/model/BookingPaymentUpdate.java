package com.staybooking.payment.gateway.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body sent to the booking service when a trade has been paid.
 */
public record BookingPaymentUpdate(
    @JsonProperty("payment_status") String paymentStatus,
    String status,
    @JsonProperty("gateway_trade_no") String gatewayTradeNumber,
    @JsonProperty("trade_amount") int tradeAmount,
    @JsonProperty("payment_date") String paymentDate,
    @JsonProperty("payment_type") String paymentType) {

  public static BookingPaymentUpdate paid(TradeResult result) {
    return new BookingPaymentUpdate("paid", "active", result.gatewayTradeNumber(),
        result.tradeAmount(), result.paymentDate(), result.paymentType());
  }
}
