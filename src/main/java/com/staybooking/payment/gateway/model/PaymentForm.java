package com.staybooking.payment.gateway.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A signed payment form: the cashier endpoint and the exact field set (including
 * {@code CheckMacValue}) the browser must POST there. Field order is insertion order with the
 * check value last.
 */
public record PaymentForm(
    @JsonProperty("action_url") String actionUrl,
    Map<String, String> params) {

  public PaymentForm {
    params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
  }
}
