package com.staybooking.payment.gateway.enums;

/**
 * The two deployments of the hosted checkout. Each one has a fixed cashier endpoint that
 * the signed payment form is posted to.
 */
public enum GatewayEnvironment {
  TEST("https://payment-stage.ecpay.com.tw/Cashier/AioCheckOut/V5"),
  PRODUCTION("https://payment.ecpay.com.tw/Cashier/AioCheckOut/V5");

  private final String actionUrl;

  GatewayEnvironment(String actionUrl) {
    this.actionUrl = actionUrl;
  }

  public String getActionUrl() {
    return actionUrl;
  }
}
