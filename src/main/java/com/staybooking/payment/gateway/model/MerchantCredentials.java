package com.staybooking.payment.gateway.model;

import com.staybooking.payment.gateway.enums.GatewayEnvironment;

/**
 * Credentials supplied explicitly by a caller instead of the configured defaults. The
 * environment is declared, not guessed, and selects the cashier endpoint.
 */
public record MerchantCredentials(
    String merchantId,
    String hashKey,
    String hashIv,
    GatewayEnvironment environment) {

  @Override
  public String toString() {
    return "MerchantCredentials[merchantId=" + merchantId + ", environment=" + environment + "]";
  }
}
