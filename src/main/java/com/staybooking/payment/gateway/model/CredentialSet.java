package com.staybooking.payment.gateway.model;

import com.staybooking.payment.gateway.enums.GatewayEnvironment;

/**
 * The merchant credentials and cashier endpoint used for one transaction.
 *
 * <p>Resolved once per request by
 * {@link com.staybooking.payment.gateway.credential.CredentialResolver} and passed explicitly
 * to every signing and verification call. The hash key and IV are secret material and are
 * left out of {@link #toString()}.
 */
public record CredentialSet(
    String merchantId,
    String signingKey,
    String signingIv,
    String gatewayUrl,
    GatewayEnvironment environment) {

  @Override
  public String toString() {
    return "CredentialSet[merchantId=" + merchantId + ", environment=" + environment + "]";
  }
}
