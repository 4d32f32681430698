package com.staybooking.payment.gateway.configuration;

import com.staybooking.payment.gateway.enums.GatewayEnvironment;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Immutable gateway settings bound once at startup from {@code payment.gateway.*}.
 *
 * <p>{@code environment} is the deployment flag. It decides which merchant credentials are
 * used by default and whether production credentials may be used at all. It is never
 * derived from the merchant id.
 *
 * @param environment deployment environment, TEST unless configured otherwise
 * @param test merchant credentials for the staging cashier
 * @param production merchant credentials for the live cashier
 * @param baseUrl public base URL of this service, used to derive callback URLs
 * @param returnUrl explicit server notification URL; derived from {@code baseUrl} when blank
 * @param orderResultUrl explicit browser result URL; derived from {@code baseUrl} when blank
 * @param clientBackUrl explicit "back to shop" URL; derived from {@code baseUrl} when blank
 * @param timeZone zone used to render {@code MerchantTradeDate}
 * @param tradeDescriptionPrefix prefix for {@code TradeDesc}, followed by the booking id
 * @param itemNamePrefix prefix for {@code ItemName}, followed by the booking id
 */
@ConfigurationProperties(prefix = "payment.gateway")
public record GatewayProperties(
    @DefaultValue("TEST") GatewayEnvironment environment,
    Merchant test,
    Merchant production,
    @DefaultValue("http://localhost:8080") String baseUrl,
    String returnUrl,
    String orderResultUrl,
    String clientBackUrl,
    @DefaultValue("Asia/Taipei") String timeZone,
    @DefaultValue("Booking ") String tradeDescriptionPrefix,
    @DefaultValue("Room booking ") String itemNamePrefix) {

  public record Merchant(String merchantId, String hashKey, String hashIv) {

    @Override
    public String toString() {
      return "Merchant[merchantId=" + merchantId + "]";
    }
  }
}
