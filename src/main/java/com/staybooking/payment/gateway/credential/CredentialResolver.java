package com.staybooking.payment.gateway.credential;

import com.staybooking.payment.gateway.configuration.GatewayProperties;
import com.staybooking.payment.gateway.configuration.GatewayProperties.Merchant;
import com.staybooking.payment.gateway.enums.GatewayEnvironment;
import com.staybooking.payment.gateway.exception.GatewayConfigurationException;
import com.staybooking.payment.gateway.model.CredentialSet;
import com.staybooking.payment.gateway.model.MerchantCredentials;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Selects the merchant credentials used to sign or verify a transaction.
 *
 * <p>The environment always comes from an explicit declaration: the deployment flag
 * {@code payment.gateway.environment} for configured credentials, or the environment carried by
 * {@link MerchantCredentials} for explicit ones. The cashier endpoint follows from it.
 *
 * <p>Production credentials are only handed out when the deployment flag is PRODUCTION as
 * well, so a staging deployment can never post to the live cashier.
 */
@Component
public class CredentialResolver {

  private final GatewayProperties properties;

  public CredentialResolver(GatewayProperties properties) {
    this.properties = properties;
  }

  /** Resolves the configured credentials for the deployment environment. */
  public CredentialSet resolve() {
    return resolve((MerchantCredentials) null);
  }

  /**
   * Resolves explicit credentials when given, the configured defaults otherwise.
   *
   * @param explicitCredentials credentials supplied by the caller; may be null
   * @return a complete credential set bound to one environment
   * @throws GatewayConfigurationException if credentials are incomplete or the environment is
   *     not allowed in this deployment
   */
  public CredentialSet resolve(MerchantCredentials explicitCredentials) {
    if (explicitCredentials == null) {
      return resolve(deploymentEnvironment());
    }
    GatewayEnvironment environment = explicitCredentials.environment();
    if (environment == null) {
      throw new GatewayConfigurationException(
          "Explicit merchant credentials must declare an environment");
    }
    return toCredentialSet(explicitCredentials.merchantId(), explicitCredentials.hashKey(),
        explicitCredentials.hashIv(), environment);
  }

  /**
   * Resolves the configured credentials for a given environment. Used to bind a callback to
   * the environment its trade was signed in.
   */
  public CredentialSet resolve(GatewayEnvironment environment) {
    Merchant merchant = configuredMerchant(environment);
    if (merchant == null) {
      throw new GatewayConfigurationException(
          "No merchant credentials configured for " + environment);
    }
    return toCredentialSet(merchant.merchantId(), merchant.hashKey(), merchant.hashIv(),
        environment);
  }

  /**
   * Finds the configured credential set of the deployment environment when its merchant id
   * matches. Stage credentials are public, so a production deployment never binds a callback
   * to them.
   */
  public Optional<CredentialSet> resolveForMerchant(String merchantId) {
    if (merchantId == null || merchantId.isBlank()) {
      return Optional.empty();
    }
    GatewayEnvironment environment = deploymentEnvironment();
    Merchant merchant = configuredMerchant(environment);
    if (merchant == null || !merchantId.equals(merchant.merchantId())) {
      return Optional.empty();
    }
    return Optional.of(resolve(environment));
  }

  public GatewayEnvironment deploymentEnvironment() {
    GatewayEnvironment environment = properties.environment();
    return environment == null ? GatewayEnvironment.TEST : environment;
  }

  private Merchant configuredMerchant(GatewayEnvironment environment) {
    return environment == GatewayEnvironment.PRODUCTION
        ? properties.production() : properties.test();
  }

  private CredentialSet toCredentialSet(String merchantId, String hashKey, String hashIv,
      GatewayEnvironment environment) {
    List<String> missing = new ArrayList<>();
    if (isBlank(merchantId)) {
      missing.add("MerchantID");
    }
    if (isBlank(hashKey)) {
      missing.add("HashKey");
    }
    if (isBlank(hashIv)) {
      missing.add("HashIV");
    }
    if (!missing.isEmpty()) {
      throw new GatewayConfigurationException(
          "Incomplete " + environment + " merchant credentials, missing: "
              + String.join(", ", missing));
    }
    if (environment == GatewayEnvironment.PRODUCTION
        && deploymentEnvironment() != GatewayEnvironment.PRODUCTION) {
      throw new GatewayConfigurationException(
          "Production credentials are not allowed in a " + deploymentEnvironment()
              + " deployment");
    }
    return new CredentialSet(merchantId, hashKey, hashIv, environment.getActionUrl(),
        environment);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
