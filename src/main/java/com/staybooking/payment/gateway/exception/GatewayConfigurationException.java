package com.staybooking.payment.gateway.exception;

/**
 * Thrown when merchant credentials are missing, incomplete or not allowed in the current
 * deployment. Nothing is signed once this is raised.
 * Handled by {@link CommonExceptionHandler} to produce a 500 response.
 */
public class GatewayConfigurationException extends RuntimeException {

  public GatewayConfigurationException(String message) {
    super(message);
  }
}
