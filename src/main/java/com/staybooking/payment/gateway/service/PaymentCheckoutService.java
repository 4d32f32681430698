package com.staybooking.payment.gateway.service;

import com.staybooking.payment.gateway.model.CallbackOutcome;
import com.staybooking.payment.gateway.model.PaymentForm;
import com.staybooking.payment.gateway.model.PostCheckoutRequest;
import java.util.Map;

/**
 * Defines the card payment operations offered to the booking flow: signing a checkout form
 * and processing the gateway's callbacks.
 */
public interface PaymentCheckoutService {

  /**
   * Builds a signed payment form for a booking.
   *
   * @param request the booking id, payable amount and customer contact details
   * @return the cashier URL and signed fields to POST there
   * @throws com.staybooking.payment.gateway.exception.InvalidTradeRequestException if the
   *     request is invalid
   * @throws com.staybooking.payment.gateway.exception.GatewayConfigurationException if
   *     merchant credentials are missing
   */
  PaymentForm createPaymentForm(PostCheckoutRequest request);

  /**
   * Verifies and applies a gateway callback. Only a verified, successful, non-simulated (or
   * stage) trade whose amount matches the signed amount is reported to the booking service.
   *
   * @param callbackFields the raw fields posted by the gateway
   * @return the outcome; verification and parse failures are returned, not thrown
   * @throws com.staybooking.payment.gateway.exception.BookingServiceUnavailableException if a
   *     paid trade could not be recorded
   */
  CallbackOutcome processCallback(Map<String, String> callbackFields);
}
