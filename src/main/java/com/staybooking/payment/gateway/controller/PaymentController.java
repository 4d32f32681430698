package com.staybooking.payment.gateway.controller;

import com.staybooking.payment.gateway.enums.CallbackStatus;
import com.staybooking.payment.gateway.model.CallbackOutcome;
import com.staybooking.payment.gateway.model.PaymentForm;
import com.staybooking.payment.gateway.model.PostCheckoutRequest;
import com.staybooking.payment.gateway.service.PaymentCheckoutService;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller exposing the card payment endpoints.
 *
 * <ul>
 *   <li>POST /api/v1/payments/checkout - Build a signed form for the hosted cashier</li>
 *   <li>POST /api/v1/payments/callback - Server notification from the gateway (ReturnURL)</li>
 *   <li>GET|POST /api/v1/payments/result - Browser redirect after payment (OrderResultURL)</li>
 * </ul>
 *
 * <p>Both inbound endpoints pass the full raw field map to the service before any field is
 * interpreted.
 */
@RestController
@RequestMapping("/api/v1")
public class PaymentController {

  /** Acknowledgement the gateway requires, otherwise it keeps retrying the notification. */
  static final String ACKNOWLEDGED = "1|OK";

  private final PaymentCheckoutService paymentCheckoutService;

  public PaymentController(PaymentCheckoutService paymentCheckoutService) {
    this.paymentCheckoutService = paymentCheckoutService;
  }

  /**
   * Builds the signed payment form for a booking paid by card.
   *
   * @param request booking id, payable amount and optional customer contact details
   * @return the cashier URL and the fields the browser must POST there
   */
  @PostMapping("/payments/checkout")
  public ResponseEntity<PaymentForm> checkout(@RequestBody PostCheckoutRequest request) {
    return new ResponseEntity<>(paymentCheckoutService.createPaymentForm(request), HttpStatus.OK);
  }

  /**
   * Receives the gateway's server-to-server payment notification.
   *
   * <p>Returns {@code 1|OK} once the notification is verified, whether or not the trade
   * succeeded. A forged or unsigned notification gets a 400 and changes nothing.
   */
  @PostMapping(value = "/payments/callback",
      consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
  public ResponseEntity<String> callback(@RequestParam Map<String, String> fields) {
    CallbackOutcome outcome = paymentCheckoutService.processCallback(fields);
    return switch (outcome.status()) {
      case PAID, NOT_PAID -> plainText(HttpStatus.OK, ACKNOWLEDGED);
      case REJECTED -> plainText(HttpStatus.BAD_REQUEST, "0|" + outcome.reason());
      case UNPROCESSABLE -> plainText(HttpStatus.OK, "0|" + outcome.reason());
    };
  }

  /**
   * Receives the customer's browser after payment and reports the verified outcome.
   */
  @RequestMapping(value = "/payments/result", method = {RequestMethod.GET, RequestMethod.POST})
  public ResponseEntity<CallbackOutcome> result(@RequestParam Map<String, String> fields) {
    CallbackOutcome outcome = paymentCheckoutService.processCallback(fields);
    HttpStatus status = outcome.status() == CallbackStatus.REJECTED
        ? HttpStatus.BAD_REQUEST : HttpStatus.OK;
    return new ResponseEntity<>(outcome, status);
  }

  private static ResponseEntity<String> plainText(HttpStatus status, String body) {
    return ResponseEntity.status(status).contentType(MediaType.TEXT_PLAIN).body(body);
  }
}
