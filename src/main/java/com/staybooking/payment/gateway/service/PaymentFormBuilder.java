package com.staybooking.payment.gateway.service;

import com.staybooking.payment.gateway.exception.InvalidTradeRequestException;
import com.staybooking.payment.gateway.model.CredentialSet;
import com.staybooking.payment.gateway.model.PaymentForm;
import com.staybooking.payment.gateway.model.TradeRequest;
import com.staybooking.payment.gateway.signing.ChecksumEngine;
import com.staybooking.payment.gateway.signing.ParameterCanonicalizer;
import com.staybooking.payment.gateway.validation.TradeRequestValidator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Assembles and signs the form that sends the customer's browser to the hosted cashier.
 *
 * <p>Pure with respect to its inputs: no network I/O happens here, the caller redirects the
 * browser. The action URL is taken from {@link CredentialSet#gatewayUrl()}, which the resolver
 * derives from the credential environment only.
 */
@Component
public class PaymentFormBuilder {

  static final String PAYMENT_TYPE = "aio";
  static final String CHOOSE_PAYMENT = "Credit";
  static final String ENCRYPT_TYPE = "1";

  private final TradeRequestValidator validator;
  private final ParameterCanonicalizer canonicalizer;
  private final ChecksumEngine checksumEngine;

  public PaymentFormBuilder(TradeRequestValidator validator,
      ParameterCanonicalizer canonicalizer,
      ChecksumEngine checksumEngine) {
    this.validator = validator;
    this.canonicalizer = canonicalizer;
    this.checksumEngine = checksumEngine;
  }

  /**
   * Builds the signed form for a trade.
   *
   * @param tradeRequest the trade to sign
   * @param credentials the resolved credential set
   * @return the cashier URL and the signed fields
   * @throws InvalidTradeRequestException if the trade request breaks a gateway field rule
   */
  public PaymentForm build(TradeRequest tradeRequest, CredentialSet credentials) {
    List<String> errors = validator.validate(tradeRequest);
    if (!errors.isEmpty()) {
      throw new InvalidTradeRequestException(errors);
    }

    Map<String, String> params = new LinkedHashMap<>();
    params.put("MerchantID", credentials.merchantId());
    params.put("MerchantTradeNo", tradeRequest.getTradeNumber());
    params.put("MerchantTradeDate", tradeRequest.getTradeTimestamp());
    params.put("PaymentType", PAYMENT_TYPE);
    params.put("TotalAmount", String.valueOf(tradeRequest.getAmount()));
    params.put("TradeDesc", tradeRequest.getDescription());
    params.put("ItemName", tradeRequest.getItemName());
    params.put("ReturnURL", tradeRequest.getReturnUrl());
    params.put("OrderResultURL", tradeRequest.getResultUrl());
    params.put("ChoosePayment", CHOOSE_PAYMENT);
    params.put("EncryptType", ENCRYPT_TYPE);
    params.put("ClientBackURL", tradeRequest.getClientBackUrl());
    params.put("CustomerName", nullToEmpty(tradeRequest.getCustomerName()));
    params.put("CustomerEmail", nullToEmpty(tradeRequest.getCustomerEmail()));
    params.put("CustomerPhone", nullToEmpty(tradeRequest.getCustomerPhone()));

    String canonical = canonicalizer.canonicalize(params, credentials.signingKey(),
        credentials.signingIv());
    params.put(ParameterCanonicalizer.CHECK_MAC_VALUE, checksumEngine.sign(canonical));

    return new PaymentForm(credentials.gatewayUrl(), params);
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
