package com.staybooking.payment.gateway.service;

import com.staybooking.payment.gateway.callback.CallbackVerification;
import com.staybooking.payment.gateway.callback.CallbackVerifier;
import com.staybooking.payment.gateway.callback.ResultParser;
import com.staybooking.payment.gateway.callback.VerifiedPayload;
import com.staybooking.payment.gateway.client.BookingStatusClient;
import com.staybooking.payment.gateway.configuration.GatewayProperties;
import com.staybooking.payment.gateway.credential.CredentialResolver;
import com.staybooking.payment.gateway.enums.GatewayEnvironment;
import com.staybooking.payment.gateway.enums.VerificationError;
import com.staybooking.payment.gateway.exception.BookingServiceUnavailableException;
import com.staybooking.payment.gateway.exception.InvalidTradeRequestException;
import com.staybooking.payment.gateway.exception.ResultParseException;
import com.staybooking.payment.gateway.model.CallbackOutcome;
import com.staybooking.payment.gateway.model.CredentialSet;
import com.staybooking.payment.gateway.model.PaymentForm;
import com.staybooking.payment.gateway.model.PostCheckoutRequest;
import com.staybooking.payment.gateway.model.TradeAttempt;
import com.staybooking.payment.gateway.model.TradeRequest;
import com.staybooking.payment.gateway.model.TradeResult;
import com.staybooking.payment.gateway.repository.TradeAttemptRepository;
import com.staybooking.payment.gateway.validation.TradeRequestValidator;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Orchestrates card checkout against the hosted cashier.
 *
 * <p>Checkout: validate, resolve credentials, build the trade request from configuration and
 * the injected {@link Clock}, sign it, and remember which environment it was signed in.
 *
 * <p>Callbacks: bind credentials explicitly (the recorded attempt first, the configured
 * merchant id otherwise), verify, parse, decide whether the trade counts as paid, and notify
 * the booking service at most once per trade.
 *
 * <p>Observability: the trade number is put in the MDC and these events are logged:
 * <ul>
 *   <li>{@code payment.form_built}: signed form returned, with amount and environment</li>
 *   <li>{@code payment.callback_received}: callback fields arrived</li>
 *   <li>{@code payment.callback_rejected}: verification failed; possible forgery</li>
 *   <li>{@code payment.callback_unprocessable}: verified but not parseable</li>
 *   <li>{@code payment.callback_not_paid} / {@code payment.callback_paid}: final decision</li>
 * </ul>
 */
@Service
public class PaymentCheckoutServiceImpl implements PaymentCheckoutService {

  private static final Logger LOG = LoggerFactory.getLogger(PaymentCheckoutServiceImpl.class);

  static final String CALLBACK_PATH = "/api/v1/payments/callback";
  static final String RESULT_PATH = "/api/v1/payments/result";

  private final GatewayProperties properties;
  private final TradeRequestValidator validator;
  private final CredentialResolver credentialResolver;
  private final PaymentFormBuilder formBuilder;
  private final CallbackVerifier callbackVerifier;
  private final ResultParser resultParser;
  private final TradeAttemptRepository attemptRepository;
  private final BookingStatusClient bookingStatusClient;
  private final Clock clock;

  public PaymentCheckoutServiceImpl(GatewayProperties properties,
      TradeRequestValidator validator,
      CredentialResolver credentialResolver,
      PaymentFormBuilder formBuilder,
      CallbackVerifier callbackVerifier,
      ResultParser resultParser,
      TradeAttemptRepository attemptRepository,
      BookingStatusClient bookingStatusClient,
      Clock clock) {
    this.properties = properties;
    this.validator = validator;
    this.credentialResolver = credentialResolver;
    this.formBuilder = formBuilder;
    this.callbackVerifier = callbackVerifier;
    this.resultParser = resultParser;
    this.attemptRepository = attemptRepository;
    this.bookingStatusClient = bookingStatusClient;
    this.clock = clock;
  }

  @Override
  public PaymentForm createPaymentForm(PostCheckoutRequest request) {
    if (request.getBookingId() != null) {
      request.setBookingId(request.getBookingId().trim());
    }

    List<String> errors = validator.validate(request);
    if (!errors.isEmpty()) {
      LOG.warn("event=payment.validation_failed errorCount={} errors={}",
          errors.size(), errors);
      throw new InvalidTradeRequestException(errors);
    }
    MDC.put("tradeNo", request.getBookingId());

    CredentialSet credentials = credentialResolver.resolve();
    TradeRequest tradeRequest = buildTradeRequest(request);
    PaymentForm form = formBuilder.build(tradeRequest, credentials);

    attemptRepository.record(new TradeAttempt(tradeRequest.getTradeNumber(),
        tradeRequest.getAmount(), credentials.merchantId(), credentials.environment(),
        clock.instant(), false));

    LOG.info("event=payment.form_built tradeNo={} amount={} environment={}",
        tradeRequest.getTradeNumber(), tradeRequest.getAmount(), credentials.environment());
    return form;
  }

  @Override
  public CallbackOutcome processCallback(Map<String, String> callbackFields) {
    String tradeNo = callbackFields.get("MerchantTradeNo");
    if (tradeNo != null) {
      MDC.put("tradeNo", tradeNo);
    }
    LOG.info("event=payment.callback_received tradeNo={} rtnCode={} fieldCount={}",
        tradeNo, callbackFields.get("RtnCode"), callbackFields.size());

    Optional<TradeAttempt> attempt = tradeNo == null
        ? Optional.empty() : attemptRepository.find(tradeNo);
    Optional<CredentialSet> credentials = bindCredentials(callbackFields, attempt);
    if (credentials.isEmpty()) {
      return reject(tradeNo, VerificationError.UNKNOWN_MERCHANT);
    }

    CallbackVerification verification = callbackVerifier.verify(callbackFields,
        credentials.get());
    if (!verification.isVerified()) {
      return reject(tradeNo, verification.getError().orElseThrow());
    }
    VerifiedPayload payload = verification.getPayload().orElseThrow();

    TradeResult result;
    try {
      result = resultParser.parse(payload);
    } catch (ResultParseException e) {
      LOG.warn("event=payment.callback_unprocessable tradeNo={} field={} reason={}",
          tradeNo, e.getField(), e.getMessage());
      return CallbackOutcome.unprocessable(e.getMessage());
    }

    Optional<String> notPaidReason = notPaidReason(result, credentials.get(), attempt);
    if (notPaidReason.isPresent()) {
      LOG.info("event=payment.callback_not_paid tradeNo={} rtnCode={} reason={}",
          result.merchantTradeNumber(), result.returnCode(), notPaidReason.get());
      return CallbackOutcome.notPaid(result, notPaidReason.get());
    }

    settle(result, attempt.isPresent());
    LOG.info("event=payment.callback_paid tradeNo={} gatewayTradeNo={} amount={} paymentType={}",
        result.merchantTradeNumber(), result.gatewayTradeNumber(), result.tradeAmount(),
        result.paymentType());
    return CallbackOutcome.paid(result);
  }

  private Optional<CredentialSet> bindCredentials(Map<String, String> callbackFields,
      Optional<TradeAttempt> attempt) {
    String merchantId = callbackFields.get("MerchantID");
    if (attempt.isPresent()) {
      TradeAttempt signed = attempt.get();
      if (merchantId != null && !merchantId.equals(signed.merchantId())) {
        return Optional.empty();
      }
      return Optional.of(credentialResolver.resolve(signed.environment()));
    }
    return credentialResolver.resolveForMerchant(merchantId);
  }

  private Optional<String> notPaidReason(TradeResult result, CredentialSet credentials,
      Optional<TradeAttempt> attempt) {
    if (!result.isSuccessful()) {
      return Optional.of("Gateway returned " + result.returnCode() + ": "
          + result.returnMessage());
    }
    if (result.simulatePaid() && credentials.environment() != GatewayEnvironment.TEST) {
      return Optional.of("Simulated payment outside the test environment");
    }
    if (attempt.isPresent() && attempt.get().amount() != result.tradeAmount()) {
      LOG.error("event=payment.amount_mismatch tradeNo={} signedAmount={} tradeAmount={}",
          result.merchantTradeNumber(), attempt.get().amount(), result.tradeAmount());
      return Optional.of("Trade amount does not match the signed amount");
    }
    return Optional.empty();
  }

  private void settle(TradeResult result, boolean attemptKnown) {
    String tradeNo = result.merchantTradeNumber();
    if (attemptKnown && !attemptRepository.markSettled(tradeNo)) {
      LOG.info("event=payment.callback_duplicate tradeNo={}", tradeNo);
      return;
    }
    try {
      bookingStatusClient.markPaid(tradeNo, result);
    } catch (BookingServiceUnavailableException e) {
      if (attemptKnown) {
        attemptRepository.unsettle(tradeNo);
      }
      throw e;
    }
  }

  private CallbackOutcome reject(String tradeNo, VerificationError error) {
    LOG.warn("event=payment.callback_rejected tradeNo={} error={}", tradeNo, error);
    return CallbackOutcome.rejected(error.getDescription());
  }

  private TradeRequest buildTradeRequest(PostCheckoutRequest request) {
    String bookingId = request.getBookingId();
    String baseUrl = stripTrailingSlash(properties.baseUrl());

    TradeRequest tradeRequest = new TradeRequest();
    tradeRequest.setTradeNumber(bookingId);
    tradeRequest.setTradeTimestamp(LocalDateTime.now(clock.withZone(tradeZone()))
        .format(TradeRequestValidator.TRADE_TIMESTAMP_FORMAT));
    tradeRequest.setAmount(request.getAmount().intValueExact());
    tradeRequest.setDescription(properties.tradeDescriptionPrefix() + bookingId);
    tradeRequest.setItemName(properties.itemNamePrefix() + bookingId);
    tradeRequest.setReturnUrl(orDefault(properties.returnUrl(), baseUrl + CALLBACK_PATH));
    tradeRequest.setResultUrl(orDefault(properties.orderResultUrl(), baseUrl + RESULT_PATH));
    tradeRequest.setClientBackUrl(orDefault(properties.clientBackUrl(),
        baseUrl + "/?bookingId=" + bookingId));
    tradeRequest.setCustomerName(request.getCustomerName());
    tradeRequest.setCustomerEmail(request.getCustomerEmail());
    tradeRequest.setCustomerPhone(request.getCustomerPhone());
    return tradeRequest;
  }

  private ZoneId tradeZone() {
    return ZoneId.of(properties.timeZone());
  }

  private static String orDefault(String configured, String fallback) {
    return configured == null || configured.isBlank() ? fallback : configured;
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
