package com.staybooking.payment.gateway.validation;

import com.staybooking.payment.gateway.model.PostCheckoutRequest;
import com.staybooking.payment.gateway.model.TradeRequest;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Validates checkout and trade requests before anything is signed.
 *
 * <p>Like the rest of the service, validation is explicit rather than annotation driven so
 * that all errors are returned at once with controlled messages.
 *
 * <p>Trade request rules:
 * <ul>
 *   <li>Trade number: required, at most 20 characters, letters and digits only. It is never
 *       truncated, since a shortened number could collide with another booking.</li>
 *   <li>Trade timestamp: required, {@code yyyy/MM/dd HH:mm:ss}</li>
 *   <li>Amount: required, not negative</li>
 *   <li>Description and item name: required</li>
 *   <li>Return, result and client-back URLs: absolute http or https URLs</li>
 * </ul>
 */
@Component
public class TradeRequestValidator {

  public static final int MAX_TRADE_NUMBER_LENGTH = 20;
  public static final DateTimeFormatter TRADE_TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("uuuu/MM/dd HH:mm:ss").withResolverStyle(ResolverStyle.STRICT);

  private static final Pattern ALPHANUMERIC = Pattern.compile("[A-Za-z0-9]+");

  /**
   * Validates the booking-facing checkout request.
   *
   * @return a list of human-readable error messages; empty if the request is valid
   */
  public List<String> validate(PostCheckoutRequest request) {
    List<String> errors = new ArrayList<>();
    validateTradeNumber("Booking id", request.getBookingId(), errors);
    validateCheckoutAmount(request.getAmount(), errors);
    return errors;
  }

  /**
   * Validates a trade request against the gateway's field rules.
   *
   * @return a list of human-readable error messages; empty if the request is valid
   */
  public List<String> validate(TradeRequest request) {
    List<String> errors = new ArrayList<>();

    validateTradeNumber("Trade number", request.getTradeNumber(), errors);
    validateTimestamp(request.getTradeTimestamp(), errors);
    validateAmount(request.getAmount(), errors);
    validateRequired("Description", request.getDescription(), errors);
    validateRequired("Item name", request.getItemName(), errors);
    validateUrl("Return URL", request.getReturnUrl(), errors);
    validateUrl("Result URL", request.getResultUrl(), errors);
    validateUrl("Client back URL", request.getClientBackUrl(), errors);

    return errors;
  }

  private void validateTradeNumber(String label, String tradeNumber, List<String> errors) {
    if (tradeNumber == null || tradeNumber.isBlank()) {
      errors.add(label + " is required");
      return;
    }
    if (tradeNumber.length() > MAX_TRADE_NUMBER_LENGTH) {
      errors.add(label + " must be at most " + MAX_TRADE_NUMBER_LENGTH + " characters");
    }
    if (!ALPHANUMERIC.matcher(tradeNumber).matches()) {
      errors.add(label + " must contain only letters and digits");
    }
  }

  private void validateCheckoutAmount(BigDecimal amount, List<String> errors) {
    if (amount == null) {
      errors.add("Amount is required");
      return;
    }
    if (amount.signum() < 0) {
      errors.add("Amount must not be negative");
    }
    if (amount.stripTrailingZeros().scale() > 0) {
      errors.add("Amount must be a whole number");
    } else if (amount.compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) > 0) {
      errors.add("Amount is too large");
    }
  }

  private void validateTimestamp(String timestamp, List<String> errors) {
    if (timestamp == null || timestamp.isBlank()) {
      errors.add("Trade timestamp is required");
      return;
    }
    try {
      LocalDateTime.parse(timestamp, TRADE_TIMESTAMP_FORMAT);
    } catch (DateTimeParseException e) {
      errors.add("Trade timestamp must match yyyy/MM/dd HH:mm:ss");
    }
  }

  private void validateAmount(Integer amount, List<String> errors) {
    if (amount == null) {
      errors.add("Amount is required");
      return;
    }
    if (amount < 0) {
      errors.add("Amount must not be negative");
    }
  }

  private void validateRequired(String label, String value, List<String> errors) {
    if (value == null || value.isBlank()) {
      errors.add(label + " is required");
    }
  }

  private void validateUrl(String label, String value, List<String> errors) {
    if (value == null || value.isBlank()) {
      errors.add(label + " is required");
      return;
    }
    try {
      URI uri = new URI(value);
      String scheme = uri.getScheme();
      if (!uri.isAbsolute() || uri.getHost() == null
          || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
        errors.add(label + " must be an absolute http(s) URL");
      }
    } catch (URISyntaxException e) {
      errors.add(label + " must be an absolute http(s) URL");
    }
  }
}
