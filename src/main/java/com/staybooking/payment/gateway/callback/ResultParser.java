package com.staybooking.payment.gateway.callback;

import com.staybooking.payment.gateway.exception.ResultParseException;
import com.staybooking.payment.gateway.model.TradeResult;
import org.springframework.stereotype.Component;

/**
 * Turns a verified callback into a {@link TradeResult}. Pure field extraction and coercion;
 * a missing or malformed required field is data corruption and is never defaulted.
 */
@Component
public class ResultParser {

  public TradeResult parse(VerifiedPayload payload) {
    return new TradeResult(
        required(payload, "MerchantTradeNo"),
        required(payload, "TradeNo"),
        requiredInt(payload, "RtnCode"),
        required(payload, "RtnMsg"),
        requiredInt(payload, "TradeAmt"),
        optional(payload, "PaymentDate"),
        optional(payload, "PaymentType"),
        optional(payload, "PaymentTypeChargeFee"),
        optional(payload, "TradeDate"),
        simulateFlag(payload));
  }

  private static String required(VerifiedPayload payload, String field) {
    return payload.get(field)
        .orElseThrow(() -> new ResultParseException(field, "Missing required field " + field));
  }

  private static int requiredInt(VerifiedPayload payload, String field) {
    String value = required(payload, field);
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new ResultParseException(field, "Field " + field + " is not an integer: " + value);
    }
  }

  private static String optional(VerifiedPayload payload, String field) {
    return payload.get(field).orElse(null);
  }

  // Absent means a real payment; the gateway only sends 1 for simulated ones.
  private static boolean simulateFlag(VerifiedPayload payload) {
    String value = payload.get("SimulatePaid").orElse(null);
    if (value == null || value.isEmpty() || "0".equals(value)) {
      return false;
    }
    if ("1".equals(value)) {
      return true;
    }
    throw new ResultParseException("SimulatePaid", "Field SimulatePaid is not 0 or 1: " + value);
  }
}
