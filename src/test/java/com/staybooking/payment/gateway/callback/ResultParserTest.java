package com.staybooking.payment.gateway.callback;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.staybooking.payment.gateway.exception.ResultParseException;
import com.staybooking.payment.gateway.model.TradeResult;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ResultParser")
class ResultParserTest {

  private final ResultParser parser = new ResultParser();

  private Map<String, String> paidFields() {
    Map<String, String> fields = new HashMap<>();
    fields.put("MerchantID", "2000132");
    fields.put("MerchantTradeNo", "BK12345678");
    fields.put("TradeNo", "2501151030123456");
    fields.put("RtnCode", "1");
    fields.put("RtnMsg", "Succeeded");
    fields.put("TradeAmt", "6000");
    fields.put("PaymentDate", "2025/01/15 10:32:10");
    fields.put("PaymentType", "Credit_CreditCard");
    fields.put("PaymentTypeChargeFee", "120");
    fields.put("TradeDate", "2025/01/15 10:30:00");
    fields.put("SimulatePaid", "0");
    return fields;
  }

  private TradeResult parse(Map<String, String> fields) {
    return parser.parse(new VerifiedPayload(fields));
  }

  @Nested
  @DisplayName("Successful Parsing")
  class SuccessfulParsing {

    @Test
    @DisplayName("Should extract every field of a paid callback")
    void shouldParsePaidCallback() {
      // when
      TradeResult result = parse(paidFields());

      // then
      assertEquals("BK12345678", result.merchantTradeNumber());
      assertEquals("2501151030123456", result.gatewayTradeNumber());
      assertEquals(1, result.returnCode());
      assertEquals("Succeeded", result.returnMessage());
      assertEquals(6000, result.tradeAmount());
      assertEquals("2025/01/15 10:32:10", result.paymentDate());
      assertEquals("Credit_CreditCard", result.paymentType());
      assertEquals("120", result.paymentTypeChargeFee());
      assertEquals("2025/01/15 10:30:00", result.tradeDate());
      assertFalse(result.simulatePaid());
      assertTrue(result.isSuccessful());
    }

    @Test
    @DisplayName("Should parse a failed trade without treating it as an error")
    void shouldParseFailedTrade() {
      // given
      Map<String, String> fields = paidFields();
      fields.put("RtnCode", "10100058");
      fields.put("RtnMsg", "Card declined");

      // when
      TradeResult result = parse(fields);

      // then
      assertEquals(10100058, result.returnCode());
      assertFalse(result.isSuccessful());
    }

    @Test
    @DisplayName("Should leave absent optional fields empty")
    void shouldAllowMissingOptionalFields() {
      // given
      Map<String, String> fields = paidFields();
      fields.remove("PaymentDate");
      fields.remove("PaymentType");
      fields.remove("PaymentTypeChargeFee");
      fields.remove("TradeDate");
      fields.remove("SimulatePaid");

      // when
      TradeResult result = parse(fields);

      // then
      assertNull(result.paymentDate());
      assertNull(result.paymentType());
      assertFalse(result.simulatePaid());
    }

    @Test
    @DisplayName("Should read SimulatePaid=1 as a simulated payment")
    void shouldReadSimulatedFlag() {
      // given
      Map<String, String> fields = paidFields();
      fields.put("SimulatePaid", "1");

      // when / then
      assertTrue(parse(fields).simulatePaid());
    }

    @Test
    @DisplayName("Should read an empty SimulatePaid as a real payment")
    void shouldReadEmptySimulatedFlag() {
      // given
      Map<String, String> fields = paidFields();
      fields.put("SimulatePaid", "");

      // when / then
      assertFalse(parse(fields).simulatePaid());
    }
  }

  @Nested
  @DisplayName("Malformed Fields")
  class MalformedFields {

    @Test
    @DisplayName("Should fail on a missing trade amount instead of defaulting it")
    void shouldFail_whenTradeAmountIsMissing() {
      // given
      Map<String, String> fields = paidFields();
      fields.remove("TradeAmt");

      // when
      ResultParseException ex = assertThrows(ResultParseException.class, () -> parse(fields));

      // then
      assertEquals("TradeAmt", ex.getField());
      assertEquals("Missing required field TradeAmt", ex.getMessage());
    }

    @Test
    @DisplayName("Should fail on a non-numeric return code")
    void shouldFail_whenReturnCodeIsNotNumeric() {
      // given
      Map<String, String> fields = paidFields();
      fields.put("RtnCode", "OK");

      // when
      ResultParseException ex = assertThrows(ResultParseException.class, () -> parse(fields));

      // then
      assertEquals("RtnCode", ex.getField());
      assertEquals("Field RtnCode is not an integer: OK", ex.getMessage());
    }

    @Test
    @DisplayName("Should fail on a missing gateway trade number")
    void shouldFail_whenTradeNoIsMissing() {
      // given
      Map<String, String> fields = paidFields();
      fields.remove("TradeNo");

      // when / then
      assertEquals("TradeNo",
          assertThrows(ResultParseException.class, () -> parse(fields)).getField());
    }

    @Test
    @DisplayName("Should fail on an unexpected SimulatePaid value")
    void shouldFail_whenSimulatedFlagIsUnknown() {
      // given
      Map<String, String> fields = paidFields();
      fields.put("SimulatePaid", "yes");

      // when / then
      assertEquals("SimulatePaid",
          assertThrows(ResultParseException.class, () -> parse(fields)).getField());
    }
  }
}
