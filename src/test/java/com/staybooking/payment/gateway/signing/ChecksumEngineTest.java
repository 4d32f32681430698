package com.staybooking.payment.gateway.signing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ChecksumEngine")
class ChecksumEngineTest {

  private static final String STAGE_KEY = "5294y06JbISpM5x9";
  private static final String STAGE_IV = "v77hoKGq4kWxNNIS";

  private final ParameterCanonicalizer canonicalizer = new ParameterCanonicalizer();
  private final ChecksumEngine engine = new ChecksumEngine();

  @Nested
  @DisplayName("Known vectors")
  class KnownVectors {

    @Test
    @DisplayName("Should reproduce the recorded check value for TEST001 / 1000")
    void shouldMatchRecordedVector() {
      // given
      Map<String, String> params = Map.of("MerchantTradeNo", "TEST001", "TotalAmount", "1000");

      // when
      String signature = engine.sign(canonicalizer.canonicalize(params, STAGE_KEY, STAGE_IV));

      // then
      assertEquals("5D945C909E1D09C7EF5E175FD5C51A0F57E8C94F976D7F2F03F7F88865754A4F",
          signature);
    }

    @Test
    @DisplayName("Should reproduce the recorded check value including the stage MerchantID")
    void shouldMatchRecordedVectorWithMerchantId() {
      // given
      Map<String, String> params = Map.of("MerchantID", "2000132",
          "MerchantTradeNo", "TEST001", "TotalAmount", "1000");

      // when
      String signature = engine.sign(canonicalizer.canonicalize(params, STAGE_KEY, STAGE_IV));

      // then
      assertEquals("A937200FDD8B614490D8BF0722AB8B2700E85F10A8187D66CD372C95D32A434A",
          signature);
    }

    @Test
    @DisplayName("Should reproduce the gateway's published documentation example")
    void shouldMatchPublishedExample() {
      // given
      Map<String, String> params = new LinkedHashMap<>();
      params.put("MerchantID", "3002607");
      params.put("MerchantTradeNo", "ecpay20230312153023");
      params.put("MerchantTradeDate", "2023/03/12 15:30:23");
      params.put("PaymentType", "aio");
      params.put("TotalAmount", "30000");
      params.put("TradeDesc", "促銷方案");
      params.put("ItemName", "Apple iphone 15");
      params.put("ReturnURL", "https://www.ecpay.com.tw/receive.php");
      params.put("ChoosePayment", "ALL");
      params.put("EncryptType", "1");

      // when
      String signature = engine.sign(
          canonicalizer.canonicalize(params, "pwFHCqoQZGmho4w6", "EkRm7iFT261dpevs"));

      // then
      assertEquals("6C51C9E6888DE861FD62FB1DD17029FC742634498FD813DC43D4243B5685B840",
          signature);
    }
  }

  @Nested
  @DisplayName("Signing")
  class Signing {

    @Test
    @DisplayName("Should render 64 upper-case hex characters")
    void shouldRenderUpperCaseHex() {
      // when
      String signature = engine.sign("hashkey%3dk%26hashiv%3dv");

      // then
      assertEquals(64, signature.length());
      assertTrue(signature.matches("[0-9A-F]{64}"));
    }

    @Test
    @DisplayName("Should change the signature when any single character changes")
    void shouldChangeOnNearMiss() {
      // given
      String base = canonicalizer.canonicalize(
          Map.of("MerchantTradeNo", "TEST001", "TotalAmount", "1000"), STAGE_KEY, STAGE_IV);
      List<String> nearMisses = List.of(
          base.replace("test001", "test002"),
          base.replace("1000", "1001"),
          base.substring(0, base.length() - 1),
          base + "s",
          "x" + base.substring(1));

      // when / then
      String signature = engine.sign(base);
      for (String nearMiss : nearMisses) {
        assertNotEquals(base, nearMiss);
        assertNotEquals(signature, engine.sign(nearMiss));
      }
    }
  }

  @Nested
  @DisplayName("Verification")
  class Verification {

    @Test
    @DisplayName("Should accept the signature it produced")
    void shouldAcceptOwnSignature() {
      // given
      String canonical = canonicalizer.canonicalize(
          Map.of("MerchantTradeNo", "BK12345678", "TotalAmount", "6000", "CustomerEmail", ""),
          STAGE_KEY, STAGE_IV);

      // when / then
      assertTrue(engine.verify(engine.sign(canonical), canonical));
    }

    @Test
    @DisplayName("Should compare case-sensitively")
    void shouldRejectLowerCaseSignature() {
      // given
      String canonical = "hashkey%3dk%26hashiv%3dv";

      // when / then
      assertFalse(engine.verify(engine.sign(canonical).toLowerCase(Locale.ROOT), canonical));
    }

    @Test
    @DisplayName("Should reject a signature that only shares a prefix")
    void shouldRejectPartialMatch() {
      // given
      String canonical = "hashkey%3dk%26hashiv%3dv";
      String signature = engine.sign(canonical);

      // when / then
      assertFalse(engine.verify(signature.substring(0, 32), canonical));
      assertFalse(engine.verify(signature + "0", canonical));
    }

    @Test
    @DisplayName("Should return false instead of throwing for a null or empty signature")
    void shouldRejectNullAndEmpty() {
      // when / then
      assertFalse(engine.verify(null, "hashkey%3dk%26hashiv%3dv"));
      assertFalse(engine.verify("", "hashkey%3dk%26hashiv%3dv"));
    }
  }
}
