package com.staybooking.payment.gateway.repository;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.staybooking.payment.gateway.enums.GatewayEnvironment;
import com.staybooking.payment.gateway.model.TradeAttempt;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TradeAttemptRepository")
class TradeAttemptRepositoryTest {

  private final TradeAttemptRepository repository = new TradeAttemptRepository();

  private TradeAttempt attempt(int amount) {
    return new TradeAttempt("BK12345678", amount, "2000132", GatewayEnvironment.TEST,
        Instant.parse("2025-01-15T02:30:00Z"), false);
  }

  @Test
  @DisplayName("Should settle an attempt exactly once")
  void shouldSettleOnce() {
    // given
    repository.record(attempt(6000));

    // when
    boolean first = repository.markSettled("BK12345678");
    boolean second = repository.markSettled("BK12345678");

    // then
    assertTrue(first);
    assertFalse(second);
    assertTrue(repository.find("BK12345678").orElseThrow().settled());
  }

  @Test
  @DisplayName("Should not settle an unknown trade")
  void shouldNotSettleUnknownTrade() {
    // when / then
    assertFalse(repository.markSettled("BK00000000"));
    assertTrue(repository.find("BK00000000").isEmpty());
  }

  @Test
  @DisplayName("Should replace an unsettled attempt when checkout is retried")
  void shouldReplaceUnsettledAttempt() {
    // given
    repository.record(attempt(6000));

    // when
    repository.record(attempt(5400));

    // then
    assertEquals(5400, repository.find("BK12345678").orElseThrow().amount());
  }

  @Test
  @DisplayName("Should keep a settled attempt when checkout is retried")
  void shouldKeepSettledAttempt() {
    // given
    repository.record(attempt(6000));
    repository.markSettled("BK12345678");

    // when
    repository.record(attempt(5400));

    // then
    TradeAttempt stored = repository.find("BK12345678").orElseThrow();
    assertEquals(6000, stored.amount());
    assertTrue(stored.settled());
  }

  @Test
  @DisplayName("Should allow settling again after a reverted settlement")
  void shouldSettleAgainAfterUnsettle() {
    // given
    repository.record(attempt(6000));
    repository.markSettled("BK12345678");

    // when
    repository.unsettle("BK12345678");

    // then
    assertFalse(repository.find("BK12345678").orElseThrow().settled());
    assertTrue(repository.markSettled("BK12345678"));
  }
}
