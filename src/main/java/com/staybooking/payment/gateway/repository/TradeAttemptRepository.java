package com.staybooking.payment.gateway.repository;

import com.staybooking.payment.gateway.model.TradeAttempt;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.springframework.stereotype.Repository;

/**
 * In-memory store of signed trade attempts keyed by trade number.
 *
 * <p>Records which environment a trade was signed in so its callbacks are verified with the
 * same credentials, and whether a paid notification has already been applied. The gateway
 * repeats notifications until acknowledged, so settling must happen at most once.
 *
 * <p>Note: attempts are kept for the life of the process. Callbacks for trades signed before
 * a restart fall back to merchant id binding.
 */
@Repository
public class TradeAttemptRepository {

  private final ConcurrentHashMap<String, TradeAttempt> store = new ConcurrentHashMap<>();

  /** Stores the attempt, replacing an unsettled one for the same trade number. */
  public void record(TradeAttempt attempt) {
    store.compute(attempt.tradeNumber(), (key, existing) ->
        existing != null && existing.settled() ? existing : attempt);
  }

  public Optional<TradeAttempt> find(String tradeNumber) {
    return Optional.ofNullable(store.get(tradeNumber));
  }

  /**
   * Marks the attempt settled.
   *
   * @return {@code true} only for the caller that performed the transition
   */
  public boolean markSettled(String tradeNumber) {
    AtomicBoolean transitioned = new AtomicBoolean(false);
    store.computeIfPresent(tradeNumber, (key, existing) -> {
      if (existing.settled()) {
        return existing;
      }
      transitioned.set(true);
      return existing.settle();
    });
    return transitioned.get();
  }

  /** Reverts a settlement whose booking update could not be delivered. */
  public void unsettle(String tradeNumber) {
    store.computeIfPresent(tradeNumber, (key, existing) -> new TradeAttempt(
        existing.tradeNumber(), existing.amount(), existing.merchantId(),
        existing.environment(), existing.createdAt(), false));
  }
}
