package com.staybooking.payment.gateway.client;

import com.staybooking.payment.gateway.model.TradeResult;

/**
 * Abstraction over the booking service that owns booking and payment status.
 *
 * <p>Only verified, successful trades are passed here; this is the single path that may move
 * a booking to "paid".
 */
public interface BookingStatusClient {

  /**
   * Records a paid trade against its booking.
   *
   * @param bookingId the booking id, which is also the merchant trade number
   * @param result the verified trade result
   * @throws com.staybooking.payment.gateway.exception.BookingServiceUnavailableException if the
   *     booking service is unreachable or returns a server error
   */
  void markPaid(String bookingId, TradeResult result);
}
