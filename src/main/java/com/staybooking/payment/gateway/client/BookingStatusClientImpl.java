package com.staybooking.payment.gateway.client;

import com.staybooking.payment.gateway.exception.BookingServiceUnavailableException;
import com.staybooking.payment.gateway.model.BookingPaymentUpdate;
import com.staybooking.payment.gateway.model.TradeResult;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP-based implementation of {@link BookingStatusClient} using {@link RestTemplate}.
 *
 * <p>Posts the payment update to {@code /api/bookings/{id}/payment} on the booking service
 * configured via {@code booking.service.url}, and translates HTTP 5xx and timeouts into
 * {@link BookingServiceUnavailableException}.
 */
@Component
public class BookingStatusClientImpl implements BookingStatusClient {

  private final RestTemplate restTemplate;
  private final String bookingServiceUrl;

  public BookingStatusClientImpl(RestTemplate restTemplate,
      @Value("${booking.service.url}") String bookingServiceUrl) {
    this.restTemplate = restTemplate;
    this.bookingServiceUrl = bookingServiceUrl;
  }

  @Override
  public void markPaid(String bookingId, TradeResult result) {
    try {
      restTemplate.postForLocation(
          bookingServiceUrl + "/api/bookings/{id}/payment",
          BookingPaymentUpdate.paid(result),
          bookingId);
    } catch (HttpServerErrorException e) {
      throw new BookingServiceUnavailableException(
          "Booking service returned error: " + e.getStatusCode());
    } catch (ResourceAccessException e) {
      throw new BookingServiceUnavailableException(
          "Booking service is unavailable: " + e.getMessage());
    }
  }
}
