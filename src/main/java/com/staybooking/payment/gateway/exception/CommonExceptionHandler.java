package com.staybooking.payment.gateway.exception;

import com.staybooking.payment.gateway.model.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Global exception handler that maps domain exceptions to HTTP responses.
 *
 * <ul>
 *   <li>{@link InvalidTradeRequestException} -> 400 Bad Request</li>
 *   <li>{@link GatewayConfigurationException} -> 500 Internal Server Error</li>
 *   <li>{@link BookingServiceUnavailableException} -> 502 Bad Gateway</li>
 * </ul>
 *
 * <p>Configuration messages never contain key material, only the names of missing settings.
 */
@ControllerAdvice
public class CommonExceptionHandler {

  private static final Logger LOG = LoggerFactory.getLogger(CommonExceptionHandler.class);

  @ExceptionHandler(InvalidTradeRequestException.class)
  public ResponseEntity<ErrorResponse> handleInvalidTradeRequest(
      InvalidTradeRequestException ex) {
    LOG.warn("Invalid trade request: {}", ex.getErrors());
    return new ResponseEntity<>(new ErrorResponse(ex.getMessage()),
        HttpStatus.BAD_REQUEST);
  }

  @ExceptionHandler(GatewayConfigurationException.class)
  public ResponseEntity<ErrorResponse> handleConfiguration(GatewayConfigurationException ex) {
    LOG.error("Payment gateway misconfigured: {}", ex.getMessage());
    return new ResponseEntity<>(new ErrorResponse(ex.getMessage()),
        HttpStatus.INTERNAL_SERVER_ERROR);
  }

  @ExceptionHandler(BookingServiceUnavailableException.class)
  public ResponseEntity<ErrorResponse> handleBookingUnavailable(
      BookingServiceUnavailableException ex) {
    LOG.error("Booking service unavailable", ex);
    return new ResponseEntity<>(new ErrorResponse(ex.getMessage()),
        HttpStatus.BAD_GATEWAY);
  }

  /** Returns a 400 when the request body cannot be parsed (e.g. unknown fields, malformed JSON). */
  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadableMessage(HttpMessageNotReadableException ex) {
    LOG.warn("Malformed request body: {}", ex.getMessage());
    return new ResponseEntity<>(new ErrorResponse(extractReadableMessage(ex)),
        HttpStatus.BAD_REQUEST);
  }

  private String extractReadableMessage(HttpMessageNotReadableException ex) {
    String detail = ex.getMostSpecificCause().getMessage();
    if (detail != null && detail.contains("Unrecognized field")) {
      int start = detail.indexOf('"');
      int end = detail.indexOf('"', start + 1);
      if (start >= 0 && end > start) {
        return "Unrecognized field: '" + detail.substring(start + 1, end) + "'";
      }
    }
    return "Malformed request body";
  }
}
