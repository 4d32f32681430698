package com.staybooking.payment.gateway.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;

/**
 * Checkout request sent by the booking front end once a booking with card payment has been
 * created. The booking id doubles as the gateway trade number.
 */
public class PostCheckoutRequest {

  @JsonProperty("booking_id")
  private String bookingId;
  private BigDecimal amount;
  @JsonProperty("customer_name")
  private String customerName;
  @JsonProperty("customer_email")
  private String customerEmail;
  @JsonProperty("customer_phone")
  private String customerPhone;

  public String getBookingId() {
    return bookingId;
  }

  public void setBookingId(String bookingId) {
    this.bookingId = bookingId;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public void setAmount(BigDecimal amount) {
    this.amount = amount;
  }

  public String getCustomerName() {
    return customerName;
  }

  public void setCustomerName(String customerName) {
    this.customerName = customerName;
  }

  public String getCustomerEmail() {
    return customerEmail;
  }

  public void setCustomerEmail(String customerEmail) {
    this.customerEmail = customerEmail;
  }

  public String getCustomerPhone() {
    return customerPhone;
  }

  public void setCustomerPhone(String customerPhone) {
    this.customerPhone = customerPhone;
  }

  @Override
  public String toString() {
    return "PostCheckoutRequest{"
        + "bookingId='" + bookingId + '\''
        + ", amount=" + amount
        + '}';
  }
}
