package com.staybooking.payment.gateway.model;

/**
 * A single checkout attempt to be signed and sent to the gateway.
 *
 * <p>{@code tradeNumber} must stay the same for retries of one booking attempt so the gateway
 * can deduplicate, and {@code amount} is the payable amount at signing time in whole currency
 * units. {@code tradeTimestamp} uses the gateway format {@code yyyy/MM/dd HH:mm:ss}.
 */
public class TradeRequest {

  private String tradeNumber;
  private String tradeTimestamp;
  private Integer amount;
  private String description;
  private String itemName;
  private String returnUrl;
  private String resultUrl;
  private String clientBackUrl;
  private String customerName;
  private String customerEmail;
  private String customerPhone;

  public String getTradeNumber() {
    return tradeNumber;
  }

  public void setTradeNumber(String tradeNumber) {
    this.tradeNumber = tradeNumber;
  }

  public String getTradeTimestamp() {
    return tradeTimestamp;
  }

  public void setTradeTimestamp(String tradeTimestamp) {
    this.tradeTimestamp = tradeTimestamp;
  }

  public Integer getAmount() {
    return amount;
  }

  public void setAmount(Integer amount) {
    this.amount = amount;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public String getItemName() {
    return itemName;
  }

  public void setItemName(String itemName) {
    this.itemName = itemName;
  }

  public String getReturnUrl() {
    return returnUrl;
  }

  public void setReturnUrl(String returnUrl) {
    this.returnUrl = returnUrl;
  }

  public String getResultUrl() {
    return resultUrl;
  }

  public void setResultUrl(String resultUrl) {
    this.resultUrl = resultUrl;
  }

  public String getClientBackUrl() {
    return clientBackUrl;
  }

  public void setClientBackUrl(String clientBackUrl) {
    this.clientBackUrl = clientBackUrl;
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
    return "TradeRequest{"
        + "tradeNumber='" + tradeNumber + '\''
        + ", tradeTimestamp='" + tradeTimestamp + '\''
        + ", amount=" + amount
        + '}';
  }
}
