package com.xpresspay.payment.gateway.model;

/**
 * Reply to a query (card/account) or verify (hosted) call.
 *
 * <p>Always check that {@link #getAmount()} matches the order total before delivering value.
 */
public class VerifyResult extends GatewayResult {

  private String transactionId;
  private String amount;
  private String currency;
  private String paymentType;
  private String gatewayStatus;

  public String getTransactionId() {
    return transactionId;
  }

  public void setTransactionId(String transactionId) {
    this.transactionId = transactionId;
  }

  public String getAmount() {
    return amount;
  }

  public void setAmount(String amount) {
    this.amount = amount;
  }

  public String getCurrency() {
    return currency;
  }

  public void setCurrency(String currency) {
    this.currency = currency;
  }

  public String getPaymentType() {
    return paymentType;
  }

  public void setPaymentType(String paymentType) {
    this.paymentType = paymentType;
  }

  /** The gateway's own status text, e.g. {@code "SUCCESSFUL"}. */
  public String getGatewayStatus() {
    return gatewayStatus;
  }

  public void setGatewayStatus(String gatewayStatus) {
    this.gatewayStatus = gatewayStatus;
  }
}
