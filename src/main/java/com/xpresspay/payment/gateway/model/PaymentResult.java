package com.xpresspay.payment.gateway.model;

/**
 * Reply to a card or account initiate, authenticate or OTP validation call.
 */
public class PaymentResult extends GatewayResult {

  private String transactionReference;
  private String uniqueKey;
  private String amount;
  private String chargedAmount;
  private String paymentType;
  private String validationInstruction;
  private String authUrl;

  public String getTransactionReference() {
    return transactionReference;
  }

  public void setTransactionReference(String transactionReference) {
    this.transactionReference = transactionReference;
  }

  public String getUniqueKey() {
    return uniqueKey;
  }

  public void setUniqueKey(String uniqueKey) {
    this.uniqueKey = uniqueKey;
  }

  public String getAmount() {
    return amount;
  }

  public void setAmount(String amount) {
    this.amount = amount;
  }

  public String getChargedAmount() {
    return chargedAmount;
  }

  public void setChargedAmount(String chargedAmount) {
    this.chargedAmount = chargedAmount;
  }

  public String getPaymentType() {
    return paymentType;
  }

  public void setPaymentType(String paymentType) {
    this.paymentType = paymentType;
  }

  public String getValidationInstruction() {
    return validationInstruction;
  }

  public void setValidationInstruction(String validationInstruction) {
    this.validationInstruction = validationInstruction;
  }

  public String getAuthUrl() {
    return authUrl;
  }

  public void setAuthUrl(String authUrl) {
    this.authUrl = authUrl;
  }
}
