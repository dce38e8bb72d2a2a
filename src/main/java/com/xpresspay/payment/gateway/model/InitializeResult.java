package com.xpresspay.payment.gateway.model;

/**
 * Reply to a hosted-page initialize call.
 */
public class InitializeResult extends GatewayResult {

  private final String paymentUrl;
  private final String reference;

  public InitializeResult(String paymentUrl, String reference) {
    this.paymentUrl = paymentUrl;
    this.reference = reference;
  }

  /** Page the customer must be redirected to. */
  public String getPaymentUrl() {
    return paymentUrl;
  }

  public String getReference() {
    return reference;
  }
}
