package com.xpresspay.payment.gateway.model;

import com.xpresspay.payment.gateway.enums.PaymentKind;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Initializes a hosted-page payment. The amount is in major units, e.g. {@code "1000.00"}.
 */
public class HostedPaymentRequest extends PaymentRequest {

  private String productId;
  private String productDescription;
  private String callbackUrl;
  private Map<String, String> metadata = new LinkedHashMap<>();

  @Override
  public PaymentKind getKind() {
    return PaymentKind.HOSTED;
  }

  public String getProductId() {
    return productId;
  }

  public void setProductId(String productId) {
    this.productId = productId;
  }

  public String getProductDescription() {
    return productDescription;
  }

  public void setProductDescription(String productDescription) {
    this.productDescription = productDescription;
  }

  public String getCallbackUrl() {
    return callbackUrl;
  }

  public void setCallbackUrl(String callbackUrl) {
    this.callbackUrl = callbackUrl;
  }

  public Map<String, String> getMetadata() {
    return metadata;
  }

  public void setMetadata(Map<String, String> metadata) {
    this.metadata = metadata;
  }
}
