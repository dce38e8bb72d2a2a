package com.xpresspay.payment.gateway.model;

import com.xpresspay.payment.gateway.enums.PaymentKind;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Initiates a card debit. The amount is in kobo, e.g. {@code "5000"}.
 *
 * <p>Only card number, CVV, expiry, amount, email and transaction id are mandatory.
 * The billing address is optional at initiation but improves approval rates on
 * international cards.
 */
public class CardPaymentRequest extends PaymentRequest {

  private String cardNumber;
  private String cvv;
  private String expiryMonth;
  private String expiryYear;
  private String country = "NG";
  private String ip;
  private String deviceFingerPrint;
  private String redirectUrl;
  private BillingAddress billingAddress;
  private Map<String, String> meta = new LinkedHashMap<>();

  @Override
  public PaymentKind getKind() {
    return PaymentKind.CARD;
  }

  public String getCardNumber() {
    return cardNumber;
  }

  public void setCardNumber(String cardNumber) {
    this.cardNumber = cardNumber;
  }

  public String getCvv() {
    return cvv;
  }

  public void setCvv(String cvv) {
    this.cvv = cvv;
  }

  public String getExpiryMonth() {
    return expiryMonth;
  }

  public void setExpiryMonth(String expiryMonth) {
    this.expiryMonth = expiryMonth;
  }

  public String getExpiryYear() {
    return expiryYear;
  }

  public void setExpiryYear(String expiryYear) {
    this.expiryYear = expiryYear;
  }

  public String getCountry() {
    return country;
  }

  public void setCountry(String country) {
    this.country = country;
  }

  public String getIp() {
    return ip;
  }

  public void setIp(String ip) {
    this.ip = ip;
  }

  public String getDeviceFingerPrint() {
    return deviceFingerPrint;
  }

  public void setDeviceFingerPrint(String deviceFingerPrint) {
    this.deviceFingerPrint = deviceFingerPrint;
  }

  public String getRedirectUrl() {
    return redirectUrl;
  }

  public void setRedirectUrl(String redirectUrl) {
    this.redirectUrl = redirectUrl;
  }

  public BillingAddress getBillingAddress() {
    return billingAddress;
  }

  public void setBillingAddress(BillingAddress billingAddress) {
    this.billingAddress = billingAddress;
  }

  public Map<String, String> getMeta() {
    return meta;
  }

  public void setMeta(Map<String, String> meta) {
    this.meta = meta;
  }
}
