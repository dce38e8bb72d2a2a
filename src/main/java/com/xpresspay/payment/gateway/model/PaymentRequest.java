package com.xpresspay.payment.gateway.model;

import com.xpresspay.payment.gateway.enums.PaymentKind;

/**
 * Fields common to every payment branch. Each branch has its own request shape;
 * {@link #getKind()} is the tag validation and payload assembly dispatch on.
 */
public abstract class PaymentRequest {

  public static final String DEFAULT_CURRENCY = "NGN";

  private String amount;
  private String email;
  private String transactionId;
  private String currency = DEFAULT_CURRENCY;
  private String firstName;
  private String lastName;
  private String phoneNumber;

  public abstract PaymentKind getKind();

  public String getAmount() {
    return amount;
  }

  public void setAmount(String amount) {
    this.amount = amount;
  }

  public String getEmail() {
    return email;
  }

  public void setEmail(String email) {
    this.email = email;
  }

  public String getTransactionId() {
    return transactionId;
  }

  public void setTransactionId(String transactionId) {
    this.transactionId = transactionId;
  }

  public String getCurrency() {
    return currency;
  }

  public void setCurrency(String currency) {
    this.currency = currency;
  }

  public String getFirstName() {
    return firstName;
  }

  public void setFirstName(String firstName) {
    this.firstName = firstName;
  }

  public String getLastName() {
    return lastName;
  }

  public void setLastName(String lastName) {
    this.lastName = lastName;
  }

  public String getPhoneNumber() {
    return phoneNumber;
  }

  public void setPhoneNumber(String phoneNumber) {
    this.phoneNumber = phoneNumber;
  }
}
