package com.xpresspay.payment.gateway.enums;

/**
 * The branch a transaction takes, fixed when the transaction is created.
 */
public enum PaymentKind {
  /** Customer pays on the gateway's own page; no card data passes through the merchant. */
  HOSTED,
  /** Card debit, possibly with PIN, AVS/3-D Secure and OTP steps. */
  CARD,
  /** Direct bank account debit confirmed by OTP. */
  ACCOUNT;

  /** Value sent in the gateway's {@code paymentType} field. */
  public String wireValue() {
    return name();
  }
}
