package com.xpresspay.payment.gateway.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * The calls a transaction can receive, with the branches each one applies to.
 */
public enum TransactionStep {
  INITIALIZE(EnumSet.of(PaymentKind.HOSTED)),
  INITIATE(EnumSet.of(PaymentKind.CARD, PaymentKind.ACCOUNT)),
  AUTHENTICATE_PIN(EnumSet.of(PaymentKind.CARD)),
  AUTHENTICATE_AVS(EnumSet.of(PaymentKind.CARD)),
  VALIDATE_OTP(EnumSet.of(PaymentKind.CARD, PaymentKind.ACCOUNT)),
  QUERY(EnumSet.allOf(PaymentKind.class));

  private final Set<PaymentKind> kinds;

  TransactionStep(Set<PaymentKind> kinds) {
    this.kinds = kinds;
  }

  public boolean appliesTo(PaymentKind kind) {
    return kinds.contains(kind);
  }
}
