package com.xpresspay.payment.gateway.enums;

public enum TransactionStatus {
  CREATED,
  AUTH_PENDING,
  VALIDATION_PENDING,
  SETTLED,
  FAILED;

  public boolean isTerminal() {
    return this == SETTLED || this == FAILED;
  }
}
