package com.xpresspay.payment.gateway.enums;

/**
 * What the gateway still needs before it can complete a card or account debit.
 */
public enum ChallengeType {
  NONE,
  /** Local card: submit the 4-digit card PIN. */
  PIN_REQUIRED,
  /** International card: submit the billing address, possibly followed by 3-D Secure. */
  AVS_REQUIRED,
  /** Submit the one-time password sent to the customer. */
  OTP_REQUIRED
}
