package com.xpresspay.payment.gateway.exception;

import java.util.List;

/**
 * Thrown when a step is called while the transaction is not in the state that step
 * requires, e.g. {@code validateOtp} on a transaction that was never initiated.
 * Always raised locally, before the transport is touched.
 */
public class IllegalTransitionException extends ValidationException {

  public IllegalTransitionException(String message) {
    super("invalid_state", List.of(message));
  }
}
