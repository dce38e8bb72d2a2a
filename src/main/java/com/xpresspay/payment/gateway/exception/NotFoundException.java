package com.xpresspay.payment.gateway.exception;

/**
 * Thrown when the gateway does not know the transaction (HTTP 404).
 * Do not retry with the same transaction id.
 */
public class NotFoundException extends XpressPayException {

  public NotFoundException(String message, Integer statusCode) {
    super(message, statusCode);
  }
}
