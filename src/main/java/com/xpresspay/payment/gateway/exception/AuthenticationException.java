package com.xpresspay.payment.gateway.exception;

/**
 * Thrown when the gateway rejects the public key (HTTP 401).
 * Fix the configured credentials; never retry.
 */
public class AuthenticationException extends XpressPayException {

  public AuthenticationException(String message, Integer statusCode) {
    super(message, statusCode);
  }
}
