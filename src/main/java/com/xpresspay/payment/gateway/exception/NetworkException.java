package com.xpresspay.payment.gateway.exception;

/**
 * Thrown when the request never reached the gateway (timeout, connection refused,
 * DNS or TLS failure). No charge can have occurred, so the call is safe to retry.
 */
public class NetworkException extends XpressPayException {

  public NetworkException(String message, Throwable cause) {
    super(message, null, cause);
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}
