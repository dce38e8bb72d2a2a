package com.xpresspay.payment.gateway.exception;

/**
 * Thrown when the gateway fails while processing the request (HTTP 5xx).
 * Transient: retry with backoff, then confirm the outcome with a query.
 */
public class ProcessingException extends XpressPayException {

  public ProcessingException(String message, Integer statusCode) {
    super(message, statusCode);
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}
