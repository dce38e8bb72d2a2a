package com.xpresspay.payment.gateway.exception;

import java.util.List;

/**
 * Thrown when a request fails validation, either locally before any network call or
 * by the gateway (HTTP 400).
 * Carries a list of all validation errors so they can be reported together, and the
 * gateway's error sub-type when one was supplied.
 */
public class ValidationException extends XpressPayException {

  private final String errorType;
  private final List<String> errors;

  public ValidationException(List<String> errors) {
    this("invalid_request", errors);
  }

  public ValidationException(String errorType, List<String> errors) {
    super("Invalid payment request: " + String.join(", ", errors));
    this.errorType = errorType;
    this.errors = List.copyOf(errors);
  }

  public ValidationException(String message, String errorType, Integer statusCode) {
    super(message, statusCode);
    this.errorType = errorType;
    this.errors = List.of(message);
  }

  public String getErrorType() {
    return errorType;
  }

  public List<String> getErrors() {
    return errors;
  }
}
