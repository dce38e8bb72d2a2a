package com.xpresspay.payment.gateway.exception;

/**
 * Thrown when the payload cannot be encrypted: missing or malformed secret key,
 * or a payload value that cannot be serialised. Always raised before any network call.
 */
public class EncryptionException extends XpressPayException {

  public EncryptionException(String message) {
    super(message);
  }

  public EncryptionException(String message, Throwable cause) {
    super(message, null, cause);
  }
}
