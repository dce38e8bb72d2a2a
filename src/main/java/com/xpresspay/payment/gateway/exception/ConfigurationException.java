package com.xpresspay.payment.gateway.exception;

/**
 * Thrown when credentials or client settings are invalid. Raised at construction time,
 * before any transaction begins.
 */
public class ConfigurationException extends XpressPayException {

  public ConfigurationException(String message) {
    super(message);
  }
}
