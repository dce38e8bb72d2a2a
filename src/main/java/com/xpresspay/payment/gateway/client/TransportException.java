package com.xpresspay.payment.gateway.client;

/**
 * Thrown by a {@link GatewayTransport} when the request could not be delivered or no
 * reply was received: timeout, connection refused, DNS or TLS failure.
 */
public class TransportException extends RuntimeException {

  public TransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
