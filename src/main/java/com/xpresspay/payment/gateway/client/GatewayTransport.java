package com.xpresspay.payment.gateway.client;

/**
 * Abstraction for the network exchange with the Xpresspay gateway.
 *
 * <p>Decouples the transaction engine from HTTP transport details so the engine can be
 * driven by a mock in tests. Implementations must return every HTTP status as a
 * {@link GatewayReply}; classifying statuses is the caller's job.
 */
public interface GatewayTransport {

  /**
   * Sends one request and waits for the reply.
   *
   * @param request the request to send
   * @return the reply, including non-2xx statuses
   * @throws TransportException if no reply was received
   */
  GatewayReply send(GatewayRequest request);
}
