package com.xpresspay.payment.gateway.client;

/**
 * Raw reply from the gateway: HTTP status and body text, whatever the status.
 */
public final class GatewayReply {

  private final int status;
  private final String body;

  public GatewayReply(int status, String body) {
    this.status = status;
    this.body = body == null ? "" : body;
  }

  public int getStatus() {
    return status;
  }

  public String getBody() {
    return body;
  }

  public boolean isSuccess() {
    return status >= 200 && status < 300;
  }
}
