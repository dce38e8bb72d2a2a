package com.xpresspay.payment.gateway.exception;

/**
 * Base type for every failure raised by the client.
 *
 * <p>Callers should catch the specific subtypes. This type is thrown directly only for
 * gateway replies the client does not anticipate (for example an unexpected 3xx or 409).
 * Where the failure came from an HTTP exchange, {@link #getStatusCode()} holds the status.
 */
public class XpressPayException extends RuntimeException {

  private final Integer statusCode;

  public XpressPayException(String message) {
    this(message, null, null);
  }

  public XpressPayException(String message, Integer statusCode) {
    this(message, statusCode, null);
  }

  public XpressPayException(String message, Integer statusCode, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  /** The HTTP status of the gateway reply, or {@code null} for local failures. */
  public Integer getStatusCode() {
    return statusCode;
  }

  /**
   * Whether the same call may be issued again without changing its input.
   * Only transport and server-side failures are retryable.
   */
  public boolean isRetryable() {
    return false;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(message=" + getMessage()
        + ", statusCode=" + statusCode + ")";
  }
}
