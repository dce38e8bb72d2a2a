package com.xpresspay.payment.gateway.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * The classified result of one exchange with the gateway.
 *
 * <p>Success and "needs more input" are independent: a reply can be unsuccessful and
 * still carry an authentication challenge, which is the normal shape of a card initiation.
 * Read {@link #isSuccessful()} and {@link #getChallenge()} separately.
 *
 * <p>The reply body is kept verbatim in {@link #getRawBody()} and parsed in {@link #getRaw()}
 * for fields the typed {@link #getResult()} does not surface.
 */
public final class GatewayOutcome {

  private final int httpStatus;
  private final boolean successful;
  private final boolean declined;
  private final boolean authenticationPending;
  private final String code;
  private final String message;
  private final AuthenticationChallenge challenge;
  private final GatewayResult result;
  private final String rawBody;
  private final JsonNode raw;

  private GatewayOutcome(Builder builder) {
    this.httpStatus = builder.httpStatus;
    this.successful = builder.successful;
    this.declined = builder.declined;
    this.authenticationPending = builder.authenticationPending;
    this.code = builder.code;
    this.message = builder.message;
    this.challenge = builder.challenge;
    this.result = builder.result;
    this.rawBody = builder.rawBody;
    this.raw = builder.raw;
  }

  public static Builder builder() {
    return new Builder();
  }

  public int getHttpStatus() {
    return httpStatus;
  }

  /** True only when the step's response code equals the gateway's success literal. */
  public boolean isSuccessful() {
    return successful;
  }

  /**
   * True when the gateway reported a final, unsuccessful result: not successful, no
   * authentication pending and a response code that does not mean "in progress".
   */
  public boolean isDeclined() {
    return declined;
  }

  /** True when the gateway signalled that an OTP, PIN or AVS step is still outstanding. */
  public boolean isAuthenticationPending() {
    return authenticationPending;
  }

  public boolean isFinal() {
    return successful || declined;
  }

  public String getCode() {
    return code;
  }

  public String getMessage() {
    return message;
  }

  public AuthenticationChallenge getChallenge() {
    return challenge;
  }

  public GatewayResult getResult() {
    return result;
  }

  /**
   * Typed view of {@link #getResult()}.
   *
   * @throws IllegalStateException if the result is of another type
   */
  public <T extends GatewayResult> T getResult(Class<T> type) {
    if (!type.isInstance(result)) {
      throw new IllegalStateException("Outcome carries "
          + (result == null ? "no result" : result.getClass().getSimpleName())
          + ", not " + type.getSimpleName());
    }
    return type.cast(result);
  }

  public String getRawBody() {
    return rawBody;
  }

  public JsonNode getRaw() {
    return raw;
  }

  @Override
  public String toString() {
    return "GatewayOutcome(httpStatus=" + httpStatus + ", successful=" + successful
        + ", declined=" + declined + ", authenticationPending=" + authenticationPending
        + ", code=" + code + ", message=" + message + ", challenge=" + challenge + ")";
  }

  public static final class Builder {

    private int httpStatus;
    private boolean successful;
    private boolean declined;
    private boolean authenticationPending;
    private String code = "";
    private String message = "";
    private AuthenticationChallenge challenge = AuthenticationChallenge.NONE;
    private GatewayResult result;
    private String rawBody = "";
    private JsonNode raw = MissingNode.getInstance();

    private Builder() {
    }

    public Builder httpStatus(int httpStatus) {
      this.httpStatus = httpStatus;
      return this;
    }

    public Builder successful(boolean successful) {
      this.successful = successful;
      return this;
    }

    public Builder declined(boolean declined) {
      this.declined = declined;
      return this;
    }

    public Builder authenticationPending(boolean authenticationPending) {
      this.authenticationPending = authenticationPending;
      return this;
    }

    public Builder code(String code) {
      this.code = code;
      return this;
    }

    public Builder message(String message) {
      this.message = message;
      return this;
    }

    public Builder challenge(AuthenticationChallenge challenge) {
      this.challenge = challenge;
      return this;
    }

    public Builder result(GatewayResult result) {
      this.result = result;
      return this;
    }

    public Builder rawBody(String rawBody) {
      this.rawBody = rawBody;
      return this;
    }

    public Builder raw(JsonNode raw) {
      this.raw = raw;
      return this;
    }

    public GatewayOutcome build() {
      return new GatewayOutcome(this);
    }
  }
}
