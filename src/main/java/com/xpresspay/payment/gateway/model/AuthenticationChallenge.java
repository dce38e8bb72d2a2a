package com.xpresspay.payment.gateway.model;

import com.xpresspay.payment.gateway.enums.ChallengeType;

/**
 * What the gateway still requires before a card or account debit can complete,
 * derived from a single reply.
 *
 * <p>For {@link ChallengeType#AVS_REQUIRED} the gateway may also return a 3-D Secure
 * {@code authUrl}; when it does, the customer must be sent there and the transaction
 * confirmed with a query instead of an OTP.
 */
public final class AuthenticationChallenge {

  public static final AuthenticationChallenge NONE =
      new AuthenticationChallenge(ChallengeType.NONE, null, null, null);

  private final ChallengeType type;
  private final String authUrl;
  private final BillingAddress billingAddress;
  private final String instruction;

  public AuthenticationChallenge(ChallengeType type, String authUrl,
      BillingAddress billingAddress, String instruction) {
    this.type = type;
    this.authUrl = authUrl;
    this.billingAddress = billingAddress;
    this.instruction = instruction;
  }

  public static AuthenticationChallenge of(ChallengeType type, String instruction) {
    return new AuthenticationChallenge(type, null, null, instruction);
  }

  public ChallengeType getType() {
    return type;
  }

  /** 3-D Secure page the customer must complete, or {@code null}. */
  public String getAuthUrl() {
    return authUrl;
  }

  /** Billing address fields echoed by the gateway for AVS, or {@code null}. */
  public BillingAddress getBillingAddress() {
    return billingAddress;
  }

  /** Human-readable instruction for the customer's next action, or {@code null}. */
  public String getInstruction() {
    return instruction;
  }

  public boolean isRequired() {
    return type != ChallengeType.NONE;
  }

  public boolean isRedirectRequired() {
    return type == ChallengeType.AVS_REQUIRED && authUrl != null;
  }

  @Override
  public String toString() {
    return "AuthenticationChallenge(type=" + type + ", authUrl=" + authUrl + ")";
  }
}
