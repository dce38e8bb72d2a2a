package com.xpresspay.payment.gateway.transaction;

import com.xpresspay.payment.gateway.enums.PaymentKind;
import com.xpresspay.payment.gateway.enums.TransactionStatus;
import com.xpresspay.payment.gateway.model.AuthenticationChallenge;
import com.xpresspay.payment.gateway.model.GatewayOutcome;

/**
 * One payment attempt, from the first initiate/initialize call to a terminal status.
 *
 * <p>Callers observe the status but never set it: only {@link TransactionStateMachine}
 * mutates a transaction. Nothing is persisted; drop the instance once
 * {@link #isTerminal()} is true. Not thread-safe.
 */
public final class Transaction {

  private final String transactionId;
  private final PaymentKind kind;
  private final String amount;
  private final String currency;
  private TransactionStatus status = TransactionStatus.CREATED;
  private AuthenticationChallenge challenge = AuthenticationChallenge.NONE;
  private GatewayOutcome lastOutcome;

  Transaction(String transactionId, PaymentKind kind, String amount, String currency) {
    this.transactionId = transactionId;
    this.kind = kind;
    this.amount = amount;
    this.currency = currency;
  }

  public String getTransactionId() {
    return transactionId;
  }

  public PaymentKind getKind() {
    return kind;
  }

  /** Amount as submitted: kobo for card and account, major units for hosted. May be null for resumed transactions. */
  public String getAmount() {
    return amount;
  }

  public String getCurrency() {
    return currency;
  }

  public TransactionStatus getStatus() {
    return status;
  }

  /** What the gateway asked for in its latest reply. */
  public AuthenticationChallenge getChallenge() {
    return challenge;
  }

  /** The latest classified reply, or {@code null} before the first exchange. */
  public GatewayOutcome getLastOutcome() {
    return lastOutcome;
  }

  public boolean isTerminal() {
    return status.isTerminal();
  }

  void setStatus(TransactionStatus status) {
    this.status = status;
  }

  void setChallenge(AuthenticationChallenge challenge) {
    this.challenge = challenge;
  }

  void setLastOutcome(GatewayOutcome lastOutcome) {
    this.lastOutcome = lastOutcome;
  }

  @Override
  public String toString() {
    return "Transaction(transactionId=" + transactionId + ", kind=" + kind
        + ", status=" + status + ", challenge=" + challenge.getType() + ")";
  }
}
