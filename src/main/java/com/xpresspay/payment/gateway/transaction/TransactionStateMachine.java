package com.xpresspay.payment.gateway.transaction;

import com.xpresspay.payment.gateway.enums.ChallengeType;
import com.xpresspay.payment.gateway.enums.PaymentKind;
import com.xpresspay.payment.gateway.enums.TransactionStatus;
import com.xpresspay.payment.gateway.enums.TransactionStep;
import com.xpresspay.payment.gateway.exception.IllegalTransitionException;
import com.xpresspay.payment.gateway.model.AuthenticationChallenge;
import com.xpresspay.payment.gateway.model.GatewayOutcome;
import com.xpresspay.payment.gateway.model.PaymentRequest;
import com.xpresspay.payment.gateway.model.PaymentResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the status of every {@link Transaction}: which step may be called in which state,
 * and where each classified reply moves the transaction.
 *
 * <pre>
 *   CREATED -> AUTH_PENDING -> VALIDATION_PENDING -> SETTLED | FAILED
 * </pre>
 * Card initiations that ask for PIN or AVS go to AUTH_PENDING; those that ask for an OTP,
 * and account initiations, go straight to VALIDATION_PENDING. Hosted transactions stay
 * CREATED until verified.
 *
 * <p>{@link #checkTransition} runs before any network call, so an out-of-order step fails
 * locally with {@link IllegalTransitionException}. {@link #apply} runs only after a reply has
 * been classified; a step that throws leaves the transaction untouched. Only query/verify
 * records {@link TransactionStatus#FAILED}, and a terminal status is never rewritten.
 *
 * <p>Stateless; safe to share across transactions.
 */
public class TransactionStateMachine {

  private static final Logger LOG = LoggerFactory.getLogger(TransactionStateMachine.class);

  /** Creates the transaction for a first initiate or initialize call. */
  public Transaction begin(PaymentRequest request) {
    return new Transaction(request.getTransactionId(), request.getKind(), request.getAmount(),
        request.getCurrency());
  }

  /**
   * Rebuilds a handle for a transaction started elsewhere, e.g. before a 3-D Secure or
   * hosted-page redirect. Its local status is unknown, so only query/verify is accepted.
   */
  public Transaction resume(String transactionId, PaymentKind kind) {
    return new Transaction(transactionId, kind, null, null);
  }

  /**
   * Fails fast when {@code step} may not be called on {@code transaction} in its current state.
   *
   * @throws IllegalTransitionException if the step does not apply to the branch, the
   *     transaction is terminal, or the step's required predecessor state has not been reached
   */
  public void checkTransition(Transaction transaction, TransactionStep step) {
    if (!step.appliesTo(transaction.getKind())) {
      throw new IllegalTransitionException(
          step + " is not available for " + transaction.getKind() + " transactions");
    }
    if (step == TransactionStep.QUERY) {
      return;
    }
    if (transaction.isTerminal()) {
      throw new IllegalTransitionException("Transaction " + transaction.getTransactionId()
          + " is already " + transaction.getStatus() + "; only query is allowed");
    }
    switch (step) {
      case INITIALIZE:
      case INITIATE:
        if (transaction.getLastOutcome() != null
            || transaction.getStatus() != TransactionStatus.CREATED) {
          throw new IllegalTransitionException("Transaction " + transaction.getTransactionId()
              + " has already been started");
        }
        break;
      case AUTHENTICATE_PIN:
        requireChallenge(transaction, step, ChallengeType.PIN_REQUIRED);
        break;
      case AUTHENTICATE_AVS:
        requireChallenge(transaction, step, ChallengeType.AVS_REQUIRED);
        if (transaction.getChallenge().isRedirectRequired()) {
          throw new IllegalTransitionException("Transaction " + transaction.getTransactionId()
              + " is waiting for 3-D Secure at " + transaction.getChallenge().getAuthUrl()
              + "; query it once the customer returns");
        }
        break;
      case VALIDATE_OTP:
        requireStatus(transaction, step, TransactionStatus.VALIDATION_PENDING);
        break;
      default:
        throw new IllegalTransitionException("Unknown step " + step);
    }
  }

  /** Records {@code outcome} and moves the transaction to the state it implies. */
  public void apply(Transaction transaction, TransactionStep step, GatewayOutcome outcome) {
    TransactionStatus from = transaction.getStatus();
    transaction.setLastOutcome(outcome);

    switch (step) {
      case INITIALIZE:
        transaction.setChallenge(AuthenticationChallenge.NONE);
        break;
      case INITIATE:
        applyInitiate(transaction, outcome);
        break;
      case AUTHENTICATE_PIN:
        applyPin(transaction, outcome);
        break;
      case AUTHENTICATE_AVS:
        applyAvs(transaction, outcome);
        break;
      case VALIDATE_OTP:
        if (outcome.isSuccessful()) {
          settle(transaction);
        } else if (outcome.getChallenge().getType() == ChallengeType.OTP_REQUIRED) {
          transaction.setChallenge(outcome.getChallenge());
        }
        break;
      case QUERY:
        applyQuery(transaction, outcome);
        break;
      default:
        throw new IllegalStateException("Unknown step " + step);
    }

    if (from != transaction.getStatus()) {
      LOG.info("event=transaction.transition transactionId={} step={} from={} to={}",
          transaction.getTransactionId(), step, from, transaction.getStatus());
    }
  }

  private void applyInitiate(Transaction transaction, GatewayOutcome outcome) {
    if (outcome.isSuccessful()) {
      settle(transaction);
      return;
    }
    AuthenticationChallenge challenge = outcome.getChallenge();
    switch (challenge.getType()) {
      case PIN_REQUIRED:
      case AVS_REQUIRED:
        move(transaction, TransactionStatus.AUTH_PENDING, challenge);
        break;
      case OTP_REQUIRED:
        move(transaction, TransactionStatus.VALIDATION_PENDING, challenge);
        break;
      default:
        // Account debits are always confirmed by an OTP sent to the account holder.
        if (transaction.getKind() == PaymentKind.ACCOUNT && !outcome.isDeclined()) {
          move(transaction, TransactionStatus.VALIDATION_PENDING,
              AuthenticationChallenge.of(ChallengeType.OTP_REQUIRED, instructionOf(outcome)));
        } else {
          transaction.setChallenge(AuthenticationChallenge.NONE);
        }
    }
  }

  private void applyPin(Transaction transaction, GatewayOutcome outcome) {
    if (outcome.isSuccessful()) {
      settle(transaction);
      return;
    }
    ChallengeType next = outcome.getChallenge().getType();
    if (next == ChallengeType.PIN_REQUIRED || outcome.isDeclined()) {
      return;
    }
    move(transaction, TransactionStatus.VALIDATION_PENDING, next == ChallengeType.OTP_REQUIRED
        ? outcome.getChallenge()
        : AuthenticationChallenge.of(ChallengeType.OTP_REQUIRED, instructionOf(outcome)));
  }

  /**
   * The AVS reply either hands back a 3-D Secure URL (customer is redirected, then the
   * transaction is queried) or announces an OTP. Both are legal successors.
   */
  private void applyAvs(Transaction transaction, GatewayOutcome outcome) {
    if (outcome.isSuccessful()) {
      settle(transaction);
      return;
    }
    AuthenticationChallenge challenge = outcome.getChallenge();
    String authUrl = challenge.getAuthUrl() != null ? challenge.getAuthUrl() : authUrlOf(outcome);
    if (authUrl != null) {
      move(transaction, TransactionStatus.AUTH_PENDING, new AuthenticationChallenge(
          ChallengeType.AVS_REQUIRED, authUrl, challenge.getBillingAddress(),
          challenge.getInstruction()));
    } else if (challenge.getType() == ChallengeType.OTP_REQUIRED) {
      move(transaction, TransactionStatus.VALIDATION_PENDING, challenge);
    }
  }

  private void applyQuery(Transaction transaction, GatewayOutcome outcome) {
    if (transaction.isTerminal()) {
      if (outcome.isFinal()
          && outcome.isSuccessful() != (transaction.getStatus() == TransactionStatus.SETTLED)) {
        LOG.warn("event=transaction.conflicting_query transactionId={} status={} code={}",
            transaction.getTransactionId(), transaction.getStatus(), outcome.getCode());
      }
      return;
    }
    if (outcome.isSuccessful()) {
      settle(transaction);
    } else if (outcome.isDeclined()) {
      move(transaction, TransactionStatus.FAILED, AuthenticationChallenge.NONE);
    }
  }

  private void settle(Transaction transaction) {
    move(transaction, TransactionStatus.SETTLED, AuthenticationChallenge.NONE);
  }

  private void move(Transaction transaction, TransactionStatus status,
      AuthenticationChallenge challenge) {
    transaction.setStatus(status);
    transaction.setChallenge(challenge);
  }

  private void requireStatus(Transaction transaction, TransactionStep step,
      TransactionStatus required) {
    if (transaction.getStatus() != required) {
      throw new IllegalTransitionException(step + " requires status " + required
          + " but transaction " + transaction.getTransactionId() + " is "
          + transaction.getStatus());
    }
  }

  private void requireChallenge(Transaction transaction, TransactionStep step,
      ChallengeType required) {
    requireStatus(transaction, step, TransactionStatus.AUTH_PENDING);
    if (transaction.getChallenge().getType() != required) {
      throw new IllegalTransitionException(step + " requires a " + required
          + " challenge but the gateway asked for " + transaction.getChallenge().getType());
    }
  }

  private static String instructionOf(GatewayOutcome outcome) {
    if (outcome.getChallenge().getInstruction() != null) {
      return outcome.getChallenge().getInstruction();
    }
    return outcome.getResult() instanceof PaymentResult
        ? ((PaymentResult) outcome.getResult()).getValidationInstruction()
        : null;
  }

  private static String authUrlOf(GatewayOutcome outcome) {
    return outcome.getResult() instanceof PaymentResult
        ? ((PaymentResult) outcome.getResult()).getAuthUrl()
        : null;
  }
}
