package com.xpresspay.payment.gateway.transaction;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.xpresspay.payment.gateway.enums.ChallengeType;
import com.xpresspay.payment.gateway.enums.PaymentKind;
import com.xpresspay.payment.gateway.enums.TransactionStatus;
import com.xpresspay.payment.gateway.enums.TransactionStep;
import com.xpresspay.payment.gateway.exception.IllegalTransitionException;
import com.xpresspay.payment.gateway.model.AccountPaymentRequest;
import com.xpresspay.payment.gateway.model.AuthenticationChallenge;
import com.xpresspay.payment.gateway.model.CardPaymentRequest;
import com.xpresspay.payment.gateway.model.GatewayOutcome;
import com.xpresspay.payment.gateway.model.HostedPaymentRequest;
import com.xpresspay.payment.gateway.model.PaymentResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TransactionStateMachine")
class TransactionStateMachineTest {

  private TransactionStateMachine stateMachine;

  @BeforeEach
  void setUp() {
    stateMachine = new TransactionStateMachine();
  }

  private Transaction card() {
    CardPaymentRequest request = new CardPaymentRequest();
    request.setTransactionId("ORDER-CARD-1");
    request.setAmount("500000");
    return stateMachine.begin(request);
  }

  private Transaction account() {
    AccountPaymentRequest request = new AccountPaymentRequest();
    request.setTransactionId("ORDER-ACCT-1");
    request.setAmount("100000");
    return stateMachine.begin(request);
  }

  private Transaction hosted() {
    HostedPaymentRequest request = new HostedPaymentRequest();
    request.setTransactionId("ORDER-HOST-1");
    request.setAmount("1000.00");
    return stateMachine.begin(request);
  }

  private static GatewayOutcome success() {
    return GatewayOutcome.builder().httpStatus(200).successful(true).code("000").build();
  }

  private static GatewayOutcome declined() {
    return GatewayOutcome.builder().httpStatus(200).declined(true).code("099").build();
  }

  private static GatewayOutcome inProgress() {
    return GatewayOutcome.builder().httpStatus(200).code("001").build();
  }

  private static GatewayOutcome challenge(ChallengeType type) {
    return GatewayOutcome.builder().httpStatus(200).code("001")
        .authenticationPending(type == ChallengeType.OTP_REQUIRED)
        .challenge(AuthenticationChallenge.of(type, null))
        .build();
  }

  private Transaction cardAwaiting(ChallengeType type) {
    Transaction transaction = card();
    stateMachine.apply(transaction, TransactionStep.INITIATE, challenge(type));
    return transaction;
  }

  @Nested
  @DisplayName("Initiation")
  class Initiation {

    @Test
    @DisplayName("Should start every transaction as CREATED without a challenge")
    void shouldStartCreated() {
      Transaction transaction = card();

      assertEquals(TransactionStatus.CREATED, transaction.getStatus());
      assertEquals(ChallengeType.NONE, transaction.getChallenge().getType());
      assertNull(transaction.getLastOutcome());
      assertEquals(PaymentKind.CARD, transaction.getKind());
    }

    @Test
    @DisplayName("Should move a card to AUTH_PENDING when PIN is requested")
    void shouldAwaitAuthentication_whenPinRequested() {
      Transaction transaction = cardAwaiting(ChallengeType.PIN_REQUIRED);

      assertEquals(TransactionStatus.AUTH_PENDING, transaction.getStatus());
      assertEquals(ChallengeType.PIN_REQUIRED, transaction.getChallenge().getType());
    }

    @Test
    @DisplayName("Should move a card to VALIDATION_PENDING when OTP is requested")
    void shouldAwaitValidation_whenOtpRequested() {
      Transaction transaction = cardAwaiting(ChallengeType.OTP_REQUIRED);

      assertEquals(TransactionStatus.VALIDATION_PENDING, transaction.getStatus());
    }

    @Test
    @DisplayName("Should settle a frictionless card charge")
    void shouldSettle_whenInitiateSucceeds() {
      Transaction transaction = card();

      stateMachine.apply(transaction, TransactionStep.INITIATE, success());

      assertEquals(TransactionStatus.SETTLED, transaction.getStatus());
      assertTrue(transaction.isTerminal());
    }

    @Test
    @DisplayName("Should send an account debit to VALIDATION_PENDING with the gateway's instruction")
    void shouldAwaitOtp_whenAccountInitiated() {
      Transaction transaction = account();
      PaymentResult result = new PaymentResult();
      result.setValidationInstruction("Enter the OTP sent to your phone");
      GatewayOutcome outcome = GatewayOutcome.builder().httpStatus(200).code("001")
          .result(result).build();

      stateMachine.apply(transaction, TransactionStep.INITIATE, outcome);

      assertEquals(TransactionStatus.VALIDATION_PENDING, transaction.getStatus());
      assertEquals(ChallengeType.OTP_REQUIRED, transaction.getChallenge().getType());
      assertEquals("Enter the OTP sent to your phone",
          transaction.getChallenge().getInstruction());
    }

    @Test
    @DisplayName("Should keep a declined initiate CREATED; only query records FAILED")
    void shouldStayCreated_whenInitiateDeclined() {
      Transaction transaction = account();

      stateMachine.apply(transaction, TransactionStep.INITIATE, declined());

      assertEquals(TransactionStatus.CREATED, transaction.getStatus());
    }

    @Test
    @DisplayName("Should reject a second initiate on the same transaction")
    void shouldReject_whenInitiatedTwice() {
      Transaction transaction = card();
      stateMachine.apply(transaction, TransactionStep.INITIATE, inProgress());

      assertThrows(IllegalTransitionException.class,
          () -> stateMachine.checkTransition(transaction, TransactionStep.INITIATE));
    }

    @Test
    @DisplayName("Should keep a hosted transaction CREATED after initialize")
    void shouldStayCreated_whenHostedInitialized() {
      Transaction transaction = hosted();

      stateMachine.checkTransition(transaction, TransactionStep.INITIALIZE);
      stateMachine.apply(transaction, TransactionStep.INITIALIZE,
          GatewayOutcome.builder().httpStatus(200).successful(true).code("00").build());

      assertEquals(TransactionStatus.CREATED, transaction.getStatus());
    }
  }

  @Nested
  @DisplayName("Step Guards")
  class StepGuards {

    @Test
    @DisplayName("Should reject validateOtp on a transaction that was never initiated")
    void shouldReject_whenOtpBeforeInitiate() {
      IllegalTransitionException ex = assertThrows(IllegalTransitionException.class,
          () -> stateMachine.checkTransition(card(), TransactionStep.VALIDATE_OTP));

      assertEquals("invalid_state", ex.getErrorType());
    }

    @Test
    @DisplayName("Should reject AVS when the gateway asked for a PIN")
    void shouldReject_whenChallengeDoesNotMatch() {
      Transaction transaction = cardAwaiting(ChallengeType.PIN_REQUIRED);

      assertThrows(IllegalTransitionException.class,
          () -> stateMachine.checkTransition(transaction, TransactionStep.AUTHENTICATE_AVS));
      assertDoesNotThrow(
          () -> stateMachine.checkTransition(transaction, TransactionStep.AUTHENTICATE_PIN));
    }

    @Test
    @DisplayName("Should reject card-only steps on account and hosted transactions")
    void shouldReject_whenStepDoesNotApplyToKind() {
      assertThrows(IllegalTransitionException.class,
          () -> stateMachine.checkTransition(account(), TransactionStep.AUTHENTICATE_PIN));
      assertThrows(IllegalTransitionException.class,
          () -> stateMachine.checkTransition(hosted(), TransactionStep.INITIATE));
      assertThrows(IllegalTransitionException.class,
          () -> stateMachine.checkTransition(card(), TransactionStep.INITIALIZE));
    }

    @Test
    @DisplayName("Should allow only query once terminal")
    void shouldAllowOnlyQuery_whenTerminal() {
      Transaction transaction = card();
      stateMachine.apply(transaction, TransactionStep.INITIATE, success());

      assertThrows(IllegalTransitionException.class,
          () -> stateMachine.checkTransition(transaction, TransactionStep.VALIDATE_OTP));
      assertDoesNotThrow(() -> stateMachine.checkTransition(transaction, TransactionStep.QUERY));
    }

    @Test
    @DisplayName("Should allow only query on a resumed transaction")
    void shouldAllowOnlyQuery_whenResumed() {
      Transaction transaction = stateMachine.resume("ORDER-CARD-9", PaymentKind.CARD);

      assertThrows(IllegalTransitionException.class,
          () -> stateMachine.checkTransition(transaction, TransactionStep.AUTHENTICATE_PIN));
      assertThrows(IllegalTransitionException.class,
          () -> stateMachine.checkTransition(transaction, TransactionStep.VALIDATE_OTP));
      assertDoesNotThrow(() -> stateMachine.checkTransition(transaction, TransactionStep.QUERY));
    }
  }

  @Nested
  @DisplayName("Authentication Steps")
  class AuthenticationSteps {

    @Test
    @DisplayName("Should move PIN to VALIDATION_PENDING when an OTP follows")
    void shouldAwaitOtp_afterPin() {
      Transaction transaction = cardAwaiting(ChallengeType.PIN_REQUIRED);

      stateMachine.apply(transaction, TransactionStep.AUTHENTICATE_PIN,
          challenge(ChallengeType.OTP_REQUIRED));

      assertEquals(TransactionStatus.VALIDATION_PENDING, transaction.getStatus());
      assertEquals(ChallengeType.OTP_REQUIRED, transaction.getChallenge().getType());
    }

    @Test
    @DisplayName("Should stay AUTH_PENDING when the gateway asks for the PIN again")
    void shouldStayPending_whenPinRejected() {
      Transaction transaction = cardAwaiting(ChallengeType.PIN_REQUIRED);

      stateMachine.apply(transaction, TransactionStep.AUTHENTICATE_PIN,
          challenge(ChallengeType.PIN_REQUIRED));

      assertEquals(TransactionStatus.AUTH_PENDING, transaction.getStatus());
      assertDoesNotThrow(
          () -> stateMachine.checkTransition(transaction, TransactionStep.AUTHENTICATE_PIN));
    }

    @Test
    @DisplayName("Should hold for 3-D Secure when AVS returns an auth URL")
    void shouldAwaitRedirect_whenAvsReturnsAuthUrl() {
      Transaction transaction = cardAwaiting(ChallengeType.AVS_REQUIRED);
      GatewayOutcome outcome = GatewayOutcome.builder().httpStatus(200).code("001")
          .challenge(new AuthenticationChallenge(ChallengeType.AVS_REQUIRED,
              "https://3ds.example/auth", null, null))
          .build();

      stateMachine.apply(transaction, TransactionStep.AUTHENTICATE_AVS, outcome);

      assertEquals(TransactionStatus.AUTH_PENDING, transaction.getStatus());
      assertEquals("https://3ds.example/auth", transaction.getChallenge().getAuthUrl());
      assertTrue(transaction.getChallenge().isRedirectRequired());
      assertThrows(IllegalTransitionException.class,
          () -> stateMachine.checkTransition(transaction, TransactionStep.AUTHENTICATE_AVS));
      assertDoesNotThrow(() -> stateMachine.checkTransition(transaction, TransactionStep.QUERY));
    }

    @Test
    @DisplayName("Should move AVS to VALIDATION_PENDING when an OTP follows")
    void shouldAwaitOtp_afterAvs() {
      Transaction transaction = cardAwaiting(ChallengeType.AVS_REQUIRED);

      stateMachine.apply(transaction, TransactionStep.AUTHENTICATE_AVS,
          challenge(ChallengeType.OTP_REQUIRED));

      assertEquals(TransactionStatus.VALIDATION_PENDING, transaction.getStatus());
    }

    @Test
    @DisplayName("Should settle on a successful OTP and stay pending on a wrong one")
    void shouldSettleOrRetry_onOtp() {
      Transaction transaction = cardAwaiting(ChallengeType.OTP_REQUIRED);

      stateMachine.apply(transaction, TransactionStep.VALIDATE_OTP, inProgress());
      assertEquals(TransactionStatus.VALIDATION_PENDING, transaction.getStatus());

      stateMachine.apply(transaction, TransactionStep.VALIDATE_OTP, success());
      assertEquals(TransactionStatus.SETTLED, transaction.getStatus());
    }
  }

  @Nested
  @DisplayName("Query")
  class Query {

    @Test
    @DisplayName("Should record FAILED when the query reports a decline")
    void shouldFail_whenQueryDeclined() {
      Transaction transaction = cardAwaiting(ChallengeType.OTP_REQUIRED);

      stateMachine.apply(transaction, TransactionStep.QUERY, declined());

      assertEquals(TransactionStatus.FAILED, transaction.getStatus());
    }

    @Test
    @DisplayName("Should leave status unchanged while the query is in progress")
    void shouldKeepStatus_whenQueryInProgress() {
      Transaction transaction = cardAwaiting(ChallengeType.PIN_REQUIRED);

      stateMachine.apply(transaction, TransactionStep.QUERY, inProgress());

      assertEquals(TransactionStatus.AUTH_PENDING, transaction.getStatus());
    }

    @Test
    @DisplayName("Should never rewrite a terminal status")
    void shouldKeepTerminalStatus_whenQueryConflicts() {
      Transaction transaction = card();
      stateMachine.apply(transaction, TransactionStep.INITIATE, success());

      stateMachine.apply(transaction, TransactionStep.QUERY, declined());
      stateMachine.apply(transaction, TransactionStep.QUERY, success());

      assertEquals(TransactionStatus.SETTLED, transaction.getStatus());
    }

    @Test
    @DisplayName("Should settle a resumed transaction from its query")
    void shouldSettle_whenResumedQuerySucceeds() {
      Transaction transaction = stateMachine.resume("ORDER-HOST-9", PaymentKind.HOSTED);

      stateMachine.apply(transaction, TransactionStep.QUERY, success());

      assertEquals(TransactionStatus.SETTLED, transaction.getStatus());
    }
  }
}
