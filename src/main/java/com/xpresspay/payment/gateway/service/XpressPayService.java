package com.xpresspay.payment.gateway.service;

import com.xpresspay.payment.gateway.enums.PaymentKind;
import com.xpresspay.payment.gateway.model.AccountPaymentRequest;
import com.xpresspay.payment.gateway.model.Bank;
import com.xpresspay.payment.gateway.model.BillingAddress;
import com.xpresspay.payment.gateway.model.CardPaymentRequest;
import com.xpresspay.payment.gateway.model.GatewayOutcome;
import com.xpresspay.payment.gateway.model.HostedPaymentRequest;
import com.xpresspay.payment.gateway.transaction.Transaction;
import java.util.List;

/**
 * Caller-facing contract for running payments against the Xpresspay gateway.
 *
 * <p>Each call is one synchronous exchange. Local checks (required fields, step order,
 * encryption) fail before anything is sent. Gateway failures surface as the specific
 * {@link com.xpresspay.payment.gateway.exception.XpressPayException} subtype.
 *
 * <p>Typical card flow:
 * <pre>
 *   Transaction tx = service.initiate(cardRequest);
 *   switch (tx.getChallenge().getType()) {
 *     case PIN_REQUIRED: service.authenticatePin(tx, pin); break;
 *     case AVS_REQUIRED: service.authenticateAvs(tx, billing); break;
 *     default: break;
 *   }
 *   if (tx.getStatus() == TransactionStatus.VALIDATION_PENDING) {
 *     service.validateOtp(tx, otp, PaymentKind.CARD);
 *   }
 *   service.query(tx);  // the only result to trust before fulfilling the order
 * </pre>
 */
public interface XpressPayService {

  /**
   * Starts a hosted-page payment. Redirect the customer to the returned
   * {@link com.xpresspay.payment.gateway.model.InitializeResult#getPaymentUrl()}, then
   * call {@link #verify(Transaction)}.
   *
   * @throws com.xpresspay.payment.gateway.exception.ValidationException if the request is invalid
   */
  Transaction initialize(HostedPaymentRequest request);

  /**
   * Encrypts card details and starts a card debit. Inspect
   * {@link Transaction#getChallenge()} for the next step.
   *
   * @throws com.xpresspay.payment.gateway.exception.ValidationException if the request is invalid
   * @throws com.xpresspay.payment.gateway.exception.EncryptionException if no usable secret key
   *     is configured
   */
  Transaction initiate(CardPaymentRequest request);

  /**
   * Encrypts account details and starts a direct debit. The account holder then receives
   * an OTP for {@link #validateOtp(Transaction, String, PaymentKind)}.
   */
  Transaction initiate(AccountPaymentRequest request);

  /** Submits the card PIN when the gateway asked for {@code PIN_REQUIRED}. */
  GatewayOutcome authenticatePin(Transaction transaction, String pin);

  /**
   * Submits the billing address when the gateway asked for {@code AVS_REQUIRED}. If the
   * reply carries a 3-D Secure URL, redirect the customer there and query afterwards.
   */
  GatewayOutcome authenticateAvs(Transaction transaction, BillingAddress billingAddress);

  /**
   * Submits the OTP the customer received.
   *
   * @param paymentType must match the transaction's branch, {@code CARD} or {@code ACCOUNT}
   */
  GatewayOutcome validateOtp(Transaction transaction, String otp, PaymentKind paymentType);

  /**
   * Asks the gateway for the transaction's current status. Safe to repeat; records a
   * terminal status once the gateway reports one.
   */
  GatewayOutcome query(Transaction transaction);

  /** Same as {@link #query(Transaction)}; the name used for hosted-page payments. */
  GatewayOutcome verify(Transaction transaction);

  /**
   * Rebuilds a handle for a transaction started in an earlier request, so it can be
   * queried after a redirect.
   */
  Transaction resume(String transactionId, PaymentKind kind);

  /** Banks that support direct debit, from the built-in table. */
  List<Bank> listBanks();

  /** Banks as currently reported by the gateway. */
  List<Bank> fetchBanks();
}
