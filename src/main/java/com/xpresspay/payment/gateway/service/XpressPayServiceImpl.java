package com.xpresspay.payment.gateway.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xpresspay.payment.gateway.bank.BankDirectory;
import com.xpresspay.payment.gateway.classifier.ResponseClassifier;
import com.xpresspay.payment.gateway.client.GatewayReply;
import com.xpresspay.payment.gateway.client.GatewayRequest;
import com.xpresspay.payment.gateway.client.GatewayTransport;
import com.xpresspay.payment.gateway.client.TransportException;
import com.xpresspay.payment.gateway.codec.PayloadCodec;
import com.xpresspay.payment.gateway.enums.PaymentKind;
import com.xpresspay.payment.gateway.enums.TransactionStep;
import com.xpresspay.payment.gateway.exception.ValidationException;
import com.xpresspay.payment.gateway.model.AccountPaymentRequest;
import com.xpresspay.payment.gateway.model.Bank;
import com.xpresspay.payment.gateway.model.BillingAddress;
import com.xpresspay.payment.gateway.model.CardPaymentRequest;
import com.xpresspay.payment.gateway.model.Credentials;
import com.xpresspay.payment.gateway.model.GatewayOutcome;
import com.xpresspay.payment.gateway.model.HostedPaymentRequest;
import com.xpresspay.payment.gateway.model.PaymentRequest;
import com.xpresspay.payment.gateway.transaction.Transaction;
import com.xpresspay.payment.gateway.transaction.TransactionStateMachine;
import com.xpresspay.payment.gateway.validation.PaymentRequestValidator;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpMethod;

/**
 * Core implementation orchestrating every payment step.
 *
 * <p>Per step:
 * <ul>
 *   <li>Guard - the state machine rejects out-of-order calls</li>
 *   <li>Validation - delegates to {@link PaymentRequestValidator}</li>
 *   <li>Encryption - card and account details go through {@link PayloadCodec}</li>
 *   <li>Exchange - one call through {@link GatewayTransport}</li>
 *   <li>Classification - {@link ResponseClassifier} produces the outcome or throws</li>
 *   <li>Transition - the state machine records the outcome on the transaction</li>
 * </ul>
 * Everything before the exchange is local: a failure there never reaches the network.
 *
 * <p>Security: card number, CVV, PIN, OTP and the secret key are never logged. Only the
 * last four card digits appear in logs.
 *
 * <p>Observability: the transaction id and payment kind are added to MDC for the duration
 * of each step. Key events:
 * <ul>
 *   <li>{@code payment.received} - first call for a transaction</li>
 *   <li>{@code payment.validation_failed} - rejected locally with error count</li>
 *   <li>{@code payment.gateway_responded} - classified reply with latency</li>
 *   <li>{@code payment.network_error} - transport failure, safe to retry</li>
 * </ul>
 *
 * <p>Holds no per-transaction state; one instance serves any number of transactions.
 */
public class XpressPayServiceImpl implements XpressPayService {

  private static final Logger LOG = LoggerFactory.getLogger(XpressPayServiceImpl.class);

  static final String INITIALIZE_PATH = "/api/Payments/Initialize";
  static final String VERIFY_PATH = "/api/Payments/VerifyPayment";
  static final String PAYMENTS_PATH = "/v1/payments";
  static final String AUTHENTICATE_PATH = "/v1/payments/authenticate";
  static final String VALIDATE_PATH = "/v1/payments/validate";
  static final String QUERY_PATH = "/v1/payments/query";
  static final String BANKS_PATH = "/v1/banks";

  private final Credentials credentials;
  private final GatewayTransport transport;
  private final PayloadCodec codec;
  private final ResponseClassifier classifier;
  private final PaymentRequestValidator validator;
  private final TransactionStateMachine stateMachine;
  private final BankDirectory bankDirectory;

  public XpressPayServiceImpl(Credentials credentials,
      GatewayTransport transport,
      PayloadCodec codec,
      ResponseClassifier classifier,
      PaymentRequestValidator validator,
      TransactionStateMachine stateMachine,
      BankDirectory bankDirectory) {
    this.credentials = credentials;
    this.transport = transport;
    this.codec = codec;
    this.classifier = classifier;
    this.validator = validator;
    this.stateMachine = stateMachine;
    this.bankDirectory = bankDirectory;
  }

  /**
   * Builds a service with default collaborators, for use without Spring.
   */
  public static XpressPayServiceImpl create(Credentials credentials, GatewayTransport transport) {
    BankDirectory bankDirectory = new BankDirectory();
    return new XpressPayServiceImpl(credentials, transport, new PayloadCodec(),
        new ResponseClassifier(new ObjectMapper()),
        new PaymentRequestValidator(Clock.systemUTC(), bankDirectory),
        new TransactionStateMachine(), bankDirectory);
  }

  @Override
  public Transaction initialize(HostedPaymentRequest request) {
    validate(request);
    Transaction transaction = stateMachine.begin(request);
    return withContext(transaction, () -> {
      stateMachine.checkTransition(transaction, TransactionStep.INITIALIZE);
      LOG.info("event=payment.received kind=HOSTED amount={} currency={}",
          request.getAmount(), request.getCurrency());
      exchange(transaction, TransactionStep.INITIALIZE,
          post(INITIALIZE_PATH, PaymentPayloads.hosted(request)));
      return transaction;
    });
  }

  @Override
  public Transaction initiate(CardPaymentRequest request) {
    sanitizeRequest(request);
    validate(request);
    Transaction transaction = stateMachine.begin(request);
    return withContext(transaction, () -> {
      stateMachine.checkTransition(transaction, TransactionStep.INITIATE);
      String cardLastFour = request.getCardNumber()
          .substring(request.getCardNumber().length() - 4);
      MDC.put("cardLastFour", cardLastFour);
      LOG.info("event=payment.received kind=CARD amount={} currency={} cardLastFour={}",
          request.getAmount(), request.getCurrency(), cardLastFour);

      String ciphertext = codec.encrypt(credentials,
          PaymentPayloads.card(credentials.getPublicKey(), request));
      exchange(transaction, TransactionStep.INITIATE, post(PAYMENTS_PATH,
          PaymentPayloads.encryptedEnvelope(credentials.getPublicKey(), ciphertext,
              PaymentKind.CARD)));
      return transaction;
    });
  }

  @Override
  public Transaction initiate(AccountPaymentRequest request) {
    sanitizeRequest(request);
    validate(request);
    Transaction transaction = stateMachine.begin(request);
    return withContext(transaction, () -> {
      stateMachine.checkTransition(transaction, TransactionStep.INITIATE);
      LOG.info("event=payment.received kind=ACCOUNT amount={} currency={} bankCode={}",
          request.getAmount(), request.getCurrency(), request.getBankCode());

      String ciphertext = codec.encrypt(credentials,
          PaymentPayloads.account(credentials.getPublicKey(), request));
      exchange(transaction, TransactionStep.INITIATE, post(PAYMENTS_PATH,
          PaymentPayloads.encryptedEnvelope(credentials.getPublicKey(), ciphertext,
              PaymentKind.ACCOUNT)));
      return transaction;
    });
  }

  @Override
  public GatewayOutcome authenticatePin(Transaction transaction, String pin) {
    return withContext(transaction, () -> {
      stateMachine.checkTransition(transaction, TransactionStep.AUTHENTICATE_PIN);
      rejectIfInvalid(validator.validatePin(pin));
      return exchange(transaction, TransactionStep.AUTHENTICATE_PIN, post(AUTHENTICATE_PATH,
          PaymentPayloads.pin(credentials.getPublicKey(), transaction.getTransactionId(), pin)));
    });
  }

  @Override
  public GatewayOutcome authenticateAvs(Transaction transaction, BillingAddress billingAddress) {
    return withContext(transaction, () -> {
      stateMachine.checkTransition(transaction, TransactionStep.AUTHENTICATE_AVS);
      rejectIfInvalid(validator.validateBillingAddress(billingAddress));
      return exchange(transaction, TransactionStep.AUTHENTICATE_AVS, post(AUTHENTICATE_PATH,
          PaymentPayloads.avs(credentials.getPublicKey(), transaction.getTransactionId(),
              billingAddress)));
    });
  }

  @Override
  public GatewayOutcome validateOtp(Transaction transaction, String otp,
      PaymentKind paymentType) {
    return withContext(transaction, () -> {
      stateMachine.checkTransition(transaction, TransactionStep.VALIDATE_OTP);
      if (paymentType != transaction.getKind()) {
        LOG.warn("event=payment.validation_failed reason=payment_type_mismatch expected={} "
            + "actual={}", transaction.getKind(), paymentType);
        throw new ValidationException("payment_type_mismatch", List.of(
            "Payment type " + paymentType + " does not match transaction type "
                + transaction.getKind()));
      }
      rejectIfInvalid(validator.validateOtp(otp));
      return exchange(transaction, TransactionStep.VALIDATE_OTP, post(VALIDATE_PATH,
          PaymentPayloads.otp(credentials.getPublicKey(), transaction.getTransactionId(), otp,
              paymentType)));
    });
  }

  @Override
  public GatewayOutcome query(Transaction transaction) {
    return withContext(transaction, () -> {
      stateMachine.checkTransition(transaction, TransactionStep.QUERY);
      GatewayRequest request = transaction.getKind() == PaymentKind.HOSTED
          ? post(VERIFY_PATH, PaymentPayloads.verify(transaction.getTransactionId()))
          : post(QUERY_PATH, PaymentPayloads.query(credentials.getPublicKey(),
              transaction.getTransactionId(), transaction.getKind()));
      GatewayOutcome outcome = exchange(transaction, TransactionStep.QUERY, request);
      LOG.info("event=payment.queried status={} code={}", transaction.getStatus(),
          outcome.getCode());
      return outcome;
    });
  }

  @Override
  public GatewayOutcome verify(Transaction transaction) {
    return query(transaction);
  }

  @Override
  public Transaction resume(String transactionId, PaymentKind kind) {
    if (transactionId == null || transactionId.isBlank() || kind == null) {
      throw new ValidationException(List.of("Transaction id and payment kind are required"));
    }
    return stateMachine.resume(transactionId, kind);
  }

  @Override
  public List<Bank> listBanks() {
    return bankDirectory.listBanks();
  }

  @Override
  public List<Bank> fetchBanks() {
    GatewayReply reply;
    try {
      reply = transport.send(new GatewayRequest(HttpMethod.GET, BANKS_PATH, authorization(),
          null, Map.of("publicKey", credentials.getPublicKey())));
    } catch (TransportException e) {
      throw classifier.classifyTransportFailure(e);
    }
    JsonNode body = classifier.checkedBody(reply);
    JsonNode entries = body.has("data") ? body.path("data") : body;
    if (entries.isObject()) {
      entries = entries.path("banks");
    }
    List<Bank> banks = new ArrayList<>();
    for (JsonNode entry : entries) {
      banks.add(new Bank(
          entry.path("name").asText(entry.path("bankName").asText("")),
          entry.path("code").asText(entry.path("bankCode").asText(""))));
    }
    LOG.debug("event=banks.fetched count={}", banks.size());
    return banks;
  }

  private GatewayOutcome exchange(Transaction transaction, TransactionStep step,
      GatewayRequest request) {
    long start = System.currentTimeMillis();
    GatewayReply reply;
    try {
      reply = transport.send(request);
    } catch (TransportException e) {
      LOG.warn("event=payment.network_error step={} retryable=true cause={}", step,
          e.getMessage());
      throw classifier.classifyTransportFailure(e);
    }
    GatewayOutcome outcome = classifier.classify(step, transaction.getKind(), reply);
    stateMachine.apply(transaction, step, outcome);
    LOG.info("event=payment.gateway_responded step={} httpStatus={} code={} successful={} "
            + "challenge={} status={} latencyMs={}",
        step, reply.getStatus(), outcome.getCode(), outcome.isSuccessful(),
        outcome.getChallenge().getType(), transaction.getStatus(),
        System.currentTimeMillis() - start);
    return outcome;
  }

  private GatewayRequest post(String path, Map<String, Object> body) {
    return new GatewayRequest(HttpMethod.POST, path, authorization(), body);
  }

  private Map<String, String> authorization() {
    return Map.of("Authorization", "Bearer " + credentials.getPublicKey());
  }

  private void validate(PaymentRequest request) {
    List<String> errors = validator.validate(request);
    if (!errors.isEmpty()) {
      LOG.warn("event=payment.validation_failed errorCount={} errors={}",
          errors.size(), errors);
      throw new ValidationException(errors);
    }
  }

  private void rejectIfInvalid(List<String> errors) {
    if (!errors.isEmpty()) {
      LOG.warn("event=payment.validation_failed errorCount={} errors={}",
          errors.size(), errors);
      throw new ValidationException(errors);
    }
  }

  /**
   * Trims leading/trailing whitespace from card and account numbers to handle
   * accidental spaces in merchant input.
   */
  private void sanitizeRequest(CardPaymentRequest request) {
    if (request == null) {
      return;
    }
    if (request.getCardNumber() != null) {
      request.setCardNumber(request.getCardNumber().trim());
    }
    if (request.getCvv() != null) {
      request.setCvv(request.getCvv().trim());
    }
  }

  private void sanitizeRequest(AccountPaymentRequest request) {
    if (request != null && request.getAccountNumber() != null) {
      request.setAccountNumber(request.getAccountNumber().trim());
    }
  }

  private <T> T withContext(Transaction transaction, Supplier<T> call) {
    MDC.put("transactionId", transaction.getTransactionId());
    MDC.put("paymentKind", transaction.getKind().name());
    try {
      return call.get();
    } finally {
      MDC.remove("transactionId");
      MDC.remove("paymentKind");
      MDC.remove("cardLastFour");
    }
  }
}
