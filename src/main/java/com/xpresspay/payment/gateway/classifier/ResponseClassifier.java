package com.xpresspay.payment.gateway.classifier;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.xpresspay.payment.gateway.client.GatewayReply;
import com.xpresspay.payment.gateway.client.TransportException;
import com.xpresspay.payment.gateway.enums.ChallengeType;
import com.xpresspay.payment.gateway.enums.PaymentKind;
import com.xpresspay.payment.gateway.enums.TransactionStep;
import com.xpresspay.payment.gateway.exception.AuthenticationException;
import com.xpresspay.payment.gateway.exception.NetworkException;
import com.xpresspay.payment.gateway.exception.NotFoundException;
import com.xpresspay.payment.gateway.exception.ProcessingException;
import com.xpresspay.payment.gateway.exception.ValidationException;
import com.xpresspay.payment.gateway.exception.XpressPayException;
import com.xpresspay.payment.gateway.model.AuthenticationChallenge;
import com.xpresspay.payment.gateway.model.BillingAddress;
import com.xpresspay.payment.gateway.model.GatewayOutcome;
import com.xpresspay.payment.gateway.model.GatewayResult;
import com.xpresspay.payment.gateway.model.InitializeResult;
import com.xpresspay.payment.gateway.model.PaymentResult;
import com.xpresspay.payment.gateway.model.VerifyResult;
import java.io.IOException;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a raw gateway reply into a {@link GatewayOutcome} or a typed exception.
 *
 * <p>Non-2xx statuses are triaged first:
 * <ul>
 *   <li>400 -> {@link ValidationException} carrying the gateway's error sub-type</li>
 *   <li>401 -> {@link AuthenticationException}</li>
 *   <li>404 -> {@link NotFoundException}</li>
 *   <li>5xx -> {@link ProcessingException}</li>
 *   <li>anything else -> {@link XpressPayException}</li>
 * </ul>
 *
 * <p>A 2xx reply is never successful by status alone: success is read from the step's
 * response code field (see {@link ResponseCodes}), and the authentication-pending flag is
 * read independently of it. Stateless and thread-safe.
 */
public class ResponseClassifier {

  private static final Logger LOG = LoggerFactory.getLogger(ResponseClassifier.class);

  private final ObjectMapper objectMapper;

  public ResponseClassifier(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Classifies one reply.
   *
   * @param step the step that produced the reply; selects the result type
   * @param kind the transaction branch; selects the response code vocabulary
   * @param reply status and body as received
   * @return the classified outcome for any 2xx reply
   * @throws XpressPayException (a subtype for 400, 401, 404 and 5xx) for any other status
   */
  public GatewayOutcome classify(TransactionStep step, PaymentKind kind, GatewayReply reply) {
    JsonNode body = checkedBody(reply);

    ResponseCodes codes = ResponseCodes.forKind(kind);
    JsonNode payment = paymentNode(body);
    String code = text(payment, codes.codeField());
    boolean successful = codes.isSuccess(code);
    boolean authenticationPending = ResponseCodes.AUTHENTICATION_PENDING.equals(
        text(payment, ResponseCodes.AUTHENTICATION_PENDING_FIELD));
    AuthenticationChallenge challenge = successful
        ? AuthenticationChallenge.NONE
        : challengeFrom(payment, authenticationPending);
    boolean declined = !successful && !authenticationPending && !challenge.isRequired()
        && !code.isEmpty() && !codes.isInProgress(code);

    GatewayOutcome outcome = GatewayOutcome.builder()
        .httpStatus(reply.getStatus())
        .successful(successful)
        .declined(declined)
        .authenticationPending(authenticationPending)
        .code(code)
        .message(messageOf(body, payment))
        .challenge(challenge)
        .result(resultFor(step, body, payment))
        .rawBody(reply.getBody())
        .raw(body)
        .build();
    LOG.debug("event=gateway.classified step={} kind={} code={} successful={} "
            + "authenticationPending={} challenge={}",
        step, kind, code, successful, authenticationPending, challenge.getType());
    return outcome;
  }

  /**
   * Triages the HTTP status and returns the parsed body of a 2xx reply, for calls that
   * carry no response code (e.g. the bank list).
   *
   * @throws XpressPayException for any non-2xx status
   */
  public JsonNode checkedBody(GatewayReply reply) {
    JsonNode body = parse(reply.getBody());
    if (!reply.isSuccess()) {
      throw errorFor(reply, body);
    }
    return body;
  }

  /** A request that never reached the gateway cannot have charged anyone: always retryable. */
  public NetworkException classifyTransportFailure(TransportException e) {
    return new NetworkException("Network error: " + e.getMessage(), e);
  }

  private XpressPayException errorFor(GatewayReply reply, JsonNode body) {
    int status = reply.getStatus();
    String message = firstNonEmpty(text(body, "responseMessage"), text(body, "message"),
        reply.getBody().trim(), "Unknown error");
    LOG.warn("event=gateway.error status={} message=\"{}\"", status, message);
    if (status == 400) {
      String errorType = firstNonEmpty(text(body, "errorType"), text(body, "error"));
      return new ValidationException(message, errorType.isEmpty() ? null : errorType, status);
    }
    if (status == 401) {
      return new AuthenticationException(message, status);
    }
    if (status == 404) {
      return new NotFoundException(message, status);
    }
    if (status >= 500) {
      return new ProcessingException(message, status);
    }
    return new XpressPayException(message, status);
  }

  /**
   * Maps {@code suggestedAuthentication} to a challenge. A pending flag without a
   * suggestion means the gateway has sent an OTP.
   */
  private AuthenticationChallenge challengeFrom(JsonNode payment, boolean authenticationPending) {
    String suggested = text(payment, ResponseCodes.SUGGESTED_AUTHENTICATION_FIELD)
        .toUpperCase(Locale.ROOT);
    String instruction = emptyToNull(text(payment, "validationInstruction"));
    if (ResponseCodes.SUGGESTED_PIN.equals(suggested)) {
      return AuthenticationChallenge.of(ChallengeType.PIN_REQUIRED, instruction);
    }
    if (suggested.startsWith("AVS")) {
      return new AuthenticationChallenge(ChallengeType.AVS_REQUIRED,
          emptyToNull(text(payment, "authUrl")), billingAddressOf(payment), instruction);
    }
    if (ResponseCodes.SUGGESTED_OTP.equals(suggested) || authenticationPending) {
      return AuthenticationChallenge.of(ChallengeType.OTP_REQUIRED, instruction);
    }
    return AuthenticationChallenge.NONE;
  }

  private BillingAddress billingAddressOf(JsonNode payment) {
    BillingAddress address = new BillingAddress(
        emptyToNull(text(payment, "billingAddress")),
        emptyToNull(text(payment, "billingCity")),
        emptyToNull(text(payment, "billingState")),
        emptyToNull(text(payment, "billingZip")),
        emptyToNull(text(payment, "billingCountry")));
    return address.isEmpty() ? null : address;
  }

  private GatewayResult resultFor(TransactionStep step, JsonNode body, JsonNode codes) {
    JsonNode payment = codes == body && body.path("data").isObject() ? body.path("data") : codes;
    switch (step) {
      case INITIALIZE: {
        JsonNode data = body.path("data");
        return new InitializeResult(emptyToNull(text(data, "paymentUrl")),
            emptyToNull(text(data, "reference")));
      }
      case QUERY: {
        VerifyResult result = new VerifyResult();
        result.setTransactionId(emptyToNull(text(payment, "transactionId")));
        result.setAmount(emptyToNull(text(payment, "amount")));
        result.setCurrency(emptyToNull(text(payment, "currency")));
        result.setPaymentType(emptyToNull(text(payment, "paymentType")));
        result.setGatewayStatus(emptyToNull(firstNonEmpty(text(payment, "status"),
            text(body, "status"))));
        return result;
      }
      default: {
        PaymentResult result = new PaymentResult();
        result.setTransactionReference(emptyToNull(text(payment, "transactionReference")));
        result.setUniqueKey(emptyToNull(text(payment, "uniqueKey")));
        result.setAmount(emptyToNull(text(payment, "amount")));
        result.setChargedAmount(emptyToNull(text(payment, "chargedAmount")));
        result.setPaymentType(emptyToNull(text(payment, "paymentType")));
        result.setValidationInstruction(emptyToNull(text(payment, "validationInstruction")));
        result.setAuthUrl(emptyToNull(text(payment, "authUrl")));
        return result;
      }
    }
  }

  private String messageOf(JsonNode body, JsonNode payment) {
    return firstNonEmpty(text(body, "responseMessage"), text(body, "message"),
        text(payment, "responseMessage"), text(payment, "paymentResponseMessage"));
  }

  /**
   * Card and account replies nest their codes under {@code data.payment}; hosted replies
   * keep them at the top level. Falls back outwards until a code-bearing object is found.
   */
  private JsonNode paymentNode(JsonNode body) {
    JsonNode payment = body.path("data").path("payment");
    if (payment.isObject()) {
      return payment;
    }
    JsonNode data = body.path("data");
    if (data.isObject() && (data.has(ResponseCodes.PAYMENT.codeField())
        || data.has(ResponseCodes.AUTHENTICATION_PENDING_FIELD))) {
      return data;
    }
    return body;
  }

  private JsonNode parse(String body) {
    if (body == null || body.isBlank()) {
      return MissingNode.getInstance();
    }
    try {
      JsonNode node = objectMapper.readTree(body);
      return node == null ? MissingNode.getInstance() : node;
    } catch (IOException e) {
      LOG.warn("event=gateway.unparseable_body length={}", body.length());
      return MissingNode.getInstance();
    }
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.path(field);
    return value.isValueNode() && !value.isNull() ? value.asText() : "";
  }

  private static String firstNonEmpty(String... values) {
    for (String value : values) {
      if (value != null && !value.isEmpty()) {
        return value;
      }
    }
    return "";
  }

  private static String emptyToNull(String value) {
    return value == null || value.isEmpty() ? null : value;
  }
}
