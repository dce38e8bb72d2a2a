package com.xpresspay.payment.gateway.classifier;

import com.xpresspay.payment.gateway.enums.PaymentKind;
import java.util.Set;

/**
 * Response code vocabularies. The hosted-page API and the card/account API report
 * success through different fields with different literals.
 */
public enum ResponseCodes {

  HOSTED("responseCode", "00", Set.of("09")),
  PAYMENT("paymentResponseCode", "000", Set.of("001"));

  /** Field holding the "authentication still pending" flag, shared by both vocabularies. */
  public static final String AUTHENTICATION_PENDING_FIELD = "authenticatePaymentResponseCode";
  public static final String AUTHENTICATION_PENDING = "02";

  public static final String SUGGESTED_AUTHENTICATION_FIELD = "suggestedAuthentication";
  public static final String SUGGESTED_PIN = "PIN";
  public static final String SUGGESTED_AVS = "AVS_VBVSECURECODE";
  public static final String SUGGESTED_OTP = "OTP";

  private final String codeField;
  private final String successCode;
  private final Set<String> inProgressCodes;

  ResponseCodes(String codeField, String successCode, Set<String> inProgressCodes) {
    this.codeField = codeField;
    this.successCode = successCode;
    this.inProgressCodes = inProgressCodes;
  }

  public static ResponseCodes forKind(PaymentKind kind) {
    return kind == PaymentKind.HOSTED ? HOSTED : PAYMENT;
  }

  public String codeField() {
    return codeField;
  }

  public boolean isSuccess(String code) {
    return successCode.equals(code);
  }

  /** Codes meaning the gateway has not reached a final decision yet. */
  public boolean isInProgress(String code) {
    return inProgressCodes.contains(code);
  }
}
