package com.xpresspay.payment.gateway.service;

import com.xpresspay.payment.gateway.codec.PayloadCodec;
import com.xpresspay.payment.gateway.enums.PaymentKind;
import com.xpresspay.payment.gateway.model.AccountPaymentRequest;
import com.xpresspay.payment.gateway.model.BillingAddress;
import com.xpresspay.payment.gateway.model.CardPaymentRequest;
import com.xpresspay.payment.gateway.model.HostedPaymentRequest;
import com.xpresspay.payment.gateway.model.PaymentRequest;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the JSON bodies the gateway expects for each step. Field order is kept stable
 * because card and account payloads are encrypted as serialised.
 * Optional fields are left out when unset.
 */
final class PaymentPayloads {

  private PaymentPayloads() {
  }

  static Map<String, Object> hosted(HostedPaymentRequest request) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("amount", request.getAmount());
    payload.put("email", request.getEmail());
    payload.put("transactionId", request.getTransactionId());
    payload.put("currency", request.getCurrency());
    putIfPresent(payload, "productId", request.getProductId());
    putIfPresent(payload, "productDescription", request.getProductDescription());
    putIfPresent(payload, "callbackUrl", request.getCallbackUrl());
    putCustomer(payload, request);
    if (request.getMetadata() != null && !request.getMetadata().isEmpty()) {
      payload.put("metadata", nameValueList(request.getMetadata(), "name", "value"));
    }
    return payload;
  }

  /** Plaintext of the encrypted {@code request} field for a card debit. */
  static Map<String, Object> card(String publicKey, CardPaymentRequest request) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("publicKey", publicKey);
    payload.put("cardNumber", request.getCardNumber());
    payload.put("cvv", request.getCvv());
    payload.put("expiryMonth", request.getExpiryMonth());
    payload.put("expiryYear", request.getExpiryYear());
    payload.put("amount", request.getAmount());
    payload.put("email", request.getEmail());
    payload.put("transactionId", request.getTransactionId());
    payload.put("currency", request.getCurrency());
    payload.put("country", request.getCountry());
    payload.put("paymentType", PaymentKind.CARD.wireValue());
    putCustomer(payload, request);
    putIfPresent(payload, "ip", request.getIp());
    putIfPresent(payload, "deviceFingerPrint", request.getDeviceFingerPrint());
    putIfPresent(payload, "redirectUrl", request.getRedirectUrl());
    putBilling(payload, request.getBillingAddress());
    if (request.getMeta() != null && !request.getMeta().isEmpty()) {
      payload.put("meta", nameValueList(request.getMeta(), "metaName", "metaValue"));
    }
    return payload;
  }

  /** Plaintext of the encrypted {@code request} field for an account debit. */
  static Map<String, Object> account(String publicKey, AccountPaymentRequest request) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("publicKey", publicKey);
    payload.put("accountNumber", request.getAccountNumber());
    payload.put("bankCode", request.getBankCode());
    payload.put("amount", request.getAmount());
    payload.put("email", request.getEmail());
    payload.put("transactionId", request.getTransactionId());
    payload.put("currency", request.getCurrency());
    payload.put("country", request.getCountry());
    payload.put("paymentType", PaymentKind.ACCOUNT.wireValue());
    putCustomer(payload, request);
    putIfPresent(payload, "ip", request.getIp());
    putIfPresent(payload, "deviceFingerPrint", request.getDeviceFingerPrint());
    putIfPresent(payload, "dateOfBirth", request.getDateOfBirth());
    putIfPresent(payload, "bvn", request.getBvn());
    putIfPresent(payload, "redirectUrl", request.getRedirectUrl());
    return payload;
  }

  static Map<String, Object> encryptedEnvelope(String publicKey, String ciphertext,
      PaymentKind kind) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("publicKey", publicKey);
    body.put("request", ciphertext);
    body.put("alg", PayloadCodec.ALGORITHM);
    body.put("paymentType", kind.wireValue());
    return body;
  }

  static Map<String, Object> pin(String publicKey, String transactionId, String pin) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("publicKey", publicKey);
    body.put("suggestedAuthentication", "PIN");
    body.put("pin", pin);
    body.put("transactionId", transactionId);
    body.put("paymentType", PaymentKind.CARD.wireValue());
    return body;
  }

  static Map<String, Object> avs(String publicKey, String transactionId, BillingAddress address) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("publicKey", publicKey);
    body.put("suggestedAuthentication", "AVS_VBVSECURECODE");
    body.put("transactionId", transactionId);
    body.put("paymentType", PaymentKind.CARD.wireValue());
    putBilling(body, address);
    return body;
  }

  static Map<String, Object> otp(String publicKey, String transactionId, String otp,
      PaymentKind kind) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("publicKey", publicKey);
    body.put("transactionReference", transactionId);
    body.put("otp", otp);
    body.put("paymentType", kind.wireValue());
    return body;
  }

  static Map<String, Object> query(String publicKey, String transactionId, PaymentKind kind) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("publicKey", publicKey);
    body.put("transactionId", transactionId);
    body.put("paymentType", kind.wireValue());
    return body;
  }

  static Map<String, Object> verify(String transactionId) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("transactionId", transactionId);
    return body;
  }

  private static void putCustomer(Map<String, Object> payload, PaymentRequest request) {
    putIfPresent(payload, "phoneNumber", request.getPhoneNumber());
    putIfPresent(payload, "firstName", request.getFirstName());
    putIfPresent(payload, "lastName", request.getLastName());
  }

  private static void putBilling(Map<String, Object> payload, BillingAddress address) {
    if (address == null) {
      return;
    }
    putIfPresent(payload, "billingZip", address.getZip());
    putIfPresent(payload, "billingCity", address.getCity());
    putIfPresent(payload, "billingAddress", address.getAddress());
    putIfPresent(payload, "billingState", address.getState());
    putIfPresent(payload, "billingCountry", address.getCountry());
  }

  private static List<Map<String, String>> nameValueList(Map<String, String> entries,
      String nameField, String valueField) {
    List<Map<String, String>> list = new ArrayList<>();
    entries.forEach((name, value) -> {
      Map<String, String> entry = new LinkedHashMap<>();
      entry.put(nameField, name);
      entry.put(valueField, value);
      list.add(entry);
    });
    return list;
  }

  private static void putIfPresent(Map<String, Object> payload, String field, String value) {
    if (value != null && !value.isEmpty()) {
      payload.put(field, value);
    }
  }
}
