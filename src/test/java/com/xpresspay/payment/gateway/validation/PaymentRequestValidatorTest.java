package com.xpresspay.payment.gateway.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.xpresspay.payment.gateway.bank.BankDirectory;
import com.xpresspay.payment.gateway.model.AccountPaymentRequest;
import com.xpresspay.payment.gateway.model.BillingAddress;
import com.xpresspay.payment.gateway.model.CardPaymentRequest;
import com.xpresspay.payment.gateway.model.HostedPaymentRequest;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("PaymentRequestValidator")
class PaymentRequestValidatorTest {

  private PaymentRequestValidator validator;

  @BeforeEach
  void setUp() {
    // Fixed clock at January 15, 2025; expiry and date of birth checks are relative to it
    Clock fixedClock = Clock.fixed(
        Instant.parse("2025-01-15T10:00:00Z"),
        ZoneId.of("UTC"));
    validator = new PaymentRequestValidator(fixedClock, new BankDirectory());
  }

  private CardPaymentRequest validCard() {
    CardPaymentRequest request = new CardPaymentRequest();
    request.setTransactionId("ORDER-0001");
    request.setEmail("ada@example.com");
    request.setAmount("500000");
    request.setCardNumber("5399838383838381");
    request.setCvv("470");
    request.setExpiryMonth("10");
    request.setExpiryYear("31");
    return request;
  }

  private AccountPaymentRequest validAccount(String bankCode) {
    AccountPaymentRequest request = new AccountPaymentRequest();
    request.setTransactionId("ORDER-0002");
    request.setEmail("ada@example.com");
    request.setAmount("100000");
    request.setAccountNumber("0690000031");
    request.setBankCode(bankCode);
    return request;
  }

  private HostedPaymentRequest validHosted() {
    HostedPaymentRequest request = new HostedPaymentRequest();
    request.setTransactionId("ORDER-0003");
    request.setEmail("ada@example.com");
    request.setAmount("1000.00");
    request.setCallbackUrl("https://merchant.example/callback");
    return request;
  }

  @Test
  @DisplayName("Should reject a missing request")
  void shouldReject_whenRequestIsNull() {
    assertEquals(List.of("Request is required"), validator.validate(null));
  }

  @Nested
  @DisplayName("Common Fields")
  class CommonFields {

    @Test
    @DisplayName("Should accept a well-formed card request")
    void shouldAccept_whenCardRequestIsValid() {
      assertTrue(validator.validate(validCard()).isEmpty());
    }

    @Test
    @DisplayName("Should reject a transaction id shorter than 6 characters")
    void shouldReject_whenTransactionIdIsTooShort() {
      // given
      CardPaymentRequest request = validCard();
      request.setTransactionId("ORD1");

      // when
      List<String> errors = validator.validate(request);

      // then
      assertEquals(List.of("Transaction id must be between 6 and 30 characters"), errors);
    }

    @Test
    @DisplayName("Should reject a missing and malformed email")
    void shouldReject_whenEmailIsInvalid() {
      CardPaymentRequest missing = validCard();
      missing.setEmail(null);
      CardPaymentRequest malformed = validCard();
      malformed.setEmail("ada.example.com");

      assertTrue(validator.validate(missing).contains("Email is required"));
      assertTrue(validator.validate(malformed).contains("Email is not a valid address"));
    }

    @Test
    @DisplayName("Should reject a lowercase currency code")
    void shouldReject_whenCurrencyIsLowercase() {
      CardPaymentRequest request = validCard();
      request.setCurrency("ngn");

      assertTrue(validator.validate(request)
          .contains("Currency must be a 3-letter ISO code, e.g. NGN"));
    }

    @Test
    @DisplayName("Should collect every error at once")
    void shouldReturnAllErrors_whenSeveralFieldsAreInvalid() {
      CardPaymentRequest request = validCard();
      request.setTransactionId(null);
      request.setCardNumber(null);
      request.setCvv(null);

      List<String> errors = validator.validate(request);

      assertEquals(3, errors.size());
      assertTrue(errors.contains("Transaction id is required"));
      assertTrue(errors.contains("Card number is required"));
      assertTrue(errors.contains("CVV is required"));
    }
  }

  @Nested
  @DisplayName("Card Validation")
  class CardValidation {

    @Test
    @DisplayName("Should reject card number with letters")
    void shouldReject_whenCardNumberHasLetters() {
      CardPaymentRequest request = validCard();
      request.setCardNumber("5399838383838abc");

      assertEquals(List.of("Card number must contain only digits"),
          validator.validate(request));
    }

    @Test
    @DisplayName("Should reject card number longer than 19 digits")
    void shouldReject_whenCardNumberIsTooLong() {
      CardPaymentRequest request = validCard();
      request.setCardNumber("12345678901234567890");

      assertEquals(List.of("Card number must be between 13 and 19 characters"),
          validator.validate(request));
    }

    @Test
    @DisplayName("Should reject a 5-digit CVV")
    void shouldReject_whenCvvIsTooLong() {
      CardPaymentRequest request = validCard();
      request.setCvv("12345");

      assertEquals(List.of("CVV must be 3 or 4 characters"), validator.validate(request));
    }

    @Test
    @DisplayName("Should reject a decimal kobo amount")
    void shouldReject_whenAmountIsDecimal() {
      CardPaymentRequest request = validCard();
      request.setAmount("5000.50");

      assertEquals(List.of("Amount must be a whole number of kobo"),
          validator.validate(request));
    }

    @Test
    @DisplayName("Should reject a zero amount")
    void shouldReject_whenAmountIsZero() {
      CardPaymentRequest request = validCard();
      request.setAmount("000");

      assertEquals(List.of("Amount must be greater than zero"), validator.validate(request));
    }

    @Test
    @DisplayName("Should accept a card expiring in the current month")
    void shouldAccept_whenCardExpiresThisMonth() {
      CardPaymentRequest request = validCard();
      request.setExpiryMonth("01");
      request.setExpiryYear("2025");

      assertTrue(validator.validate(request).isEmpty());
    }

    @Test
    @DisplayName("Should reject a card that expired last month")
    void shouldReject_whenCardExpiredLastMonth() {
      CardPaymentRequest request = validCard();
      request.setExpiryMonth("12");
      request.setExpiryYear("24");

      assertEquals(List.of("Card has expired"), validator.validate(request));
    }

    @Test
    @DisplayName("Should reject month 13 and a 3-digit year")
    void shouldReject_whenExpiryIsMalformed() {
      CardPaymentRequest request = validCard();
      request.setExpiryMonth("13");
      request.setExpiryYear("203");

      List<String> errors = validator.validate(request);

      assertEquals(2, errors.size());
      assertTrue(errors.contains("Expiry month must be between 01 and 12"));
      assertTrue(errors.contains("Expiry year must be 2 or 4 digits"));
    }

    @Test
    @DisplayName("Should reject a partial billing address")
    void shouldReject_whenBillingAddressIsPartial() {
      CardPaymentRequest request = validCard();
      request.setBillingAddress(new BillingAddress("7 Marina Road", "Lagos", null, null, "NG"));

      List<String> errors = validator.validate(request);

      assertEquals(List.of("Billing state is required", "Billing zip is required"), errors);
    }
  }

  @Nested
  @DisplayName("Account Validation")
  class AccountValidation {

    @Test
    @DisplayName("Should accept a standard bank with only account number and bank code")
    void shouldAccept_whenBankNeedsNoExtras() {
      assertTrue(validator.validate(validAccount(BankDirectory.ACCESS_BANK)).isEmpty());
    }

    @Test
    @DisplayName("Should reject a 9-digit account number")
    void shouldReject_whenAccountNumberIsShort() {
      AccountPaymentRequest request = validAccount(BankDirectory.ACCESS_BANK);
      request.setAccountNumber("069000003");

      assertEquals(List.of("Account number must be exactly 10 digits"),
          validator.validate(request));
    }

    @Test
    @DisplayName("Should require a date of birth for Zenith Bank")
    void shouldReject_whenZenithDebitHasNoDateOfBirth() {
      AccountPaymentRequest request = validAccount(BankDirectory.ZENITH_BANK);

      assertEquals(List.of("Date of birth is required for this bank"),
          validator.validate(request));
    }

    @Test
    @DisplayName("Should accept Zenith Bank with a valid date of birth")
    void shouldAccept_whenZenithDebitHasDateOfBirth() {
      AccountPaymentRequest request = validAccount(BankDirectory.ZENITH_BANK);
      request.setDateOfBirth("14061990");

      assertTrue(validator.validate(request).isEmpty());
    }

    @Test
    @DisplayName("Should reject an impossible or future date of birth")
    void shouldReject_whenDateOfBirthIsInvalid() {
      AccountPaymentRequest impossible = validAccount(BankDirectory.ZENITH_BANK);
      impossible.setDateOfBirth("31021990");
      AccountPaymentRequest future = validAccount(BankDirectory.ZENITH_BANK);
      future.setDateOfBirth("01012030");

      assertEquals(List.of("Date of birth must be a valid date in DDMMYYYY format"),
          validator.validate(impossible));
      assertEquals(List.of("Date of birth must not be in the future"),
          validator.validate(future));
    }

    @Test
    @DisplayName("Should require date of birth and BVN for UBA")
    void shouldReject_whenUbaDebitHasNoBvn() {
      AccountPaymentRequest request = validAccount(BankDirectory.UBA);
      request.setDateOfBirth("14061990");

      assertEquals(List.of("BVN is required for bank 033"), validator.validate(request));

      request.setBvn("2222222222");
      assertEquals(List.of("BVN must be exactly 11 digits"), validator.validate(request));

      request.setBvn("22222222222");
      assertTrue(validator.validate(request).isEmpty());
    }

    @Test
    @DisplayName("Should require a redirect URL for GTBank")
    void shouldReject_whenGtbDebitHasNoRedirectUrl() {
      AccountPaymentRequest request = validAccount(BankDirectory.GTBANK);

      assertEquals(List.of("Redirect URL is required for bank 058"),
          validator.validate(request));

      request.setRedirectUrl("https://merchant.example/return");
      assertTrue(validator.validate(request).isEmpty());
    }

    @Test
    @DisplayName("Should require a bank code")
    void shouldReject_whenBankCodeIsMissing() {
      AccountPaymentRequest request = validAccount(null);

      assertEquals(List.of("Bank code is required"), validator.validate(request));
    }
  }

  @Nested
  @DisplayName("Hosted Validation")
  class HostedValidation {

    @Test
    @DisplayName("Should accept a major-unit amount")
    void shouldAccept_whenHostedRequestIsValid() {
      assertTrue(validator.validate(validHosted()).isEmpty());
    }

    @Test
    @DisplayName("Should reject three decimal places")
    void shouldReject_whenAmountHasThreeDecimals() {
      HostedPaymentRequest request = validHosted();
      request.setAmount("10.001");

      assertEquals(
          List.of("Amount must be a decimal with at most two decimal places, e.g. 1000.00"),
          validator.validate(request));
    }

    @Test
    @DisplayName("Should reject a callback URL that is not http(s)")
    void shouldReject_whenCallbackUrlIsNotHttp() {
      HostedPaymentRequest request = validHosted();
      request.setCallbackUrl("ftp://merchant.example/callback");

      assertEquals(List.of("Callback URL must be an absolute http(s) URL"),
          validator.validate(request));
    }
  }

  @Nested
  @DisplayName("Authentication Inputs")
  class AuthenticationInputs {

    @Test
    @DisplayName("Should accept a 4-digit PIN and reject anything else")
    void shouldValidatePin() {
      assertTrue(validator.validatePin("1234").isEmpty());
      assertEquals(List.of("PIN is required"), validator.validatePin(" "));
      assertEquals(List.of("PIN must be exactly 4 digits"), validator.validatePin("12a4"));
      assertEquals(List.of("PIN must be exactly 4 digits"), validator.validatePin("12345"));
    }

    @Test
    @DisplayName("Should require digits-only OTP")
    void shouldValidateOtp() {
      assertTrue(validator.validateOtp("123456").isEmpty());
      assertEquals(List.of("OTP is required"), validator.validateOtp(null));
      assertEquals(List.of("OTP must contain only digits"), validator.validateOtp("12-456"));
    }

    @Test
    @DisplayName("Should require a complete billing address for AVS")
    void shouldValidateBillingAddress() {
      assertEquals(List.of("Billing address is required"),
          validator.validateBillingAddress(new BillingAddress()));

      BillingAddress complete =
          new BillingAddress("7 Marina Road", "Lagos", "Lagos", "101001", "NG");
      assertTrue(validator.validateBillingAddress(complete).isEmpty());
    }
  }
}
