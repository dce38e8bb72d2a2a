package com.xpresspay.payment.gateway.validation;

import com.xpresspay.payment.gateway.bank.BankDirectory;
import com.xpresspay.payment.gateway.model.AccountPaymentRequest;
import com.xpresspay.payment.gateway.model.BankDebitProfile;
import com.xpresspay.payment.gateway.model.BillingAddress;
import com.xpresspay.payment.gateway.model.CardPaymentRequest;
import com.xpresspay.payment.gateway.model.HostedPaymentRequest;
import com.xpresspay.payment.gateway.model.PaymentRequest;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Validates requests locally, before anything is encrypted or sent to the gateway.
 *
 * <p>Uses an explicit validation approach (rather than Bean Validation annotations) so that
 * all errors are returned at once and card expiry can be checked against an injected
 * {@link Clock}. Branch rules are selected by {@link PaymentRequest#getKind()}.
 *
 * <p>Validation rules:
 * <ul>
 *   <li>All branches: transaction id 6-30 characters, valid email, 3-letter currency</li>
 *   <li>Hosted: amount in major units, positive, at most two decimals</li>
 *   <li>Card: amount in kobo; card number 13-19 digits; CVV 3-4 digits; expiry not in the
 *       past (current month is valid); billing address, when given, complete</li>
 *   <li>Account: amount in kobo; 10-digit account number; bank code; plus the fields the
 *       bank's {@link BankDebitProfile} requires</li>
 * </ul>
 */
public class PaymentRequestValidator {

  private static final Pattern DIGITS = Pattern.compile("\\d+");
  private static final Pattern KOBO_AMOUNT = Pattern.compile("\\d+");
  private static final Pattern MAJOR_UNIT_AMOUNT = Pattern.compile("\\d+(\\.\\d{1,2})?");
  private static final Pattern EMAIL = Pattern.compile("[^@\\s]+@[^@\\s]+\\.[^@\\s]+");
  private static final Pattern CURRENCY = Pattern.compile("[A-Z]{3}");
  private static final DateTimeFormatter DATE_OF_BIRTH =
      DateTimeFormatter.ofPattern("ddMMuuuu").withResolverStyle(ResolverStyle.STRICT);

  private final Clock clock;
  private final BankDirectory bankDirectory;

  public PaymentRequestValidator(Clock clock, BankDirectory bankDirectory) {
    this.clock = clock;
    this.bankDirectory = bankDirectory;
  }

  /**
   * Validates the given request against the common rules and its branch's rules.
   *
   * @param request the request to validate
   * @return a list of human-readable error messages; empty if the request is valid
   */
  public List<String> validate(PaymentRequest request) {
    List<String> errors = new ArrayList<>();
    if (request == null) {
      errors.add("Request is required");
      return errors;
    }

    validateTransactionId(request.getTransactionId(), errors);
    validateEmail(request.getEmail(), errors);
    validateCurrency(request.getCurrency(), errors);

    switch (request.getKind()) {
      case HOSTED:
        validateHosted((HostedPaymentRequest) request, errors);
        break;
      case CARD:
        validateCard((CardPaymentRequest) request, errors);
        break;
      case ACCOUNT:
        validateAccount((AccountPaymentRequest) request, errors);
        break;
      default:
        errors.add("Unsupported payment kind: " + request.getKind());
    }
    return errors;
  }

  /** Card PIN: exactly four digits. */
  public List<String> validatePin(String pin) {
    List<String> errors = new ArrayList<>();
    if (pin == null || pin.isBlank()) {
      errors.add("PIN is required");
    } else if (pin.length() != 4 || !DIGITS.matcher(pin).matches()) {
      errors.add("PIN must be exactly 4 digits");
    }
    return errors;
  }

  /** Billing address submitted for AVS: every field is required. */
  public List<String> validateBillingAddress(BillingAddress address) {
    List<String> errors = new ArrayList<>();
    if (address == null || address.isEmpty()) {
      errors.add("Billing address is required");
      return errors;
    }
    requireBillingFields(address, errors);
    return errors;
  }

  public List<String> validateOtp(String otp) {
    List<String> errors = new ArrayList<>();
    if (otp == null || otp.isBlank()) {
      errors.add("OTP is required");
    } else if (!DIGITS.matcher(otp).matches()) {
      errors.add("OTP must contain only digits");
    }
    return errors;
  }

  private void validateHosted(HostedPaymentRequest request, List<String> errors) {
    String amount = request.getAmount();
    if (amount == null || amount.isBlank()) {
      errors.add("Amount is required");
    } else if (!MAJOR_UNIT_AMOUNT.matcher(amount).matches()) {
      errors.add("Amount must be a decimal with at most two decimal places, e.g. 1000.00");
    } else if (Double.parseDouble(amount) <= 0) {
      errors.add("Amount must be greater than zero");
    }
    if (request.getCallbackUrl() != null && !isHttpUrl(request.getCallbackUrl())) {
      errors.add("Callback URL must be an absolute http(s) URL");
    }
  }

  private void validateCard(CardPaymentRequest request, List<String> errors) {
    validateKoboAmount(request.getAmount(), errors);
    validateCardNumber(request.getCardNumber(), errors);
    validateCvv(request.getCvv(), errors);
    validateExpiryDate(request.getExpiryMonth(), request.getExpiryYear(), errors);
    BillingAddress billing = request.getBillingAddress();
    if (billing != null && !billing.isEmpty()) {
      requireBillingFields(billing, errors);
    }
  }

  private void validateAccount(AccountPaymentRequest request, List<String> errors) {
    validateKoboAmount(request.getAmount(), errors);

    String accountNumber = request.getAccountNumber();
    if (accountNumber == null || accountNumber.isBlank()) {
      errors.add("Account number is required");
    } else if (accountNumber.length() != 10 || !DIGITS.matcher(accountNumber).matches()) {
      errors.add("Account number must be exactly 10 digits");
    }

    String bankCode = request.getBankCode();
    if (bankCode == null || bankCode.isBlank()) {
      errors.add("Bank code is required");
      return;
    }
    if (!DIGITS.matcher(bankCode).matches()) {
      errors.add("Bank code must contain only digits");
    }

    BankDebitProfile profile = bankDirectory.profileFor(bankCode);
    if (profile.isDateOfBirthRequired()) {
      validateDateOfBirth(request.getDateOfBirth(), errors);
    }
    if (profile.isBvnRequired()) {
      String bvn = request.getBvn();
      if (bvn == null || bvn.isBlank()) {
        errors.add("BVN is required for bank " + bankCode);
      } else if (bvn.length() != 11 || !DIGITS.matcher(bvn).matches()) {
        errors.add("BVN must be exactly 11 digits");
      }
    }
    if (profile.isRedirectUrlRequired()) {
      String redirectUrl = request.getRedirectUrl();
      if (redirectUrl == null || redirectUrl.isBlank()) {
        errors.add("Redirect URL is required for bank " + bankCode);
      } else if (!isHttpUrl(redirectUrl)) {
        errors.add("Redirect URL must be an absolute http(s) URL");
      }
    }
  }

  private void validateTransactionId(String transactionId, List<String> errors) {
    if (transactionId == null || transactionId.isBlank()) {
      errors.add("Transaction id is required");
      return;
    }
    if (transactionId.length() < 6 || transactionId.length() > 30) {
      errors.add("Transaction id must be between 6 and 30 characters");
    }
  }

  private void validateEmail(String email, List<String> errors) {
    if (email == null || email.isBlank()) {
      errors.add("Email is required");
    } else if (!EMAIL.matcher(email).matches()) {
      errors.add("Email is not a valid address");
    }
  }

  private void validateCurrency(String currency, List<String> errors) {
    if (currency == null || currency.isBlank()) {
      errors.add("Currency is required");
    } else if (!CURRENCY.matcher(currency).matches()) {
      errors.add("Currency must be a 3-letter ISO code, e.g. NGN");
    }
  }

  private void validateKoboAmount(String amount, List<String> errors) {
    if (amount == null || amount.isBlank()) {
      errors.add("Amount is required");
    } else if (!KOBO_AMOUNT.matcher(amount).matches()) {
      errors.add("Amount must be a whole number of kobo");
    } else if (amount.chars().allMatch(c -> c == '0')) {
      errors.add("Amount must be greater than zero");
    }
  }

  private void validateCardNumber(String cardNumber, List<String> errors) {
    if (cardNumber == null || cardNumber.isBlank()) {
      errors.add("Card number is required");
      return;
    }
    if (cardNumber.length() < 13 || cardNumber.length() > 19) {
      errors.add("Card number must be between 13 and 19 characters");
    }
    if (!DIGITS.matcher(cardNumber).matches()) {
      errors.add("Card number must contain only digits");
    }
  }

  private void validateCvv(String cvv, List<String> errors) {
    if (cvv == null || cvv.isBlank()) {
      errors.add("CVV is required");
      return;
    }
    if (cvv.length() < 3 || cvv.length() > 4) {
      errors.add("CVV must be 3 or 4 characters");
    }
    if (!DIGITS.matcher(cvv).matches()) {
      errors.add("CVV must contain only digits");
    }
  }

  /**
   * Validates that the expiry date is not in the past. A card expiring in the current
   * month is considered valid. Two-digit years are read as 20YY.
   */
  private void validateExpiryDate(String expiryMonth, String expiryYear, List<String> errors) {
    Integer month = null;
    Integer year = null;
    if (expiryMonth == null || expiryMonth.isBlank()) {
      errors.add("Expiry month is required");
    } else if (!DIGITS.matcher(expiryMonth).matches() || expiryMonth.length() > 2
        || Integer.parseInt(expiryMonth) < 1 || Integer.parseInt(expiryMonth) > 12) {
      errors.add("Expiry month must be between 01 and 12");
    } else {
      month = Integer.parseInt(expiryMonth);
    }
    if (expiryYear == null || expiryYear.isBlank()) {
      errors.add("Expiry year is required");
    } else if (!DIGITS.matcher(expiryYear).matches()
        || (expiryYear.length() != 2 && expiryYear.length() != 4)) {
      errors.add("Expiry year must be 2 or 4 digits");
    } else {
      year = Integer.parseInt(expiryYear);
      if (expiryYear.length() == 2) {
        year += 2000;
      }
    }
    if (month == null || year == null) {
      return;
    }
    LocalDate now = LocalDate.now(clock);
    LocalDate expiryDate = LocalDate.of(year, month, 1)
        .plusMonths(1)
        .minusDays(1);
    if (expiryDate.isBefore(now)) {
      errors.add("Card has expired");
    }
  }

  private void validateDateOfBirth(String dateOfBirth, List<String> errors) {
    if (dateOfBirth == null || dateOfBirth.isBlank()) {
      errors.add("Date of birth is required for this bank");
      return;
    }
    try {
      LocalDate parsed = LocalDate.parse(dateOfBirth, DATE_OF_BIRTH);
      if (parsed.isAfter(LocalDate.now(clock))) {
        errors.add("Date of birth must not be in the future");
      }
    } catch (DateTimeParseException e) {
      errors.add("Date of birth must be a valid date in DDMMYYYY format");
    }
  }

  private void requireBillingFields(BillingAddress address, List<String> errors) {
    if (isBlank(address.getAddress())) {
      errors.add("Billing address line is required");
    }
    if (isBlank(address.getCity())) {
      errors.add("Billing city is required");
    }
    if (isBlank(address.getState())) {
      errors.add("Billing state is required");
    }
    if (isBlank(address.getZip())) {
      errors.add("Billing zip is required");
    }
    if (isBlank(address.getCountry())) {
      errors.add("Billing country is required");
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private static boolean isHttpUrl(String value) {
    try {
      URI uri = new URI(value);
      return uri.isAbsolute() && uri.getHost() != null
          && ("http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme()));
    } catch (URISyntaxException e) {
      return false;
    }
  }
}
