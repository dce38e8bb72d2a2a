package com.xpresspay.payment.gateway.model;

/**
 * Extra fields a bank requires before it accepts a direct debit.
 */
public final class BankDebitProfile {

  private static final BankDebitProfile STANDARD = new BankDebitProfile(null, false, false, false);

  private final String bankCode;
  private final boolean dateOfBirthRequired;
  private final boolean bvnRequired;
  private final boolean redirectUrlRequired;

  public BankDebitProfile(String bankCode, boolean dateOfBirthRequired, boolean bvnRequired,
      boolean redirectUrlRequired) {
    this.bankCode = bankCode;
    this.dateOfBirthRequired = dateOfBirthRequired;
    this.bvnRequired = bvnRequired;
    this.redirectUrlRequired = redirectUrlRequired;
  }

  /** Profile for banks with no requirements beyond account number and bank code. */
  public static BankDebitProfile standard() {
    return STANDARD;
  }

  public String getBankCode() {
    return bankCode;
  }

  public boolean isDateOfBirthRequired() {
    return dateOfBirthRequired;
  }

  public boolean isBvnRequired() {
    return bvnRequired;
  }

  public boolean isRedirectUrlRequired() {
    return redirectUrlRequired;
  }
}
