package com.xpresspay.payment.gateway.model;

import com.xpresspay.payment.gateway.enums.PaymentKind;

/**
 * Initiates a direct bank account debit. The amount is in kobo.
 *
 * <p>Some banks need extra fields, see {@link BankDebitProfile}: date of birth
 * (DDMMYYYY) for Zenith and UBA, BVN for UBA, a redirect URL for GTBank and First Bank.
 */
public class AccountPaymentRequest extends PaymentRequest {

  private String accountNumber;
  private String bankCode;
  private String country = "NG";
  private String ip;
  private String deviceFingerPrint;
  private String dateOfBirth;
  private String bvn;
  private String redirectUrl;

  @Override
  public PaymentKind getKind() {
    return PaymentKind.ACCOUNT;
  }

  public String getAccountNumber() {
    return accountNumber;
  }

  public void setAccountNumber(String accountNumber) {
    this.accountNumber = accountNumber;
  }

  public String getBankCode() {
    return bankCode;
  }

  public void setBankCode(String bankCode) {
    this.bankCode = bankCode;
  }

  public String getCountry() {
    return country;
  }

  public void setCountry(String country) {
    this.country = country;
  }

  public String getIp() {
    return ip;
  }

  public void setIp(String ip) {
    this.ip = ip;
  }

  public String getDeviceFingerPrint() {
    return deviceFingerPrint;
  }

  public void setDeviceFingerPrint(String deviceFingerPrint) {
    this.deviceFingerPrint = deviceFingerPrint;
  }

  public String getDateOfBirth() {
    return dateOfBirth;
  }

  public void setDateOfBirth(String dateOfBirth) {
    this.dateOfBirth = dateOfBirth;
  }

  public String getBvn() {
    return bvn;
  }

  public void setBvn(String bvn) {
    this.bvn = bvn;
  }

  public String getRedirectUrl() {
    return redirectUrl;
  }

  public void setRedirectUrl(String redirectUrl) {
    this.redirectUrl = redirectUrl;
  }
}
