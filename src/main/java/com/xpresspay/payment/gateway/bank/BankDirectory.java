package com.xpresspay.payment.gateway.bank;

import com.xpresspay.payment.gateway.model.Bank;
import com.xpresspay.payment.gateway.model.BankDebitProfile;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static table of banks that support direct account debit, and the extra fields each
 * bank requires.
 *
 * <p>Requirements:
 * <ul>
 *   <li>Zenith Bank (057): date of birth</li>
 *   <li>United Bank for Africa (033): date of birth and BVN</li>
 *   <li>Guaranty Trust Bank (058), First Bank (011): redirect URL</li>
 * </ul>
 * Every other bank code, listed or not, needs only account number and bank code.
 */
public class BankDirectory {

  public static final String ACCESS_BANK = "044";
  public static final String FIRST_BANK = "011";
  public static final String GTBANK = "058";
  public static final String UBA = "033";
  public static final String ZENITH_BANK = "057";

  private static final List<Bank> BANKS = List.of(
      new Bank("Access Bank", ACCESS_BANK),
      new Bank("Citibank Nigeria", "023"),
      new Bank("Ecobank Nigeria", "050"),
      new Bank("Fidelity Bank", "070"),
      new Bank("First Bank of Nigeria", FIRST_BANK),
      new Bank("First City Monument Bank", "214"),
      new Bank("Guaranty Trust Bank", GTBANK),
      new Bank("Heritage Bank", "030"),
      new Bank("Keystone Bank", "082"),
      new Bank("Polaris Bank", "076"),
      new Bank("Stanbic IBTC Bank", "221"),
      new Bank("Standard Chartered Bank", "068"),
      new Bank("Sterling Bank", "232"),
      new Bank("Union Bank of Nigeria", "032"),
      new Bank("United Bank for Africa", UBA),
      new Bank("Unity Bank", "215"),
      new Bank("Wema Bank", "035"),
      new Bank("Zenith Bank", ZENITH_BANK));

  private static final Map<String, BankDebitProfile> PROFILES = Map.of(
      ZENITH_BANK, new BankDebitProfile(ZENITH_BANK, true, false, false),
      UBA, new BankDebitProfile(UBA, true, true, false),
      GTBANK, new BankDebitProfile(GTBANK, false, false, true),
      FIRST_BANK, new BankDebitProfile(FIRST_BANK, false, false, true));

  /** Banks in display order. */
  public List<Bank> listBanks() {
    return BANKS;
  }

  public Optional<Bank> findBank(String bankCode) {
    if (bankCode == null) {
      return Optional.empty();
    }
    return BANKS.stream().filter(bank -> bank.getCode().equals(bankCode)).findFirst();
  }

  public BankDebitProfile profileFor(String bankCode) {
    if (bankCode == null) {
      return BankDebitProfile.standard();
    }
    return PROFILES.getOrDefault(bankCode, BankDebitProfile.standard());
  }
}
