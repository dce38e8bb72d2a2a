package com.xpresspay.payment.gateway.model;

import java.util.Objects;

/**
 * A bank that supports direct account debit, identified by its CBN bank code.
 */
public final class Bank {

  private final String name;
  private final String code;

  public Bank(String name, String code) {
    this.name = name;
    this.code = code;
  }

  public String getName() {
    return name;
  }

  public String getCode() {
    return code;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Bank)) {
      return false;
    }
    Bank bank = (Bank) o;
    return Objects.equals(name, bank.name) && Objects.equals(code, bank.code);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, code);
  }

  @Override
  public String toString() {
    return name + " (" + code + ")";
  }
}
