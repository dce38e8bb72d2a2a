package com.xpresspay.payment.gateway.model;

import java.util.Objects;

/**
 * Cardholder billing address used for address verification on international cards.
 */
public class BillingAddress {

  private String address;
  private String city;
  private String state;
  private String zip;
  private String country;

  public BillingAddress() {
  }

  public BillingAddress(String address, String city, String state, String zip, String country) {
    this.address = address;
    this.city = city;
    this.state = state;
    this.zip = zip;
    this.country = country;
  }

  public String getAddress() {
    return address;
  }

  public void setAddress(String address) {
    this.address = address;
  }

  public String getCity() {
    return city;
  }

  public void setCity(String city) {
    this.city = city;
  }

  public String getState() {
    return state;
  }

  public void setState(String state) {
    this.state = state;
  }

  public String getZip() {
    return zip;
  }

  public void setZip(String zip) {
    this.zip = zip;
  }

  public String getCountry() {
    return country;
  }

  public void setCountry(String country) {
    this.country = country;
  }

  public boolean isEmpty() {
    return address == null && city == null && state == null && zip == null && country == null;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof BillingAddress)) {
      return false;
    }
    BillingAddress that = (BillingAddress) o;
    return Objects.equals(address, that.address) && Objects.equals(city, that.city)
        && Objects.equals(state, that.state) && Objects.equals(zip, that.zip)
        && Objects.equals(country, that.country);
  }

  @Override
  public int hashCode() {
    return Objects.hash(address, city, state, zip, country);
  }
}
