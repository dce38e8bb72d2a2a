package com.xpresspay.payment.gateway.model;

import com.xpresspay.payment.gateway.exception.ConfigurationException;
import java.util.Map;

/**
 * Merchant credentials issued by the Xpresspay dashboard.
 *
 * <p>The public key identifies the merchant on every call and is sent as a bearer token.
 * The secret key is optional: it is only needed for card and account debits, where it is
 * used locally to derive the payload encryption key. It is never sent to the gateway and
 * never printed by {@link #toString()}.
 */
public final class Credentials {

  public static final String PUBLIC_KEY_PREFIX = "XPPUBK-";
  public static final String SECRET_KEY_PREFIX = "XPSECK-";
  public static final int MIN_SECRET_KEY_LENGTH = 12;

  static final String PUBLIC_KEY_ENV = "XPRESSPAY_PUBLIC_KEY";
  static final String SECRET_KEY_ENV = "XPRESSPAY_SECRET_KEY";

  private final String publicKey;
  private final String secretKey;

  public Credentials(String publicKey, String secretKey) {
    if (publicKey == null || !publicKey.startsWith(PUBLIC_KEY_PREFIX)) {
      throw new ConfigurationException(
          "A valid Xpresspay public key starting with '" + PUBLIC_KEY_PREFIX
              + "' is required");
    }
    if (secretKey != null && !secretKey.isEmpty()) {
      if (!secretKey.startsWith(SECRET_KEY_PREFIX)) {
        throw new ConfigurationException(
            "Xpresspay secret key must start with '" + SECRET_KEY_PREFIX + "'");
      }
      if (secretKey.length() - SECRET_KEY_PREFIX.length() < MIN_SECRET_KEY_LENGTH) {
        throw new ConfigurationException(
            "Xpresspay secret key is too short; use the full key from the dashboard");
      }
    }
    this.publicKey = publicKey;
    this.secretKey = secretKey == null || secretKey.isEmpty() ? null : secretKey;
  }

  public static Credentials of(String publicKey) {
    return new Credentials(publicKey, null);
  }

  public static Credentials of(String publicKey, String secretKey) {
    return new Credentials(publicKey, secretKey);
  }

  /** Reads {@code XPRESSPAY_PUBLIC_KEY} and {@code XPRESSPAY_SECRET_KEY} from the process environment. */
  public static Credentials fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  public static Credentials fromEnvironment(Map<String, String> environment) {
    return new Credentials(environment.get(PUBLIC_KEY_ENV), environment.get(SECRET_KEY_ENV));
  }

  public String getPublicKey() {
    return publicKey;
  }

  /** The secret key, or {@code null} when the credentials only cover the hosted flow. */
  public String getSecretKey() {
    return secretKey;
  }

  public boolean hasSecretKey() {
    return secretKey != null;
  }

  @Override
  public String toString() {
    return "Credentials(publicKey=" + publicKey + ", secretKey="
        + (secretKey == null ? "none" : "****") + ")";
  }
}
