package com.xpresspay.payment.gateway.configuration;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Client settings bound from {@code xpresspay.*}.
 *
 * <pre>
 * xpresspay.public-key=XPPUBK-...
 * xpresspay.secret-key=XPSECK-...   # only for card and account debits
 * xpresspay.sandbox=true
 * </pre>
 */
@ConfigurationProperties(prefix = "xpresspay")
public class XpressPayProperties {

  public static final String LIVE_BASE_URL = "https://myxpresspay.com:6004";
  public static final String SANDBOX_BASE_URL = "https://pgsandbox.xpresspayments.com:6004";

  private String publicKey;
  private String secretKey;
  private boolean sandbox = true;
  /** Overrides the live/sandbox URL, e.g. for a local stub. */
  private String baseUrl;
  private Duration connectTimeout = Duration.ofSeconds(10);
  private Duration readTimeout = Duration.ofSeconds(30);

  public String getPublicKey() {
    return publicKey;
  }

  public void setPublicKey(String publicKey) {
    this.publicKey = publicKey;
  }

  public String getSecretKey() {
    return secretKey;
  }

  public void setSecretKey(String secretKey) {
    this.secretKey = secretKey;
  }

  public boolean isSandbox() {
    return sandbox;
  }

  public void setSandbox(boolean sandbox) {
    this.sandbox = sandbox;
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  public void setConnectTimeout(Duration connectTimeout) {
    this.connectTimeout = connectTimeout;
  }

  public Duration getReadTimeout() {
    return readTimeout;
  }

  public void setReadTimeout(Duration readTimeout) {
    this.readTimeout = readTimeout;
  }

  /** The explicit base URL if set, else the sandbox or live endpoint. */
  public String resolveBaseUrl() {
    if (baseUrl != null && !baseUrl.isBlank()) {
      return baseUrl;
    }
    return sandbox ? SANDBOX_BASE_URL : LIVE_BASE_URL;
  }
}
