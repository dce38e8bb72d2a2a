package com.xpresspay.payment.gateway.client;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpMethod;

/**
 * One call to the gateway: method, path relative to the base URL, headers and an
 * optional JSON body (already encrypted where the step requires it).
 */
public final class GatewayRequest {

  private final HttpMethod method;
  private final String path;
  private final Map<String, String> headers;
  private final Map<String, Object> body;
  private final Map<String, String> queryParams;

  public GatewayRequest(HttpMethod method, String path, Map<String, String> headers,
      Map<String, Object> body) {
    this(method, path, headers, body, Map.of());
  }

  /**
   * @param queryParams raw, unencoded query parameter values; the transport encodes them
   */
  public GatewayRequest(HttpMethod method, String path, Map<String, String> headers,
      Map<String, Object> body, Map<String, String> queryParams) {
    this.method = method;
    this.path = path;
    this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    this.body = body == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(body));
    this.queryParams = Collections.unmodifiableMap(new LinkedHashMap<>(queryParams));
  }

  public HttpMethod getMethod() {
    return method;
  }

  public String getPath() {
    return path;
  }

  public Map<String, String> getHeaders() {
    return headers;
  }

  /** The JSON body, or {@code null} for calls without one. */
  public Map<String, Object> getBody() {
    return body;
  }

  public Map<String, String> getQueryParams() {
    return queryParams;
  }

  @Override
  public String toString() {
    return method + " " + path;
  }
}
