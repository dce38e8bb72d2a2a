package com.xpresspay.payment.gateway.client;

import java.io.IOException;
import java.net.URI;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.ResponseErrorHandler;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * HTTP-based implementation of {@link GatewayTransport} using {@link RestTemplate}.
 *
 * <p>Posts JSON to the gateway and hands back status and body untouched. 4xx and 5xx
 * replies are returned rather than thrown so the response classifier sees them; only
 * infrastructure failures ({@link ResourceAccessException}: timeouts, refused connections)
 * become {@link TransportException}.
 *
 * <p>The base URL is configured via the {@code xpresspay.base-url} or
 * {@code xpresspay.sandbox} properties.
 */
public class RestTemplateGatewayTransport implements GatewayTransport {

  private static final Logger LOG = LoggerFactory.getLogger(RestTemplateGatewayTransport.class);

  private final RestTemplate restTemplate;
  private final String baseUrl;

  /**
   * Builds a private {@link RestTemplate} from {@code builder}, so the pass-through error
   * handler never leaks into templates the application uses elsewhere.
   */
  public RestTemplateGatewayTransport(RestTemplateBuilder builder, String baseUrl) {
    this.restTemplate = builder.errorHandler(new PassThroughErrorHandler()).build();
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  /** The template this transport owns; exposed for binding a mock server in tests. */
  public RestTemplate getRestTemplate() {
    return restTemplate;
  }

  @Override
  public GatewayReply send(GatewayRequest request) {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    headers.setAccept(List.of(MediaType.APPLICATION_JSON));
    request.getHeaders().forEach(headers::set);

    long start = System.currentTimeMillis();
    try {
      ResponseEntity<String> response = restTemplate.exchange(
          uriFor(request),
          request.getMethod(),
          new HttpEntity<>(request.getBody(), headers),
          String.class);
      LOG.debug("event=gateway.exchange request=\"{}\" status={} latencyMs={}",
          request, response.getStatusCode().value(), System.currentTimeMillis() - start);
      return new GatewayReply(response.getStatusCode().value(), response.getBody());
    } catch (ResourceAccessException e) {
      LOG.warn("event=gateway.unreachable request=\"{}\" latencyMs={} cause={}",
          request, System.currentTimeMillis() - start, e.getMessage());
      throw new TransportException("Gateway is unreachable: " + e.getMessage(), e);
    }
  }

  /** Query parameter values are expanded as URI variables, so each is encoded exactly once. */
  private URI uriFor(GatewayRequest request) {
    UriComponentsBuilder uri = UriComponentsBuilder.fromUriString(baseUrl)
        .path(request.getPath());
    request.getQueryParams().keySet()
        .forEach(name -> uri.queryParam(name, "{" + name + "}"));
    return uri.encode().buildAndExpand(request.getQueryParams()).toUri();
  }

  /** Leaves every status to the response classifier. */
  private static final class PassThroughErrorHandler implements ResponseErrorHandler {

    @Override
    public boolean hasError(ClientHttpResponse response) throws IOException {
      return false;
    }

    @Override
    public void handleError(ClientHttpResponse response) throws IOException {
      // hasError is always false
    }
  }
}
