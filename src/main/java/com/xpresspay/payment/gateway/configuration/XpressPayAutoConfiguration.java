package com.xpresspay.payment.gateway.configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xpresspay.payment.gateway.bank.BankDirectory;
import com.xpresspay.payment.gateway.classifier.ResponseClassifier;
import com.xpresspay.payment.gateway.client.GatewayTransport;
import com.xpresspay.payment.gateway.client.RestTemplateGatewayTransport;
import com.xpresspay.payment.gateway.codec.PayloadCodec;
import com.xpresspay.payment.gateway.model.Credentials;
import com.xpresspay.payment.gateway.service.XpressPayService;
import com.xpresspay.payment.gateway.service.XpressPayServiceImpl;
import com.xpresspay.payment.gateway.transaction.TransactionStateMachine;
import com.xpresspay.payment.gateway.validation.PaymentRequestValidator;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.web.client.RestTemplate;

/**
 * Wires the client when {@code xpresspay.public-key} is set.
 *
 * <p>Provides:
 * <ul>
 *   <li>{@link Credentials}, checked at startup so a bad key fails before any payment</li>
 *   <li>The gateway transport, over a private {@link RestTemplate} with the configured
 *       connect/read timeouts</li>
 *   <li>{@link Clock} for testable card expiry checks (replace with a fixed clock in tests)</li>
 *   <li>The codec, classifier, validator, state machine and {@link XpressPayService}</li>
 * </ul>
 * Every bean backs off when the application defines its own. None of them is a global
 * singleton: all can be constructed directly without Spring.
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "xpresspay", name = "public-key")
@EnableConfigurationProperties(XpressPayProperties.class)
public class XpressPayAutoConfiguration {

  private static final Logger LOG = LoggerFactory.getLogger(XpressPayAutoConfiguration.class);

  @Bean
  @ConditionalOnMissingBean
  public Credentials xpressPayCredentials(XpressPayProperties properties) {
    Credentials credentials = new Credentials(properties.getPublicKey(),
        properties.getSecretKey());
    LOG.info("event=xpresspay.configured baseUrl={} sandbox={} encryptionEnabled={}",
        properties.resolveBaseUrl(), properties.isSandbox(), credentials.hasSecretKey());
    return credentials;
  }

  /**
   * The transport builds its own {@link RestTemplate} from the application's
   * {@link RestTemplateBuilder} (when there is one) and does not publish it as a bean.
   */
  @Bean
  @ConditionalOnMissingBean
  public GatewayTransport xpressPayTransport(ObjectProvider<RestTemplateBuilder> builder,
      XpressPayProperties properties) {
    RestTemplateBuilder timed = builder.getIfAvailable(RestTemplateBuilder::new)
        .setConnectTimeout(properties.getConnectTimeout())
        .setReadTimeout(properties.getReadTimeout());
    return new RestTemplateGatewayTransport(timed, properties.resolveBaseUrl());
  }

  @Bean
  @ConditionalOnMissingBean
  public Clock xpressPayClock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public PayloadCodec payloadCodec() {
    return new PayloadCodec();
  }

  @Bean
  @ConditionalOnMissingBean
  public ResponseClassifier responseClassifier(ObjectProvider<ObjectMapper> objectMapper) {
    return new ResponseClassifier(objectMapper.getIfAvailable(ObjectMapper::new));
  }

  @Bean
  @ConditionalOnMissingBean
  public BankDirectory bankDirectory() {
    return new BankDirectory();
  }

  @Bean
  @ConditionalOnMissingBean
  public PaymentRequestValidator paymentRequestValidator(Clock xpressPayClock,
      BankDirectory bankDirectory) {
    return new PaymentRequestValidator(xpressPayClock, bankDirectory);
  }

  @Bean
  @ConditionalOnMissingBean
  public TransactionStateMachine transactionStateMachine() {
    return new TransactionStateMachine();
  }

  @Bean
  @ConditionalOnMissingBean
  public XpressPayService xpressPayService(Credentials credentials, GatewayTransport transport,
      PayloadCodec codec, ResponseClassifier classifier, PaymentRequestValidator validator,
      TransactionStateMachine stateMachine, BankDirectory bankDirectory) {
    return new XpressPayServiceImpl(credentials, transport, codec, classifier, validator,
        stateMachine, bankDirectory);
  }
}
