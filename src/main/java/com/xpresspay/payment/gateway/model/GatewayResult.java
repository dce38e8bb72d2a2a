package com.xpresspay.payment.gateway.model;

/**
 * Step-specific fields of a classified reply. One subtype per reply shape:
 * {@link InitializeResult}, {@link PaymentResult} and {@link VerifyResult}.
 */
public abstract class GatewayResult {
}
