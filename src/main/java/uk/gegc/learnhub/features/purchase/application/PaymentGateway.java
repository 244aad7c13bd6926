package uk.gegc.learnhub.features.purchase.application;

import uk.gegc.learnhub.features.purchase.domain.exception.PaymentGatewayException;

/**
 * Creates payable orders at the payment gateway.
 */
public interface PaymentGateway {

    /**
     * @throws PaymentGatewayException when the gateway rejects the request or cannot be reached
     */
    GatewayOrder createOrder(OrderRequest request);
}
