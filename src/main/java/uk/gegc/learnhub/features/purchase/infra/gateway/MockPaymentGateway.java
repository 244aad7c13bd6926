package uk.gegc.learnhub.features.purchase.infra.gateway;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.learnhub.features.purchase.application.GatewayOrder;
import uk.gegc.learnhub.features.purchase.application.OrderRequest;
import uk.gegc.learnhub.features.purchase.application.PaymentGateway;

/**
 * Development stand-in used when no Razorpay keys are configured. Order ids are derived
 * from the receipt so they stay unique per purchase.
 */
@Slf4j
public class MockPaymentGateway implements PaymentGateway {

    static final String ORDER_PREFIX = "order_mock_";

    @Override
    public GatewayOrder createOrder(OrderRequest request) {
        String receipt = request.receipt();
        String suffix = receipt.substring(receipt.indexOf('_') + 1);
        String orderId = ORDER_PREFIX + suffix;
        log.warn("Razorpay not configured, issuing mock order {}", orderId);
        return new GatewayOrder(orderId, request.amountMinor(), request.currency());
    }
}
