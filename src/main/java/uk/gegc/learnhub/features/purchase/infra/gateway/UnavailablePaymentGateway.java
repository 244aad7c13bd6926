package uk.gegc.learnhub.features.purchase.infra.gateway;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.learnhub.features.purchase.application.GatewayOrder;
import uk.gegc.learnhub.features.purchase.application.OrderRequest;
import uk.gegc.learnhub.features.purchase.application.PaymentGateway;
import uk.gegc.learnhub.features.purchase.domain.exception.PaymentGatewayException;

/**
 * Strict-mode gateway when Razorpay keys are missing: every checkout fails instead of
 * silently handing out mock orders.
 */
@Slf4j
public class UnavailablePaymentGateway implements PaymentGateway {

    @Override
    public GatewayOrder createOrder(OrderRequest request) {
        log.error("Checkout attempted but Razorpay keys are not configured (receipt {})", request.receipt());
        throw new PaymentGatewayException("Payment gateway is not configured");
    }
}
