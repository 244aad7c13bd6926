package uk.gegc.learnhub.features.purchase.infra.gateway;

import com.razorpay.Order;
import com.razorpay.RazorpayClient;
import com.razorpay.RazorpayException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.json.JSONObject;
import uk.gegc.learnhub.features.purchase.application.GatewayOrder;
import uk.gegc.learnhub.features.purchase.application.OrderRequest;
import uk.gegc.learnhub.features.purchase.application.PaymentGateway;
import uk.gegc.learnhub.features.purchase.domain.exception.PaymentGatewayException;

@Slf4j
@RequiredArgsConstructor
public class RazorpayPaymentGateway implements PaymentGateway {

    private final RazorpayClient client;

    @Override
    public GatewayOrder createOrder(OrderRequest request) {
        JSONObject body = new JSONObject();
        body.put("amount", request.amountMinor());
        body.put("currency", request.currency());
        body.put("receipt", request.receipt());
        body.put("notes", new JSONObject(request.notes()));

        try {
            Order order = client.orders.create(body);
            String orderId = order.get("id");
            Object amount = order.get("amount");
            String currency = order.get("currency");
            log.info("Created Razorpay order {} for receipt {}", orderId, request.receipt());
            return new GatewayOrder(
                    orderId,
                    amount instanceof Number n ? n.longValue() : request.amountMinor(),
                    currency != null ? currency : request.currency()
            );
        } catch (RazorpayException e) {
            log.error("Razorpay order creation failed for receipt {}: {}", request.receipt(), e.getMessage());
            throw new PaymentGatewayException("Failed to create payment order", e);
        }
    }
}
