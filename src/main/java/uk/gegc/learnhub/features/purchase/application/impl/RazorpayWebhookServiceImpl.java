package uk.gegc.learnhub.features.purchase.application.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import uk.gegc.learnhub.features.purchase.application.PurchaseMetricsService;
import uk.gegc.learnhub.features.purchase.application.PurchaseProperties;
import uk.gegc.learnhub.features.purchase.application.PurchaseTransitionService;
import uk.gegc.learnhub.features.purchase.application.RazorpayWebhookService;
import uk.gegc.learnhub.features.purchase.application.WebhookLoggingContext;
import uk.gegc.learnhub.features.purchase.domain.exception.WebhookPayloadException;
import uk.gegc.learnhub.features.purchase.domain.exception.WebhookSignatureException;
import uk.gegc.learnhub.features.purchase.domain.model.ProcessedGatewayEvent;
import uk.gegc.learnhub.features.purchase.domain.model.Purchase;
import uk.gegc.learnhub.features.purchase.domain.model.PurchaseEvent;
import uk.gegc.learnhub.features.purchase.infra.gateway.PaymentSignatureVerifier;
import uk.gegc.learnhub.features.purchase.infra.repository.ProcessedGatewayEventRepository;
import uk.gegc.learnhub.features.purchase.infra.repository.PurchaseRepository;

import java.io.IOException;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class RazorpayWebhookServiceImpl implements RazorpayWebhookService {

    static final String PAYMENT_CAPTURED = "payment.captured";
    static final String PAYMENT_FAILED = "payment.failed";
    static final String ORDER_PAID = "order.paid";

    private final PaymentSignatureVerifier signatureVerifier;
    private final PurchaseProperties purchaseProperties;
    private final PurchaseRepository purchaseRepository;
    private final ProcessedGatewayEventRepository processedEventRepository;
    private final PurchaseTransitionService transitionService;
    private final PurchaseMetricsService metricsService;
    private final ObjectMapper objectMapper;

    @Override
    public Result process(byte[] payload, String signatureHeader, String eventIdHeader) {
        long startTime = System.currentTimeMillis();

        verifySignature(payload, signatureHeader);
        JsonNode event = parse(payload);
        String type = event.path("event").asText("");

        metricsService.incrementWebhookReceived(type);

        WebhookLoggingContext loggingContext = WebhookLoggingContext.builder()
                .eventId(eventIdHeader)
                .eventType(type)
                .build();
        loggingContext.logInfo(log, "Processing Razorpay webhook event: id={} type={}", eventIdHeader, type);

        try {
            if (StringUtils.hasText(eventIdHeader) && processedEventRepository.existsByEventId(eventIdHeader)) {
                loggingContext.logInfo(log, "Duplicate Razorpay event received; id={} type={}", eventIdHeader, type);
                metricsService.incrementWebhookDuplicate(type);
                return Result.DUPLICATE;
            }

            Result result = routeEvent(event, type, loggingContext);
            if (result != Result.IGNORED && !markProcessed(eventIdHeader, type)) {
                loggingContext.logInfo(log, "Razorpay event {} was recorded concurrently", eventIdHeader);
            }

            switch (result) {
                case OK -> metricsService.incrementWebhookOk(type);
                case IGNORED -> metricsService.incrementWebhookIgnored(type);
                case DUPLICATE -> metricsService.incrementWebhookDuplicate(type);
            }
            metricsService.recordWebhookLatency(type, System.currentTimeMillis() - startTime);
            return result;
        } catch (WebhookPayloadException e) {
            metricsService.incrementWebhookFailed(type);
            loggingContext.logWarn(log, "Malformed Razorpay event: id={} type={} reason={}", eventIdHeader, type, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metricsService.incrementWebhookFailed(type);
            loggingContext.logError(log, "Failed to process webhook event: id={} type={}", eventIdHeader, type, e);
            // rethrown so the controller answers 500 and Razorpay retries
            throw e;
        } finally {
            WebhookLoggingContext.clearMDC();
        }
    }

    private void verifySignature(byte[] payload, String signatureHeader) {
        if (!StringUtils.hasText(signatureHeader)) {
            throw new WebhookSignatureException("Missing webhook signature");
        }
        if (!signatureVerifier.hasWebhookSecret()) {
            if (purchaseProperties.isStrictMode()) {
                log.error("Razorpay webhook secret not configured; rejecting webhook in strict mode");
                throw new WebhookSignatureException("Webhook signature cannot be verified");
            }
            log.warn("Razorpay webhook secret not configured; skipping signature verification");
            return;
        }
        if (!signatureVerifier.isWebhookSignatureValid(payload, signatureHeader)) {
            log.warn("Razorpay webhook signature verification failed");
            throw new WebhookSignatureException("Invalid webhook signature");
        }
    }

    private JsonNode parse(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new WebhookPayloadException("Webhook payload is empty");
        }
        try {
            JsonNode node = objectMapper.readTree(payload);
            if (node == null || !node.isObject()) {
                throw new WebhookPayloadException("Webhook payload must be a JSON object");
            }
            return node;
        } catch (IOException e) {
            throw new WebhookPayloadException("Webhook payload is not valid JSON", e);
        }
    }

    private Result routeEvent(JsonNode event, String type, WebhookLoggingContext loggingContext) {
        switch (type) {
            case PAYMENT_CAPTURED: {
                JsonNode payment = entity(event, "payment");
                String orderId = requiredText(payment, "order_id");
                String paymentId = requiredText(payment, "id");
                return applyToOrder(orderId, PurchaseEvent.PAYMENT_CAPTURED, paymentId, loggingContext);
            }
            case PAYMENT_FAILED: {
                JsonNode payment = entity(event, "payment");
                String orderId = requiredText(payment, "order_id");
                return applyToOrder(orderId, PurchaseEvent.PAYMENT_FAILED, null, loggingContext);
            }
            case ORDER_PAID: {
                JsonNode order = entity(event, "order");
                String orderId = requiredText(order, "id");
                return applyToOrder(orderId, PurchaseEvent.ORDER_PAID, null, loggingContext);
            }
            default:
                loggingContext.logInfo(log, "Ignoring Razorpay event type={} (not handled)", type);
                return Result.IGNORED;
        }
    }

    private Result applyToOrder(String orderId, PurchaseEvent purchaseEvent, String paymentId,
                                WebhookLoggingContext loggingContext) {
        loggingContext.setOrderId(orderId);
        Optional<Purchase> found = purchaseRepository.findByGatewayOrderId(orderId);
        if (found.isEmpty()) {
            loggingContext.logWarn(log, "No purchase for Razorpay order {}; acknowledging", orderId);
            return Result.OK;
        }

        Purchase purchase = found.get();
        loggingContext.setPurchaseId(purchase.getId());
        loggingContext.setUserId(purchase.getUserId());

        boolean applied = transitionService.apply(purchase, purchaseEvent, paymentId, null);
        if (applied) {
            loggingContext.logInfo(log, "Applied {} to purchase {}", purchaseEvent, purchase.getId());
        } else {
            loggingContext.logInfo(log, "{} left purchase {} unchanged", purchaseEvent, purchase.getId());
        }
        return Result.OK;
    }

    private boolean markProcessed(String eventId, String type) {
        if (!StringUtils.hasText(eventId)) {
            return true;
        }
        try {
            processedEventRepository.saveAndFlush(new ProcessedGatewayEvent(eventId, type));
            return true;
        } catch (DataIntegrityViolationException e) {
            return false;
        }
    }

    private static JsonNode entity(JsonNode event, String kind) {
        JsonNode entity = event.path("payload").path(kind).path("entity");
        if (!entity.isObject()) {
            throw new WebhookPayloadException("Missing payload." + kind + ".entity");
        }
        return entity;
    }

    private static String requiredText(JsonNode node, String field) {
        String value = node.path(field).asText(null);
        if (!StringUtils.hasText(value)) {
            throw new WebhookPayloadException("Missing " + field + " in webhook entity");
        }
        return value;
    }
}
