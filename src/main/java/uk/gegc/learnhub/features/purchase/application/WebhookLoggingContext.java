package uk.gegc.learnhub.features.purchase.application;

import lombok.Builder;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Structured logging fields for one webhook delivery.
 */
@Data
@Builder
public class WebhookLoggingContext {
    private String eventId;
    private String eventType;
    private String orderId;
    private UUID purchaseId;
    private UUID userId;

    public void setMDC() {
        if (eventId != null) MDC.put("gateway_event_id", eventId);
        if (eventType != null) MDC.put("gateway_event_type", eventType);
        if (orderId != null) MDC.put("gateway_order_id", orderId);
        if (purchaseId != null) MDC.put("purchase_id", purchaseId.toString());
        if (userId != null) MDC.put("user_id", userId.toString());
    }

    public static void clearMDC() {
        MDC.remove("gateway_event_id");
        MDC.remove("gateway_event_type");
        MDC.remove("gateway_order_id");
        MDC.remove("purchase_id");
        MDC.remove("user_id");
    }

    public void logInfo(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.info(message, args);
        } finally {
            clearMDC();
        }
    }

    public void logWarn(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.warn(message, args);
        } finally {
            clearMDC();
        }
    }

    public void logError(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.error(message, args);
        } finally {
            clearMDC();
        }
    }
}
