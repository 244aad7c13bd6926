package uk.gegc.learnhub.features.purchase.application;

/**
 * Counters and timers for the purchase flow.
 */
public interface PurchaseMetricsService {

    void incrementCheckoutCreated(String purchaseType);

    /**
     * Client-side verification outcomes.
     */
    void incrementVerifyOk();
    void incrementVerifyFailed();
    void incrementVerifyConflict();

    /**
     * Webhook counters.
     */
    void incrementWebhookReceived(String eventType);
    void incrementWebhookOk(String eventType);
    void incrementWebhookIgnored(String eventType);
    void incrementWebhookDuplicate(String eventType);
    void incrementWebhookFailed(String eventType);

    void recordWebhookLatency(String eventType, long latencyMs);

    void incrementEntitlementGranted();
}
