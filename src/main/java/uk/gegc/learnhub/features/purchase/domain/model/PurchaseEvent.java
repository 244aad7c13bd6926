package uk.gegc.learnhub.features.purchase.domain.model;

/**
 * Inputs that can move a purchase between states. Client verification and gateway
 * webhooks both map onto these.
 */
public enum PurchaseEvent {
    /** Client-side verification succeeded or the gateway reported a captured payment. */
    PAYMENT_CAPTURED,
    /** Gateway reported the whole order as paid. */
    ORDER_PAID,
    /** Client signature mismatch or gateway-reported failure. */
    PAYMENT_FAILED,
    REFUND_ISSUED
}
