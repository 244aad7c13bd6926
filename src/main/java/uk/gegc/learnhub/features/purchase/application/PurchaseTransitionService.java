package uk.gegc.learnhub.features.purchase.application;

import uk.gegc.learnhub.features.purchase.domain.model.Purchase;
import uk.gegc.learnhub.features.purchase.domain.model.PurchaseEvent;

/**
 * The one place purchase status changes are written. Client verification and webhooks
 * both call it, so two deliveries of the same outcome race on a single conditional update.
 */
public interface PurchaseTransitionService {

    /**
     * Applies {@code event} to the purchase if its current status allows it.
     *
     * @param paymentId gateway payment id to record on completion, may be null
     * @param signature client signature to record on completion, may be null
     * @return true when this call performed the transition; false when the event was a
     * no-op for the status or another writer changed the row first
     */
    boolean apply(Purchase purchase, PurchaseEvent event, String paymentId, String signature);
}
