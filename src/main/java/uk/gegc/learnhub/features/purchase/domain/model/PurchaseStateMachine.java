package uk.gegc.learnhub.features.purchase.domain.model;

import java.util.Optional;

/**
 * Transition table for purchases:
 * <pre>
 *   PENDING   --PAYMENT_CAPTURED / ORDER_PAID--> COMPLETED
 *   PENDING   --PAYMENT_FAILED-----------------> FAILED
 *   COMPLETED --REFUND_ISSUED------------------> REFUNDED
 * </pre>
 * Every other pair is a no-op, reported as an empty result.
 */
public final class PurchaseStateMachine {

    private PurchaseStateMachine() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static Optional<PurchaseStatus> next(PurchaseStatus current, PurchaseEvent event) {
        if (current == null || event == null) {
            return Optional.empty();
        }
        return switch (current) {
            case PENDING -> switch (event) {
                case PAYMENT_CAPTURED, ORDER_PAID -> Optional.of(PurchaseStatus.COMPLETED);
                case PAYMENT_FAILED -> Optional.of(PurchaseStatus.FAILED);
                case REFUND_ISSUED -> Optional.empty();
            };
            case COMPLETED -> event == PurchaseEvent.REFUND_ISSUED
                    ? Optional.of(PurchaseStatus.REFUNDED)
                    : Optional.empty();
            case FAILED, REFUNDED -> Optional.empty();
        };
    }
}
