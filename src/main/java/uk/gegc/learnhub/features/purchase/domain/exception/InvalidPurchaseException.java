package uk.gegc.learnhub.features.purchase.domain.exception;

/**
 * Raised when a catalog item cannot be sold, e.g. a non-positive price.
 */
public class InvalidPurchaseException extends RuntimeException {
    public InvalidPurchaseException(String message) {
        super(message);
    }
}
