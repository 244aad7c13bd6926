package uk.gegc.learnhub.features.purchase.domain.exception;

/**
 * Failure talking to, or configuring, the payment gateway. Surfaces as 500 with a generic detail.
 */
public class PaymentGatewayException extends RuntimeException {
    public PaymentGatewayException(String message) {
        super(message);
    }

    public PaymentGatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
