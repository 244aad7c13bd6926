package uk.gegc.learnhub.features.purchase.api;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import uk.gegc.learnhub.features.purchase.domain.exception.InvalidPaymentSignatureException;
import uk.gegc.learnhub.features.purchase.domain.exception.InvalidPurchaseException;
import uk.gegc.learnhub.features.purchase.domain.exception.PaymentAlreadyVerifiedException;
import uk.gegc.learnhub.features.purchase.domain.exception.PaymentGatewayException;
import uk.gegc.learnhub.features.purchase.domain.exception.PurchaseNotPendingException;
import uk.gegc.learnhub.features.purchase.domain.exception.WebhookPayloadException;
import uk.gegc.learnhub.features.purchase.domain.exception.WebhookSignatureException;
import uk.gegc.learnhub.shared.api.problem.ErrorTypes;
import uk.gegc.learnhub.shared.api.problem.ProblemDetailBuilder;

/**
 * Maps purchase domain exceptions to RFC 7807 Problem Detail responses.
 * Ordered ahead of the global handler so its catch-all does not claim these first.
 */
@Slf4j
@Order(Ordered.HIGHEST_PRECEDENCE)
@RestControllerAdvice(basePackages = "uk.gegc.learnhub.features.purchase.api")
public class PurchaseErrorHandler {

    @ExceptionHandler(InvalidPurchaseException.class)
    public ResponseEntity<ProblemDetail> handleInvalidPurchase(InvalidPurchaseException ex, HttpServletRequest request) {
        log.warn("Invalid purchase: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.INVALID_PURCHASE,
                "Invalid Purchase",
                ex.getMessage(),
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(PaymentAlreadyVerifiedException.class)
    public ResponseEntity<ProblemDetail> handleAlreadyVerified(PaymentAlreadyVerifiedException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.CONFLICT,
                ErrorTypes.PAYMENT_ALREADY_VERIFIED,
                "Payment Already Verified",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
    }

    @ExceptionHandler(PurchaseNotPendingException.class)
    public ResponseEntity<ProblemDetail> handleNotPending(PurchaseNotPendingException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.CONFLICT,
                ErrorTypes.PURCHASE_NOT_PENDING,
                "Purchase Not Pending",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
    }

    @ExceptionHandler(InvalidPaymentSignatureException.class)
    public ResponseEntity<ProblemDetail> handleInvalidPaymentSignature(InvalidPaymentSignatureException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.INVALID_PAYMENT_SIGNATURE,
                "Invalid Payment Signature",
                ex.getMessage(),
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(WebhookSignatureException.class)
    public ResponseEntity<ProblemDetail> handleWebhookSignature(WebhookSignatureException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.WEBHOOK_INVALID_SIGNATURE,
                "Webhook Invalid Signature",
                ex.getMessage(),
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(WebhookPayloadException.class)
    public ResponseEntity<ProblemDetail> handleWebhookPayload(WebhookPayloadException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.WEBHOOK_MALFORMED_PAYLOAD,
                "Malformed Webhook Payload",
                ex.getMessage(),
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(PaymentGatewayException.class)
    public ResponseEntity<ProblemDetail> handlePaymentGateway(PaymentGatewayException ex, HttpServletRequest request) {
        log.error("Payment gateway error: {}", ex.getMessage(), ex);
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorTypes.PAYMENT_GATEWAY_ERROR,
                "Payment Gateway Error",
                "The payment provider could not process the request",
                request
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }
}
