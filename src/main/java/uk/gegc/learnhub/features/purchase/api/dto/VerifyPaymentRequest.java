package uk.gegc.learnhub.features.purchase.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

/**
 * Payment confirmation returned to the client by Razorpay Checkout. Accepts both the
 * camelCase names and Razorpay's own {@code razorpay_*} field names.
 */
@Schema(name = "VerifyPaymentRequest", description = "Razorpay payment confirmation to verify")
public record VerifyPaymentRequest(
        @Schema(description = "Razorpay order id", example = "order_NZ3fFk1WqWpA8x")
        @JsonAlias("razorpay_order_id")
        @NotBlank(message = "Missing payment verification data")
        String orderId,

        @Schema(description = "Razorpay payment id", example = "pay_NZ3gQ0oYtqZ9sV")
        @JsonAlias("razorpay_payment_id")
        @NotBlank(message = "Missing payment verification data")
        String paymentId,

        @Schema(description = "Hex HMAC-SHA256 of orderId|paymentId")
        @JsonAlias("razorpay_signature")
        @NotBlank(message = "Missing payment verification data")
        String signature
) {}
