package uk.gegc.learnhub.features.purchase.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(name = "CheckoutResponse", description = "Everything the client needs to open Razorpay Checkout")
public record CheckoutResponse(
        @Schema(description = "Razorpay order id", example = "order_NZ3fFk1WqWpA8x")
        String orderId,

        @Schema(description = "Amount in minor currency units (paise)", example = "9999")
        long amount,

        @Schema(description = "Currency code", example = "INR")
        String currency,

        @Schema(description = "Public Razorpay key id for the checkout widget")
        String keyId,

        @Schema(description = "Pending purchase id")
        UUID purchaseId,

        String successUrl,

        String cancelUrl
) {}
