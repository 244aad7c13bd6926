package uk.gegc.learnhub.features.purchase.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.learnhub.features.purchase.domain.model.PurchaseStatus;

import java.math.BigDecimal;

@Schema(name = "PurchaseStatusResponse", description = "Current state of the purchase behind a Razorpay order")
public record PurchaseStatusResponse(
        String orderId,
        PurchaseStatus status,
        @Schema(description = "Amount in major currency units", example = "99.99")
        BigDecimal amount,
        String currency
) {}
