package uk.gegc.learnhub.features.purchase.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "VerifyPaymentResponse")
public record VerifyPaymentResponse(
        PurchaseDto purchase,
        @Schema(example = "true")
        boolean verified
) {}
