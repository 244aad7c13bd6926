package uk.gegc.learnhub.features.purchase.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.learnhub.features.purchase.domain.model.PurchaseStatus;
import uk.gegc.learnhub.features.purchase.domain.model.PurchaseType;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Schema(name = "PurchaseDto")
public record PurchaseDto(
        UUID id,
        UUID userId,
        PurchaseType purchaseType,
        UUID serviceId,
        UUID courseId,
        BigDecimal amount,
        BigDecimal originalAmount,
        BigDecimal discountAmount,
        String couponCode,
        String currency,
        PurchaseStatus status,
        String gatewayOrderId,
        String gatewayPaymentId,
        Instant completedAt,
        Instant refundedAt,
        Map<String, String> metadata,
        Instant createdAt,
        Instant updatedAt
) {}
