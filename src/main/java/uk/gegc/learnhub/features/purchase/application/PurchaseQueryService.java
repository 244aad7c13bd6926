package uk.gegc.learnhub.features.purchase.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.learnhub.features.purchase.api.dto.PurchaseDto;
import uk.gegc.learnhub.features.purchase.api.dto.PurchaseStatusResponse;
import uk.gegc.learnhub.features.purchase.domain.model.PurchaseStatus;
import uk.gegc.learnhub.features.purchase.domain.model.PurchaseType;

import java.util.UUID;

/**
 * Read side of the purchase ledger. Every lookup is scoped to the calling user.
 */
public interface PurchaseQueryService {

    PurchaseStatusResponse getStatusByOrderId(UUID userId, String orderId);

    Page<PurchaseDto> getHistory(UUID userId, PurchaseStatus status, PurchaseType purchaseType, Pageable pageable);

    PurchaseDto getById(UUID userId, UUID purchaseId);
}
