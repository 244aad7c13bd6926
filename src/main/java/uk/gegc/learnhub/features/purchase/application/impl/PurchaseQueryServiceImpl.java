package uk.gegc.learnhub.features.purchase.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.learnhub.features.purchase.api.dto.PurchaseDto;
import uk.gegc.learnhub.features.purchase.api.dto.PurchaseStatusResponse;
import uk.gegc.learnhub.features.purchase.application.PurchaseQueryService;
import uk.gegc.learnhub.features.purchase.domain.model.PurchaseStatus;
import uk.gegc.learnhub.features.purchase.domain.model.PurchaseType;
import uk.gegc.learnhub.features.purchase.infra.mapping.PurchaseMapper;
import uk.gegc.learnhub.features.purchase.infra.repository.PurchaseRepository;
import uk.gegc.learnhub.shared.exception.ResourceNotFoundException;

import java.util.UUID;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class PurchaseQueryServiceImpl implements PurchaseQueryService {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt");

    private final PurchaseRepository purchaseRepository;
    private final PurchaseMapper purchaseMapper;

    @Override
    public PurchaseStatusResponse getStatusByOrderId(UUID userId, String orderId) {
        return purchaseRepository.findByGatewayOrderIdAndUserId(orderId, userId)
                .map(purchaseMapper::toStatusResponse)
                .orElseThrow(() -> new ResourceNotFoundException("Purchase not found"));
    }

    @Override
    public Page<PurchaseDto> getHistory(UUID userId, PurchaseStatus status, PurchaseType purchaseType, Pageable pageable) {
        // history is always newest first; client sort parameters are ignored
        Pageable newestFirst = PageRequest.of(pageable.getPageNumber(), pageable.getPageSize(), NEWEST_FIRST);
        return purchaseRepository.findHistory(userId, status, purchaseType, newestFirst)
                .map(purchaseMapper::toDto);
    }

    @Override
    public PurchaseDto getById(UUID userId, UUID purchaseId) {
        return purchaseRepository.findByIdAndUserId(purchaseId, userId)
                .map(purchaseMapper::toDto)
                .orElseThrow(() -> new ResourceNotFoundException("Purchase not found"));
    }
}
