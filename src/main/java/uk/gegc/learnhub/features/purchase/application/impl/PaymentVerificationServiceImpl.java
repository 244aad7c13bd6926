package uk.gegc.learnhub.features.purchase.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.learnhub.features.purchase.api.dto.VerifyPaymentRequest;
import uk.gegc.learnhub.features.purchase.api.dto.VerifyPaymentResponse;
import uk.gegc.learnhub.features.purchase.application.PaymentVerificationService;
import uk.gegc.learnhub.features.purchase.application.PurchaseMetricsService;
import uk.gegc.learnhub.features.purchase.application.PurchaseTransitionService;
import uk.gegc.learnhub.features.purchase.domain.exception.InvalidPaymentSignatureException;
import uk.gegc.learnhub.features.purchase.domain.exception.PaymentAlreadyVerifiedException;
import uk.gegc.learnhub.features.purchase.domain.exception.PurchaseNotPendingException;
import uk.gegc.learnhub.features.purchase.domain.model.Purchase;
import uk.gegc.learnhub.features.purchase.domain.model.PurchaseEvent;
import uk.gegc.learnhub.features.purchase.domain.model.PurchaseStatus;
import uk.gegc.learnhub.features.purchase.infra.gateway.PaymentSignatureVerifier;
import uk.gegc.learnhub.features.purchase.infra.mapping.PurchaseMapper;
import uk.gegc.learnhub.features.purchase.infra.repository.PurchaseRepository;
import uk.gegc.learnhub.shared.exception.ResourceNotFoundException;

import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentVerificationServiceImpl implements PaymentVerificationService {

    private final PurchaseRepository purchaseRepository;
    private final PaymentSignatureVerifier signatureVerifier;
    private final PurchaseTransitionService transitionService;
    private final PurchaseMetricsService metricsService;
    private final PurchaseMapper purchaseMapper;

    @Override
    public VerifyPaymentResponse verify(UUID userId, VerifyPaymentRequest request) {
        Purchase purchase = findOwned(request.orderId(), userId);
        rejectIfNotPending(purchase);

        if (!signatureVerifier.isPaymentSignatureValid(request.orderId(), request.paymentId(), request.signature())) {
            transitionService.apply(purchase, PurchaseEvent.PAYMENT_FAILED, null, null);
            metricsService.incrementVerifyFailed();
            log.warn("Invalid payment signature for purchase {} order {}", purchase.getId(), request.orderId());
            throw new InvalidPaymentSignatureException("Invalid payment signature");
        }

        boolean won = transitionService.apply(purchase, PurchaseEvent.PAYMENT_CAPTURED,
                request.paymentId(), request.signature());
        Purchase current = findOwned(request.orderId(), userId);
        if (!won) {
            // a webhook or a parallel verify moved the purchase first
            rejectIfNotPending(current);
            throw new PurchaseNotPendingException("Purchase is no longer pending");
        }

        metricsService.incrementVerifyOk();
        log.info("Payment verified for purchase {} order {}", current.getId(), request.orderId());
        return new VerifyPaymentResponse(purchaseMapper.toDto(current), true);
    }

    private Purchase findOwned(String orderId, UUID userId) {
        return purchaseRepository.findByGatewayOrderIdAndUserId(orderId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Purchase not found"));
    }

    private void rejectIfNotPending(Purchase purchase) {
        if (purchase.getStatus() == PurchaseStatus.PENDING) {
            return;
        }
        metricsService.incrementVerifyConflict();
        if (purchase.getStatus() == PurchaseStatus.COMPLETED) {
            throw new PaymentAlreadyVerifiedException("Payment already verified");
        }
        throw new PurchaseNotPendingException("Purchase is no longer pending");
    }
}
