package uk.gegc.learnhub.features.purchase.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.learnhub.features.purchase.application.EntitlementService;
import uk.gegc.learnhub.features.purchase.application.PurchaseTransitionService;
import uk.gegc.learnhub.features.purchase.domain.model.Purchase;
import uk.gegc.learnhub.features.purchase.domain.model.PurchaseEvent;
import uk.gegc.learnhub.features.purchase.domain.model.PurchaseStateMachine;
import uk.gegc.learnhub.features.purchase.domain.model.PurchaseStatus;
import uk.gegc.learnhub.features.purchase.infra.repository.PurchaseRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class PurchaseTransitionServiceImpl implements PurchaseTransitionService {

    private final PurchaseRepository purchaseRepository;
    private final EntitlementService entitlementService;
    private final Clock clock;

    @Override
    public boolean apply(Purchase purchase, PurchaseEvent event, String paymentId, String signature) {
        PurchaseStatus current = purchase.getStatus();
        Optional<PurchaseStatus> next = PurchaseStateMachine.next(current, event);
        if (next.isEmpty()) {
            log.info("Event {} is a no-op for purchase {} in status {}", event, purchase.getId(), current);
            return false;
        }

        PurchaseStatus target = next.get();
        Instant now = Instant.now(clock);
        int updated = switch (target) {
            case COMPLETED -> purchaseRepository.completeIfStatus(purchase.getId(), current, target, paymentId, signature, now);
            case REFUNDED -> purchaseRepository.refundIfStatus(purchase.getId(), current, target, now);
            default -> purchaseRepository.updateStatusIfCurrent(purchase.getId(), current, target, now);
        };

        if (updated == 0) {
            log.info("Purchase {} left status {} before {} could be applied", purchase.getId(), current, event);
            return false;
        }

        log.info("Purchase {} moved {} -> {} on {}", purchase.getId(), current, target, event);
        if (target == PurchaseStatus.COMPLETED) {
            grantEntitlement(purchase);
        }
        return true;
    }

    private void grantEntitlement(Purchase purchase) {
        try {
            entitlementService.applyFor(purchase);
        } catch (RuntimeException e) {
            // completion is already committed and stays
            log.error("Entitlement failed for completed purchase {}: {}", purchase.getId(), e.getMessage(), e);
        }
    }
}
