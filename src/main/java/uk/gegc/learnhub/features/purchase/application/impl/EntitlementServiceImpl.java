package uk.gegc.learnhub.features.purchase.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.learnhub.features.catalog.application.CatalogItem;
import uk.gegc.learnhub.features.catalog.application.CatalogLookupService;
import uk.gegc.learnhub.features.purchase.application.EntitlementService;
import uk.gegc.learnhub.features.purchase.application.PurchaseMetricsService;
import uk.gegc.learnhub.features.purchase.application.PurchaseProperties;
import uk.gegc.learnhub.features.purchase.domain.model.Purchase;
import uk.gegc.learnhub.features.purchase.domain.model.PurchaseType;
import uk.gegc.learnhub.features.user.domain.model.User;
import uk.gegc.learnhub.features.user.domain.repository.UserRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class EntitlementServiceImpl implements EntitlementService {

    private final CatalogLookupService catalogLookupService;
    private final UserRepository userRepository;
    private final PurchaseProperties purchaseProperties;
    private final PurchaseMetricsService metricsService;
    private final Clock clock;

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean applyFor(Purchase purchase) {
        if (purchase.getPurchaseType() != PurchaseType.COURSE) {
            return false;
        }

        Optional<CatalogItem> course = catalogLookupService.findCourse(purchase.getCourseId());
        if (course.isEmpty()) {
            log.warn("Course {} for purchase {} no longer exists; skipping entitlement",
                    purchase.getCourseId(), purchase.getId());
            return false;
        }
        if (!course.get().premium()) {
            return false;
        }

        Optional<User> buyer = userRepository.findById(purchase.getUserId());
        if (buyer.isEmpty()) {
            log.warn("User {} for purchase {} not found; skipping entitlement", purchase.getUserId(), purchase.getId());
            return false;
        }

        User user = buyer.get();
        Instant expiresAt = ZonedDateTime.now(clock).plus(purchaseProperties.getPremiumDuration()).toInstant();
        // never shorten an existing membership
        if (user.getPremiumExpiresAt() != null && user.getPremiumExpiresAt().isAfter(expiresAt)) {
            expiresAt = user.getPremiumExpiresAt();
        }
        user.setIsPremium(true);
        user.setPremiumExpiresAt(expiresAt);
        userRepository.save(user);

        metricsService.incrementEntitlementGranted();
        log.info("Granted premium to user {} until {} for purchase {}", user.getId(), expiresAt, purchase.getId());
        return true;
    }
}
