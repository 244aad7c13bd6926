package uk.gegc.learnhub.features.purchase.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import uk.gegc.learnhub.features.catalog.application.CatalogItem;
import uk.gegc.learnhub.features.catalog.application.CatalogLookupService;
import uk.gegc.learnhub.features.purchase.api.dto.CheckoutResponse;
import uk.gegc.learnhub.features.purchase.api.dto.CreateCheckoutRequest;
import uk.gegc.learnhub.features.purchase.application.CheckoutService;
import uk.gegc.learnhub.features.purchase.application.GatewayOrder;
import uk.gegc.learnhub.features.purchase.application.OrderRequest;
import uk.gegc.learnhub.features.purchase.application.PaymentGateway;
import uk.gegc.learnhub.features.purchase.application.PurchaseMetricsService;
import uk.gegc.learnhub.features.purchase.application.PurchaseProperties;
import uk.gegc.learnhub.features.purchase.application.RazorpayProperties;
import uk.gegc.learnhub.features.purchase.domain.exception.InvalidPurchaseException;
import uk.gegc.learnhub.features.purchase.domain.model.Purchase;
import uk.gegc.learnhub.features.purchase.domain.model.PurchaseStatus;
import uk.gegc.learnhub.features.purchase.domain.model.PurchaseType;
import uk.gegc.learnhub.features.purchase.infra.repository.PurchaseRepository;
import uk.gegc.learnhub.features.user.domain.repository.UserRepository;
import uk.gegc.learnhub.shared.exception.ResourceNotFoundException;
import uk.gegc.learnhub.shared.exception.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Not transactional: the pending row is committed before the gateway is called, so a
 * gateway failure leaves an orphaned pending purchase rather than a lost one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CheckoutServiceImpl implements CheckoutService {

    private static final BigDecimal MINOR_UNITS = BigDecimal.valueOf(100);

    private final CatalogLookupService catalogLookupService;
    private final UserRepository userRepository;
    private final PurchaseRepository purchaseRepository;
    private final PaymentGateway paymentGateway;
    private final PurchaseProperties purchaseProperties;
    private final RazorpayProperties razorpayProperties;
    private final PurchaseMetricsService metricsService;
    private final Clock clock;

    @Override
    public CheckoutResponse createCheckout(UUID userId, CreateCheckoutRequest request) {
        PurchaseType purchaseType = parseType(request.purchaseType());
        CatalogItem item = resolveItem(purchaseType, request);

        if (item.price() == null || item.price().signum() <= 0) {
            throw new InvalidPurchaseException("Item price must be greater than 0");
        }
        if (!userRepository.existsById(userId)) {
            throw new ResourceNotFoundException("User not found");
        }

        Purchase purchase = purchaseRepository.save(newPendingPurchase(userId, purchaseType, item));

        OrderRequest orderRequest = new OrderRequest(
                toMinorUnits(purchase.getAmount()),
                purchase.getCurrency(),
                receiptFor(purchase.getId()),
                orderNotes(purchase, item)
        );
        GatewayOrder order = paymentGateway.createOrder(orderRequest);

        purchaseRepository.attachGatewayOrder(purchase.getId(), order.id(), Instant.now(clock));
        metricsService.incrementCheckoutCreated(purchaseType.getValue());
        log.info("Checkout created: purchase={} order={} user={} amountMinor={}",
                purchase.getId(), order.id(), userId, order.amountMinor());

        return new CheckoutResponse(
                order.id(),
                order.amountMinor(),
                order.currency(),
                razorpayProperties.getKeyId(),
                purchase.getId(),
                StringUtils.hasText(request.successUrl()) ? request.successUrl() : purchaseProperties.getDefaultSuccessUrl(),
                StringUtils.hasText(request.cancelUrl()) ? request.cancelUrl() : purchaseProperties.getDefaultCancelUrl()
        );
    }

    /**
     * Rounds half-up to whole minor units, so 99.99 becomes 9999.
     */
    static long toMinorUnits(BigDecimal amount) {
        return amount.multiply(MINOR_UNITS).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    static String receiptFor(UUID purchaseId) {
        return "rcpt_" + purchaseId.toString().replace("-", "");
    }

    private PurchaseType parseType(String rawType) {
        try {
            PurchaseType type = PurchaseType.fromValue(rawType);
            if (type == null) {
                throw new ValidationException("purchaseType is required");
            }
            return type;
        } catch (IllegalArgumentException e) {
            throw new ValidationException("purchaseType must be 'service' or 'course'");
        }
    }

    private CatalogItem resolveItem(PurchaseType type, CreateCheckoutRequest request) {
        if (type == PurchaseType.SERVICE) {
            if (request.serviceId() == null) {
                throw new ValidationException("serviceId is required for service purchases");
            }
            return catalogLookupService.findService(request.serviceId())
                    .orElseThrow(() -> new ResourceNotFoundException("Service not found"));
        }
        if (request.courseId() == null) {
            throw new ValidationException("courseId is required for course purchases");
        }
        return catalogLookupService.findCourse(request.courseId())
                .orElseThrow(() -> new ResourceNotFoundException("Course not found"));
    }

    private Purchase newPendingPurchase(UUID userId, PurchaseType type, CatalogItem item) {
        Purchase purchase = new Purchase();
        purchase.setUserId(userId);
        purchase.setPurchaseType(type);
        if (type == PurchaseType.SERVICE) {
            purchase.setServiceId(item.id());
        } else {
            purchase.setCourseId(item.id());
        }
        purchase.setAmount(item.price());
        purchase.setOriginalAmount(item.price());
        purchase.setCurrency(purchaseProperties.getCurrency().toUpperCase(Locale.ROOT));
        purchase.setStatus(PurchaseStatus.PENDING);

        Map<String, String> metadata = new HashMap<>();
        metadata.put("itemName", item.name());
        metadata.put("itemDescription", item.description() != null ? item.description() : "");
        metadata.put("userId", userId.toString());
        purchase.setMetadata(metadata);
        return purchase;
    }

    private Map<String, String> orderNotes(Purchase purchase, CatalogItem item) {
        Map<String, String> notes = new LinkedHashMap<>();
        notes.put("purchaseId", purchase.getId().toString());
        notes.put("userId", purchase.getUserId().toString());
        notes.put("purchaseType", purchase.getPurchaseType().getValue());
        notes.put("serviceId", purchase.getServiceId() != null ? purchase.getServiceId().toString() : "");
        notes.put("courseId", purchase.getCourseId() != null ? purchase.getCourseId().toString() : "");
        notes.put("itemName", item.name());
        return notes;
    }
}
