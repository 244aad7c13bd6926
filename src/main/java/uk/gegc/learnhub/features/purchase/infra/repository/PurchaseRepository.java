package uk.gegc.learnhub.features.purchase.infra.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.learnhub.features.purchase.domain.model.Purchase;
import uk.gegc.learnhub.features.purchase.domain.model.PurchaseStatus;
import uk.gegc.learnhub.features.purchase.domain.model.PurchaseType;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Status changes are conditional updates keyed on the expected current status. A return
 * value of 1 means the caller performed the transition; 0 means another writer got there
 * first or the purchase was never in the expected state.
 */
@Repository
public interface PurchaseRepository extends JpaRepository<Purchase, UUID> {

    Optional<Purchase> findByGatewayOrderId(String gatewayOrderId);

    Optional<Purchase> findByGatewayOrderIdAndUserId(String gatewayOrderId, UUID userId);

    Optional<Purchase> findByIdAndUserId(UUID id, UUID userId);

    @Query("""
            SELECT p FROM Purchase p
            WHERE p.userId = :userId
              AND (:status IS NULL OR p.status = :status)
              AND (:purchaseType IS NULL OR p.purchaseType = :purchaseType)
            """)
    Page<Purchase> findHistory(@Param("userId") UUID userId,
                               @Param("status") PurchaseStatus status,
                               @Param("purchaseType") PurchaseType purchaseType,
                               Pageable pageable);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Purchase p
               SET p.status = :target,
                   p.gatewayPaymentId = COALESCE(:paymentId, p.gatewayPaymentId),
                   p.gatewaySignature = COALESCE(:signature, p.gatewaySignature),
                   p.completedAt = :now,
                   p.updatedAt = :now
             WHERE p.id = :id AND p.status = :expected
            """)
    int completeIfStatus(@Param("id") UUID id,
                         @Param("expected") PurchaseStatus expected,
                         @Param("target") PurchaseStatus target,
                         @Param("paymentId") String paymentId,
                         @Param("signature") String signature,
                         @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Purchase p SET p.status = :target, p.updatedAt = :now WHERE p.id = :id AND p.status = :expected")
    int updateStatusIfCurrent(@Param("id") UUID id,
                              @Param("expected") PurchaseStatus expected,
                              @Param("target") PurchaseStatus target,
                              @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Purchase p SET p.status = :target, p.refundedAt = :now, p.updatedAt = :now WHERE p.id = :id AND p.status = :expected")
    int refundIfStatus(@Param("id") UUID id,
                       @Param("expected") PurchaseStatus expected,
                       @Param("target") PurchaseStatus target,
                       @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Purchase p SET p.gatewayOrderId = :orderId, p.updatedAt = :now WHERE p.id = :id AND p.gatewayOrderId IS NULL")
    int attachGatewayOrder(@Param("id") UUID id,
                           @Param("orderId") String orderId,
                           @Param("now") Instant now);
}
