package uk.gegc.learnhub.features.purchase.infra.repository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import uk.gegc.learnhub.features.purchase.domain.model.ProcessedGatewayEvent;
import uk.gegc.learnhub.features.purchase.domain.model.Purchase;
import uk.gegc.learnhub.features.purchase.domain.model.PurchaseStatus;
import uk.gegc.learnhub.features.purchase.domain.model.PurchaseType;
import uk.gegc.learnhub.features.user.domain.model.User;
import uk.gegc.learnhub.features.user.domain.repository.UserRepository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs against the Flyway schema rather than a Hibernate-generated one, so the foreign keys
 * and check constraints of the migration are in force.
 */
@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@TestPropertySource(properties = {
        "spring.datasource.url=jdbc:h2:mem:learnhub_flyway;MODE=MySQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1",
        "spring.flyway.enabled=true",
        "spring.jpa.hibernate.ddl-auto=none",
        "spring.jpa.properties.hibernate.type.preferred_uuid_jdbc_type=BINARY"
})
class PurchaseRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");

    @Autowired
    private PurchaseRepository purchaseRepository;

    @Autowired
    private ProcessedGatewayEventRepository processedEventRepository;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private TestEntityManager entityManager;

    private UUID userId;

    @BeforeEach
    void setUp() {
        userId = newUser("owner@example.com");
    }

    @Test
    @DisplayName("gateway order id is unique across purchases")
    void uniqueGatewayOrderId() {
        purchaseRepository.saveAndFlush(pending(PurchaseType.COURSE, "order_dup"));

        assertThatThrownBy(() -> purchaseRepository.saveAndFlush(pending(PurchaseType.COURSE, "order_dup")))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("metadata survives a round trip through the JSON column")
    void metadataColumn() {
        Purchase purchase = pending(PurchaseType.SERVICE, "order_meta");
        purchase.setMetadata(Map.of("itemName", "Resume Review"));
        UUID id = purchaseRepository.saveAndFlush(purchase).getId();

        assertThat(purchaseRepository.findById(id)).get()
                .extracting(Purchase::getMetadata)
                .isEqualTo(Map.of("itemName", "Resume Review"));
    }

    @Nested
    @DisplayName("conditional updates")
    class ConditionalUpdates {

        @Test
        @DisplayName("only the first completion wins")
        void completeOnce() {
            UUID id = purchaseRepository.saveAndFlush(pending(PurchaseType.COURSE, "order_once")).getId();

            int first = purchaseRepository.completeIfStatus(id, PurchaseStatus.PENDING, PurchaseStatus.COMPLETED,
                    "pay_1", "sig_1", NOW);
            int second = purchaseRepository.completeIfStatus(id, PurchaseStatus.PENDING, PurchaseStatus.COMPLETED,
                    "pay_2", null, NOW);

            assertThat(first).isEqualTo(1);
            assertThat(second).isZero();
            Purchase stored = purchaseRepository.findById(id).orElseThrow();
            assertThat(stored.getStatus()).isEqualTo(PurchaseStatus.COMPLETED);
            assertThat(stored.getGatewayPaymentId()).isEqualTo("pay_1");
            assertThat(stored.getGatewaySignature()).isEqualTo("sig_1");
            assertThat(stored.getCompletedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("completion without a payment id keeps the stored one")
        void completeKeepsPaymentId() {
            Purchase purchase = pending(PurchaseType.COURSE, "order_keep");
            purchase.setGatewayPaymentId("pay_existing");
            UUID id = purchaseRepository.saveAndFlush(purchase).getId();

            purchaseRepository.completeIfStatus(id, PurchaseStatus.PENDING, PurchaseStatus.COMPLETED, null, null, NOW);

            assertThat(purchaseRepository.findById(id).orElseThrow().getGatewayPaymentId()).isEqualTo("pay_existing");
        }

        @Test
        @DisplayName("failed purchase cannot be completed")
        void failedStaysFailed() {
            UUID id = purchaseRepository.saveAndFlush(pending(PurchaseType.COURSE, "order_fail")).getId();

            assertThat(purchaseRepository.updateStatusIfCurrent(id, PurchaseStatus.PENDING, PurchaseStatus.FAILED, NOW))
                    .isEqualTo(1);
            assertThat(purchaseRepository.completeIfStatus(id, PurchaseStatus.PENDING, PurchaseStatus.COMPLETED,
                    "pay_1", null, NOW)).isZero();
            assertThat(purchaseRepository.findById(id).orElseThrow().getStatus()).isEqualTo(PurchaseStatus.FAILED);
        }

        @Test
        @DisplayName("refund stamps the refund time")
        void refund() {
            UUID id = purchaseRepository.saveAndFlush(pending(PurchaseType.COURSE, "order_refund")).getId();
            purchaseRepository.completeIfStatus(id, PurchaseStatus.PENDING, PurchaseStatus.COMPLETED, "pay_1", null, NOW);

            assertThat(purchaseRepository.refundIfStatus(id, PurchaseStatus.COMPLETED, PurchaseStatus.REFUNDED, NOW))
                    .isEqualTo(1);
            Purchase stored = purchaseRepository.findById(id).orElseThrow();
            assertThat(stored.getStatus()).isEqualTo(PurchaseStatus.REFUNDED);
            assertThat(stored.getRefundedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("gateway order is attached only once")
        void attachOnce() {
            UUID id = purchaseRepository.saveAndFlush(pending(PurchaseType.SERVICE, null)).getId();

            assertThat(purchaseRepository.attachGatewayOrder(id, "order_first", NOW)).isEqualTo(1);
            assertThat(purchaseRepository.attachGatewayOrder(id, "order_second", NOW)).isZero();
            assertThat(purchaseRepository.findByGatewayOrderId("order_first")).isPresent();
        }
    }

    @Nested
    @DisplayName("lookups")
    class Lookups {

        @Test
        @DisplayName("order lookup is scoped to the owner")
        void ownerScoped() {
            purchaseRepository.saveAndFlush(pending(PurchaseType.COURSE, "order_owned"));

            assertThat(purchaseRepository.findByGatewayOrderIdAndUserId("order_owned", userId)).isPresent();
            assertThat(purchaseRepository.findByGatewayOrderIdAndUserId("order_owned", UUID.randomUUID())).isEmpty();
        }

        @Test
        @DisplayName("history filters by status and type")
        void historyFilters() {
            purchaseRepository.saveAndFlush(pending(PurchaseType.COURSE, "order_h1"));
            purchaseRepository.saveAndFlush(pending(PurchaseType.SERVICE, "order_h2"));
            Purchase done = purchaseRepository.saveAndFlush(pending(PurchaseType.COURSE, "order_h3"));
            purchaseRepository.completeIfStatus(done.getId(), PurchaseStatus.PENDING, PurchaseStatus.COMPLETED, "pay", null, NOW);

            Purchase foreign = pending(PurchaseType.COURSE, "order_h4");
            foreign.setUserId(newUser("foreign@example.com"));
            purchaseRepository.saveAndFlush(foreign);

            PageRequest page = PageRequest.of(0, 10);
            assertThat(purchaseRepository.findHistory(userId, null, null, page).getTotalElements()).isEqualTo(3);
            assertThat(purchaseRepository.findHistory(userId, PurchaseStatus.PENDING, null, page).getTotalElements()).isEqualTo(2);
            assertThat(purchaseRepository.findHistory(userId, null, PurchaseType.SERVICE, page).getTotalElements()).isEqualTo(1);

            Page<Purchase> completedCourses = purchaseRepository.findHistory(userId, PurchaseStatus.COMPLETED, PurchaseType.COURSE, page);
            assertThat(completedCourses.getContent()).extracting(Purchase::getGatewayOrderId).containsExactly("order_h3");
        }
    }

    @Nested
    @DisplayName("schema constraints")
    class SchemaConstraints {

        @Test
        @DisplayName("course purchase may not also reference a service")
        void itemCheck() {
            Purchase purchase = pending(PurchaseType.COURSE, "order_both");
            purchase.setServiceId(UUID.randomUUID());

            assertThatThrownBy(() -> purchaseRepository.saveAndFlush(purchase))
                    .isInstanceOf(DataIntegrityViolationException.class);
        }

        @Test
        @DisplayName("service purchase needs its service id")
        void serviceNeedsServiceId() {
            Purchase purchase = pending(PurchaseType.SERVICE, "order_no_service");
            purchase.setServiceId(null);

            assertThatThrownBy(() -> purchaseRepository.saveAndFlush(purchase))
                    .isInstanceOf(DataIntegrityViolationException.class);
        }

        @Test
        @DisplayName("purchase must belong to an existing user")
        void userForeignKey() {
            Purchase purchase = pending(PurchaseType.COURSE, "order_orphan");
            purchase.setUserId(UUID.randomUUID());

            assertThatThrownBy(() -> purchaseRepository.saveAndFlush(purchase))
                    .isInstanceOf(DataIntegrityViolationException.class);
        }
    }

    @Nested
    @DisplayName("processed gateway events")
    class ProcessedEvents {

        @Test
        @DisplayName("are found by id")
        void foundById() {
            processedEventRepository.saveAndFlush(new ProcessedGatewayEvent("evt_123", "payment.captured"));

            assertThat(processedEventRepository.existsByEventId("evt_123")).isTrue();
            assertThat(processedEventRepository.existsByEventId("evt_999")).isFalse();
        }

        @Test
        @DisplayName("recording the same id twice fails instead of overwriting")
        void duplicateInsertFails() {
            processedEventRepository.saveAndFlush(new ProcessedGatewayEvent("evt_dup", "payment.captured"));
            entityManager.clear();

            assertThatThrownBy(() -> processedEventRepository.saveAndFlush(new ProcessedGatewayEvent("evt_dup", "order.paid")))
                    .isInstanceOf(DataIntegrityViolationException.class);
        }

        @Test
        @DisplayName("loaded events are no longer new")
        void loadedIsNotNew() {
            processedEventRepository.saveAndFlush(new ProcessedGatewayEvent("evt_loaded", "order.paid"));
            entityManager.clear();

            assertThat(processedEventRepository.findById("evt_loaded")).get()
                    .extracting(ProcessedGatewayEvent::isNew)
                    .isEqualTo(false);
        }
    }

    private UUID newUser(String email) {
        User user = new User();
        user.setEmail(email);
        return userRepository.saveAndFlush(user).getId();
    }

    private Purchase pending(PurchaseType type, String orderId) {
        Purchase purchase = new Purchase();
        purchase.setUserId(userId);
        purchase.setPurchaseType(type);
        if (type == PurchaseType.COURSE) {
            purchase.setCourseId(UUID.randomUUID());
        } else {
            purchase.setServiceId(UUID.randomUUID());
        }
        purchase.setAmount(new BigDecimal("99.99"));
        purchase.setOriginalAmount(new BigDecimal("99.99"));
        purchase.setCurrency("INR");
        purchase.setStatus(PurchaseStatus.PENDING);
        purchase.setGatewayOrderId(orderId);
        return purchase;
    }
}
