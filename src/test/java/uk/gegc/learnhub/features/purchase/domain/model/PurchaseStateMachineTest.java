package uk.gegc.learnhub.features.purchase.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PurchaseStateMachine")
class PurchaseStateMachineTest {

    @Nested
    @DisplayName("from PENDING")
    class FromPending {

        @Test
        @DisplayName("captured payment completes the purchase")
        void capturedCompletes() {
            assertThat(PurchaseStateMachine.next(PurchaseStatus.PENDING, PurchaseEvent.PAYMENT_CAPTURED))
                    .contains(PurchaseStatus.COMPLETED);
        }

        @Test
        @DisplayName("paid order completes the purchase")
        void orderPaidCompletes() {
            assertThat(PurchaseStateMachine.next(PurchaseStatus.PENDING, PurchaseEvent.ORDER_PAID))
                    .contains(PurchaseStatus.COMPLETED);
        }

        @Test
        @DisplayName("failed payment fails the purchase")
        void failedFails() {
            assertThat(PurchaseStateMachine.next(PurchaseStatus.PENDING, PurchaseEvent.PAYMENT_FAILED))
                    .contains(PurchaseStatus.FAILED);
        }

        @Test
        @DisplayName("refund of an unpaid purchase is a no-op")
        void refundIsNoOp() {
            assertThat(PurchaseStateMachine.next(PurchaseStatus.PENDING, PurchaseEvent.REFUND_ISSUED)).isEmpty();
        }
    }

    @Test
    @DisplayName("COMPLETED only moves to REFUNDED")
    void completedOnlyRefunds() {
        assertThat(PurchaseStateMachine.next(PurchaseStatus.COMPLETED, PurchaseEvent.REFUND_ISSUED))
                .contains(PurchaseStatus.REFUNDED);
        assertThat(PurchaseStateMachine.next(PurchaseStatus.COMPLETED, PurchaseEvent.PAYMENT_FAILED)).isEmpty();
        assertThat(PurchaseStateMachine.next(PurchaseStatus.COMPLETED, PurchaseEvent.PAYMENT_CAPTURED)).isEmpty();
        assertThat(PurchaseStateMachine.next(PurchaseStatus.COMPLETED, PurchaseEvent.ORDER_PAID)).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(PurchaseEvent.class)
    @DisplayName("FAILED never changes")
    void failedIsFinal(PurchaseEvent event) {
        assertThat(PurchaseStateMachine.next(PurchaseStatus.FAILED, event)).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(PurchaseEvent.class)
    @DisplayName("REFUNDED never changes")
    void refundedIsFinal(PurchaseEvent event) {
        assertThat(PurchaseStateMachine.next(PurchaseStatus.REFUNDED, event)).isEmpty();
    }

    @Test
    @DisplayName("status JSON names are lower-case and parse case-insensitively")
    void statusValues() {
        assertThat(PurchaseStatus.COMPLETED.getValue()).isEqualTo("completed");
        assertThat(PurchaseStatus.fromValue("Completed")).isEqualTo(PurchaseStatus.COMPLETED);
        assertThat(PurchaseType.fromValue("SERVICE")).isEqualTo(PurchaseType.SERVICE);
        assertThat(PurchaseStatus.PENDING.isTerminal()).isFalse();
        assertThat(PurchaseStatus.FAILED.isTerminal()).isTrue();
    }
}
