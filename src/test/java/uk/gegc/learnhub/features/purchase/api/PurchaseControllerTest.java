package uk.gegc.learnhub.features.purchase.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.learnhub.features.purchase.api.dto.CheckoutResponse;
import uk.gegc.learnhub.features.purchase.api.dto.CreateCheckoutRequest;
import uk.gegc.learnhub.features.purchase.api.dto.PurchaseDto;
import uk.gegc.learnhub.features.purchase.api.dto.PurchaseStatusResponse;
import uk.gegc.learnhub.features.purchase.api.dto.VerifyPaymentRequest;
import uk.gegc.learnhub.features.purchase.api.dto.VerifyPaymentResponse;
import uk.gegc.learnhub.features.purchase.application.CheckoutService;
import uk.gegc.learnhub.features.purchase.application.PaymentVerificationService;
import uk.gegc.learnhub.features.purchase.application.PurchaseQueryService;
import uk.gegc.learnhub.features.purchase.domain.exception.InvalidPaymentSignatureException;
import uk.gegc.learnhub.features.purchase.domain.exception.InvalidPurchaseException;
import uk.gegc.learnhub.features.purchase.domain.exception.PaymentAlreadyVerifiedException;
import uk.gegc.learnhub.features.purchase.domain.exception.PaymentGatewayException;
import uk.gegc.learnhub.features.purchase.domain.model.PurchaseStatus;
import uk.gegc.learnhub.features.purchase.domain.model.PurchaseType;
import uk.gegc.learnhub.shared.config.FeatureFlags;
import uk.gegc.learnhub.shared.exception.ResourceNotFoundException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("PurchaseController")
class PurchaseControllerTest {

    private static final String USER_ID = "7c9e6679-7425-40de-944b-e07fc1f90ae7";
    private static final UUID COURSE_ID = UUID.fromString("550e8400-e29b-41d4-a716-446655440001");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private CheckoutService checkoutService;

    @MockitoBean
    private PaymentVerificationService paymentVerificationService;

    @MockitoBean
    private PurchaseQueryService purchaseQueryService;

    @MockitoBean
    private FeatureFlags featureFlags;

    @BeforeEach
    void setUp() {
        when(featureFlags.isPurchases()).thenReturn(true);
    }

    @Nested
    @DisplayName("POST /api/v1/purchases/checkout")
    class Checkout {

        @Test
        @WithMockUser(username = USER_ID)
        @DisplayName("returns 201 with the order details")
        void created() throws Exception {
            UUID purchaseId = UUID.randomUUID();
            when(checkoutService.createCheckout(eq(UUID.fromString(USER_ID)), any(CreateCheckoutRequest.class)))
                    .thenReturn(new CheckoutResponse("order_abc", 9999L, "INR", "rzp_test_key", purchaseId,
                            "http://localhost:5173/payment/success", "http://localhost:5173/payment/cancel"));

            mockMvc.perform(post("/api/v1/purchases/checkout")
                            .with(csrf())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"purchaseType\":\"course\",\"courseId\":\"" + COURSE_ID + "\"}"))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.orderId").value("order_abc"))
                    .andExpect(jsonPath("$.amount").value(9999))
                    .andExpect(jsonPath("$.currency").value("INR"))
                    .andExpect(jsonPath("$.keyId").value("rzp_test_key"))
                    .andExpect(jsonPath("$.purchaseId").value(purchaseId.toString()));
        }

        @Test
        @WithMockUser(username = USER_ID)
        @DisplayName("rejects an unknown purchase type")
        void invalidType() throws Exception {
            mockMvc.perform(post("/api/v1/purchases/checkout")
                            .with(csrf())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"purchaseType\":\"bundle\",\"courseId\":\"" + COURSE_ID + "\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.fieldErrors").isArray());
            verifyNoInteractions(checkoutService);
        }

        @Test
        @WithMockUser(username = USER_ID)
        @DisplayName("free item maps to 400")
        void invalidPurchase() throws Exception {
            when(checkoutService.createCheckout(any(), any()))
                    .thenThrow(new InvalidPurchaseException("Item price must be greater than 0"));

            mockMvc.perform(post("/api/v1/purchases/checkout")
                            .with(csrf())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"purchaseType\":\"course\",\"courseId\":\"" + COURSE_ID + "\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail").value("Item price must be greater than 0"));
        }

        @Test
        @WithMockUser(username = USER_ID)
        @DisplayName("missing course maps to 404")
        void notFound() throws Exception {
            when(checkoutService.createCheckout(any(), any())).thenThrow(new ResourceNotFoundException("Course not found"));

            mockMvc.perform(post("/api/v1/purchases/checkout")
                            .with(csrf())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"purchaseType\":\"course\",\"courseId\":\"" + COURSE_ID + "\"}"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.detail").value("Course not found"));
        }

        @Test
        @WithMockUser(username = USER_ID)
        @DisplayName("gateway failure maps to 500 without provider details")
        void gatewayFailure() throws Exception {
            when(checkoutService.createCheckout(any(), any()))
                    .thenThrow(new PaymentGatewayException("BAD_REQUEST_ERROR: key_id invalid"));

            mockMvc.perform(post("/api/v1/purchases/checkout")
                            .with(csrf())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"purchaseType\":\"course\",\"courseId\":\"" + COURSE_ID + "\"}"))
                    .andExpect(status().isInternalServerError());
        }

        @Test
        @DisplayName("requires authentication")
        void unauthenticated() throws Exception {
            mockMvc.perform(post("/api/v1/purchases/checkout")
                            .with(csrf())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"purchaseType\":\"course\",\"courseId\":\"" + COURSE_ID + "\"}"))
                    .andExpect(status().isUnauthorized());
        }

        @Test
        @WithMockUser(username = USER_ID)
        @DisplayName("is hidden when purchases are disabled")
        void disabled() throws Exception {
            when(featureFlags.isPurchases()).thenReturn(false);

            mockMvc.perform(post("/api/v1/purchases/checkout")
                            .with(csrf())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"purchaseType\":\"course\",\"courseId\":\"" + COURSE_ID + "\"}"))
                    .andExpect(status().isNotFound());
            verifyNoInteractions(checkoutService);
        }
    }

    @Nested
    @DisplayName("POST /api/v1/purchases/verify")
    class Verify {

        @Test
        @WithMockUser(username = USER_ID)
        @DisplayName("accepts the razorpay_* field names")
        void verified() throws Exception {
            when(paymentVerificationService.verify(eq(UUID.fromString(USER_ID)), any(VerifyPaymentRequest.class)))
                    .thenReturn(new VerifyPaymentResponse(dto(PurchaseStatus.COMPLETED), true));

            mockMvc.perform(post("/api/v1/purchases/verify")
                            .with(csrf())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"razorpay_order_id":"order_abc","razorpay_payment_id":"pay_1","razorpay_signature":"abc"}
                                    """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.verified").value(true))
                    .andExpect(jsonPath("$.purchase.status").value("completed"))
                    .andExpect(jsonPath("$.purchase.purchaseType").value("course"));

            ArgumentCaptor<VerifyPaymentRequest> captor = ArgumentCaptor.forClass(VerifyPaymentRequest.class);
            verify(paymentVerificationService).verify(eq(UUID.fromString(USER_ID)), captor.capture());
            assertThat(captor.getValue().orderId()).isEqualTo("order_abc");
            assertThat(captor.getValue().paymentId()).isEqualTo("pay_1");
        }

        @Test
        @WithMockUser(username = USER_ID)
        @DisplayName("missing fields are reported with one message")
        void missingFields() throws Exception {
            mockMvc.perform(post("/api/v1/purchases/verify")
                            .with(csrf())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"orderId\":\"order_abc\",\"paymentId\":\"pay_1\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail").value("Missing payment verification data"));
        }

        @Test
        @WithMockUser(username = USER_ID)
        @DisplayName("bad signature maps to 400")
        void badSignature() throws Exception {
            when(paymentVerificationService.verify(any(), any()))
                    .thenThrow(new InvalidPaymentSignatureException("Invalid payment signature"));

            mockMvc.perform(post("/api/v1/purchases/verify")
                            .with(csrf())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"orderId\":\"order_abc\",\"paymentId\":\"pay_1\",\"signature\":\"bad\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail").value("Invalid payment signature"));
        }

        @Test
        @WithMockUser(username = USER_ID)
        @DisplayName("second verification maps to 409")
        void alreadyVerified() throws Exception {
            when(paymentVerificationService.verify(any(), any()))
                    .thenThrow(new PaymentAlreadyVerifiedException("Payment already verified"));

            mockMvc.perform(post("/api/v1/purchases/verify")
                            .with(csrf())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"orderId\":\"order_abc\",\"paymentId\":\"pay_1\",\"signature\":\"sig\"}"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.detail").value("Payment already verified"));
        }
    }

    @Nested
    @DisplayName("GET endpoints")
    class Reads {

        @Test
        @WithMockUser(username = USER_ID)
        @DisplayName("status by order id")
        void statusByOrder() throws Exception {
            when(purchaseQueryService.getStatusByOrderId(UUID.fromString(USER_ID), "order_abc"))
                    .thenReturn(new PurchaseStatusResponse("order_abc", PurchaseStatus.PENDING, new BigDecimal("99.99"), "INR"));

            mockMvc.perform(get("/api/v1/purchases/status/order_abc"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.orderId").value("order_abc"))
                    .andExpect(jsonPath("$.status").value("pending"))
                    .andExpect(jsonPath("$.amount").value(99.99));
        }

        @Test
        @WithMockUser(username = USER_ID)
        @DisplayName("history uses 1-based pages capped at 100")
        void history() throws Exception {
            when(purchaseQueryService.getHistory(any(), any(), any(), any()))
                    .thenReturn(new PageImpl<>(List.of(dto(PurchaseStatus.COMPLETED)), PageRequest.of(0, 100), 1));

            mockMvc.perform(get("/api/v1/purchases")
                            .param("status", "COMPLETED")
                            .param("purchaseType", "course")
                            .param("page", "1")
                            .param("size", "500"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.content[0].status").value("completed"));

            ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
            verify(purchaseQueryService).getHistory(eq(UUID.fromString(USER_ID)), eq(PurchaseStatus.COMPLETED),
                    eq(PurchaseType.COURSE), pageable.capture());
            assertThat(pageable.getValue().getPageNumber()).isZero();
            assertThat(pageable.getValue().getPageSize()).isEqualTo(100);
        }

        @Test
        @WithMockUser(username = USER_ID)
        @DisplayName("history defaults to ten per page without filters")
        void historyDefaults() throws Exception {
            when(purchaseQueryService.getHistory(any(), any(), any(), any()))
                    .thenReturn(new PageImpl<>(List.of(), PageRequest.of(0, 10), 0));

            mockMvc.perform(get("/api/v1/purchases"))
                    .andExpect(status().isOk());

            ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
            verify(purchaseQueryService).getHistory(eq(UUID.fromString(USER_ID)), isNull(), isNull(), pageable.capture());
            assertThat(pageable.getValue().getPageSize()).isEqualTo(10);
        }

        @Test
        @WithMockUser(username = USER_ID)
        @DisplayName("unknown status filter is a 400")
        void badStatusFilter() throws Exception {
            mockMvc.perform(get("/api/v1/purchases").param("status", "shipped"))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @WithMockUser(username = USER_ID)
        @DisplayName("purchase by id")
        void byId() throws Exception {
            PurchaseDto dto = dto(PurchaseStatus.PENDING);
            when(purchaseQueryService.getById(UUID.fromString(USER_ID), dto.id())).thenReturn(dto);

            mockMvc.perform(get("/api/v1/purchases/{id}", dto.id()))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.id").value(dto.id().toString()))
                    .andExpect(jsonPath("$.gatewayOrderId").value("order_abc"));
        }

        @Test
        @WithMockUser(username = USER_ID)
        @DisplayName("malformed id is a 400")
        void malformedId() throws Exception {
            mockMvc.perform(get("/api/v1/purchases/not-a-uuid"))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @WithMockUser(username = "not-a-uuid")
        @DisplayName("principal that is not a user id is rejected")
        void foreignPrincipal() throws Exception {
            mockMvc.perform(get("/api/v1/purchases/status/order_abc"))
                    .andExpect(status().isUnauthorized());
        }
    }

    private static PurchaseDto dto(PurchaseStatus status) {
        Instant created = Instant.parse("2024-01-01T12:00:00Z");
        return new PurchaseDto(UUID.randomUUID(), UUID.fromString(USER_ID), PurchaseType.COURSE, null, COURSE_ID,
                new BigDecimal("99.99"), new BigDecimal("99.99"), null, null, "INR", status,
                "order_abc", status == PurchaseStatus.COMPLETED ? "pay_1" : null,
                status == PurchaseStatus.COMPLETED ? created : null, null,
                Map.of("itemName", "Spring in Depth"), created, created);
    }
}
