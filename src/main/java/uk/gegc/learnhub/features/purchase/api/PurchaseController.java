package uk.gegc.learnhub.features.purchase.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springdoc.core.annotations.ParameterObject;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.learnhub.features.purchase.api.dto.CheckoutResponse;
import uk.gegc.learnhub.features.purchase.api.dto.CreateCheckoutRequest;
import uk.gegc.learnhub.features.purchase.api.dto.PurchaseDto;
import uk.gegc.learnhub.features.purchase.api.dto.PurchaseStatusResponse;
import uk.gegc.learnhub.features.purchase.api.dto.VerifyPaymentRequest;
import uk.gegc.learnhub.features.purchase.api.dto.VerifyPaymentResponse;
import uk.gegc.learnhub.features.purchase.application.CheckoutService;
import uk.gegc.learnhub.features.purchase.application.PaymentVerificationService;
import uk.gegc.learnhub.features.purchase.application.PurchaseQueryService;
import uk.gegc.learnhub.features.purchase.domain.model.PurchaseStatus;
import uk.gegc.learnhub.features.purchase.domain.model.PurchaseType;
import uk.gegc.learnhub.shared.config.FeatureFlags;

import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1/purchases")
@RequiredArgsConstructor
@Validated
@Tag(name = "Purchases", description = "One-time purchases of services and courses through Razorpay")
@SecurityRequirement(name = "bearerAuth")
public class PurchaseController {

    private final CheckoutService checkoutService;
    private final PaymentVerificationService paymentVerificationService;
    private final PurchaseQueryService purchaseQueryService;
    private final FeatureFlags featureFlags;

    @Operation(
            summary = "Create checkout order",
            description = "Records a pending purchase for a service or course and opens a Razorpay order for it."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Order created",
                    content = @Content(schema = @Schema(implementation = CheckoutResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request or item not purchasable",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "401", description = "Not authenticated",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Item or user not found, or purchases disabled",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "500", description = "Payment gateway error",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/checkout")
    public ResponseEntity<CheckoutResponse> createCheckout(
            @Valid @RequestBody CreateCheckoutRequest request,
            Authentication authentication) {
        if (!featureFlags.isPurchases()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }
        UUID userId = PurchaseSecurityUtils.currentUserId(authentication);
        log.info("Creating checkout for user {} type {}", userId, request.purchaseType());
        CheckoutResponse response = checkoutService.createCheckout(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(
            summary = "Verify payment",
            description = "Checks the Razorpay payment signature returned to the client and completes the purchase."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Payment verified",
                    content = @Content(schema = @Schema(implementation = VerifyPaymentResponse.class))),
            @ApiResponse(responseCode = "400", description = "Missing data or invalid signature",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Purchase not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Purchase already verified or no longer pending",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/verify")
    public ResponseEntity<VerifyPaymentResponse> verifyPayment(
            @Valid @RequestBody VerifyPaymentRequest request,
            Authentication authentication) {
        if (!featureFlags.isPurchases()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }
        UUID userId = PurchaseSecurityUtils.currentUserId(authentication);
        return ResponseEntity.ok(paymentVerificationService.verify(userId, request));
    }

    @Operation(summary = "Get purchase status by Razorpay order id")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Status retrieved",
                    content = @Content(schema = @Schema(implementation = PurchaseStatusResponse.class))),
            @ApiResponse(responseCode = "404", description = "Purchase not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/status/{orderId}")
    public ResponseEntity<PurchaseStatusResponse> getStatus(
            @Parameter(description = "Razorpay order id", required = true) @PathVariable String orderId,
            Authentication authentication) {
        if (!featureFlags.isPurchases()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }
        UUID userId = PurchaseSecurityUtils.currentUserId(authentication);
        return ResponseEntity.ok(purchaseQueryService.getStatusByOrderId(userId, orderId));
    }

    @Operation(
            summary = "List my purchases",
            description = "Caller's purchases, newest first. Pages start at 1; page size is capped at 100."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Purchases retrieved"),
            @ApiResponse(responseCode = "400", description = "Invalid filter value",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping
    public ResponseEntity<Page<PurchaseDto>> listPurchases(
            @Parameter(description = "Filter by status", schema = @Schema(allowableValues = {"pending", "completed", "failed", "refunded"}))
            @RequestParam(required = false) PurchaseStatus status,
            @Parameter(description = "Filter by purchase type", schema = @Schema(allowableValues = {"service", "course"}))
            @RequestParam(required = false) PurchaseType purchaseType,
            @ParameterObject @PageableDefault(size = 10) Pageable pageable,
            Authentication authentication) {
        if (!featureFlags.isPurchases()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }
        UUID userId = PurchaseSecurityUtils.currentUserId(authentication);
        return ResponseEntity.ok(purchaseQueryService.getHistory(userId, status, purchaseType, pageable));
    }

    @Operation(summary = "Get one of my purchases")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Purchase retrieved",
                    content = @Content(schema = @Schema(implementation = PurchaseDto.class))),
            @ApiResponse(responseCode = "400", description = "Malformed purchase id",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Purchase not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{id}")
    public ResponseEntity<PurchaseDto> getPurchase(
            @Parameter(description = "Purchase id", required = true) @PathVariable UUID id,
            Authentication authentication) {
        if (!featureFlags.isPurchases()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }
        UUID userId = PurchaseSecurityUtils.currentUserId(authentication);
        return ResponseEntity.ok(purchaseQueryService.getById(userId, id));
    }
}
