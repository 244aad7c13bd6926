package uk.gegc.learnhub.features.purchase.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.learnhub.features.purchase.api.dto.WebhookAck;
import uk.gegc.learnhub.features.purchase.application.RazorpayWebhookService;
import uk.gegc.learnhub.shared.config.FeatureFlags;

@Slf4j
@RestController
@RequestMapping("/api/v1/purchases")
@RequiredArgsConstructor
@Tag(name = "Razorpay Webhooks", description = "Endpoint called by Razorpay with payment events")
public class PurchaseWebhookController {

    private final RazorpayWebhookService webhookService;
    private final FeatureFlags featureFlags;

    @Operation(
            summary = "Handle Razorpay webhook",
            description = "Verifies the X-Razorpay-Signature over the raw body and applies payment.captured, payment.failed and order.paid events."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Event received",
                    content = @Content(schema = @Schema(implementation = WebhookAck.class))),
            @ApiResponse(responseCode = "400", description = "Missing or invalid signature, or malformed payload",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "500", description = "Processing failed; Razorpay will retry",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/webhook")
    public ResponseEntity<WebhookAck> handleWebhook(
            @Parameter(hidden = true) @RequestBody(required = false) byte[] payload,
            @Parameter(description = "HMAC-SHA256 of the raw body") @RequestHeader(name = "X-Razorpay-Signature", required = false) String signature,
            @Parameter(description = "Razorpay delivery id, used for de-duplication") @RequestHeader(name = "X-Razorpay-Event-Id", required = false) String eventId
    ) {
        if (!featureFlags.isPurchases()) {
            log.warn("Purchases feature is disabled, rejecting webhook");
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }

        var result = webhookService.process(payload, signature, eventId);
        log.debug("Razorpay webhook handled with result {}", result);
        return ResponseEntity.ok(WebhookAck.ok());
    }
}
