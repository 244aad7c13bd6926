package uk.gegc.learnhub.features.purchase.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.hibernate.validator.constraints.URL;

import java.util.UUID;

@Schema(name = "CreateCheckoutRequest", description = "Request to open a Razorpay order for a service or course")
public record CreateCheckoutRequest(
        @Schema(description = "What is being bought", allowableValues = {"service", "course"}, example = "course", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "purchaseType is required")
        @Pattern(regexp = "(?i)service|course", message = "purchaseType must be 'service' or 'course'")
        String purchaseType,

        @Schema(description = "Service id, required when purchaseType is service", example = "550e8400-e29b-41d4-a716-446655440000")
        UUID serviceId,

        @Schema(description = "Course id, required when purchaseType is course", example = "550e8400-e29b-41d4-a716-446655440001")
        UUID courseId,

        @Schema(description = "Where the client goes after a successful payment", example = "https://app.learnhub.dev/payment/success")
        @URL(message = "successUrl must be a valid URL")
        String successUrl,

        @Schema(description = "Where the client goes after a cancelled payment", example = "https://app.learnhub.dev/payment/cancel")
        @URL(message = "cancelUrl must be a valid URL")
        String cancelUrl
) {}
