package uk.gegc.learnhub.features.purchase.application;

import uk.gegc.learnhub.features.purchase.api.dto.VerifyPaymentRequest;
import uk.gegc.learnhub.features.purchase.api.dto.VerifyPaymentResponse;

import java.util.UUID;

public interface PaymentVerificationService {

    /**
     * Checks the client's payment signature and completes the caller's purchase.
     */
    VerifyPaymentResponse verify(UUID userId, VerifyPaymentRequest request);
}
