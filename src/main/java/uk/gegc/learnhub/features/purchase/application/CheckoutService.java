package uk.gegc.learnhub.features.purchase.application;

import uk.gegc.learnhub.features.purchase.api.dto.CheckoutResponse;
import uk.gegc.learnhub.features.purchase.api.dto.CreateCheckoutRequest;

import java.util.UUID;

public interface CheckoutService {

    /**
     * Records a pending purchase for the caller and opens a gateway order for it.
     */
    CheckoutResponse createCheckout(UUID userId, CreateCheckoutRequest request);
}
