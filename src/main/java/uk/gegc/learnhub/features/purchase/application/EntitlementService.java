package uk.gegc.learnhub.features.purchase.application;

import uk.gegc.learnhub.features.purchase.domain.model.Purchase;

/**
 * Applies the side effects of a completed purchase to the buyer's account.
 */
public interface EntitlementService {

    /**
     * Grants premium membership when {@code purchase} is for a premium course.
     *
     * @return true when the buyer's account was changed
     */
    boolean applyFor(Purchase purchase);
}
