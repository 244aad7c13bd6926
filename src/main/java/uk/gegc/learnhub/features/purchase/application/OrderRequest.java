package uk.gegc.learnhub.features.purchase.application;

import java.util.Map;

/**
 * @param amountMinor amount in the currency's minor unit (paise for INR)
 */
public record OrderRequest(
        long amountMinor,
        String currency,
        String receipt,
        Map<String, String> notes
) {
}
