package uk.gegc.learnhub.features.catalog.application;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Read-only view of a purchasable catalog entry.
 *
 * @param premium only meaningful for courses; services are never premium
 */
public record CatalogItem(
        UUID id,
        String name,
        String description,
        BigDecimal price,
        boolean premium
) {
}
