package uk.gegc.learnhub.features.catalog.application;

import java.util.Optional;
import java.util.UUID;

/**
 * Resolves purchasable items, ignoring soft-deleted rows.
 */
public interface CatalogLookupService {

    Optional<CatalogItem> findService(UUID serviceId);

    Optional<CatalogItem> findCourse(UUID courseId);
}
