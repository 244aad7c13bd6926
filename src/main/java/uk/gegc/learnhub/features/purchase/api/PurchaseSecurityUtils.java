package uk.gegc.learnhub.features.purchase.api;

import org.springframework.security.core.Authentication;
import uk.gegc.learnhub.shared.exception.UnauthorizedException;

import java.util.UUID;

/**
 * Extracts the buyer id from the authenticated principal; bearer tokens carry it as the subject.
 */
public final class PurchaseSecurityUtils {

    private PurchaseSecurityUtils() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static UUID currentUserId(Authentication authentication) {
        if (authentication == null || !authentication.isAuthenticated()) {
            throw new UnauthorizedException("Not authenticated");
        }
        String userId = authentication.getName();
        if (userId == null || userId.isBlank()) {
            throw new UnauthorizedException("Not authenticated");
        }
        try {
            return UUID.fromString(userId);
        } catch (IllegalArgumentException e) {
            throw new UnauthorizedException("Invalid user id in authentication");
        }
    }
}
