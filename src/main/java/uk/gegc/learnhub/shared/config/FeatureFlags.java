package uk.gegc.learnhub.shared.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for feature flags
 */
@Component
@ConfigurationProperties(prefix = "learnhub.features")
public class FeatureFlags {

    private boolean purchases = true;

    public boolean isPurchases() {
        return purchases;
    }

    public void setPurchases(boolean purchases) {
        this.purchases = purchases;
    }
}
