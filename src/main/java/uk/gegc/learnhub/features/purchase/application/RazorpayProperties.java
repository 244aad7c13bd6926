package uk.gegc.learnhub.features.purchase.application;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Razorpay configuration properties: API keys and webhook secret.
 */
@Configuration
@ConfigurationProperties(prefix = "razorpay")
@Data
public class RazorpayProperties {
    /** Public key id, also handed to the client checkout widget. */
    private String keyId;

    /** Secret API key (server-side). Signs client payment confirmations. */
    private String keySecret;

    /** Webhook signing secret configured in the Razorpay dashboard. */
    private String webhookSecret;
}
