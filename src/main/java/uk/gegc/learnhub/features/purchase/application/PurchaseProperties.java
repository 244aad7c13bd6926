package uk.gegc.learnhub.features.purchase.application;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Period;

@Configuration
@ConfigurationProperties(prefix = "learnhub.purchases")
@Data
public class PurchaseProperties {
    /** Currency for every order; no conversion is done. */
    private String currency = "INR";

    private String defaultSuccessUrl = "http://localhost:5173/payment/success";

    private String defaultCancelUrl = "http://localhost:5173/payment/cancel";

    /**
     * When true an unconfigured gateway or webhook secret is an error instead of
     * falling back to the mock gateway / unsigned webhooks.
     */
    private boolean strictMode = false;

    /** How long a premium course purchase keeps the buyer premium. */
    private Period premiumDuration = Period.ofYears(1);

    /**
     * Secret used to check payment signatures when no Razorpay key secret is set and
     * strict mode is off. Never used in strict mode.
     */
    private String devKeySecret = "test-secret";
}
