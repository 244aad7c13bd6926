package uk.gegc.learnhub.features.purchase.infra.web;

import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;
import uk.gegc.learnhub.features.purchase.domain.model.PurchaseStatus;
import uk.gegc.learnhub.features.purchase.domain.model.PurchaseType;

/**
 * Lets query parameters use the same lower-case names as the JSON bodies
 * ({@code ?status=completed&purchaseType=course}).
 */
@Configuration
public class PurchaseWebConfig implements WebMvcConfigurer {

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, PurchaseStatus.class, PurchaseStatus::fromValue);
        registry.addConverter(String.class, PurchaseType.class, PurchaseType::fromValue);
    }
}
