package uk.gegc.learnhub.features.purchase.infra.gateway;

import com.razorpay.RazorpayClient;
import com.razorpay.RazorpayException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import uk.gegc.learnhub.features.purchase.application.PaymentGateway;
import uk.gegc.learnhub.features.purchase.application.PurchaseProperties;
import uk.gegc.learnhub.features.purchase.application.RazorpayProperties;
import uk.gegc.learnhub.features.purchase.domain.exception.PaymentGatewayException;

/**
 * Chooses the {@link PaymentGateway} once at startup.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class PaymentGatewayConfig {

    private final RazorpayProperties razorpay;
    private final PurchaseProperties purchases;

    @Bean
    public PaymentGateway paymentGateway() {
        if (StringUtils.hasText(razorpay.getKeyId()) && StringUtils.hasText(razorpay.getKeySecret())) {
            try {
                log.info("Using Razorpay payment gateway with key id {}", razorpay.getKeyId());
                return new RazorpayPaymentGateway(new RazorpayClient(razorpay.getKeyId(), razorpay.getKeySecret()));
            } catch (RazorpayException e) {
                throw new PaymentGatewayException("Failed to initialise Razorpay client", e);
            }
        }
        if (purchases.isStrictMode()) {
            log.error("Razorpay keys missing in strict mode; checkout will fail until configured");
            return new UnavailablePaymentGateway();
        }
        log.warn("Razorpay keys missing; using mock payment gateway");
        return new MockPaymentGateway();
    }
}
