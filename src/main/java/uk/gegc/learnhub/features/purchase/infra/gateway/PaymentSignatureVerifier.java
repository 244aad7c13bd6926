package uk.gegc.learnhub.features.purchase.infra.gateway;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import uk.gegc.learnhub.features.purchase.application.PurchaseProperties;
import uk.gegc.learnhub.features.purchase.application.RazorpayProperties;
import uk.gegc.learnhub.features.purchase.domain.exception.PaymentGatewayException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * HMAC-SHA256 checks for client payment confirmations ({@code orderId|paymentId} signed
 * with the key secret) and webhook bodies (signed with the webhook secret over the raw
 * request bytes).
 * <p>
 * Secrets are resolved once at startup. Without a key secret, strict mode leaves payment
 * verification unavailable; otherwise the configured dev secret is used.
 */
@Slf4j
@Component
public class PaymentSignatureVerifier {

    private final String paymentSecret;
    private final String webhookSecret;

    public PaymentSignatureVerifier(RazorpayProperties razorpay, PurchaseProperties purchaseProperties) {
        this.paymentSecret = resolvePaymentSecret(razorpay, purchaseProperties);
        this.webhookSecret = StringUtils.hasText(razorpay.getWebhookSecret()) ? razorpay.getWebhookSecret() : null;
    }

    private static String resolvePaymentSecret(RazorpayProperties razorpay, PurchaseProperties purchaseProperties) {
        if (StringUtils.hasText(razorpay.getKeySecret())) {
            return razorpay.getKeySecret();
        }
        if (purchaseProperties.isStrictMode()) {
            return null;
        }
        log.warn("Razorpay key secret is not configured; payment signatures are checked with the dev secret");
        return purchaseProperties.getDevKeySecret();
    }

    public boolean isPaymentSignatureValid(String orderId, String paymentId, String signature) {
        if (paymentSecret == null) {
            throw new PaymentGatewayException("Razorpay key secret is not configured");
        }
        byte[] signedPayload = (orderId + "|" + paymentId).getBytes(StandardCharsets.UTF_8);
        return matches(hmacHex(paymentSecret, signedPayload), signature);
    }

    public boolean hasWebhookSecret() {
        return webhookSecret != null;
    }

    public boolean isWebhookSignatureValid(byte[] payload, String signature) {
        if (webhookSecret == null) {
            throw new PaymentGatewayException("Razorpay webhook secret is not configured");
        }
        return matches(hmacHex(webhookSecret, payload), signature);
    }

    private static String hmacHex(String secret, byte[] payload) {
        return new HmacUtils(HmacAlgorithms.HMAC_SHA_256, secret.getBytes(StandardCharsets.UTF_8)).hmacHex(payload);
    }

    private static boolean matches(String expectedHex, String signature) {
        if (signature == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expectedHex.getBytes(StandardCharsets.US_ASCII),
                signature.getBytes(StandardCharsets.UTF_8));
    }
}
