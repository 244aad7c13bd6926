package uk.gegc.learnhub.features.purchase.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.learnhub.features.purchase.application.PurchaseMetricsService;

import java.util.concurrent.TimeUnit;

@Slf4j
@Service
public class PurchaseMetricsServiceImpl implements PurchaseMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter verifyOkCounter;
    private final Counter verifyFailedCounter;
    private final Counter verifyConflictCounter;
    private final Counter entitlementGrantedCounter;

    public PurchaseMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.verifyOkCounter = Counter.builder("purchases.verify.ok")
                .description("Client payment confirmations that completed a purchase")
                .register(meterRegistry);
        this.verifyFailedCounter = Counter.builder("purchases.verify.failed")
                .description("Client payment confirmations rejected for a bad signature")
                .register(meterRegistry);
        this.verifyConflictCounter = Counter.builder("purchases.verify.conflict")
                .description("Client payment confirmations for purchases no longer pending")
                .register(meterRegistry);
        this.entitlementGrantedCounter = Counter.builder("purchases.entitlements.granted")
                .description("Premium memberships granted by course purchases")
                .register(meterRegistry);
    }

    @Override
    public void incrementCheckoutCreated(String purchaseType) {
        log.info("METRIC: purchases.checkout.created purchaseType={}", purchaseType);
        Counter.builder("purchases.checkout.created")
                .description("Checkout orders created")
                .tag("purchaseType", purchaseType)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementVerifyOk() {
        log.info("METRIC: purchases.verify.ok");
        verifyOkCounter.increment();
    }

    @Override
    public void incrementVerifyFailed() {
        log.info("METRIC: purchases.verify.failed");
        verifyFailedCounter.increment();
    }

    @Override
    public void incrementVerifyConflict() {
        log.info("METRIC: purchases.verify.conflict");
        verifyConflictCounter.increment();
    }

    @Override
    public void incrementWebhookReceived(String eventType) {
        webhookCounter("razorpay.webhooks.received", eventType).increment();
    }

    @Override
    public void incrementWebhookOk(String eventType) {
        webhookCounter("razorpay.webhooks.ok", eventType).increment();
    }

    @Override
    public void incrementWebhookIgnored(String eventType) {
        webhookCounter("razorpay.webhooks.ignored", eventType).increment();
    }

    @Override
    public void incrementWebhookDuplicate(String eventType) {
        webhookCounter("razorpay.webhooks.duplicate", eventType).increment();
    }

    @Override
    public void incrementWebhookFailed(String eventType) {
        webhookCounter("razorpay.webhooks.failed", eventType).increment();
    }

    @Override
    public void recordWebhookLatency(String eventType, long latencyMs) {
        log.info("METRIC: razorpay.webhooks.latency eventType={} latencyMs={}", eventType, latencyMs);
        Timer.builder("razorpay.webhooks.latency")
                .description("Razorpay webhook processing latency")
                .tag("eventType", safe(eventType))
                .register(meterRegistry)
                .record(latencyMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void incrementEntitlementGranted() {
        log.info("METRIC: purchases.entitlements.granted");
        entitlementGrantedCounter.increment();
    }

    private Counter webhookCounter(String name, String eventType) {
        log.info("METRIC: {} eventType={}", name, eventType);
        return Counter.builder(name)
                .tag("eventType", safe(eventType))
                .register(meterRegistry);
    }

    private static String safe(String eventType) {
        return eventType != null && !eventType.isBlank() ? eventType : "unknown";
    }
}
