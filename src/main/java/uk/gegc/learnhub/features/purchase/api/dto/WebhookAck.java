package uk.gegc.learnhub.features.purchase.api.dto;

public record WebhookAck(boolean received) {

    public static WebhookAck ok() {
        return new WebhookAck(true);
    }
}
