package uk.gegc.learnhub.features.purchase.application;

public record GatewayOrder(
        String id,
        long amountMinor,
        String currency
) {
}
