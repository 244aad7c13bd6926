package uk.gegc.learnhub.features.purchase.application;

public interface RazorpayWebhookService {

    enum Result { OK, DUPLICATE, IGNORED }

    /**
     * @param payload         raw request body, exactly as signed by Razorpay
     * @param signatureHeader value of {@code X-Razorpay-Signature}
     * @param eventIdHeader   value of {@code X-Razorpay-Event-Id}, may be null
     */
    Result process(byte[] payload, String signatureHeader, String eventIdHeader);
}
