package uk.gegc.vidstream.features.subscription.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;
import uk.gegc.vidstream.features.subscription.application.ActivationResult;
import uk.gegc.vidstream.features.subscription.application.PayChanguProperties;
import uk.gegc.vidstream.features.subscription.application.PaymentLoggingContext;
import uk.gegc.vidstream.features.subscription.application.PaymentWebhookService;
import uk.gegc.vidstream.features.subscription.application.SubscriptionMetricsService;
import uk.gegc.vidstream.features.subscription.application.SubscriptionService;
import uk.gegc.vidstream.features.subscription.domain.exception.InvalidTransactionReferenceException;
import uk.gegc.vidstream.features.subscription.domain.exception.PaymentNotCompletedException;
import uk.gegc.vidstream.features.subscription.domain.exception.WebhookSignatureException;
import uk.gegc.vidstream.features.subscription.domain.model.PaymentTransaction;
import uk.gegc.vidstream.features.subscription.domain.model.PaymentTransactionStatus;
import uk.gegc.vidstream.features.subscription.domain.repository.PaymentTransactionRepository;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentWebhookServiceImpl implements PaymentWebhookService {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final Set<String> SUCCESS_STATUSES = Set.of("successful", "success");

    private final PayChanguProperties payChanguProperties;
    private final SubscriptionService subscriptionService;
    private final PaymentTransactionRepository paymentTransactionRepository;
    private final SubscriptionMetricsService metricsService;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;

    @Override
    public Result process(String payload, String signatureHeader) {
        long startTime = System.currentTimeMillis();

        String webhookSecret = payChanguProperties.getWebhookSecret();
        if (!StringUtils.hasText(webhookSecret)) {
            log.warn("PayChangu webhook secret not configured; rejecting request");
            throw new WebhookSignatureException("Webhook secret not configured");
        }
        if (!signatureMatches(payload, signatureHeader, webhookSecret)) {
            log.warn("PayChangu webhook signature verification failed");
            throw new WebhookSignatureException("Invalid webhook signature");
        }

        JsonNode event = parse(payload);
        String reference = textOrNull(event, "tx_ref");
        if (reference == null) {
            reference = textOrNull(event, "reference");
        }
        if (!StringUtils.hasText(reference)) {
            throw new InvalidTransactionReferenceException("Missing tx_ref in webhook payload");
        }
        String status = Optional.ofNullable(textOrNull(event, "status")).orElse("unknown").toLowerCase();

        metricsService.incrementWebhookReceived(status);
        PaymentLoggingContext loggingContext = PaymentLoggingContext.builder()
                .reference(reference)
                .eventStatus(status)
                .build();
        loggingContext.logInfo(log, "Processing PayChangu webhook: tx_ref={} status={}", reference, status);

        try {
            Result result = handle(reference, status, loggingContext);
            switch (result) {
                case OK -> metricsService.incrementWebhookOk(status);
                case DUPLICATE -> metricsService.incrementWebhookDuplicate(status);
                case IGNORED -> metricsService.incrementWebhookIgnored(status);
            }
            metricsService.recordWebhookLatency(status, System.currentTimeMillis() - startTime);
            return result;
        } catch (RuntimeException e) {
            metricsService.incrementWebhookFailed(status);
            loggingContext.logError(log, "Failed to process webhook: tx_ref={} status={}", reference, status, e);
            // rethrown so the provider sees a non-2xx and retries
            throw e;
        } finally {
            PaymentLoggingContext.clearMDC();
        }
    }

    private Result handle(String reference, String status, PaymentLoggingContext loggingContext) {
        Optional<PaymentTransaction> transaction = paymentTransactionRepository.findById(reference);
        if (transaction.isEmpty()) {
            loggingContext.logWarn(log, "Webhook for unknown transaction {}; ignoring", reference);
            return Result.IGNORED;
        }
        loggingContext.setUserId(transaction.get().getUserId());

        if (!SUCCESS_STATUSES.contains(status)) {
            transactionTemplate.executeWithoutResult(tx -> paymentTransactionRepository.markFailedIfPending(
                    reference, PaymentTransactionStatus.PENDING, PaymentTransactionStatus.FAILED));
            loggingContext.logInfo(log, "Transaction {} reported as '{}'; no activation", reference, status);
            return Result.IGNORED;
        }

        if (transaction.get().getStatus() == PaymentTransactionStatus.COMPLETED) {
            loggingContext.logInfo(log, "Duplicate webhook for completed transaction {}", reference);
            return Result.DUPLICATE;
        }

        try {
            ActivationResult activation = subscriptionService.confirmAndActivate(reference);
            return activation == ActivationResult.APPLIED ? Result.OK : Result.DUPLICATE;
        } catch (PaymentNotCompletedException e) {
            loggingContext.logWarn(log, "Provider did not confirm transaction {}: {}", reference, e.getMessage());
            return Result.IGNORED;
        }
    }

    private boolean signatureMatches(String payload, String signatureHeader, String secret) {
        if (!StringUtils.hasText(signatureHeader) || payload == null) {
            return false;
        }
        byte[] expected = hmac(payload, secret);
        byte[] provided;
        try {
            provided = HexFormat.of().parseHex(signatureHeader.trim().toLowerCase());
        } catch (IllegalArgumentException e) {
            log.debug("Webhook signature header is not hex: {}", e.getMessage());
            return false;
        }
        return MessageDigest.isEqual(expected, provided);
    }

    static byte[] hmac(String payload, String secret) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    private JsonNode parse(String payload) {
        try {
            JsonNode root = objectMapper.readTree(payload);
            if (root == null || !root.isObject()) {
                throw new InvalidTransactionReferenceException("Webhook payload must be a JSON object");
            }
            // some events nest the charge under "data"
            JsonNode data = root.get("data");
            if (!root.hasNonNull("tx_ref") && data != null && data.isObject()) {
                return data;
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new InvalidTransactionReferenceException("Malformed webhook payload");
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
