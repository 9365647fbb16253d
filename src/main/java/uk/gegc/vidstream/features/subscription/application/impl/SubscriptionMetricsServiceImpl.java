package uk.gegc.vidstream.features.subscription.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.vidstream.features.subscription.application.SubscriptionMetricsService;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer-backed metrics. Webhook counters are tagged with the provider's event status,
 * activation counters with the plan name; both sets are small and bounded.
 */
@Slf4j
@Service
public class SubscriptionMetricsServiceImpl implements SubscriptionMetricsService {

    private static final String UNKNOWN = "unknown";

    private final MeterRegistry meterRegistry;
    private final Counter activationAlreadyAppliedCounter;

    public SubscriptionMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.activationAlreadyAppliedCounter = Counter.builder("subscriptions.activations.already_applied")
                .description("Activations skipped because the transaction was already applied")
                .register(meterRegistry);
    }

    @Override
    public void incrementWebhookReceived(String eventStatus) {
        webhookCounter("payments.webhooks.received", "Payment webhooks received", eventStatus).increment();
    }

    @Override
    public void incrementWebhookOk(String eventStatus) {
        webhookCounter("payments.webhooks.ok", "Payment webhooks that activated a subscription", eventStatus).increment();
    }

    @Override
    public void incrementWebhookDuplicate(String eventStatus) {
        webhookCounter("payments.webhooks.duplicate", "Payment webhooks for already-applied transactions", eventStatus).increment();
    }

    @Override
    public void incrementWebhookIgnored(String eventStatus) {
        webhookCounter("payments.webhooks.ignored", "Payment webhooks acknowledged without activation", eventStatus).increment();
    }

    @Override
    public void incrementWebhookFailed(String eventStatus) {
        webhookCounter("payments.webhooks.failed", "Payment webhooks that failed processing", eventStatus).increment();
    }

    @Override
    public void recordWebhookLatency(String eventStatus, long latencyMs) {
        Timer.builder("payments.webhooks.latency")
                .description("Payment webhook processing latency")
                .tag("status", tagValue(eventStatus))
                .register(meterRegistry)
                .record(latencyMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void incrementActivationApplied(String planName) {
        Counter.builder("subscriptions.activations.applied")
                .description("Subscription activations applied")
                .tag("plan", tagValue(planName))
                .register(meterRegistry)
                .increment();
        log.debug("Subscription activation recorded for plan '{}'", planName);
    }

    @Override
    public void incrementActivationAlreadyApplied() {
        activationAlreadyAppliedCounter.increment();
    }

    private Counter webhookCounter(String name, String description, String eventStatus) {
        return Counter.builder(name)
                .description(description)
                .tag("status", tagValue(eventStatus))
                .register(meterRegistry);
    }

    private static String tagValue(String value) {
        return value == null || value.isBlank() ? UNKNOWN : value.toLowerCase();
    }
}
