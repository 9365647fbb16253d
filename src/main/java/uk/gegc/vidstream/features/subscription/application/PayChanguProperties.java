package uk.gegc.vidstream.features.subscription.application;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * PayChangu mobile-money configuration: API credentials, webhook secret and HTTP timeouts.
 */
@Configuration
@ConfigurationProperties(prefix = "app.payments.paychangu")
@Data
public class PayChanguProperties {
    private String baseUrl = "https://api.paychangu.com";

    /** Secret API key sent as a bearer credential. */
    private String secretKey;

    /** Shared secret for the HMAC-SHA256 {@code Signature} header on webhooks. */
    private String webhookSecret;

    /** Where the provider posts payment events. */
    private String callbackUrl;

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration readTimeout = Duration.ofSeconds(15);
}
