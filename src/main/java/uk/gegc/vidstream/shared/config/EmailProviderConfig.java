package uk.gegc.vidstream.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import uk.gegc.vidstream.shared.email.EmailService;
import uk.gegc.vidstream.shared.email.impl.NoopEmailService;

/**
 * Selects the {@link EmailService} implementation from {@code app.email.provider}.
 *
 * <ul>
 *     <li>{@code smtp}: {@link uk.gegc.vidstream.shared.email.impl.SmtpEmailService}, picked up by component scan</li>
 *     <li>{@code noop}: log only (default, used in development and tests)</li>
 * </ul>
 */
@Slf4j
@Configuration
public class EmailProviderConfig {

    @Bean
    @Primary
    @ConditionalOnProperty(name = "app.email.provider", havingValue = "noop", matchIfMissing = true)
    public EmailService noopEmailService() {
        log.info("Activating No-op email service (emails will be logged but not sent)");
        return new NoopEmailService();
    }
}
