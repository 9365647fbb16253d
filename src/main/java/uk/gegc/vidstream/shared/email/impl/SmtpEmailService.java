package uk.gegc.vidstream.shared.email.impl;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;
import uk.gegc.vidstream.shared.email.EmailService;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

import static uk.gegc.vidstream.shared.util.LogMasking.maskEmail;

/**
 * SMTP delivery through Spring's {@link JavaMailSender}. Activated when {@code app.email.provider=smtp}.
 *
 * <p>Delivery failures are logged and never propagated: the password reset flow must answer the
 * same way whether or not an address is registered.
 */
@Slf4j
@Service
@Primary
@ConditionalOnProperty(name = "app.email.provider", havingValue = "smtp")
@RequiredArgsConstructor
public class SmtpEmailService implements EmailService {

    private static final DateTimeFormatter EXPIRY_FORMAT = DateTimeFormatter.ofPattern("d MMM yyyy, HH:mm 'UTC'");

    private final JavaMailSender mailSender;

    @Value("${spring.mail.username:}")
    private String fromEmail;

    @Value("${app.email.password-reset.subject:Reset your VidStream password}")
    private String passwordResetSubject;

    @Value("${app.email.subscription.subject:Your VidStream subscription is active}")
    private String subscriptionSubject;

    @Value("${app.frontend.base-url:http://localhost:3000}")
    private String baseUrl;

    @Value("${app.auth.reset-token-ttl-minutes:60}")
    private long resetTokenTtlMinutes;

    @PostConstruct
    void verifyEmailConfiguration() {
        if (fromEmail == null || fromEmail.isBlank()) {
            log.warn("Email service disabled: spring.mail.username is not configured");
        } else {
            log.info("Email service enabled with sender: {}", fromEmail);
        }
    }

    @Override
    public void sendPasswordResetEmail(String email, String resetToken) {
        String resetUrl = baseUrl + "/reset-password?token=" + URLEncoder.encode(resetToken, StandardCharsets.UTF_8);
        String body = String.format("""
                Hello,

                We received a request to reset the password for your VidStream account.

                To choose a new password, open the following link:
                %s

                The link expires in %d minutes. If you did not request a reset, ignore this email
                and your password will stay unchanged.

                The VidStream Team
                """, resetUrl, resetTokenTtlMinutes);
        send(email, passwordResetSubject, body, "password reset");
    }

    @Override
    public void sendSubscriptionActivatedEmail(String email, String planName, LocalDateTime expiresAt) {
        String until = expiresAt != null ? EXPIRY_FORMAT.format(expiresAt) : "further notice";
        String body = String.format("""
                Hello,

                Thank you for your payment. Your "%s" subscription is active until %s.

                Enjoy watching,
                The VidStream Team
                """, planName, until);
        send(email, subscriptionSubject, body, "subscription confirmation");
    }

    private void send(String to, String subject, String body, String kind) {
        if (fromEmail == null || fromEmail.isBlank()) {
            log.warn("Email service disabled - skipping {} email to: {}", kind, maskEmail(to));
            return;
        }
        try {
            SimpleMailMessage message = new SimpleMailMessage();
            message.setFrom(fromEmail);
            message.setTo(to);
            message.setSubject(subject);
            message.setText(body);
            mailSender.send(message);
            log.info("Sent {} email to: {}", kind, maskEmail(to));
        } catch (MailException e) {
            log.error("Failed to send {} email to: {}", kind, maskEmail(to), e);
        }
    }
}
