package uk.gegc.vidstream.shared.email.impl;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.vidstream.shared.email.EmailService;

import java.time.LocalDateTime;

import static uk.gegc.vidstream.shared.util.LogMasking.maskEmail;
import static uk.gegc.vidstream.shared.util.LogMasking.maskToken;

/**
 * Logs e-mail send attempts without delivering anything.
 * Activated when {@code app.email.provider=noop} or the property is absent.
 */
@Slf4j
public class NoopEmailService implements EmailService {

    @Override
    public void sendPasswordResetEmail(String email, String resetToken) {
        log.info("[NOOP] Would send password reset email to: {} with token: {}",
                maskEmail(email), maskToken(resetToken));
    }

    @Override
    public void sendSubscriptionActivatedEmail(String email, String planName, LocalDateTime expiresAt) {
        log.info("[NOOP] Would send subscription confirmation to: {} for plan '{}' (expires {})",
                maskEmail(email), planName, expiresAt);
    }
}
