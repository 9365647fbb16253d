package uk.gegc.vidstream.shared.email;

import java.time.LocalDateTime;

public interface EmailService {
    void sendPasswordResetEmail(String email, String resetToken);

    void sendSubscriptionActivatedEmail(String email, String planName, LocalDateTime expiresAt);
}
