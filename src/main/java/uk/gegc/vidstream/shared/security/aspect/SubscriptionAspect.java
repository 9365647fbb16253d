package uk.gegc.vidstream.shared.security.aspect;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.JoinPoint;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Before;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import uk.gegc.vidstream.features.auth.domain.exception.CredentialsInvalidException;
import uk.gegc.vidstream.features.auth.infra.security.UserPrincipal;
import uk.gegc.vidstream.features.subscription.application.SubscriptionGuard;

@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class SubscriptionAspect {

    private final SubscriptionGuard subscriptionGuard;

    @Before("@annotation(uk.gegc.vidstream.shared.security.annotation.RequireActiveSubscription)"
            + " || @within(uk.gegc.vidstream.shared.security.annotation.RequireActiveSubscription)")
    public void checkSubscription(JoinPoint joinPoint) {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof UserPrincipal principal)) {
            log.warn("Subscription check on {} without an authenticated user", joinPoint.getSignature().toShortString());
            throw new CredentialsInvalidException("Could not validate credentials");
        }
        subscriptionGuard.requireActiveSubscription(principal.getUser());
    }
}
