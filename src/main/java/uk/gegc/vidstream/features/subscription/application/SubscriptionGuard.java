package uk.gegc.vidstream.features.subscription.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import uk.gegc.vidstream.features.subscription.domain.exception.SubscriptionRequiredException;
import uk.gegc.vidstream.features.user.domain.model.User;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Decides whether a resolved user may reach subscription-gated content.
 *
 * <p>A user is entitled when subscribed and the expiry is either absent or still in the future.
 * The decision only reads the user row and the clock.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SubscriptionGuard {

    static final String SUBSCRIPTION_REQUIRED = "Active subscription required";

    @Qualifier("utcClock")
    private final Clock utcClock;

    public boolean isEntitled(User user) {
        return stateOf(user) == SubscriptionState.ACTIVE;
    }

    public SubscriptionState stateOf(User user) {
        if (!user.isSubscribed()) {
            return SubscriptionState.UNSUBSCRIBED;
        }
        LocalDateTime expiry = user.getSubscriptionExpiry();
        if (expiry == null || expiry.isAfter(LocalDateTime.now(utcClock))) {
            return SubscriptionState.ACTIVE;
        }
        return SubscriptionState.LAPSED;
    }

    /**
     * @return the same user, for chaining at call sites
     * @throws SubscriptionRequiredException when the user is unsubscribed or lapsed
     */
    public User requireActiveSubscription(User user) {
        SubscriptionState state = stateOf(user);
        if (state != SubscriptionState.ACTIVE) {
            log.debug("Subscription check failed for user {}: {}", user.getId(), state);
            throw new SubscriptionRequiredException(SUBSCRIPTION_REQUIRED);
        }
        return user;
    }
}
