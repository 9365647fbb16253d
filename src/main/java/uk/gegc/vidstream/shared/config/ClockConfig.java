package uk.gegc.vidstream.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;

/**
 * Single source of time for the application.
 *
 * <p>Token expiry, subscription expiry and reset-token lifetimes are all compared against this
 * clock, so every stored timestamp is UTC. Tests construct services with {@link Clock#fixed}.
 */
@Configuration
public class ClockConfig {

    @Bean("utcClock")
    @Primary
    public Clock utcClock() {
        return Clock.systemUTC();
    }
}
