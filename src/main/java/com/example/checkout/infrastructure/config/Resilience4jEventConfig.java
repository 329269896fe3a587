package com.example.checkout.infrastructure.config;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;

/**
 * Logs the events of every collaborator time limiter, including limiters created lazily on first use.
 */
@Configuration
public class Resilience4jEventConfig {

    private static final Logger log = LoggerFactory.getLogger(Resilience4jEventConfig.class);

    private final TimeLimiterRegistry timeLimiterRegistry;

    public Resilience4jEventConfig(TimeLimiterRegistry timeLimiterRegistry) {
        this.timeLimiterRegistry = timeLimiterRegistry;
    }

    @PostConstruct
    public void registerEventListeners() {
        timeLimiterRegistry.getAllTimeLimiters().forEach(this::registerTimeLimiterEventListener);
        timeLimiterRegistry.getEventPublisher()
                .onEntryAdded(event -> registerTimeLimiterEventListener(event.getAddedEntry()));
    }

    private void registerTimeLimiterEventListener(TimeLimiter timeLimiter) {
        log.debug("Time limiter {} registered with timeout {}",
                timeLimiter.getName(), timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
        timeLimiter.getEventPublisher()
                .onTimeout(event -> log.warn(
                        "[TIMEOUT] name={}, limit={}",
                        event.getTimeLimiterName(),
                        timeLimiter.getTimeLimiterConfig().getTimeoutDuration()))
                .onSuccess(event -> log.debug(
                        "[TL_SUCCESS] name={}",
                        event.getTimeLimiterName()))
                .onError(event -> log.warn(
                        "[TL_ERROR] name={}, error={}",
                        event.getTimeLimiterName(),
                        event.getThrowable().getMessage()));
    }
}
