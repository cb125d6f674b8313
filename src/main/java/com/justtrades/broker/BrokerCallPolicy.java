package com.justtrades.broker;

import com.justtrades.exception.BrokerException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * The one place that decides how a broker call is retried and rate limited.
 *
 * <ul>
 *   <li><b>Queries</b> (position, orders, fills) are idempotent: rate limited and
 *       retried with exponential backoff on {@link BrokerException}
 *       (Resilience4j retry instance {@code brokerQuery}).</li>
 *   <li><b>Submissions</b> (place, cancel) are single-shot. A transport failure
 *       surfaces to the caller; a duplicate order is worse than a visible failure.</li>
 *   <li><b>Emergency submissions</b> (kill switch) skip the limiter.</li>
 * </ul>
 *
 * <p>Limiters are keyed by a fingerprint of the access token, not by account:
 * the broker throttles per session, so accounts sharing a token share a limiter.
 * Each limiter is created from the {@code brokerToken} config of the registry.
 */
@Component
public class BrokerCallPolicy {

    private static final Logger log = LoggerFactory.getLogger(BrokerCallPolicy.class);

    static final String LIMITER_CONFIG = "brokerToken";
    static final String QUERY_RETRY = "brokerQuery";

    private final RateLimiterRegistry rateLimiterRegistry;
    private final Retry queryRetry;

    public BrokerCallPolicy(RateLimiterRegistry rateLimiterRegistry, RetryRegistry retryRegistry) {
        this.rateLimiterRegistry = rateLimiterRegistry;
        this.queryRetry = retryRegistry.retry(QUERY_RETRY);
    }

    /** Read-only call: rate limited, retried on transport failure. */
    public <T> T query(String accessToken, String operation, Supplier<T> call) {
        RateLimiter limiter = limiterFor(accessToken);
        Supplier<T> limited = () -> {
            acquire(limiter, operation);
            return call.get();
        };
        return Retry.decorateSupplier(queryRetry, limited).get();
    }

    /** Order-placing call: rate limited unless {@code emergency}, never retried. */
    public <T> T submit(String accessToken, String operation, boolean emergency, Supplier<T> call) {
        if (!emergency) {
            acquire(limiterFor(accessToken), operation);
        }
        return call.get();
    }

    /** Order-placing call with no result. */
    public void submit(String accessToken, String operation, Runnable call) {
        submit(accessToken, operation, false, () -> {
            call.run();
            return null;
        });
    }

    RateLimiter limiterFor(String accessToken) {
        return rateLimiterRegistry.rateLimiter("token-" + fingerprint(accessToken), LIMITER_CONFIG);
    }

    private void acquire(RateLimiter limiter, String operation) {
        if (!limiter.acquirePermission()) {
            log.warn("Rate limit wait exceeded for {} on {}", operation, limiter.getName());
            throw new BrokerException("Rate limited: " + operation);
        }
    }

    /** Short, non-reversible token id so limiter names and logs never carry the token. */
    static String fingerprint(String accessToken) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(String.valueOf(accessToken).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, 12);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
