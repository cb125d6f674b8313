package com.justtrades.unit.broker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.justtrades.broker.BrokerCallPolicy;
import com.justtrades.domain.enums.OrderPurpose;
import com.justtrades.exception.BrokerException;
import com.justtrades.exception.OrderRejectedException;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BrokerCallPolicyTest {

    private static BrokerCallPolicy policy(int permitsPerPeriod) {
        RateLimiterRegistry limiters = RateLimiterRegistry.of(Map.of("brokerToken", RateLimiterConfig.custom()
                .limitForPeriod(permitsPerPeriod)
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .timeoutDuration(Duration.ZERO)
                .build()));
        RetryRegistry retries = RetryRegistry.of(RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .retryExceptions(BrokerException.class)
                .build());
        return new BrokerCallPolicy(limiters, retries);
    }

    @Test
    @DisplayName("Queries are retried on transport failures")
    void query_retried() {
        BrokerCallPolicy policy = policy(10);
        AtomicInteger attempts = new AtomicInteger();

        String result = policy.query("token-a", "queryPosition", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new BrokerException("connection reset");
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(attempts).hasValue(3);
    }

    @Test
    @DisplayName("Submissions are never retried")
    void submit_singleShot() {
        BrokerCallPolicy policy = policy(10);
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> policy.submit("token-a", "placeOrder", false, () -> {
                    attempts.incrementAndGet();
                    throw new BrokerException("read timeout");
                }))
                .isInstanceOf(BrokerException.class);
        assertThat(attempts).hasValue(1);
    }

    @Test
    @DisplayName("Rejections pass through queries without retry")
    void query_rejectionNotRetried() {
        BrokerCallPolicy policy = policy(10);
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> policy.query("token-a", "queryPosition", () -> {
                    attempts.incrementAndGet();
                    throw new OrderRejectedException("MNQZ5", OrderPurpose.ENTRY, "nope");
                }))
                .isInstanceOf(OrderRejectedException.class);
        assertThat(attempts).hasValue(1);
    }

    @Test
    @DisplayName("Submissions over the per-token limit fail fast; emergency submissions skip the limiter")
    void submit_rateLimited() {
        BrokerCallPolicy policy = policy(2);
        policy.submit("token-a", "placeOrder", false, () -> "1");
        policy.submit("token-a", "placeOrder", false, () -> "2");

        assertThatThrownBy(() -> policy.submit("token-a", "placeOrder", false, () -> "3"))
                .isInstanceOf(BrokerException.class)
                .hasMessageContaining("Rate limited");
        assertThat(policy.submit("token-a", "placeOrder", true, () -> "flatten")).isEqualTo("flatten");
    }

    @Test
    @DisplayName("Limiters are per token: accounts on another token are unaffected")
    void limiterPerToken() {
        BrokerCallPolicy policy = policy(1);
        policy.submit("token-a", "placeOrder", false, () -> "1");

        assertThat(policy.submit("token-b", "placeOrder", false, () -> "2")).isEqualTo("2");
        assertThatThrownBy(() -> policy.submit("token-a", "cancelOrder", () -> { }))
                .isInstanceOf(BrokerException.class);
    }
}
