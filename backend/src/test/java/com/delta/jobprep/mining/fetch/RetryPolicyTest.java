package com.delta.jobprep.mining.fetch;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void emptyResultsAreRetriedLikeFailures() {
        List<Duration> sleeps = new ArrayList<>();
        RetryPolicy policy = RetryPolicy.ofMillis(List.of(10, 20, 30), sleeps::add);
        AtomicInteger calls = new AtomicInteger();

        Optional<String> result = policy.execute("job", attempt -> {
            calls.incrementAndGet();
            return attempt == 3 ? Optional.of("done") : Optional.empty();
        });

        assertThat(result).contains("done");
        assertThat(calls.get()).isEqualTo(3);
        assertThat(sleeps).containsExactly(Duration.ofMillis(10), Duration.ofMillis(20));
    }

    @Test
    void interruptStopsRetryingAndKeepsFlag() {
        RetryPolicy policy = RetryPolicy.ofMillis(List.of(10, 20), duration -> {
            throw new InterruptedException("stop");
        });
        AtomicInteger calls = new AtomicInteger();

        Optional<String> result = policy.execute("job", attempt -> {
            calls.incrementAndGet();
            throw new IllegalStateException("boom");
        });

        assertThat(result).isEmpty();
        assertThat(calls.get()).isEqualTo(1);
        assertThat(Thread.interrupted()).isTrue();
    }

    @Test
    void requiresAtLeastOneAttempt() {
        assertThatThrownBy(() -> new RetryPolicy(List.of(), Sleeper.SYSTEM))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
