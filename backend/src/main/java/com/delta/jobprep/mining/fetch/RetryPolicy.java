package com.delta.jobprep.mining.fetch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Fixed delay-table retry. One attempt per table entry; a failed attempt (exception or empty
 * result) is followed by that entry's delay.
 */
public class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final List<Duration> delays;
    private final Sleeper sleeper;

    public RetryPolicy(List<Duration> delays, Sleeper sleeper) {
        if (delays == null || delays.isEmpty()) {
            throw new IllegalArgumentException("delays must contain at least one entry");
        }
        this.delays = List.copyOf(delays);
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
    }

    public static RetryPolicy ofMillis(List<Integer> delaysMs, Sleeper sleeper) {
        List<Duration> delays = delaysMs.stream()
            .map(ms -> Duration.ofMillis(Math.max(0, ms)))
            .toList();
        return new RetryPolicy(delays, sleeper);
    }

    public int maxAttempts() {
        return delays.size();
    }

    public <T> Optional<T> execute(String label, Attempt<T> attempt) {
        for (int i = 0; i < delays.size(); i++) {
            int attemptNumber = i + 1;
            try {
                Optional<T> result = attempt.run(attemptNumber);
                if (result != null && result.isPresent()) {
                    return result;
                }
                log.warn("Attempt {}/{} for {} produced no result", attemptNumber, delays.size(), label);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Attempt {}/{} for {} interrupted", attemptNumber, delays.size(), label);
                return Optional.empty();
            } catch (Exception e) {
                log.warn("Attempt {}/{} failed for {}: {}", attemptNumber, delays.size(), label, e.getMessage());
            }
            if (!pause(delays.get(i))) {
                return Optional.empty();
            }
        }
        log.warn("All {} attempts failed for {}", delays.size(), label);
        return Optional.empty();
    }

    private boolean pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @FunctionalInterface
    public interface Attempt<T> {
        Optional<T> run(int attemptNumber) throws Exception;
    }
}
