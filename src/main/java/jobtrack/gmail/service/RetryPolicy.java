package jobtrack.gmail.service;

import jobtrack.gmail.exception.ProviderUnavailableException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bounded exponential backoff for calls to Google.
 * <p>
 * Only {@link ProviderUnavailableException} is retried. Everything else, including
 * {@link jobtrack.gmail.exception.AuthExpiredException}, propagates on the first occurrence.
 */
@Slf4j
@Getter
public class RetryPolicy {

    /**
     * Pause between attempts. Replaced in tests so retries run instantly.
     */
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final double multiplier;
    private final Duration maxBackoff;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {
        this(maxAttempts, initialBackoff, multiplier, maxBackoff, duration -> Thread.sleep(duration.toMillis()));
    }

    public RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.multiplier = multiplier;
        this.maxBackoff = maxBackoff;
        this.sleeper = sleeper;
    }

    public boolean isRetryable(Throwable error) {
        return error instanceof ProviderUnavailableException;
    }

    /**
     * Delay before the attempt that follows failed attempt number {@code failedAttempt} (1-based).
     */
    public Duration backoffAfter(int failedAttempt) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, failedAttempt - 1);
        long capped = (long) Math.min(millis, maxBackoff.toMillis());
        return Duration.ofMillis(capped);
    }

    /**
     * Runs {@code call}, retrying retryable failures until {@code maxAttempts} is used up.
     * The last failure is rethrown as-is.
     */
    public <T> T execute(String operation, Supplier<T> call) {
        int attempt = 1;
        while (true) {
            try {
                return call.get();
            } catch (RuntimeException e) {
                if (!isRetryable(e) || attempt >= maxAttempts) {
                    throw e;
                }
                Duration delay = backoffAfter(attempt);
                log.warn("{} failed (attempt {}/{}), retrying in {} ms: {}",
                        operation, attempt, maxAttempts, delay.toMillis(), e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw new ProviderUnavailableException(operation + " interrupted while backing off", e);
                }
                attempt++;
            }
        }
    }
}
