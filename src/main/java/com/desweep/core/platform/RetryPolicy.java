package com.desweep.core.platform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.function.Predicate;

/**
 * Retry rules shared by every platform call site.
 *
 * <p>A failed call is retried while {@code retryable} accepts the failure and fewer
 * than {@code maxRetries} retries have been made. The delay before retry {@code n}
 * (0-based) is {@code baseDelay * 2^n}, unless the failure carries a server
 * "retry after" hint and {@code respectRetryAfter} is set.
 */
public final class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    /** Sleeps between attempts; replaced in tests. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    public static final Predicate<Throwable> TRANSIENT_ONLY = t -> t instanceof TransientNetworkException;

    private final int maxRetries;
    private final Duration baseDelay;
    private final boolean respectRetryAfter;
    private final Predicate<Throwable> retryable;
    private final Sleeper sleeper;

    public RetryPolicy(int maxRetries, Duration baseDelay, boolean respectRetryAfter,
                       Predicate<Throwable> retryable, Sleeper sleeper) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
        this.respectRetryAfter = respectRetryAfter;
        this.retryable = retryable;
        this.sleeper = sleeper;
    }

    public static RetryPolicy defaults() {
        return from(new PlatformProperties.Retry());
    }

    public static RetryPolicy from(PlatformProperties.Retry retry) {
        return new RetryPolicy(retry.getMaxRetries(), Duration.ofMillis(retry.getBaseDelayMs()),
                retry.isRespectRetryAfter(), TRANSIENT_ONLY, d -> Thread.sleep(d.toMillis()));
    }

    public RetryPolicy withSleeper(Sleeper sleeper) {
        return new RetryPolicy(maxRetries, baseDelay, respectRetryAfter, retryable, sleeper);
    }

    public int maxRetries() {
        return maxRetries;
    }

    /**
     * Runs {@code call}, retrying per this policy.
     *
     * @param operation description used in log lines, e.g. "GET /automation/v1/automations"
     * @return the first successful result
     * @throws RuntimeException the last failure, unwrapped when it is unchecked
     */
    public <T> T execute(String operation, Callable<T> call) {
        int retry = 0;
        while (true) {
            try {
                return call.call();
            } catch (Exception e) {
                if (retry >= maxRetries || !retryable.test(e)) {
                    throw propagate(operation, e);
                }
                Duration delay = delayFor(retry, e);
                log.warn("{} failed ({}), retrying in {}ms (attempt {}/{})",
                        operation, e.getMessage(), delay.toMillis(), retry + 1, maxRetries);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new PlatformApiException("Interrupted while waiting to retry " + operation, ie);
                }
                retry++;
            }
        }
    }

    Duration delayFor(int retry, Throwable failure) {
        if (respectRetryAfter && failure instanceof TransientNetworkException transientFailure
                && transientFailure.getRetryAfter().isPresent()) {
            return transientFailure.getRetryAfter().get();
        }
        return baseDelay.multipliedBy(1L << retry);
    }

    private static RuntimeException propagate(String operation, Exception e) {
        if (e instanceof RuntimeException runtime) {
            return runtime;
        }
        return new PlatformApiException(operation + " failed: " + e.getMessage(), e);
    }
}
