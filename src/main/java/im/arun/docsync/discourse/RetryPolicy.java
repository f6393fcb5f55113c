package im.arun.docsync.discourse;

import lombok.Value;

/**
 * Retry budget and exponential backoff for remote calls.
 */
@Value
public class RetryPolicy {
    int maxAttempts;
    long baseBackoffMs;
    long maxBackoffMs;

    public RetryPolicy(int maxAttempts, long baseBackoffMs, long maxBackoffMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (baseBackoffMs < 0 || maxBackoffMs < baseBackoffMs) {
            throw new IllegalArgumentException(String.format(
                    "Invalid backoff bounds: base=%d max=%d", baseBackoffMs, maxBackoffMs));
        }
        this.maxAttempts = maxAttempts;
        this.baseBackoffMs = baseBackoffMs;
        this.maxBackoffMs = maxBackoffMs;
    }

    /**
     * Wait before the next attempt after {@code failedAttempts} failures.
     * A server supplied Retry-After wins over the computed backoff, still capped.
     */
    public long backoffMillis(int failedAttempts, long retryAfterMs) {
        int exponent = Math.min(Math.max(failedAttempts - 1, 0), 30);
        long backoff = Math.min(baseBackoffMs * (1L << exponent), maxBackoffMs);
        if (retryAfterMs > 0) {
            backoff = Math.max(backoff, Math.min(retryAfterMs, maxBackoffMs));
        }
        return backoff;
    }
}
