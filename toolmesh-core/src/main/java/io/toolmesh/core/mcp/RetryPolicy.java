package io.toolmesh.core.mcp;

// maxAttempts includes the first attempt.
public record RetryPolicy(int maxAttempts, long initialDelayMs, double multiplier, long maxDelayMs) {

    public RetryPolicy {
        maxAttempts = Math.max(1, maxAttempts);
        initialDelayMs = Math.max(0, initialDelayMs);
        multiplier = multiplier < 1.0 ? 1.0 : multiplier;
        maxDelayMs = Math.max(initialDelayMs, maxDelayMs);
    }

    public static RetryPolicy none() {
        return new RetryPolicy(1, 0, 1.0, 0);
    }

    public static RetryPolicy fixed(int maxAttempts, long delayMs) {
        return new RetryPolicy(maxAttempts, delayMs, 1.0, delayMs);
    }

    public static RetryPolicy backoff(int maxAttempts, long initialDelayMs, long maxDelayMs) {
        return new RetryPolicy(maxAttempts, initialDelayMs, 2.0, maxDelayMs);
    }

    public long delayBeforeAttempt(int attempt) {
        if (attempt <= 1) {
            return 0;
        }
        double delay = initialDelayMs * Math.pow(multiplier, attempt - 2);
        return (long) Math.min(delay, maxDelayMs);
    }
}
