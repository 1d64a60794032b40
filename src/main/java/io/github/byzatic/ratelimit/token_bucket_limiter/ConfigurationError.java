package io.github.byzatic.ratelimit.token_bucket_limiter;

/**
 * Reasons a limiter configuration change (or {@link TokenBucketLimiter.Builder#build()}) is rejected.
 */
public enum ConfigurationError {
    AVAILABLE_TOKENS_TOO_HIGH,
    MAX_TOKENS_TOO_LOW,
    REFILL_AMOUNT_TOO_HIGH,
    REFILL_INTERVAL_TOO_LONG;

    public String message() {
        return switch (this) {
            case AVAILABLE_TOKENS_TOO_HIGH -> "available tokens cannot be set higher than max tokens";
            case MAX_TOKENS_TOO_LOW -> "max tokens cannot be less than the refill amount";
            case REFILL_AMOUNT_TOO_HIGH -> "refill amount cannot exceed the max tokens";
            case REFILL_INTERVAL_TOO_LONG -> "refill interval in nanoseconds exceeds maximum 64-bit value";
        };
    }
}
