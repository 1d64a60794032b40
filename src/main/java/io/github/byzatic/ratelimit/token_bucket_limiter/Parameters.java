package io.github.byzatic.ratelimit.token_bucket_limiter;

import com.google.errorprone.annotations.Immutable;

import java.time.Duration;
import java.util.Objects;

/**
 * Refill parameters of a {@link TokenBucketLimiter}. Always replaced as a whole so that
 * readers never observe a capacity, amount and interval that were not committed together.
 */
@Immutable
final class Parameters {
    private final long capacity;
    private final long refillAmount;
    private final long refillIntervalNanos;

    Parameters(long capacity, long refillAmount, long refillIntervalNanos) {
        this.capacity = capacity;
        this.refillAmount = refillAmount;
        this.refillIntervalNanos = refillIntervalNanos;
    }

    long capacity() {
        return capacity;
    }

    long refillAmount() {
        return refillAmount;
    }

    long refillIntervalNanos() {
        return refillIntervalNanos;
    }

    Duration refillInterval() {
        return Duration.ofNanos(refillIntervalNanos);
    }

    /**
     * Tokens per second.
     */
    double rate() {
        return refillAmount * 1_000_000_000.0 / refillIntervalNanos;
    }

    Parameters withCapacity(long capacity) {
        return new Parameters(capacity, refillAmount, refillIntervalNanos);
    }

    Parameters withRefillAmount(long refillAmount) {
        return new Parameters(capacity, refillAmount, refillIntervalNanos);
    }

    Parameters withRefillIntervalNanos(long refillIntervalNanos) {
        return new Parameters(capacity, refillAmount, refillIntervalNanos);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Parameters)) return false;
        Parameters that = (Parameters) o;
        return capacity == that.capacity
                && refillAmount == that.refillAmount
                && refillIntervalNanos == that.refillIntervalNanos;
    }

    @Override
    public int hashCode() {
        return Objects.hash(capacity, refillAmount, refillIntervalNanos);
    }

    @Override
    public String toString() {
        return "Parameters{capacity=" + capacity + ", refillAmount=" + refillAmount +
                ", refillInterval=" + refillInterval() + '}';
    }
}
