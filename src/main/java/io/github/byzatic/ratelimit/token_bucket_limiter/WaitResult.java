package io.github.byzatic.ratelimit.token_bucket_limiter;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of a non-blocking acquisition attempt.
 * <p>
 * A rejected result carries a best-effort hint of how long to wait before retrying. The hint is
 * advisory: a retry after waiting that long is more likely to succeed, not guaranteed to.
 */
public final class WaitResult {
    private static final WaitResult ACQUIRED = new WaitResult(true, Duration.ZERO);

    private final boolean acquired;
    private final Duration retryAfter;

    private WaitResult(boolean acquired, Duration retryAfter) {
        this.acquired = acquired;
        this.retryAfter = retryAfter;
    }

    public static @NotNull WaitResult acquired() {
        return ACQUIRED;
    }

    public static @NotNull WaitResult rejected(@NotNull Duration retryAfter) {
        Objects.requireNonNull(retryAfter, "retryAfter");
        if (retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter must not be negative");
        }
        return new WaitResult(false, retryAfter);
    }

    public boolean isAcquired() {
        return acquired;
    }

    /**
     * @return suggested wait before the next attempt; {@link Duration#ZERO} for an acquired result
     */
    public @NotNull Duration retryAfter() {
        return retryAfter;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WaitResult)) return false;
        WaitResult that = (WaitResult) o;
        return acquired == that.acquired && retryAfter.equals(that.retryAfter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(acquired, retryAfter);
    }

    @Override
    public String toString() {
        return acquired ? "WaitResult{acquired}" : "WaitResult{rejected, retryAfter=" + retryAfter + '}';
    }
}
