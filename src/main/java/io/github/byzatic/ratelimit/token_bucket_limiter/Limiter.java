package io.github.byzatic.ratelimit.token_bucket_limiter;


import org.jetbrains.annotations.NotNull;

/**
 * Non-blocking rate limiter contract.
 * <p>
 * A call to {@link #tryWait(long)} attempts to consume permits and returns immediately.
 * Implementations should be thread-safe unless explicitly stated otherwise.
 *
 * <h3>Semantics</h3>
 * <ul>
 *   <li>Non-blocking: never sleeps or waits. A rejected attempt reports a hint of how long
 *       the caller may want to wait; how (or whether) to wait is up to the caller.</li>
 *   <li>All-or-nothing: either every requested permit is taken or none is.</li>
 *   <li>Fairness is not guaranteed unless specified by the implementation.</li>
 * </ul>
 */
public interface Limiter {
    /**
     * Attempts to acquire {@code permits} permits.
     *
     * @param permits number of permits, must be &gt;= 0
     * @return an acquired result, or a rejected one carrying a retry hint
     */
    @NotNull WaitResult tryWait(long permits);

    /**
     * Attempts to acquire a single permit.
     */
    default @NotNull WaitResult tryWait() {
        return tryWait(1);
    }

    /**
     * Attempts to acquire a single permit.
     *
     * @return {@code true} if a permit was acquired and the caller may proceed;
     *         {@code false} otherwise.
     */
    default boolean tryAcquire() {
        return tryWait().isAcquired();
    }
}
