package io.github.byzatic.ratelimit.token_bucket_limiter;

import com.google.common.base.Ticker;
import com.google.common.math.LongMath;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A lock-free token-bucket rate limiter that can be shared between threads.
 * <p>
 * Adds {@code refillAmount} tokens after every elapsed {@code refillInterval}, holding at most
 * {@code maxTokens} tokens at once. There is no background thread: refill is computed lazily on
 * each acquisition attempt, collapsing any number of elapsed intervals into a single update.
 *
 * <h3>Algorithm</h3>
 * <ul>
 *   <li>Every {@link #tryWait(long)} first refills: if the scheduled refill tick has passed, the
 *       refill clock is advanced by a whole number of intervals with a compare-and-swap. Only the
 *       thread that wins that CAS credits the tokens for those intervals.</li>
 *   <li>Tokens that do not fit under {@code maxTokens} are counted in {@link #dropped()}.</li>
 *   <li>The requested tokens are then subtracted with a CAS retry loop. If not enough tokens are
 *       available the call returns immediately with a hint of how long to wait.</li>
 * </ul>
 *
 * <h3>Thread-safety</h3>
 * <ul>
 *   <li>The token balance, refill clock and dropped counter are independent atomics.</li>
 *   <li>Capacity, refill amount and refill interval are read and replaced together under a
 *       read-write lock. Acquisition never takes the write lock.</li>
 * </ul>
 *
 * <h3>Example</h3>
 * <pre>{@code
 * // 1000 tokens/hour, all usable in a single burst
 * TokenBucketLimiter limiter = TokenBucketLimiter.builder(1000, Duration.ofHours(1))
 *         .maxTokens(1000)
 *         .initialAvailable(1000)
 *         .build();
 *
 * WaitResult result = limiter.tryWait();
 * if (!result.isAcquired()) {
 *     Thread.sleep(result.retryAfter().toMillis());
 * }
 * }</pre>
 *
 * In practice the clock resolution puts a lower bound on the interval. For rates beyond a million
 * tokens per second prefer an interval of at least a microsecond with several tokens per refill.
 */
@ThreadSafe
public final class TokenBucketLimiter implements Limiter {
    private final static Logger logger = LoggerFactory.getLogger(TokenBucketLimiter.class);

    // refill() result when tokens were credited; any other result is the nanos until the next refill
    private static final long REFILLED = 0L;

    private final Ticker ticker;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    @GuardedBy("lock") private Parameters parameters;

    private final AtomicLong available;
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong refillAt;

    private TokenBucketLimiter(Builder b, long refillIntervalNanos) {
        this.ticker = b.ticker;
        this.parameters = new Parameters(b.maxTokens, b.refillAmount, refillIntervalNanos);
        this.available = new AtomicLong(b.initialAvailable);
        logger.debug("Creating limiter: {}, initialAvailable= {}", parameters, b.initialAvailable);
        // last step: the first refill is due one full interval after the limiter is handed out
        this.refillAt = new AtomicLong(ticker.read() + refillIntervalNanos);
    }

    /**
     * Starts a builder for a limiter that adds {@code amount} tokens after each {@code interval}.
     *
     * @param amount   tokens added per refill, must be &gt;= 0
     * @param interval time between refills, must be positive
     */
    public static @NotNull Builder builder(long amount, @NotNull Duration interval) {
        return new Builder(amount, interval);
    }

    public static final class Builder {
        private final long refillAmount;
        private final Duration refillInterval;
        private long maxTokens = 1;
        private long initialAvailable = 0;
        private Ticker ticker = Ticker.systemTicker();

        private Builder(long refillAmount, Duration refillInterval) {
            this.refillAmount = requireNonNegative(refillAmount, "refill amount");
            this.refillInterval = Objects.requireNonNull(refillInterval, "refillInterval");
        }

        /**
         * Upper bound on tokens held at once, i.e. the burst size. Defaults to one, which
         * prohibits bursts. Must not be lower than the refill amount.
         */
        public Builder maxTokens(long tokens) {
            this.maxTokens = requireNonNegative(tokens, "max tokens");
            return this;
        }

        /**
         * Tokens available right after construction. Defaults to zero, so that a restarted
         * process cannot exceed the configured rate.
         */
        public Builder initialAvailable(long tokens) {
            this.initialAvailable = requireNonNegative(tokens, "initial available");
            return this;
        }

        /**
         * Time source, {@link Ticker#systemTicker()} unless replaced.
         */
        public Builder ticker(@NotNull Ticker ticker) {
            this.ticker = Objects.requireNonNull(ticker, "ticker");
            return this;
        }

        public TokenBucketLimiter build() throws LimiterConfigurationException {
            if (maxTokens < refillAmount) {
                throw new LimiterConfigurationException(ConfigurationError.MAX_TOKENS_TOO_LOW,
                        "max tokens " + maxTokens + " < refill amount " + refillAmount);
            }
            return new TokenBucketLimiter(this, toNanos(refillInterval));
        }
    }

    // ======== Parameters ========

    /**
     * Current effective rate in tokens per second.
     */
    public double rate() {
        return parameters().rate();
    }

    public @NotNull Duration refillInterval() {
        return parameters().refillInterval();
    }

    /**
     * Changes the interval between refills. Applies from the next scheduled refill on; the
     * refill already scheduled is not moved.
     */
    public void setRefillInterval(@NotNull Duration interval) throws LimiterConfigurationException {
        long nanos = toNanos(interval);
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            parameters = parameters.withRefillIntervalNanos(nanos);
        } finally {
            writeLock.unlock();
        }
        logger.debug("Refill interval set to {}", interval);
    }

    public long refillAmount() {
        return parameters().refillAmount();
    }

    public void setRefillAmount(long amount) throws LimiterConfigurationException {
        requireNonNegative(amount, "refill amount");
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            if (amount > parameters.capacity()) {
                logger.debug("Rejected refill amount {} above max tokens {}", amount, parameters.capacity());
                throw new LimiterConfigurationException(ConfigurationError.REFILL_AMOUNT_TOO_HIGH,
                        "refill amount " + amount + " > max tokens " + parameters.capacity());
            }
            parameters = parameters.withRefillAmount(amount);
        } finally {
            writeLock.unlock();
        }
        logger.debug("Refill amount set to {}", amount);
    }

    public long maxTokens() {
        return parameters().capacity();
    }

    /**
     * Changes the burst size. Must not be lower than the refill amount.
     * <p>
     * Raising the capacity raises the available tokens to the new ceiling, so the extra room is
     * usable at once. Lowering it clamps the available tokens down to the new ceiling.
     */
    public void setMaxTokens(long amount) throws LimiterConfigurationException {
        requireNonNegative(amount, "max tokens");
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            if (amount < parameters.refillAmount()) {
                logger.debug("Rejected max tokens {} below refill amount {}", amount, parameters.refillAmount());
                throw new LimiterConfigurationException(ConfigurationError.MAX_TOKENS_TOO_LOW,
                        "max tokens " + amount + " < refill amount " + parameters.refillAmount());
            }
            long previous = parameters.capacity();
            parameters = parameters.withCapacity(amount);

            // Refill, returns and explicit sets are excluded by the write lock; acquirers only lower the balance.
            if (amount > previous) {
                available.updateAndGet(current -> Math.max(current, amount));
            } else if (amount < previous) {
                available.updateAndGet(current -> Math.min(current, amount));
            }
        } finally {
            writeLock.unlock();
        }
        logger.debug("Max tokens set to {}", amount);
    }

    // ======== State ========

    /**
     * Number of tokens currently available. Does not trigger a refill.
     */
    public long available() {
        return available.get();
    }

    /**
     * Overwrites the number of available tokens.
     *
     * @throws LimiterConfigurationException with {@link ConfigurationError#AVAILABLE_TOKENS_TOO_HIGH}
     *                                       if {@code amount} exceeds the max tokens
     */
    public void setAvailable(long amount) throws LimiterConfigurationException {
        requireNonNegative(amount, "available");
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            if (amount > parameters.capacity()) {
                logger.debug("Rejected available {} above max tokens {}", amount, parameters.capacity());
                throw new LimiterConfigurationException(ConfigurationError.AVAILABLE_TOKENS_TOO_HIGH,
                        "available " + amount + " > max tokens " + parameters.capacity());
            }
            available.set(amount);
        } finally {
            readLock.unlock();
        }
        logger.debug("Available tokens set to {}", amount);
    }

    /**
     * Tick of the next scheduled refill, on the time base of the limiter's {@link Ticker}.
     */
    public long nextRefill() {
        return refillAt.get();
    }

    /**
     * Time left until the next scheduled refill, {@link Duration#ZERO} if one is already due.
     */
    public @NotNull Duration untilNextRefill() {
        long remaining = refillAt.get() - ticker.read();
        return remaining > 0 ? Duration.ofNanos(remaining) : Duration.ZERO;
    }

    /**
     * Number of tokens discarded so far because the bucket was full at refill time.
     */
    public long dropped() {
        return dropped.get();
    }

    /**
     * Gives back tokens, for example for an operation that was charged but did not happen.
     * The balance never goes above the max tokens.
     */
    public void returnTokens(long tokens) {
        requireNonNegative(tokens, "tokens");
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            long capacity = parameters.capacity();
            available.updateAndGet(current -> Math.min(LongMath.saturatedAdd(current, tokens), capacity));
        } finally {
            readLock.unlock();
        }
    }

    // ======== Acquisition ========

    /**
     * Non-blocking attempt to take {@code permits} tokens. On success the tokens are taken. On
     * failure nothing is taken and the result carries a hint of when to try again.
     */
    @Override
    public @NotNull WaitResult tryWait(long permits) {
        requireNonNegative(permits, "permits");
        while (true) {
            long untilRefill = refill(ticker.read());

            while (true) {
                long current = available.get();

                if (current == 0) {
                    if (untilRefill == REFILLED) {
                        // another caller took the fresh tokens first
                        break;
                    }
                    Parameters p = parameters();
                    return WaitResult.rejected(scale(untilRefill, refillCycles(permits, p)));
                }

                if (current >= permits) {
                    if (available.compareAndSet(current, current - permits)) {
                        return WaitResult.acquired();
                    }
                } else {
                    Parameters p = parameters();
                    long shortfall = permits - current;
                    return WaitResult.rejected(scale(p.refillIntervalNanos(), refillCycles(shortfall, p)));
                }
            }
        }
    }

    /**
     * Credits every refill interval elapsed by {@code now}.
     *
     * @return {@link #REFILLED} if tokens were credited, otherwise the nanos until the next refill
     */
    private long refill(long now) {
        while (true) {
            long due = refillAt.get();
            if (now - due < 0) {
                return due - now;
            }

            Lock readLock = lock.readLock();
            readLock.lock();
            try {
                long interval = parameters.refillIntervalNanos();
                long intervals = (now - due) / interval + 1;
                long next = due + intervals * interval;

                if (refillAt.compareAndSet(due, next)) {
                    long amount = LongMath.saturatedMultiply(intervals, parameters.refillAmount());
                    if (amount == 0) {
                        return next - now;
                    }
                    credit(amount, parameters.capacity(), intervals);
                    return REFILLED;
                }
            } finally {
                readLock.unlock();
            }
        }
    }

    @GuardedBy("lock")
    private void credit(long amount, long capacity, long intervals) {
        while (true) {
            long current = available.get();
            // initialAvailable is not validated, so the balance may start above capacity
            long added = Math.max(0, Math.min(amount, capacity - current));
            if (available.compareAndSet(current, current + added)) {
                long overflow = amount - added;
                if (overflow > 0) {
                    dropped.addAndGet(overflow);
                }
                if (logger.isTraceEnabled()) {
                    logger.trace("Refilled {} interval(s): added= {}, dropped= {}", intervals, added, overflow);
                }
                return;
            }
        }
    }

    // ======== Internals ========

    private Parameters parameters() {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return parameters;
        } finally {
            readLock.unlock();
        }
    }

    // Integer division: a shortfall below one refill yields a zero hint.
    private static long refillCycles(long tokens, Parameters p) {
        return p.refillAmount() == 0 ? 1 : tokens / p.refillAmount();
    }

    private static Duration scale(long nanos, long cycles) {
        return Duration.ofNanos(LongMath.saturatedMultiply(nanos, cycles));
    }

    private static long toNanos(Duration interval) throws LimiterConfigurationException {
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("refill interval must be positive, got " + interval);
        }
        try {
            return interval.toNanos();
        } catch (ArithmeticException e) {
            throw new LimiterConfigurationException(ConfigurationError.REFILL_INTERVAL_TOO_LONG, e);
        }
    }

    private static long requireNonNegative(long value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must be >= 0, got " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return "TokenBucketLimiter{" + parameters() + ", available=" + available.get() +
                ", dropped=" + dropped.get() + ", nextRefill=" + refillAt.get() + '}';
    }
}
