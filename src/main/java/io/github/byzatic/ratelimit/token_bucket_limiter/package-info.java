/**
 * Token-bucket rate limiting that can be shared between threads without a background timer.
 * <p>
 * {@link io.github.byzatic.ratelimit.token_bucket_limiter.TokenBucketLimiter} never blocks: a
 * rejected attempt returns a {@link io.github.byzatic.ratelimit.token_bucket_limiter.WaitResult}
 * with a retry hint and the caller picks the waiting strategy.
 *
 * <pre>{@code
 * // 1 token/s with no burst: a steady rate of requests
 * TokenBucketLimiter steady = TokenBucketLimiter.builder(1, Duration.ofSeconds(1)).build();
 *
 * // 50 million tokens/s, no more than 50 in any 1 microsecond window
 * TokenBucketLimiter fast = TokenBucketLimiter.builder(50, Duration.ofNanos(1_000))
 *         .maxTokens(50)
 *         .build();
 *
 * // 100 tokens/s, simple sleep-wait
 * TokenBucketLimiter limiter = TokenBucketLimiter.builder(1, Duration.ofMillis(10)).build();
 * for (int i = 0; i < 10; ) {
 *     WaitResult result = limiter.tryWait();
 *     if (!result.isAcquired()) {
 *         Thread.sleep(result.retryAfter().toMillis());
 *         continue;
 *     }
 *     i++;
 *     // do some rate limited action here
 * }
 * }</pre>
 */
package io.github.byzatic.ratelimit.token_bucket_limiter;
