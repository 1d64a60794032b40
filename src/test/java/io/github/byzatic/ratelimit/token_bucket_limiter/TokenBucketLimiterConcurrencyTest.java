package io.github.byzatic.ratelimit.token_bucket_limiter;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class TokenBucketLimiterConcurrencyTest {

    private static final int THREADS = 8;

    ExecutorService executor;

    @AfterEach
    void tearDown() throws Exception {
        if (executor != null) {
            executor.shutdownNow();
            assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void concurrentAcquirers_neverCreditARefillTwice() throws Exception {
        long interval = 20_000;
        TokenBucketLimiter limiter = TokenBucketLimiter.builder(3, Duration.ofNanos(interval))
                .maxTokens(5)
                .initialAvailable(5)
                .build();
        long firstRefill = limiter.nextRefill();

        executor = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        AtomicLong acquired = new AtomicLong();
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < THREADS; t++) {
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < 20_000; i++) {
                    long permits = 1 + (i % 2);
                    if (limiter.tryWait(permits).isAcquired()) {
                        acquired.addAndGet(permits);
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);

        // every token ever credited was either taken, is still held or was dropped
        long credited = (limiter.nextRefill() - firstRefill) / interval * 3;
        assertEquals(5 + credited, acquired.get() + limiter.available() + limiter.dropped(), limiter.toString());
        assertTrue(limiter.available() <= limiter.maxTokens());
    }

    @Test
    void concurrentCapacityChanges_keepBalanceWithinMaxTokens() throws Exception {
        TokenBucketLimiter limiter = TokenBucketLimiter.builder(1, Duration.ofNanos(5_000))
                .maxTokens(2)
                .build();

        executor = Executors.newFixedThreadPool(THREADS + 2);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean running = new AtomicBoolean(true);
        AtomicInteger violations = new AtomicInteger();
        List<Future<?>> workers = new ArrayList<>();

        for (int t = 0; t < THREADS; t++) {
            int id = t;
            workers.add(executor.submit(() -> {
                start.await();
                while (running.get()) {
                    WaitResult result = limiter.tryWait(1 + id % 3);
                    if (result.isAcquired() && id % 2 == 0) {
                        limiter.returnTokens(1 + id % 3);
                    }
                    if (limiter.available() > 8) violations.incrementAndGet();
                }
                return null;
            }));
        }

        // only this task changes the capacity, so right after a change the ceiling is known
        Future<?> resizer = executor.submit(() -> {
            start.await();
            for (int i = 0; i < 300; i++) {
                limiter.setMaxTokens(8);
                if (limiter.available() > 8) violations.incrementAndGet();
                limiter.setMaxTokens(2);
                if (limiter.available() > 2) violations.incrementAndGet();
            }
            return null;
        });

        start.countDown();
        resizer.get(30, TimeUnit.SECONDS);
        running.set(false);
        for (Future<?> f : workers) f.get(30, TimeUnit.SECONDS);

        assertEquals(0, violations.get());
        assertEquals(2, limiter.maxTokens());
        assertTrue(limiter.available() >= 0 && limiter.available() <= 2, limiter.toString());
    }

    @Test
    void dropped_isMonotonicUnderContention() throws Exception {
        TokenBucketLimiter limiter = TokenBucketLimiter.builder(1, Duration.ofNanos(1_000)).build();

        executor = Executors.newFixedThreadPool(THREADS + 1);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean running = new AtomicBoolean(true);
        List<Future<?>> workers = new ArrayList<>();
        for (int t = 0; t < THREADS; t++) {
            workers.add(executor.submit(() -> {
                start.await();
                while (running.get()) {
                    limiter.tryAcquire();
                    Thread.onSpinWait();
                }
                return null;
            }));
        }

        Future<Boolean> observer = executor.submit(() -> {
            start.await();
            long last = 0;
            long end = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(100);
            while (System.nanoTime() - end < 0) {
                long now = limiter.dropped();
                if (now < last) return false;
                last = now;
            }
            return true;
        });

        start.countDown();
        assertTrue(observer.get(30, TimeUnit.SECONDS), "dropped() went backwards");
        running.set(false);
        for (Future<?> f : workers) f.get(30, TimeUnit.SECONDS);
    }
}
