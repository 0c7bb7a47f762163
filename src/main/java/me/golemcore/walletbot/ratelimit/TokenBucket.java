package me.golemcore.walletbot.ratelimit;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.walletbot.domain.model.RateLimitResult;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Thread-safe token bucket.
 *
 * <p>
 * The bucket starts full with {@code capacity} tokens, refills continuously
 * over {@code refillPeriod} and denies requests when empty, returning the wait
 * time until the next token. Refill is computed lazily on each
 * {@link #tryConsume()} from the time elapsed since the last refill.
 *
 * @since 1.0
 */
public class TokenBucket {

    private final long capacity;
    private final Duration refillPeriod;
    private final LongSupplier nanoTime;
    private long tokens;
    private long lastRefillNanos;
    private long lastUsedNanos;

    public TokenBucket(long capacity, Duration refillPeriod) {
        this(capacity, refillPeriod, System::nanoTime);
    }

    TokenBucket(long capacity, Duration refillPeriod, LongSupplier nanoTime) {
        if (capacity <= 0 || refillPeriod.isZero() || refillPeriod.isNegative()) {
            throw new IllegalArgumentException("Bucket needs positive capacity and refill period");
        }
        this.capacity = capacity;
        this.refillPeriod = refillPeriod;
        this.nanoTime = nanoTime;
        this.tokens = capacity;
        this.lastRefillNanos = nanoTime.getAsLong();
        this.lastUsedNanos = lastRefillNanos;
    }

    /**
     * Try to consume one token.
     */
    public synchronized RateLimitResult tryConsume() {
        refill();
        lastUsedNanos = nanoTime.getAsLong();

        if (tokens > 0) {
            tokens--;
            return RateLimitResult.allowed(tokens);
        }

        return RateLimitResult.denied(calculateWaitTimeMs(), "Rate limit exceeded");
    }

    /**
     * Whether the bucket has been unused for at least {@code idle}; a full,
     * idle bucket can be dropped and recreated without changing behaviour.
     */
    public synchronized boolean isIdleFor(Duration idle) {
        return nanoTime.getAsLong() - lastUsedNanos >= idle.toNanos();
    }

    private void refill() {
        long now = nanoTime.getAsLong();
        long elapsedNanos = now - lastRefillNanos;

        if (elapsedNanos <= 0) {
            return;
        }

        long tokensToAdd = (elapsedNanos * capacity) / refillPeriod.toNanos();

        if (tokensToAdd > 0) {
            tokens = Math.min(capacity, tokens + tokensToAdd);
            lastRefillNanos = now;
        }
    }

    private long calculateWaitTimeMs() {
        long nanosPerToken = refillPeriod.toNanos() / capacity;
        long untilNext = nanosPerToken - (nanoTime.getAsLong() - lastRefillNanos);
        return Math.max(untilNext, 0) / 1_000_000;
    }
}
