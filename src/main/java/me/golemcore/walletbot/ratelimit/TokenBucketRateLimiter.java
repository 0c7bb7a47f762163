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
import me.golemcore.walletbot.infrastructure.config.BotProperties;
import me.golemcore.walletbot.port.outbound.RateLimitPort;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Token bucket based rate limiter with per-user buckets.
 *
 * <p>
 * Implements {@link RateLimitPort} with two buckets per user:
 * <ul>
 * <li><b>Events</b> - chat events per window (default 5 per 5 s)</li>
 * <li><b>PIN attempts</b> - security PIN guesses per window (default 3 per 5
 * min)</li>
 * </ul>
 *
 * <p>
 * Can be disabled via {@code bot.rate-limit.enabled=false}.
 *
 * @since 1.0
 * @see TokenBucket
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TokenBucketRateLimiter implements RateLimitPort {

    private static final Duration EVICT_AFTER = Duration.ofMinutes(30);

    private final BotProperties properties;

    private final Map<String, TokenBucket> buckets = new ConcurrentHashMap<>();

    private ScheduledExecutorService evictionExecutor;

    @PostConstruct
    public void init() {
        evictionExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "rate-limit-eviction");
            t.setDaemon(true);
            return t;
        });
        evictionExecutor.scheduleAtFixedRate(this::evictIdleBuckets, 10, 10, TimeUnit.MINUTES);
    }

    @PreDestroy
    public void destroy() {
        if (evictionExecutor != null) {
            evictionExecutor.shutdownNow();
            try {
                evictionExecutor.awaitTermination(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public RateLimitResult tryConsume(String userId) {
        BotProperties.RateLimitProperties config = properties.getRateLimit();
        if (!config.isEnabled()) {
            return RateLimitResult.allowed(Long.MAX_VALUE);
        }
        return resolveBucket("user:" + userId, config.getRequestsPerWindow(), config.getWindow()).tryConsume();
    }

    @Override
    public RateLimitResult tryConsumePinAttempt(String userId) {
        BotProperties.RateLimitProperties config = properties.getRateLimit();
        if (!config.isEnabled()) {
            return RateLimitResult.allowed(Long.MAX_VALUE);
        }
        RateLimitResult result = resolveBucket("pin:" + userId, config.getPinAttempts(), config.getPinWindow())
                .tryConsume();
        if (!result.isAllowed()) {
            log.warn("[RateLimit] PIN attempts exhausted for user {}", userId);
        }
        return result;
    }

    /**
     * Drop buckets nobody used recently so the map does not grow with every
     * user ever seen.
     */
    void evictIdleBuckets() {
        BotProperties.RateLimitProperties config = properties.getRateLimit();
        Duration idle = max(EVICT_AFTER, max(config.getWindow(), config.getPinWindow()));
        int before = buckets.size();
        buckets.values().removeIf(bucket -> bucket.isIdleFor(idle));
        int evicted = before - buckets.size();
        if (evicted > 0) {
            log.debug("[RateLimit] Evicted {} idle buckets", evicted);
        }
    }

    int bucketCount() {
        return buckets.size();
    }

    private static Duration max(Duration a, Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    private TokenBucket resolveBucket(String key, int capacity, Duration refillPeriod) {
        return buckets.computeIfAbsent(key, bucketKey -> new TokenBucket(capacity, refillPeriod));
    }
}
