package com.fhirsls.api.config;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-client token buckets.
 *
 * Rule loads and data clears share a strict bucket; everything else draws on the default one.
 */
@Configuration
public class RateLimitConfig {

    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    private final long defaultPerMinute;
    private final long strictPerMinute;

    public RateLimitConfig(
            @Value("${fhirsls.rate-limit.default-per-minute:100}") long defaultPerMinute,
            @Value("${fhirsls.rate-limit.strict-per-minute:10}") long strictPerMinute) {
        this.defaultPerMinute = defaultPerMinute;
        this.strictPerMinute = strictPerMinute;
    }

    public Bucket resolveBucket(String clientId) {
        return buckets.computeIfAbsent(clientId, key -> createBucket(defaultPerMinute));
    }

    public Bucket resolveStrictBucket(String clientId) {
        return buckets.computeIfAbsent(clientId + ":strict", key -> createBucket(strictPerMinute));
    }

    private static Bucket createBucket(long perMinute) {
        Bandwidth limit = Bandwidth.builder()
                .capacity(perMinute)
                .refillGreedy(perMinute, Duration.ofMinutes(1))
                .build();
        return Bucket.builder().addLimit(limit).build();
    }

    /**
     * Drops a client's buckets. Used by tests.
     */
    public void clearBucket(String clientId) {
        buckets.remove(clientId);
        buckets.remove(clientId + ":strict");
    }
}
