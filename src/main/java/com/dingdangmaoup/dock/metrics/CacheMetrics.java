package com.dingdangmaoup.dock.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

/**
 * Cache metrics collection
 */
@Component
public class CacheMetrics {

    private final Counter localCacheHits;
    private final Counter localCacheMisses;
    private final Counter redisCacheHits;
    private final Counter redisCacheMisses;
    private final Counter loads;
    private final Counter skippedPopulations;
    private final Counter invalidations;

    private final Timer redisCacheLatency;
    private final Timer loadLatency;

    public CacheMetrics(MeterRegistry meterRegistry) {
        this.localCacheHits = Counter.builder("dock.cache.hit")
                .tag("level", "local")
                .description("Number of local cache hits")
                .register(meterRegistry);

        this.localCacheMisses = Counter.builder("dock.cache.miss")
                .tag("level", "local")
                .description("Number of local cache misses")
                .register(meterRegistry);

        this.redisCacheHits = Counter.builder("dock.cache.hit")
                .tag("level", "redis")
                .description("Number of Redis cache hits")
                .register(meterRegistry);

        this.redisCacheMisses = Counter.builder("dock.cache.miss")
                .tag("level", "redis")
                .description("Number of Redis cache misses")
                .register(meterRegistry);

        this.loads = Counter.builder("dock.cache.load")
                .description("Number of reads served from the stores after a miss at every level")
                .register(meterRegistry);

        this.skippedPopulations = Counter.builder("dock.cache.populate.skipped")
                .description("Loaded values not cached because a write invalidated the cache during the load")
                .register(meterRegistry);

        this.invalidations = Counter.builder("dock.cache.invalidation")
                .description("Number of key invalidations")
                .register(meterRegistry);

        this.redisCacheLatency = Timer.builder("dock.cache.latency")
                .tag("level", "redis")
                .description("Redis cache lookup latency")
                .register(meterRegistry);

        this.loadLatency = Timer.builder("dock.cache.latency")
                .tag("level", "store")
                .description("Store load latency on cache miss")
                .register(meterRegistry);
    }

    public void recordLocalCacheHit() {
        localCacheHits.increment();
    }

    public void recordLocalCacheMiss() {
        localCacheMisses.increment();
    }

    public void recordRedisCacheHit() {
        redisCacheHits.increment();
    }

    public void recordRedisCacheMiss() {
        redisCacheMisses.increment();
    }

    public void recordLoad() {
        loads.increment();
    }

    public void recordSkippedPopulation() {
        skippedPopulations.increment();
    }

    public void recordInvalidation() {
        invalidations.increment();
    }

    public Timer.Sample startTimer() {
        return Timer.start();
    }

    public void recordRedisCacheLatency(Timer.Sample sample) {
        sample.stop(redisCacheLatency);
    }

    public void recordLoadLatency(Timer.Sample sample) {
        sample.stop(loadLatency);
    }
}
