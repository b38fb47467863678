package com.dingdangmaoup.dock.cache;

import com.dingdangmaoup.dock.metrics.CacheMetrics;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import io.micrometer.core.instrument.Timer;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Read-through cache in front of the catalog, tag lists and manifests:
 * L1: local Caffeine cache, authoritative for this instance
 * L2: Redis, shared between instances, short TTL, best effort
 * <p>
 * Write paths call the invalidate methods and wait for them before answering
 * the client. A value loaded while an invalidation ran is returned but not
 * cached, so a load that raced a write cannot put the old state back.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MultiLevelCacheManager {

    private final LocalCacheManager localCache;
    private final RedisCacheManager redisCache;
    private final CacheMetrics cacheMetrics;

    private final AtomicLong invalidationSequence = new AtomicLong();

    /**
     * Get cache entry with multi-level lookup
     */
    public <T> Mono<Optional<T>> get(CacheKey key, Class<T> type) {
        return Mono.defer(() -> {
            Optional<T> local = localCache.get(key, type);
            if (local.isPresent()) {
                cacheMetrics.recordLocalCacheHit();
                return Mono.just(local);
            }
            cacheMetrics.recordLocalCacheMiss();

            long sequence = invalidationSequence.get();
            Timer.Sample redisTimer = cacheMetrics.startTimer();
            return redisCache.get(key, type)
                    .map(redisResult -> {
                        cacheMetrics.recordRedisCacheLatency(redisTimer);
                        if (redisResult.isPresent()) {
                            log.debug("Cache HIT at L2 (Redis): {}", key);
                            cacheMetrics.recordRedisCacheHit();
                            populateLocal(key, redisResult.get(), sequence);
                            return Optional.of(redisResult.get().getValue());
                        }
                        cacheMetrics.recordRedisCacheMiss();
                        return Optional.<T>empty();
                    });
        });
    }

    /**
     * Get from cache, or run {@code loader} and populate both levels with its
     * result. Loader errors propagate and nothing is cached.
     */
    public <T> Mono<T> getOrLoad(CacheKey key, Class<T> type, Supplier<Mono<T>> loader) {
        return get(key, type).flatMap(cached -> {
            if (cached.isPresent()) {
                return Mono.just(cached.get());
            }

            long sequence = invalidationSequence.get();
            Timer.Sample loadTimer = cacheMetrics.startTimer();
            log.debug("Cache MISS at all levels: {}, loading", key);
            return loader.get()
                    .flatMap(value -> {
                        cacheMetrics.recordLoad();
                        cacheMetrics.recordLoadLatency(loadTimer);
                        CacheEntry<Object> entry = CacheEntry.of(value);
                        if (!populateLocal(key, entry, sequence)) {
                            log.debug("Skipping cache population of {}: invalidated during load", key);
                            cacheMetrics.recordSkippedPopulation();
                            return Mono.just(value);
                        }
                        return redisCache.put(key, entry)
                                .then(Mono.defer(() -> invalidationSequence.get() == sequence
                                        ? Mono.<Void>empty()
                                        : redisCache.evict(key)))
                                .thenReturn(value);
                    });
        });
    }

    /**
     * Put into L1 unless an invalidation ran since {@code sequence} was read.
     * An eviction that lands between the check and the put is caught by the
     * second read, and the entry is dropped again.
     */
    private boolean populateLocal(CacheKey key, CacheEntry<?> entry, long sequence) {
        if (invalidationSequence.get() != sequence) {
            return false;
        }
        localCache.put(key, entry);
        if (invalidationSequence.get() != sequence) {
            localCache.evict(key);
            return false;
        }
        return true;
    }

    /**
     * Put entry into all cache levels
     */
    public Mono<Void> put(CacheKey key, Object value) {
        return Mono.defer(() -> {
            CacheEntry<Object> entry = CacheEntry.of(value);
            localCache.put(key, entry);
            return redisCache.put(key, entry);
        });
    }

    /**
     * Evict entry from all cache levels. The local eviction happens on subscription,
     * before the shared one is attempted.
     */
    public Mono<Void> evict(CacheKey key) {
        return Mono.defer(() -> {
            invalidationSequence.incrementAndGet();
            localCache.evict(key);
            cacheMetrics.recordInvalidation();
            return redisCache.evict(key)
                    .doOnSuccess(v -> log.debug("Cache EVICT from all levels: {}", key));
        });
    }

    /**
     * Catalog and tag list of a repository; called by every write to it.
     */
    public Mono<Void> invalidate(String repository) {
        return Mono.when(evict(CacheKey.catalog()), evict(CacheKey.tags(repository)));
    }

    public Mono<Void> invalidateTag(String repository, String tag) {
        return evict(CacheKey.manifestByTag(repository, tag));
    }

    public Mono<Void> invalidateManifest(String repository, String digest) {
        return evict(CacheKey.manifestByDigest(repository, digest));
    }

    public void clearLocal() {
        invalidationSequence.incrementAndGet();
        localCache.clear();
    }

    /**
     * Clear all caches
     */
    public Mono<Void> clearAll() {
        return Mono.defer(() -> {
            clearLocal();
            return redisCache.clear()
                    .doOnSuccess(v -> log.info("All caches CLEARED"));
        });
    }

    /**
     * Get cache statistics
     */
    public CacheSnapshot getStats() {
        CacheStats stats = localCache.stats();
        return CacheSnapshot.builder()
                .localSize(localCache.size())
                .localHitCount(stats.hitCount())
                .localMissCount(stats.missCount())
                .localHitRate(stats.hitRate())
                .localEvictionCount(stats.evictionCount())
                .redisEnabled(redisCache.isEnabled())
                .redisConnected(redisCache.isConnected())
                .build();
    }

    @Data
    @Builder
    public static class CacheSnapshot {
        private long localSize;
        private long localHitCount;
        private long localMissCount;
        private double localHitRate;
        private long localEvictionCount;
        private boolean redisEnabled;
        private boolean redisConnected;
    }
}
