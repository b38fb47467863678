package com.dingdangmaoup.dock.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * In-process tier. Calls complete synchronously, so an eviction is visible
 * to every later read on this instance as soon as it returns.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LocalCacheManager {

    private final Cache<String, Object> localCache;

    public <T> Optional<T> get(CacheKey key, Class<T> type) {
        Object value = localCache.getIfPresent(key.toCacheKey());
        if (value instanceof CacheEntry<?> entry && type.isInstance(entry.getValue())) {
            log.debug("Local cache HIT: {}", key);
            return Optional.of(type.cast(entry.getValue()));
        }
        log.debug("Local cache MISS: {}", key);
        return Optional.empty();
    }

    public void put(CacheKey key, CacheEntry<?> entry) {
        localCache.put(key.toCacheKey(), entry);
        log.debug("Local cache PUT: {}", key);
    }

    public void evict(CacheKey key) {
        localCache.invalidate(key.toCacheKey());
        log.debug("Local cache EVICT: {}", key);
    }

    public void clear() {
        localCache.invalidateAll();
        log.info("Local cache CLEARED");
    }

    public long size() {
        return localCache.estimatedSize();
    }

    public CacheStats stats() {
        return localCache.stats();
    }
}
