package com.dingdangmaoup.dock.registry.model;

import com.dingdangmaoup.dock.cache.MultiLevelCacheManager;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * {@code {"cache_stats":{"memory_cache":{...},"redis_enabled":..,"redis_connected":..}}}
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CacheHealthResponse {

    @JsonProperty("cache_stats")
    private CacheStats cacheStats;

    public static CacheHealthResponse from(MultiLevelCacheManager.CacheSnapshot snapshot) {
        MemoryCache memory = new MemoryCache(snapshot.getLocalSize(), snapshot.getLocalHitCount(),
                snapshot.getLocalMissCount(), snapshot.getLocalHitRate(), snapshot.getLocalEvictionCount());
        return new CacheHealthResponse(new CacheStats(memory, snapshot.isRedisEnabled(), snapshot.isRedisConnected()));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CacheStats {
        @JsonProperty("memory_cache")
        private MemoryCache memoryCache;
        @JsonProperty("redis_enabled")
        private boolean redisEnabled;
        @JsonProperty("redis_connected")
        private boolean redisConnected;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MemoryCache {
        private long entries;
        @JsonProperty("hit_count")
        private long hitCount;
        @JsonProperty("miss_count")
        private long missCount;
        @JsonProperty("hit_rate")
        private double hitRate;
        @JsonProperty("eviction_count")
        private long evictionCount;
    }
}
