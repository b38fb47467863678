package com.dingdangmaoup.dock.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Cache configuration properties
 */
@Data
@Component
@ConfigurationProperties(prefix = "dock.cache")
public class CacheProperties {

    /**
     * Local cache configuration (Caffeine)
     */
    private Local local = new Local();

    /**
     * Shared cache configuration (Redis)
     */
    private Redis redis = new Redis();

    @Data
    public static class Local {
        /**
         * Maximum number of cache entries
         */
        private long maxEntries = 10000;

        /**
         * Time to live for cache entries
         */
        private Duration ttl = Duration.ofMinutes(5);
    }

    @Data
    public static class Redis {
        /**
         * When false the registry runs with the local tier only
         */
        private boolean enabled = true;

        /**
         * TTL for every shared entry; bounds how long another instance may serve a stale value
         */
        private Duration ttl = Duration.ofSeconds(30);

        /**
         * Prefix of every key written to Redis
         */
        private String keyPrefix = "dock:";
    }
}
