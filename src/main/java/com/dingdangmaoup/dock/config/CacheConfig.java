package com.dingdangmaoup.dock.config;

import com.dingdangmaoup.dock.config.properties.CacheProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class CacheConfig {

    private final CacheProperties cacheProperties;

    @Bean
    public Cache<String, Object> localCache() {
        log.info("Initialized local registry cache with maxEntries={}, ttl={}",
                cacheProperties.getLocal().getMaxEntries(),
                cacheProperties.getLocal().getTtl());

        return Caffeine.newBuilder()
                .maximumSize(cacheProperties.getLocal().getMaxEntries())
                .expireAfterWrite(cacheProperties.getLocal().getTtl())
                .recordStats()
                .build();
    }
}
