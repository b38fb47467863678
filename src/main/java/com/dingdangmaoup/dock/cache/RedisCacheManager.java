package com.dingdangmaoup.dock.cache;

import com.dingdangmaoup.dock.config.properties.CacheProperties;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shared tier. Best effort: any Redis failure is logged, flips the tier to
 * disconnected and is answered as a miss. The next successful command flips it back.
 */
@Slf4j
@Component
public class RedisCacheManager {

    private final ReactiveRedisTemplate<String, String> reactiveRedisTemplate;
    private final CacheProperties cacheProperties;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean connected = new AtomicBoolean(false);

    public RedisCacheManager(ReactiveRedisTemplate<String, String> reactiveRedisTemplate,
                             CacheProperties cacheProperties,
                             ObjectMapper objectMapper) {
        this.reactiveRedisTemplate = reactiveRedisTemplate;
        this.cacheProperties = cacheProperties;
        this.objectMapper = objectMapper;
    }

    public boolean isEnabled() {
        return cacheProperties.getRedis().isEnabled();
    }

    public boolean isConnected() {
        return isEnabled() && connected.get();
    }

    public <T> Mono<Optional<CacheEntry<T>>> get(CacheKey key, Class<T> type) {
        if (!isEnabled()) {
            return Mono.just(Optional.empty());
        }
        JavaType entryType = objectMapper.getTypeFactory().constructParametricType(CacheEntry.class, type);
        return reactiveRedisTemplate.opsForValue()
                .get(redisKey(key))
                .map(json -> {
                    try {
                        CacheEntry<T> entry = objectMapper.readValue(json, entryType);
                        log.debug("Redis cache HIT: {}", key);
                        return Optional.of(entry);
                    } catch (Exception e) {
                        log.warn("Dropping unreadable Redis cache entry {}", key, e);
                        return Optional.<CacheEntry<T>>empty();
                    }
                })
                .defaultIfEmpty(Optional.empty())
                .doOnNext(opt -> {
                    markConnected();
                    if (opt.isEmpty()) {
                        log.debug("Redis cache MISS: {}", key);
                    }
                })
                .onErrorResume(error -> {
                    markDisconnected("GET " + key, error);
                    return Mono.just(Optional.empty());
                });
    }

    public Mono<Void> put(CacheKey key, CacheEntry<?> entry) {
        if (!isEnabled()) {
            return Mono.empty();
        }
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(entry))
                .flatMap(json -> reactiveRedisTemplate.opsForValue()
                        .set(redisKey(key), json, cacheProperties.getRedis().getTtl()))
                .doOnSuccess(success -> {
                    markConnected();
                    log.debug("Redis cache PUT: {}", key);
                })
                .onErrorResume(error -> {
                    markDisconnected("PUT " + key, error);
                    return Mono.empty();
                })
                .then();
    }

    public Mono<Void> evict(CacheKey key) {
        if (!isEnabled()) {
            return Mono.empty();
        }
        return reactiveRedisTemplate.delete(redisKey(key))
                .doOnSuccess(count -> {
                    markConnected();
                    log.debug("Redis cache EVICT: {} (deleted: {})", key, count);
                })
                .onErrorResume(error -> {
                    // the entry expires on its own after the shared TTL
                    markDisconnected("EVICT " + key, error);
                    return Mono.empty();
                })
                .then();
    }

    public Mono<Void> clear() {
        if (!isEnabled()) {
            return Mono.empty();
        }
        return reactiveRedisTemplate.keys(cacheProperties.getRedis().getKeyPrefix() + "*")
                .collectList()
                .flatMap(keys -> keys.isEmpty()
                        ? Mono.just(0L)
                        : reactiveRedisTemplate.delete(keys.toArray(String[]::new)))
                .doOnSuccess(count -> log.info("Redis cache CLEARED ({} keys)", count))
                .onErrorResume(error -> {
                    markDisconnected("CLEAR", error);
                    return Mono.empty();
                })
                .then();
    }

    /**
     * Round trip to Redis; updates the connection flag.
     */
    public Mono<Boolean> ping() {
        if (!isEnabled()) {
            return Mono.just(false);
        }
        return reactiveRedisTemplate.execute(connection -> connection.ping())
                .next()
                .map("PONG"::equals)
                .doOnNext(ok -> {
                    if (ok) {
                        markConnected();
                    }
                })
                .onErrorResume(error -> {
                    markDisconnected("PING", error);
                    return Mono.just(false);
                });
    }

    private String redisKey(CacheKey key) {
        return cacheProperties.getRedis().getKeyPrefix() + key.toCacheKey();
    }

    private void markConnected() {
        if (connected.compareAndSet(false, true)) {
            log.info("Redis cache tier connected");
        }
    }

    private void markDisconnected(String operation, Throwable error) {
        if (connected.compareAndSet(true, false)) {
            log.warn("Redis cache tier unavailable ({}), serving from local cache only: {}",
                    operation, error.getMessage());
        } else {
            log.debug("Redis cache {} failed: {}", operation, error.getMessage());
        }
    }
}
