package com.dingdangmaoup.dock.lifecycle;

import com.dingdangmaoup.dock.cache.RedisCacheManager;
import com.dingdangmaoup.dock.storage.ContentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Readiness: storage has room, the shared cache answers (when enabled), and
 * the instance is not shutting down.
 */
@Slf4j
@Component
public class ReadinessProbe implements ReactiveHealthIndicator {

    private final RedisCacheManager redisCache;
    private final ContentStore contentStore;
    private final long minFreeBytes;

    private volatile boolean draining = false;

    public ReadinessProbe(RedisCacheManager redisCache,
                          ContentStore contentStore,
                          @Value("${dock.health.min-free-bytes:1073741824}") long minFreeBytes) {
        this.redisCache = redisCache;
        this.contentStore = contentStore;
        this.minFreeBytes = minFreeBytes;
    }

    @Override
    public Mono<Health> health() {
        return readiness()
                .map(response -> "UP".equals(response.get("status"))
                        ? Health.up().withDetails(response).build()
                        : Health.down().withDetails(response).build())
                .onErrorResume(error -> {
                    log.error("Health check error", error);
                    return Mono.just(Health.down().withException(error).build());
                });
    }

    public Mono<Map<String, Object>> readiness() {
        if (draining) {
            Map<String, Object> response = new HashMap<>();
            response.put("status", "DOWN");
            response.put("reason", "draining");
            return Mono.just(response);
        }

        Mono<Boolean> redisCheck = redisCache.isEnabled()
                ? redisCache.ping().timeout(Duration.ofSeconds(2)).onErrorReturn(false)
                : Mono.just(true);

        Mono<Boolean> storageCheck = contentStore.availableSpace()
                .map(space -> space >= minFreeBytes)
                .timeout(Duration.ofSeconds(2))
                .onErrorReturn(false);

        return Mono.zip(redisCheck, storageCheck)
                .map(tuple -> {
                    boolean redisHealthy = tuple.getT1();
                    boolean storageHealthy = tuple.getT2();

                    Map<String, Object> response = new HashMap<>();
                    response.put("status", redisHealthy && storageHealthy ? "UP" : "DOWN");
                    response.put("redis", !redisCache.isEnabled() ? "disabled" : redisHealthy ? "connected" : "disconnected");
                    response.put("storage", storageHealthy ? "available" : "insufficient space");
                    return response;
                });
    }

    public boolean isDraining() {
        return draining;
    }

    public void setDraining(boolean draining) {
        this.draining = draining;
        log.info("Readiness probe draining status set to: {}", draining);
    }
}
