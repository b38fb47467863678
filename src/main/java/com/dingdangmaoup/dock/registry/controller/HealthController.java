package com.dingdangmaoup.dock.registry.controller;

import com.dingdangmaoup.dock.cache.MultiLevelCacheManager;
import com.dingdangmaoup.dock.registry.model.CacheHealthResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

    private final MultiLevelCacheManager cacheManager;

    @GetMapping("/cache")
    public Mono<CacheHealthResponse> cache() {
        return Mono.fromSupplier(() -> CacheHealthResponse.from(cacheManager.getStats()));
    }
}
