package com.dingdangmaoup.dock.lifecycle;

import com.dingdangmaoup.dock.cache.RedisCacheManager;
import com.dingdangmaoup.dock.storage.ContentStore;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ReadinessProbeTest {

    private final RedisCacheManager redisCache = mock(RedisCacheManager.class);
    private final ContentStore contentStore = mock(ContentStore.class);
    private final ReadinessProbe probe = new ReadinessProbe(redisCache, contentStore, 1024);

    @Test
    void upWhenStorageHasRoomAndRedisDisabled() {
        when(redisCache.isEnabled()).thenReturn(false);
        when(contentStore.availableSpace()).thenReturn(Mono.just(4096L));

        StepVerifier.create(probe.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails()).containsEntry("redis", "disabled");
                })
                .verifyComplete();
    }

    @Test
    void downWhenRedisUnreachable() {
        when(redisCache.isEnabled()).thenReturn(true);
        when(redisCache.ping()).thenReturn(Mono.just(false));
        when(contentStore.availableSpace()).thenReturn(Mono.just(4096L));

        StepVerifier.create(probe.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                    assertThat(health.getDetails()).containsEntry("redis", "disconnected");
                })
                .verifyComplete();
    }

    @Test
    void downWhenStorageIsFull() {
        when(redisCache.isEnabled()).thenReturn(false);
        when(contentStore.availableSpace()).thenReturn(Mono.just(10L));

        StepVerifier.create(probe.health())
                .assertNext(health -> assertThat(health.getStatus()).isEqualTo(Status.DOWN))
                .verifyComplete();
    }

    @Test
    void downWhileDraining() {
        probe.setDraining(true);

        StepVerifier.create(probe.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                    assertThat(health.getDetails()).containsEntry("reason", "draining");
                })
                .verifyComplete();
    }
}
