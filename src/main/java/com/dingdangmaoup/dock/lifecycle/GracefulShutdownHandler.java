package com.dingdangmaoup.dock.lifecycle;

import com.dingdangmaoup.dock.cache.MultiLevelCacheManager;
import com.dingdangmaoup.dock.upload.BlobUploadManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.stereotype.Component;

/**
 * Handles graceful shutdown of the application
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GracefulShutdownHandler implements ApplicationListener<ContextClosedEvent> {

    private final ReadinessProbe readinessProbe;
    private final BlobUploadManager uploadManager;
    private final MultiLevelCacheManager cacheManager;

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        log.info("=== Starting graceful shutdown ===");

        try {
            log.info("Step 1: Marking readiness probe as draining");
            readinessProbe.setDraining(true);

            log.info("Step 2: Dropping {} open upload sessions", uploadManager.activeSessionCount());
            uploadManager.shutdown();

            log.info("Step 3: Clearing local cache");
            cacheManager.clearLocal();

            log.info("=== Graceful shutdown completed successfully ===");
        } catch (RuntimeException e) {
            log.error("Error during graceful shutdown", e);
        }
    }
}
