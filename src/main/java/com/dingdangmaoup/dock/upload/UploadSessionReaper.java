package com.dingdangmaoup.dock.upload;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Reclaims idle upload sessions and their spool files
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "dock.upload.reaper-enabled", havingValue = "true", matchIfMissing = true)
public class UploadSessionReaper {

    private final BlobUploadManager uploadManager;

    @Scheduled(fixedDelayString = "${dock.upload.reap-interval:300000}")
    public void reap() {
        log.debug("Running upload session reaper");
        try {
            int expired = uploadManager.reapExpired();
            if (expired > 0) {
                log.info("Expired {} idle upload sessions, {} still open", expired, uploadManager.activeSessionCount());
            }
        } catch (RuntimeException e) {
            log.error("Error while reaping upload sessions", e);
        }
    }
}
