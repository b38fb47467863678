package com.dingdangmaoup.dock.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Upload, blob and manifest metrics
 */
@Component
public class RegistryMetrics {

    private final Counter uploadStarted;
    private final Counter uploadCompleted;
    private final Counter uploadFailed;
    private final Counter uploadExpired;
    private final Counter uploadBytes;
    private final Counter blobMounted;
    private final Counter blobDownload;
    private final Counter manifestPush;
    private final Counter manifestPull;
    private final Counter manifestDelete;
    private final AtomicLong activeUploads = new AtomicLong(0);

    public RegistryMetrics(MeterRegistry meterRegistry) {
        this.uploadStarted = Counter.builder("dock.upload.started")
                .description("Number of upload sessions started")
                .register(meterRegistry);

        this.uploadCompleted = Counter.builder("dock.upload.completed")
                .description("Number of uploads committed to the content store")
                .register(meterRegistry);

        this.uploadFailed = Counter.builder("dock.upload.failed")
                .description("Number of uploads rejected at completion")
                .register(meterRegistry);

        this.uploadExpired = Counter.builder("dock.upload.expired")
                .description("Number of upload sessions reclaimed after going idle")
                .register(meterRegistry);

        this.uploadBytes = Counter.builder("dock.upload.bytes")
                .description("Bytes accepted into upload sessions")
                .baseUnit("bytes")
                .register(meterRegistry);

        this.blobMounted = Counter.builder("dock.blob.mount")
                .description("Number of cross-repository blob mounts")
                .register(meterRegistry);

        this.blobDownload = Counter.builder("dock.blob.download")
                .description("Number of blob downloads")
                .register(meterRegistry);

        this.manifestPush = Counter.builder("dock.manifest.push")
                .description("Number of manifests pushed")
                .register(meterRegistry);

        this.manifestPull = Counter.builder("dock.manifest.pull")
                .description("Number of manifests served")
                .register(meterRegistry);

        this.manifestDelete = Counter.builder("dock.manifest.delete")
                .description("Number of manifests removed from a repository")
                .register(meterRegistry);

        Gauge.builder("dock.upload.active", activeUploads, AtomicLong::get)
                .description("Number of open upload sessions")
                .register(meterRegistry);
    }

    public void recordUploadStarted() {
        uploadStarted.increment();
        activeUploads.incrementAndGet();
    }

    public void recordUploadBytes(long bytes) {
        uploadBytes.increment(bytes);
    }

    public void recordUploadCompleted() {
        uploadCompleted.increment();
    }

    public void recordUploadFailed() {
        uploadFailed.increment();
    }

    public void recordUploadExpired() {
        uploadExpired.increment();
    }

    public void recordUploadClosed() {
        activeUploads.decrementAndGet();
    }

    public void recordBlobMounted() {
        blobMounted.increment();
    }

    public void recordBlobDownload() {
        blobDownload.increment();
    }

    public void recordManifestPush() {
        manifestPush.increment();
    }

    public void recordManifestPull() {
        manifestPull.increment();
    }

    public void recordManifestDelete() {
        manifestDelete.increment();
    }

    public long getActiveUploads() {
        return activeUploads.get();
    }
}
