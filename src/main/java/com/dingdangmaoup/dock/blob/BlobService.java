package com.dingdangmaoup.dock.blob;

import com.dingdangmaoup.dock.access.Capability;
import com.dingdangmaoup.dock.access.RepositoryAccessPolicy;
import com.dingdangmaoup.dock.cache.MultiLevelCacheManager;
import com.dingdangmaoup.dock.coordination.KeyedLocks;
import com.dingdangmaoup.dock.digest.Digest;
import com.dingdangmaoup.dock.exception.NotFoundException;
import com.dingdangmaoup.dock.metrics.RegistryMetrics;
import com.dingdangmaoup.dock.repository.RepositoryService;
import com.dingdangmaoup.dock.storage.BlobLink;
import com.dingdangmaoup.dock.storage.BlobMetadata;
import com.dingdangmaoup.dock.storage.ContentStore;
import com.dingdangmaoup.dock.storage.MetadataStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;

/**
 * Blobs as seen through a repository. A blob is readable from a repository
 * only when the repository exists, links the digest, and the content store
 * holds the bytes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BlobService {

    public static final String DEFAULT_MEDIA_TYPE = "application/octet-stream";

    private final ContentStore contentStore;
    private final MetadataStore metadataStore;
    private final RepositoryService repositoryService;
    private final MultiLevelCacheManager cacheManager;
    private final RepositoryAccessPolicy accessPolicy;
    private final KeyedLocks locks;
    private final RegistryMetrics registryMetrics;
    private final Clock clock;

    public Mono<BlobMetadata> stat(String repository, Digest digest) {
        return accessPolicy.check(repository, Capability.PULL)
                .then(repositoryService.requireRepository(repository))
                .then(Mono.fromCallable(() -> metadataStore.getBlobLink(repository, digest)
                                .orElseThrow(() -> NotFoundException.blob(digest.toString())))
                        .subscribeOn(Schedulers.boundedElastic()))
                .flatMap(link -> contentStore.stat(digest)
                        .map(blob -> {
                            blob.setMediaType(link.getMediaType() != null ? link.getMediaType() : DEFAULT_MEDIA_TYPE);
                            return blob;
                        }));
    }

    /**
     * Content of a blob; resolve it with {@link #stat(String, Digest)} first to get headers and 404s right.
     */
    public Flux<DataBuffer> read(Digest digest) {
        return contentStore.get(digest)
                .doOnSubscribe(subscription -> registryMetrics.recordBlobDownload());
    }

    /**
     * Record that {@code repository} references a stored blob, creating the repository when allowed.
     */
    public Mono<BlobMetadata> link(String repository, BlobMetadata blob) {
        return Mono.fromCallable(() -> locks.withRead(RepositoryService.lockKey(repository), () -> {
                    boolean created = repositoryService.ensureRepositoryExists(repository);
                    metadataStore.linkBlob(repository, BlobLink.builder()
                            .digest(blob.getDigest())
                            .size(blob.getSize())
                            .mediaType(blob.getMediaType() != null ? blob.getMediaType() : DEFAULT_MEDIA_TYPE)
                            .linkedAt(Instant.now(clock))
                            .build());
                    return created;
                }))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(created -> created ? cacheManager.invalidate(repository) : Mono.<Void>empty())
                .thenReturn(blob);
    }

    /**
     * Link a blob that {@code fromRepository} already references.
     *
     * @return the mounted blob, or empty when it cannot be mounted
     */
    public Mono<BlobMetadata> mount(String repository, Digest digest, String fromRepository) {
        return accessPolicy.check(repository, Capability.PUSH)
                .then(accessPolicy.check(fromRepository, Capability.PULL))
                .then(Mono.fromCallable(() -> metadataStore.getBlobLink(fromRepository, digest).isPresent())
                        .subscribeOn(Schedulers.boundedElastic()))
                .filter(linked -> linked)
                .flatMap(linked -> contentStore.exists(digest))
                .filter(stored -> stored)
                .flatMap(stored -> contentStore.stat(digest))
                .flatMap(blob -> link(repository, blob))
                .doOnNext(blob -> {
                    registryMetrics.recordBlobMounted();
                    log.info("Mounted blob {} from {} into {}", digest, fromRepository, repository);
                });
    }

    /**
     * Remove the blob from the repository. Content stays in the content store.
     */
    public Mono<Void> unlink(String repository, Digest digest) {
        return accessPolicy.check(repository, Capability.DELETE)
                .then(repositoryService.requireRepository(repository))
                .then(Mono.fromCallable(() -> locks.withRead(RepositoryService.lockKey(repository),
                                () -> metadataStore.unlinkBlob(repository, digest)))
                        .subscribeOn(Schedulers.boundedElastic()))
                .flatMap(removed -> removed
                        ? Mono.<Void>empty()
                        : Mono.error(NotFoundException.blob(digest.toString())))
                .doOnSuccess(v -> log.info("Unlinked blob {} from {}", digest, repository));
    }
}
