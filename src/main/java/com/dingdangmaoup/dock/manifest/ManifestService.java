package com.dingdangmaoup.dock.manifest;

import com.dingdangmaoup.dock.access.Capability;
import com.dingdangmaoup.dock.access.RepositoryAccessPolicy;
import com.dingdangmaoup.dock.cache.CacheKey;
import com.dingdangmaoup.dock.cache.MultiLevelCacheManager;
import com.dingdangmaoup.dock.config.properties.RegistryProperties;
import com.dingdangmaoup.dock.coordination.KeyedLocks;
import com.dingdangmaoup.dock.digest.Digest;
import com.dingdangmaoup.dock.digest.DigestAlgorithm;
import com.dingdangmaoup.dock.digest.DigestEngine;
import com.dingdangmaoup.dock.exception.DigestMismatchException;
import com.dingdangmaoup.dock.exception.ManifestInvalidException;
import com.dingdangmaoup.dock.exception.NotFoundException;
import com.dingdangmaoup.dock.metrics.RegistryMetrics;
import com.dingdangmaoup.dock.repository.Pagination;
import com.dingdangmaoup.dock.repository.RepositoryNamePolicy;
import com.dingdangmaoup.dock.repository.RepositoryService;
import com.dingdangmaoup.dock.storage.ContentStore;
import com.dingdangmaoup.dock.storage.ManifestRevision;
import com.dingdangmaoup.dock.storage.MetadataStore;
import com.dingdangmaoup.dock.storage.TagRecord;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Manifests and tags of a repository.
 * <p>
 * Puts hold the read side of the repository lock plus the lock of the tag
 * they write, so pushes to different tags run in parallel and the last
 * writer of a tag wins. Deletes and the removal of manifests that lost their
 * last tag hold the write side. Every write invalidates the affected cache
 * keys before its Mono completes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ManifestService {

    private final ContentStore contentStore;
    private final MetadataStore metadataStore;
    private final RepositoryService repositoryService;
    private final RepositoryNamePolicy namePolicy;
    private final RepositoryAccessPolicy accessPolicy;
    private final ManifestValidator validator;
    private final DigestEngine digestEngine;
    private final MultiLevelCacheManager cacheManager;
    private final KeyedLocks locks;
    private final RegistryProperties registryProperties;
    private final RegistryMetrics registryMetrics;
    private final Clock clock;

    /**
     * Store a manifest under a tag or its digest.
     *
     * @param reference   tag name, or the digest the client claims for {@code content}
     * @param contentType Content-Type of the request, may be null
     * @return the digest of {@code content}
     */
    public Mono<Digest> putManifest(String repository, String reference, byte[] content, String contentType) {
        return Mono.fromRunnable(() -> namePolicy.validateRepository(repository))
                .then(accessPolicy.check(repository, Capability.PUSH))
                .then(repositoryService.ensureRepository(repository))
                .then(Mono.fromCallable(() -> prepare(reference, content, contentType))
                        .subscribeOn(Schedulers.boundedElastic()))
                .flatMap(prepared -> verifyReferences(repository, prepared)
                        .then(contentStore.put(prepared.getDigest(), content))
                        .then(Mono.fromCallable(() -> recordPush(repository, prepared, content.length))
                                .subscribeOn(Schedulers.boundedElastic()))
                        .flatMap(previous -> invalidateAfterPush(repository, prepared.getTag(), previous)
                                .then(removeIfUnreferenced(repository, previous)))
                        .then(Mono.fromRunnable(() -> {
                            registryMetrics.recordManifestPush();
                            log.info("Pushed manifest {}:{} ({})", repository, reference, prepared.getDigest());
                        }))
                        .thenReturn(prepared.getDigest()));
    }

    public Mono<ManifestContent> getManifest(String repository, String reference) {
        boolean byDigest = Digest.looksLikeDigest(reference);
        CacheKey key = byDigest
                ? CacheKey.manifestByDigest(repository, reference)
                : CacheKey.manifestByTag(repository, reference);
        return accessPolicy.check(repository, Capability.PULL)
                .then(cacheManager.getOrLoad(key, ManifestContent.class, () -> loadManifest(repository, reference, byDigest)))
                .doOnNext(manifest -> registryMetrics.recordManifestPull());
    }

    public Mono<Pagination.Page> listTags(String repository, Integer limit, String last) {
        return accessPolicy.check(repository, Capability.PULL)
                .then(cacheManager.getOrLoad(CacheKey.tags(repository), TagNames.class,
                        () -> Mono.fromCallable(() -> {
                                    if (!metadataStore.repositoryExists(repository)) {
                                        throw NotFoundException.repository(repository);
                                    }
                                    return new TagNames(metadataStore.listTags(repository).stream()
                                            .map(TagRecord::getName)
                                            .toList());
                                })
                                .subscribeOn(Schedulers.boundedElastic())))
                .map(tags -> Pagination.apply(tags.getTags(), limit, last));
    }

    /**
     * Remove a tag; its manifest goes too when no other tag points at it and it was not pushed by digest.
     */
    public Mono<Void> deleteTag(String repository, String tag) {
        return accessPolicy.check(repository, Capability.DELETE)
                .then(Mono.fromCallable(() -> locks.withWrite(RepositoryService.lockKey(repository), () -> {
                            requireRepository(repository);
                            TagRecord record = metadataStore.getTag(repository, tag)
                                    .orElseThrow(() -> NotFoundException.manifest(repository, tag));
                            metadataStore.deleteTag(repository, tag);
                            Digest digest = Digest.parse(record.getDigest());
                            return removeRevisionIfUnreferenced(repository, digest) ? record.getDigest() : "";
                        }))
                        .subscribeOn(Schedulers.boundedElastic()))
                .flatMap(removed -> cacheManager.invalidate(repository)
                        .then(cacheManager.invalidateTag(repository, tag))
                        .then(removed.isEmpty() ? Mono.<Void>empty() : cacheManager.invalidateManifest(repository, removed)))
                .doOnSuccess(v -> log.info("Deleted tag {}:{}", repository, tag));
    }

    /**
     * Delete by tag (see {@link #deleteTag(String, String)}) or by digest, which
     * removes the manifest and every tag pointing at it.
     */
    public Mono<Void> deleteManifest(String repository, String reference) {
        if (!Digest.looksLikeDigest(reference)) {
            return deleteTag(repository, reference);
        }
        return Mono.fromCallable(() -> Digest.parse(reference))
                .flatMap(digest -> accessPolicy.check(repository, Capability.DELETE)
                        .then(Mono.fromCallable(() -> locks.withWrite(RepositoryService.lockKey(repository), () -> {
                                    requireRepository(repository);
                                    if (metadataStore.getRevision(repository, digest).isEmpty()) {
                                        throw NotFoundException.manifest(repository, reference);
                                    }
                                    List<String> removedTags = new ArrayList<>();
                                    for (TagRecord tag : metadataStore.listTags(repository)) {
                                        if (reference.equals(tag.getDigest())) {
                                            metadataStore.deleteTag(repository, tag.getName());
                                            removedTags.add(tag.getName());
                                        }
                                    }
                                    metadataStore.deleteRevision(repository, digest);
                                    return removedTags;
                                }))
                                .subscribeOn(Schedulers.boundedElastic()))
                        .flatMap(removedTags -> Flux.fromIterable(removedTags)
                                .concatMap(tag -> cacheManager.invalidateTag(repository, tag))
                                .then(cacheManager.invalidateManifest(repository, reference))
                                .then(cacheManager.invalidate(repository))))
                .doOnSuccess(v -> {
                    registryMetrics.recordManifestDelete();
                    log.info("Deleted manifest {}@{}", repository, reference);
                });
    }

    private PreparedManifest prepare(String reference, byte[] content, String contentType) {
        Digest digest;
        String tag = null;
        if (Digest.looksLikeDigest(reference)) {
            Digest claimed = Digest.parse(reference);
            digest = digestEngine.compute(content, claimed.getAlgorithm());
            if (!digest.equals(claimed)) {
                throw new DigestMismatchException(claimed.toString(), digest.toString());
            }
        } else {
            namePolicy.validateTag(reference);
            tag = reference;
            digest = digestEngine.compute(content, DigestAlgorithm.SHA256);
        }
        ManifestValidator.ParsedManifest parsed = validator.parse(content);
        return new PreparedManifest(digest, tag, validator.resolveMediaType(contentType, parsed), parsed);
    }

    private Mono<Void> verifyReferences(String repository, PreparedManifest prepared) {
        if (!registryProperties.isStrictManifestReferences()) {
            return Mono.empty();
        }
        Mono<Void> blobs = Flux.fromIterable(prepared.getParsed().getBlobReferences())
                .concatMap(digest -> contentStore.exists(digest)
                        .flatMap(exists -> exists
                                ? Mono.<Void>empty()
                                : Mono.error(ManifestInvalidException.unknownBlob(digest.toString()))))
                .then();
        Mono<Void> manifests = Flux.fromIterable(prepared.getParsed().getManifestReferences())
                .concatMap(digest -> Mono.fromCallable(() -> metadataStore.getRevision(repository, digest).isPresent())
                        .subscribeOn(Schedulers.boundedElastic())
                        .flatMap(exists -> exists
                                ? Mono.<Void>empty()
                                : Mono.error(ManifestInvalidException.unknownManifest(digest.toString()))))
                .then();
        return blobs.then(manifests);
    }

    /**
     * Write revision and tag. The revision is written first so a tag never points at nothing.
     *
     * @return the digest the tag pointed at before, if it changed; otherwise empty string
     */
    private String recordPush(String repository, PreparedManifest prepared, long size) {
        String repositoryLock = RepositoryService.lockKey(repository);
        if (prepared.getTag() == null) {
            return locks.withRead(repositoryLock, () -> {
                repositoryService.ensureRepositoryExists(repository);
                writeRevision(repository, prepared, size, true);
                return "";
            });
        }
        return locks.withReadThenExclusive(repositoryLock, tagLockKey(repository, prepared.getTag()), () -> {
            repositoryService.ensureRepositoryExists(repository);
            writeRevision(repository, prepared, size, false);
            String previous = metadataStore.getTag(repository, prepared.getTag())
                    .map(TagRecord::getDigest)
                    .orElse("");
            metadataStore.putTag(repository, TagRecord.builder()
                    .name(prepared.getTag())
                    .digest(prepared.getDigest().toString())
                    .updatedAt(Instant.now(clock))
                    .build());
            if (!previous.isEmpty() && !previous.equals(prepared.getDigest().toString())) {
                log.info("Tag {}:{} moved from {} to {}", repository, prepared.getTag(), previous, prepared.getDigest());
                return previous;
            }
            return "";
        });
    }

    private void writeRevision(String repository, PreparedManifest prepared, long size, boolean pinned) {
        ManifestRevision existing = metadataStore.getRevision(repository, prepared.getDigest()).orElse(null);
        if (existing != null) {
            if (pinned && !existing.isPinned()) {
                metadataStore.putRevision(repository, existing.toBuilder().pinned(true).build());
            }
            return;
        }
        metadataStore.putRevision(repository, ManifestRevision.builder()
                .digest(prepared.getDigest().toString())
                .mediaType(prepared.getMediaType())
                .size(size)
                .pinned(pinned)
                .createdAt(Instant.now(clock))
                .build());
    }

    private Mono<Void> invalidateAfterPush(String repository, String tag, String previous) {
        Mono<Void> tagInvalidation = tag == null ? Mono.empty() : cacheManager.invalidateTag(repository, tag);
        return cacheManager.invalidate(repository).then(tagInvalidation);
    }

    /**
     * Drop a manifest that lost its last tag. Runs as its own step under the
     * write lock, since concurrent puts to other tags may have picked it up again.
     */
    private Mono<Void> removeIfUnreferenced(String repository, String digest) {
        if (digest.isEmpty()) {
            return Mono.empty();
        }
        return Mono.fromCallable(() -> locks.withWrite(RepositoryService.lockKey(repository),
                        () -> removeRevisionIfUnreferenced(repository, Digest.parse(digest))))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(removed -> removed ? cacheManager.invalidateManifest(repository, digest) : Mono.empty());
    }

    /**
     * Must be called under the write lock of the repository
     */
    private boolean removeRevisionIfUnreferenced(String repository, Digest digest) {
        ManifestRevision revision = metadataStore.getRevision(repository, digest).orElse(null);
        if (revision == null || revision.isPinned()) {
            return false;
        }
        String value = digest.toString();
        boolean tagged = metadataStore.listTags(repository).stream()
                .anyMatch(tag -> value.equals(tag.getDigest()));
        if (tagged) {
            return false;
        }
        metadataStore.deleteRevision(repository, digest);
        registryMetrics.recordManifestDelete();
        log.info("Removed untagged manifest {}@{}", repository, digest);
        return true;
    }

    private Mono<ManifestContent> loadManifest(String repository, String reference, boolean byDigest) {
        return Mono.fromCallable(() -> {
                    requireRepository(repository);
                    Digest digest;
                    if (byDigest) {
                        digest = Digest.parse(reference);
                    } else {
                        digest = metadataStore.getTag(repository, reference)
                                .map(tag -> Digest.parse(tag.getDigest()))
                                .orElseThrow(() -> NotFoundException.manifest(repository, reference));
                    }
                    return metadataStore.getRevision(repository, digest)
                            .orElseThrow(() -> NotFoundException.manifest(repository, reference));
                })
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(revision -> contentStore.readAll(Digest.parse(revision.getDigest()))
                        .map(bytes -> ManifestContent.builder()
                                .digest(revision.getDigest())
                                .mediaType(revision.getMediaType())
                                .content(bytes)
                                .build()));
    }

    private void requireRepository(String repository) {
        if (!metadataStore.repositoryExists(repository)) {
            throw NotFoundException.repository(repository);
        }
    }

    private static String tagLockKey(String repository, String tag) {
        return "tag:" + repository + ":" + tag;
    }

    @Data
    @AllArgsConstructor
    private static class PreparedManifest {
        private Digest digest;
        private String tag;
        private String mediaType;
        private ManifestValidator.ParsedManifest parsed;
    }
}
