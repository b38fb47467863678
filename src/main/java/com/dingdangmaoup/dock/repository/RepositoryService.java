package com.dingdangmaoup.dock.repository;

import com.dingdangmaoup.dock.cache.CacheKey;
import com.dingdangmaoup.dock.cache.MultiLevelCacheManager;
import com.dingdangmaoup.dock.config.properties.RegistryProperties;
import com.dingdangmaoup.dock.coordination.KeyedLocks;
import com.dingdangmaoup.dock.exception.NotFoundException;
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

import java.util.List;

/**
 * Repository lifecycle and the catalog.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RepositoryService {

    private final MetadataStore metadataStore;
    private final MultiLevelCacheManager cacheManager;
    private final RepositoryNamePolicy namePolicy;
    private final RegistryProperties registryProperties;
    private final KeyedLocks locks;

    public static String lockKey(String repository) {
        return "repository:" + repository;
    }

    /**
     * Start of every write path: the repository exists afterwards, or the call
     * fails with NAME_INVALID / NAME_UNKNOWN.
     */
    public Mono<Void> ensureRepository(String repository) {
        return Mono.fromCallable(() -> ensureRepositoryExists(repository))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(created -> created ? cacheManager.invalidate(repository) : Mono.empty());
    }

    /**
     * Blocking form of {@link #ensureRepository(String)} for callers already
     * holding the repository lock. The caller invalidates the catalog.
     *
     * @return true if the repository was created
     */
    public boolean ensureRepositoryExists(String repository) {
        namePolicy.validateRepository(repository);
        if (metadataStore.repositoryExists(repository)) {
            return false;
        }
        if (!registryProperties.isAutoCreateRepositories()) {
            throw NotFoundException.repository(repository);
        }
        return metadataStore.createRepository(repository);
    }

    public Mono<Boolean> createRepository(String repository) {
        return Mono.fromCallable(() -> {
                    namePolicy.validateRepository(repository);
                    return metadataStore.createRepository(repository);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(created -> created
                        ? cacheManager.invalidate(repository).thenReturn(true)
                        : Mono.just(false));
    }

    /**
     * Straight from the metadata store, never from the cache.
     */
    public Mono<Boolean> exists(String repository) {
        return Mono.fromCallable(() -> metadataStore.repositoryExists(repository))
                .subscribeOn(Schedulers.boundedElastic());
    }

    public Mono<Void> requireRepository(String repository) {
        return exists(repository)
                .flatMap(exists -> exists ? Mono.<Void>empty() : Mono.error(NotFoundException.repository(repository)));
    }

    /**
     * Delete the repository with its tags, manifests and blob links. Blob content stays in the content store.
     */
    public Mono<Void> deleteRepository(String repository) {
        return Mono.fromCallable(() -> locks.withWrite(lockKey(repository), () -> {
                    if (!metadataStore.repositoryExists(repository)) {
                        throw NotFoundException.repository(repository);
                    }
                    DeletedContent deleted = new DeletedContent(
                            metadataStore.listTags(repository).stream().map(TagRecord::getName).toList(),
                            metadataStore.listRevisions(repository).stream().map(ManifestRevision::getDigest).toList());
                    metadataStore.deleteRepository(repository);
                    return deleted;
                }))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(deleted -> Flux.concat(
                                Flux.fromIterable(deleted.getTags()).map(tag -> cacheManager.invalidateTag(repository, tag)),
                                Flux.fromIterable(deleted.getDigests()).map(digest -> cacheManager.invalidateManifest(repository, digest)))
                        .concatMap(invalidation -> invalidation)
                        .then(cacheManager.invalidate(repository)))
                .doOnSuccess(v -> log.info("Deleted repository {}", repository));
    }

    /**
     * Alphabetical listing, stable across calls; {@code limit} null means unbounded.
     */
    public Mono<Pagination.Page> listRepositories(Integer limit, String last) {
        return cacheManager.getOrLoad(CacheKey.catalog(), RepositoryNames.class,
                        () -> Mono.fromCallable(() -> new RepositoryNames(metadataStore.listRepositories()))
                                .subscribeOn(Schedulers.boundedElastic()))
                .map(names -> Pagination.apply(names.getNames(), limit, last));
    }

    @Data
    @AllArgsConstructor
    private static class DeletedContent {
        private List<String> tags;
        private List<String> digests;
    }
}
