package com.dingdangmaoup.dock;

import com.dingdangmaoup.dock.access.ConfiguredRepositoryAccessPolicy;
import com.dingdangmaoup.dock.blob.BlobService;
import com.dingdangmaoup.dock.cache.LocalCacheManager;
import com.dingdangmaoup.dock.cache.MultiLevelCacheManager;
import com.dingdangmaoup.dock.cache.RedisCacheManager;
import com.dingdangmaoup.dock.config.CacheConfig;
import com.dingdangmaoup.dock.config.WebFluxConfig;
import com.dingdangmaoup.dock.config.properties.AccessProperties;
import com.dingdangmaoup.dock.config.properties.CacheProperties;
import com.dingdangmaoup.dock.config.properties.RegistryProperties;
import com.dingdangmaoup.dock.config.properties.UploadProperties;
import com.dingdangmaoup.dock.coordination.KeyedLocks;
import com.dingdangmaoup.dock.digest.DigestEngine;
import com.dingdangmaoup.dock.manifest.ManifestService;
import com.dingdangmaoup.dock.manifest.ManifestValidator;
import com.dingdangmaoup.dock.metrics.CacheMetrics;
import com.dingdangmaoup.dock.metrics.RegistryMetrics;
import com.dingdangmaoup.dock.registry.controller.RegistryController;
import com.dingdangmaoup.dock.repository.RepositoryNamePolicy;
import com.dingdangmaoup.dock.repository.RepositoryService;
import com.dingdangmaoup.dock.storage.FileSystemContentStore;
import com.dingdangmaoup.dock.storage.FileSystemMetadataStore;
import com.dingdangmaoup.dock.upload.BlobUploadManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.data.redis.core.ReactiveRedisTemplate;

import java.nio.file.Path;
import java.time.Instant;

import static org.mockito.Mockito.mock;

/**
 * The registry wired by hand over a temp directory, without a Spring context.
 * Redis is a Mockito mock; by default the shared tier is disabled.
 */
public class RegistryFixture {

    public final Path basePath;
    public final MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
    public final ObjectMapper objectMapper;
    public final RegistryProperties registryProperties = new RegistryProperties();
    public final UploadProperties uploadProperties = new UploadProperties();
    public final AccessProperties accessProperties = new AccessProperties();
    public final CacheProperties cacheProperties = new CacheProperties();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    public final DigestEngine digestEngine = new DigestEngine();
    public final FileSystemContentStore contentStore;
    public final FileSystemMetadataStore metadataStore;
    public final KeyedLocks locks = new KeyedLocks();
    public final MultiLevelCacheManager cacheManager;
    public final RepositoryNamePolicy namePolicy;
    public final RepositoryService repositoryService;
    public final ConfiguredRepositoryAccessPolicy accessPolicy;
    public final RegistryMetrics registryMetrics;
    public final BlobService blobService;
    public final BlobUploadManager uploadManager;
    public final ManifestService manifestService;

    @SuppressWarnings("unchecked")
    public RegistryFixture(Path basePath) {
        this(basePath, mock(ReactiveRedisTemplate.class), false);
    }

    public RegistryFixture(Path basePath, ReactiveRedisTemplate<String, String> redisTemplate, boolean redisEnabled) {
        this.basePath = basePath;
        String tempDir = basePath.resolve("temp").toString();
        this.objectMapper = new WebFluxConfig(uploadProperties).objectMapper();
        this.cacheProperties.getRedis().setEnabled(redisEnabled);

        this.contentStore = new FileSystemContentStore(basePath.toString(), tempDir, 4096);
        this.metadataStore = new FileSystemMetadataStore(basePath.toString(), objectMapper);
        this.cacheManager = new MultiLevelCacheManager(
                new LocalCacheManager(new CacheConfig(cacheProperties).localCache()),
                new RedisCacheManager(redisTemplate, cacheProperties, objectMapper),
                new CacheMetrics(meterRegistry));
        this.namePolicy = new RepositoryNamePolicy(registryProperties);
        this.repositoryService = new RepositoryService(metadataStore, cacheManager, namePolicy, registryProperties, locks);
        this.accessPolicy = new ConfiguredRepositoryAccessPolicy(accessProperties);
        this.registryMetrics = new RegistryMetrics(meterRegistry);
        this.blobService = new BlobService(contentStore, metadataStore, repositoryService, cacheManager,
                accessPolicy, locks, registryMetrics, clock);
        this.uploadManager = new BlobUploadManager(contentStore, blobService, repositoryService, namePolicy,
                accessPolicy, digestEngine, locks, registryMetrics, uploadProperties, clock, tempDir, 4096);
        this.manifestService = new ManifestService(contentStore, metadataStore, repositoryService, namePolicy,
                accessPolicy, new ManifestValidator(objectMapper), digestEngine, cacheManager, locks,
                registryProperties, registryMetrics, clock);
    }

    public RegistryController controller() {
        return new RegistryController(repositoryService, manifestService, blobService, uploadManager, uploadProperties);
    }
}
