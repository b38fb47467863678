package com.dingdangmaoup.dock.storage;

import com.dingdangmaoup.dock.digest.Digest;
import com.dingdangmaoup.dock.exception.NotFoundException;
import com.dingdangmaoup.dock.exception.RegistryException;
import com.dingdangmaoup.dock.exception.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.*;
import java.time.Instant;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Content store on the local file system. Layout:
 * {@code {base}/blobs/{algorithm}/{first two hex chars}/{hex}}. Writes land in
 * a temp file first and are moved into place atomically.
 */
@Slf4j
@Component
public class FileSystemContentStore implements ContentStore {

    private final String basePath;
    private final String tempDir;
    private final int chunkSize;
    private final DefaultDataBufferFactory bufferFactory;

    public FileSystemContentStore(
            @Value("${dock.storage.base-path:/data/dock}") String basePath,
            @Value("${dock.storage.temp-dir:${dock.storage.base-path:/data/dock}/temp}") String tempDir,
            @Value("${dock.storage.blob-chunk-size:65536}") int chunkSize) {
        this.basePath = basePath;
        this.tempDir = tempDir;
        this.chunkSize = chunkSize;
        this.bufferFactory = new DefaultDataBufferFactory();
    }

    @Override
    public Mono<BlobMetadata> put(Digest digest, Flux<DataBuffer> data) {
        return Mono.defer(() -> {
            Path finalPath = getBlobPath(digest);
            if (Files.exists(finalPath)) {
                log.debug("Blob {} already stored, skipping write", digest);
                return stat(digest);
            }

            Path tempFile = getTempPath(UUID.randomUUID().toString());
            try {
                Files.createDirectories(finalPath.getParent());
                Files.createDirectories(tempFile.getParent());
            } catch (IOException e) {
                return Mono.error(new StoreUnavailableException("Failed to prepare blob directories", e));
            }

            log.debug("Saving blob {} to temporary file: {}", digest, tempFile);

            return DataBufferUtils.write(data, tempFile, StandardOpenOption.CREATE_NEW)
                    .then(Mono.fromCallable(() -> {
                        try {
                            Files.move(tempFile, finalPath, StandardCopyOption.ATOMIC_MOVE);
                        } catch (FileAlreadyExistsException e) {
                            // a concurrent writer stored the same content first
                            Files.deleteIfExists(tempFile);
                        }
                        long size = Files.size(finalPath);
                        log.info("Stored blob {} ({} bytes)", digest, size);
                        return BlobMetadata.builder()
                                .digest(digest.toString())
                                .size(size)
                                .createdAt(Instant.now())
                                .build();
                    }))
                    .onErrorResume(error -> {
                        try {
                            Files.deleteIfExists(tempFile);
                        } catch (IOException e) {
                            log.warn("Failed to cleanup temp file: {}", tempFile, e);
                        }
                        log.error("Failed to store blob {}", digest, error);
                        return Mono.error(new StoreUnavailableException("Failed to store blob " + digest, error));
                    });
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Flux<DataBuffer> get(Digest digest) {
        return Mono.fromCallable(() -> getBlobPath(digest))
                .flatMapMany(path -> {
                    if (!Files.exists(path)) {
                        return Flux.error(NotFoundException.blob(digest.toString()));
                    }
                    log.debug("Reading blob {} from: {}", digest, path);
                    return DataBufferUtils.read(path, bufferFactory, chunkSize)
                            .onErrorMap(IOException.class,
                                    e -> new StoreUnavailableException("Failed to read blob " + digest, e));
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Boolean> exists(Digest digest) {
        return Mono.fromCallable(() -> Files.exists(getBlobPath(digest)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<BlobMetadata> stat(Digest digest) {
        return Mono.fromCallable(() -> {
            Path path = getBlobPath(digest);
            if (!Files.exists(path)) {
                throw NotFoundException.blob(digest.toString());
            }
            return BlobMetadata.builder()
                    .digest(digest.toString())
                    .size(Files.size(path))
                    .createdAt(Files.getLastModifiedTime(path).toInstant())
                    .build();
        }).subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(e -> !(e instanceof RegistryException),
                        e -> new StoreUnavailableException("Failed to stat blob " + digest, e));
    }

    @Override
    public Mono<Boolean> delete(Digest digest) {
        return Mono.fromCallable(() -> {
            boolean deleted = Files.deleteIfExists(getBlobPath(digest));
            if (deleted) {
                log.info("Deleted blob: {}", digest);
            }
            return deleted;
        }).subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(IOException.class, e -> new StoreUnavailableException("Failed to delete blob " + digest, e));
    }

    @Override
    public Mono<Long> totalSize() {
        return Mono.fromCallable(() -> {
            Path blobsPath = Paths.get(basePath, "blobs");
            if (!Files.exists(blobsPath)) {
                return 0L;
            }
            try (Stream<Path> files = Files.walk(blobsPath)) {
                return files.filter(Files::isRegularFile)
                        .mapToLong(path -> {
                            try {
                                return Files.size(path);
                            } catch (IOException e) {
                                log.warn("Failed to get size of file: {}", path, e);
                                return 0L;
                            }
                        })
                        .sum();
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Long> availableSpace() {
        return Mono.fromCallable(() -> Files.getFileStore(Paths.get(basePath)).getUsableSpace())
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Path getBlobPath(Digest digest) {
        String hex = digest.getHex();
        return Paths.get(basePath, "blobs", digest.getAlgorithm().getPrefix(), hex.substring(0, 2), hex);
    }

    private Path getTempPath(String tempId) {
        return Paths.get(tempDir, "blobs", tempId);
    }
}
