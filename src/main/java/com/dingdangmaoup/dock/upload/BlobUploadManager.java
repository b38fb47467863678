package com.dingdangmaoup.dock.upload;

import com.dingdangmaoup.dock.access.Capability;
import com.dingdangmaoup.dock.access.RepositoryAccessPolicy;
import com.dingdangmaoup.dock.blob.BlobService;
import com.dingdangmaoup.dock.config.properties.UploadProperties;
import com.dingdangmaoup.dock.coordination.KeyedLocks;
import com.dingdangmaoup.dock.digest.Digest;
import com.dingdangmaoup.dock.digest.DigestEngine;
import com.dingdangmaoup.dock.exception.ConflictException;
import com.dingdangmaoup.dock.exception.DigestMismatchException;
import com.dingdangmaoup.dock.exception.OffsetMismatchException;
import com.dingdangmaoup.dock.exception.SessionNotFoundException;
import com.dingdangmaoup.dock.exception.StoreUnavailableException;
import com.dingdangmaoup.dock.metrics.RegistryMetrics;
import com.dingdangmaoup.dock.repository.RepositoryNamePolicy;
import com.dingdangmaoup.dock.repository.RepositoryService;
import com.dingdangmaoup.dock.storage.BlobMetadata;
import com.dingdangmaoup.dock.storage.ContentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Resumable blob uploads. Each session spools its bytes to
 * {@code {temp-dir}/uploads/{uuid}}; nothing reaches the content store until
 * completion, and then only if the digest of the whole spool matches the one
 * the client announced.
 * <p>
 * Session state changes happen under the session's lock from {@link KeyedLocks};
 * different sessions never contend.
 */
@Slf4j
@Service
public class BlobUploadManager {

    private final ContentStore contentStore;
    private final BlobService blobService;
    private final RepositoryService repositoryService;
    private final RepositoryNamePolicy namePolicy;
    private final RepositoryAccessPolicy accessPolicy;
    private final DigestEngine digestEngine;
    private final KeyedLocks locks;
    private final RegistryMetrics registryMetrics;
    private final UploadProperties uploadProperties;
    private final Clock clock;
    private final Path uploadDir;
    private final int chunkSize;

    private final Map<String, UploadSession> sessions = new ConcurrentHashMap<>();

    public BlobUploadManager(ContentStore contentStore,
                             BlobService blobService,
                             RepositoryService repositoryService,
                             RepositoryNamePolicy namePolicy,
                             RepositoryAccessPolicy accessPolicy,
                             DigestEngine digestEngine,
                             KeyedLocks locks,
                             RegistryMetrics registryMetrics,
                             UploadProperties uploadProperties,
                             Clock clock,
                             @Value("${dock.storage.temp-dir:${dock.storage.base-path:/data/dock}/temp}") String tempDir,
                             @Value("${dock.storage.blob-chunk-size:65536}") int chunkSize) {
        this.contentStore = contentStore;
        this.blobService = blobService;
        this.repositoryService = repositoryService;
        this.namePolicy = namePolicy;
        this.accessPolicy = accessPolicy;
        this.digestEngine = digestEngine;
        this.locks = locks;
        this.registryMetrics = registryMetrics;
        this.uploadProperties = uploadProperties;
        this.clock = clock;
        this.uploadDir = Paths.get(tempDir, "uploads");
        this.chunkSize = chunkSize;
    }

    public Mono<UploadSession> start(String repository) {
        return Mono.fromRunnable(() -> namePolicy.validateRepository(repository))
                .then(accessPolicy.check(repository, Capability.PUSH))
                .then(repositoryService.ensureRepository(repository))
                .then(Mono.fromCallable(() -> createSession(repository))
                        .subscribeOn(Schedulers.boundedElastic()));
    }

    /**
     * Append bytes to a session.
     *
     * @param expectedStartOffset where the client believes the chunk starts; null appends at the current offset
     * @return the session after the append
     */
    public Mono<UploadSession> appendChunk(String sessionId, byte[] chunk, Long expectedStartOffset) {
        return appendChunk(null, sessionId, chunk, expectedStartOffset);
    }

    /**
     * As {@link #appendChunk(String, byte[], Long)}, for a session that must belong to {@code repository}.
     */
    public Mono<UploadSession> appendChunk(String repository, String sessionId, byte[] chunk, Long expectedStartOffset) {
        return Mono.fromCallable(() -> locks.withExclusive(sessionLockKey(sessionId), () -> {
                    UploadSession session = requireWritable(repository, sessionId);
                    if (expectedStartOffset != null && expectedStartOffset != session.getOffset()) {
                        throw new OffsetMismatchException(sessionId, session.getOffset(), expectedStartOffset);
                    }
                    appendToSpool(session, chunk);
                    return session.snapshot();
                }))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Append the final bytes, verify the digest of everything received and
     * commit the blob. A digest mismatch ends the session. If the content store
     * or the link fails, the session stays open at its new offset and the client
     * may retry the completion without a body.
     */
    public Mono<BlobMetadata> complete(String sessionId, byte[] finalChunk, Digest expectedDigest) {
        return complete(null, sessionId, finalChunk, expectedDigest);
    }

    public Mono<BlobMetadata> complete(String repository, String sessionId, byte[] finalChunk, Digest expectedDigest) {
        return Mono.fromCallable(() -> locks.withExclusive(sessionLockKey(sessionId), () -> {
                    UploadSession session = requireWritable(repository, sessionId);
                    appendToSpool(session, finalChunk);

                    Digest actual = digestEngine.compute(session.getSpoolFile(), expectedDigest.getAlgorithm());
                    if (!actual.equals(expectedDigest)) {
                        close(session, UploadState.CANCELLED);
                        deleteSpool(session.getSpoolFile());
                        registryMetrics.recordUploadFailed();
                        log.warn("Upload {} rejected: expected {}, received {}", sessionId, expectedDigest, actual);
                        throw new DigestMismatchException(expectedDigest.toString(), actual.toString());
                    }
                    session.setState(UploadState.COMMITTING);
                    return session.snapshot();
                }))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(session -> contentStore.put(expectedDigest,
                                DataBufferUtils.read(session.getSpoolFile(), DefaultDataBufferFactory.sharedInstance, chunkSize))
                        .flatMap(blob -> blobService.link(session.getRepository(), blob))
                        .flatMap(blob -> finishCommit(sessionId).thenReturn(blob))
                        .onErrorResume(error -> reopen(sessionId).then(Mono.error(error)))
                        .doOnSuccess(blob -> {
                            registryMetrics.recordUploadCompleted();
                            log.info("Upload {} completed: {} ({} bytes) in {}",
                                    sessionId, expectedDigest, session.getOffset(), session.getRepository());
                        }));
    }

    /**
     * Abort a session. Cancelling an unknown or finished session is not an error.
     */
    public Mono<Void> cancel(String sessionId) {
        return cancel(null, sessionId);
    }

    public Mono<Void> cancel(String repository, String sessionId) {
        return Mono.fromRunnable(() -> locks.withExclusive(sessionLockKey(sessionId), () -> {
                    UploadSession session = sessions.get(sessionId);
                    if (session != null) {
                        checkOwner(repository, session);
                        if (session.getState() == UploadState.COMMITTING) {
                            throw new ConflictException("upload " + sessionId + " is being committed");
                        }
                        close(session, UploadState.CANCELLED);
                        deleteSpool(session.getSpoolFile());
                        log.info("Upload {} cancelled", sessionId);
                    }
                    return null;
                }))
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    public Mono<UploadSession> status(String sessionId) {
        return status(null, sessionId);
    }

    public Mono<UploadSession> status(String repository, String sessionId) {
        return Mono.fromCallable(() -> locks.withExclusive(sessionLockKey(sessionId),
                        () -> requireActive(repository, sessionId).snapshot()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Single-request upload: verify and store {@code content} without a session.
     */
    public Mono<BlobMetadata> monolithic(String repository, byte[] content, Digest expectedDigest) {
        return Mono.fromRunnable(() -> namePolicy.validateRepository(repository))
                .then(accessPolicy.check(repository, Capability.PUSH))
                .then(repositoryService.ensureRepository(repository))
                .then(Mono.fromCallable(() -> digestEngine.verify(content, expectedDigest))
                        .subscribeOn(Schedulers.boundedElastic()))
                .flatMap(digest -> contentStore.put(digest, content))
                .flatMap(blob -> blobService.link(repository, blob))
                .doOnSuccess(blob -> {
                    registryMetrics.recordUploadCompleted();
                    log.info("Monolithic upload of {} ({} bytes) into {}", expectedDigest, content.length, repository);
                });
    }

    /**
     * Cross-repository mount; empty when the blob cannot be mounted and a regular upload is needed.
     */
    public Mono<BlobMetadata> mount(String repository, Digest digest, String fromRepository) {
        return Mono.fromRunnable(() -> namePolicy.validateRepository(repository))
                .then(blobService.mount(repository, digest, fromRepository));
    }

    /**
     * Expire idle sessions and delete spool files no live session owns.
     *
     * @return number of sessions expired
     */
    public int reapExpired() {
        Instant cutoff = Instant.now(clock).minus(uploadProperties.getSessionTtl());
        int expired = 0;
        for (String sessionId : new ArrayList<>(sessions.keySet())) {
            boolean reaped = locks.withExclusive(sessionLockKey(sessionId), () -> {
                UploadSession session = sessions.get(sessionId);
                if (session == null || session.getState() == UploadState.COMMITTING
                        || !session.getLastActivity().isBefore(cutoff)) {
                    return false;
                }
                expire(session);
                return true;
            });
            if (reaped) {
                expired++;
            }
        }
        deleteOrphanedSpoolFiles(cutoff);
        return expired;
    }

    /**
     * Drop every open session; used at shutdown.
     */
    public void shutdown() {
        for (String sessionId : new ArrayList<>(sessions.keySet())) {
            locks.withExclusive(sessionLockKey(sessionId), () -> {
                UploadSession session = sessions.get(sessionId);
                if (session != null) {
                    close(session, UploadState.CANCELLED);
                    deleteSpool(session.getSpoolFile());
                }
                return null;
            });
        }
        log.info("Upload manager stopped");
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    private UploadSession createSession(String repository) {
        String sessionId = UUID.randomUUID().toString();
        Path spoolFile = uploadDir.resolve(sessionId);
        try {
            Files.createDirectories(uploadDir);
            Files.createFile(spoolFile);
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to create upload spool file", e);
        }
        Instant now = Instant.now(clock);
        UploadSession session = UploadSession.builder()
                .id(sessionId)
                .repository(repository)
                .offset(0)
                .spoolFile(spoolFile)
                .createdAt(now)
                .lastActivity(now)
                .state(UploadState.CREATED)
                .build();
        sessions.put(sessionId, session);
        registryMetrics.recordUploadStarted();
        log.info("Upload {} started for {}", sessionId, repository);
        return session.snapshot();
    }

    /**
     * Must be called under the session lock
     *
     * @param repository repository the caller addressed, or null to skip the ownership check
     */
    private UploadSession requireActive(String repository, String sessionId) {
        UploadSession session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId, false);
        }
        if (session.getState() != UploadState.COMMITTING
                && session.getLastActivity().plus(uploadProperties.getSessionTtl()).isBefore(Instant.now(clock))) {
            expire(session);
            throw new SessionNotFoundException(sessionId, true);
        }
        checkOwner(repository, session);
        return session;
    }

    /**
     * As {@link #requireActive}, for calls that change the spool
     */
    private UploadSession requireWritable(String repository, String sessionId) {
        UploadSession session = requireActive(repository, sessionId);
        if (session.getState() == UploadState.COMMITTING) {
            throw new ConflictException("upload " + sessionId + " is being committed");
        }
        return session;
    }

    private Mono<Void> finishCommit(String sessionId) {
        return Mono.fromRunnable(() -> locks.withExclusive(sessionLockKey(sessionId), () -> {
                    UploadSession session = sessions.get(sessionId);
                    if (session != null) {
                        close(session, UploadState.COMPLETED);
                        deleteSpool(session.getSpoolFile());
                    }
                    return null;
                }))
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    private Mono<Void> reopen(String sessionId) {
        return Mono.fromRunnable(() -> locks.withExclusive(sessionLockKey(sessionId), () -> {
                    UploadSession session = sessions.get(sessionId);
                    if (session != null && session.getState() == UploadState.COMMITTING) {
                        session.setState(UploadState.ACCEPTING);
                        session.setLastActivity(Instant.now(clock));
                        log.warn("Upload {} could not be committed, kept open at offset {}", sessionId, session.getOffset());
                    }
                    return null;
                }))
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    private static void checkOwner(String repository, UploadSession session) {
        if (repository != null && !repository.equals(session.getRepository())) {
            throw new ConflictException("upload " + session.getId() + " belongs to repository " + session.getRepository());
        }
    }

    private void appendToSpool(UploadSession session, byte[] chunk) {
        if (chunk != null && chunk.length > 0) {
            try {
                truncateSpool(session);
                Files.write(session.getSpoolFile(), chunk, StandardOpenOption.APPEND);
            } catch (IOException e) {
                try {
                    truncateSpool(session);
                } catch (IOException cleanup) {
                    e.addSuppressed(cleanup);
                }
                throw new StoreUnavailableException("Failed to append to upload " + session.getId(), e);
            }
            session.setOffset(session.getOffset() + chunk.length);
            registryMetrics.recordUploadBytes(chunk.length);
        }
        session.setState(UploadState.ACCEPTING);
        session.setLastActivity(Instant.now(clock));
    }

    /**
     * Cut the spool back to the accepted offset, dropping bytes a failed append left behind
     */
    private static void truncateSpool(UploadSession session) throws IOException {
        if (Files.size(session.getSpoolFile()) > session.getOffset()) {
            try (FileChannel channel = FileChannel.open(session.getSpoolFile(), StandardOpenOption.WRITE)) {
                channel.truncate(session.getOffset());
            }
            log.warn("Upload {} spool truncated back to offset {}", session.getId(), session.getOffset());
        }
    }

    private void expire(UploadSession session) {
        close(session, UploadState.EXPIRED);
        deleteSpool(session.getSpoolFile());
        registryMetrics.recordUploadExpired();
        log.info("Upload {} expired after {} idle", session.getId(), uploadProperties.getSessionTtl());
    }

    private void close(UploadSession session, UploadState finalState) {
        session.setState(finalState);
        if (sessions.remove(session.getId()) != null) {
            registryMetrics.recordUploadClosed();
        }
    }

    private void deleteOrphanedSpoolFiles(Instant cutoff) {
        if (!Files.isDirectory(uploadDir)) {
            return;
        }
        Set<Path> live = sessions.values().stream()
                .map(UploadSession::getSpoolFile)
                .collect(Collectors.toSet());
        try (Stream<Path> files = Files.list(uploadDir)) {
            List<Path> orphans = files
                    .filter(Files::isRegularFile)
                    .filter(path -> !live.contains(path))
                    .filter(path -> isOlderThan(path, cutoff))
                    .toList();
            orphans.forEach(this::deleteSpool);
            if (!orphans.isEmpty()) {
                log.info("Deleted {} orphaned spool files", orphans.size());
            }
        } catch (IOException e) {
            log.error("Failed to scan upload directory {}", uploadDir, e);
        }
    }

    private boolean isOlderThan(Path path, Instant cutoff) {
        try {
            return Files.getLastModifiedTime(path).toInstant().isBefore(cutoff);
        } catch (IOException e) {
            log.warn("Failed to read modification time of {}", path, e);
            return false;
        }
    }

    private void deleteSpool(Path spoolFile) {
        try {
            Files.deleteIfExists(spoolFile);
        } catch (IOException e) {
            log.warn("Failed to delete spool file: {}", spoolFile, e);
        }
    }

    private static String sessionLockKey(String sessionId) {
        return "upload:" + sessionId;
    }
}
