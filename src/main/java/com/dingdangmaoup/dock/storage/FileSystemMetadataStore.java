package com.dingdangmaoup.dock.storage;

import com.dingdangmaoup.dock.digest.Digest;
import com.dingdangmaoup.dock.exception.StoreUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * File-system-based implementation of MetadataStore.
 * Layout under {@code {base}/repositories/{repository}/}:
 * <pre>
 *   _repository.json
 *   _manifests/tags/{tag}.json
 *   _manifests/revisions/{algorithm}/{hex}.json
 *   _layers/{algorithm}/{hex}.json
 * </pre>
 * Every record is written to a sibling temp file and moved into place.
 */
@Slf4j
@Component
public class FileSystemMetadataStore implements MetadataStore {

    private static final String REPOSITORY_MARKER = "_repository.json";
    private static final String JSON = ".json";

    private final Path repositoriesRoot;
    private final ObjectMapper objectMapper;

    public FileSystemMetadataStore(
            @Value("${dock.storage.base-path:/data/dock}") String basePath,
            ObjectMapper objectMapper) {
        this.repositoriesRoot = Paths.get(basePath, "repositories");
        this.objectMapper = objectMapper;
        try {
            Files.createDirectories(repositoriesRoot);
            log.info("Initialized metadata storage at: {}", repositoriesRoot);
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to initialize metadata storage", e);
        }
    }

    @Override
    public boolean repositoryExists(String repository) {
        return Files.exists(repositoryDir(repository).resolve(REPOSITORY_MARKER));
    }

    @Override
    public boolean createRepository(String repository) {
        Path marker = repositoryDir(repository).resolve(REPOSITORY_MARKER);
        if (Files.exists(marker)) {
            return false;
        }
        write(marker, RepositoryRecord.builder().name(repository).createdAt(Instant.now()).build());
        log.info("Created repository: {}", repository);
        return true;
    }

    @Override
    public boolean deleteRepository(String repository) {
        Path dir = repositoryDir(repository);
        if (!Files.exists(dir.resolve(REPOSITORY_MARKER))) {
            return false;
        }
        try {
            // remove the marker first so a half-deleted repository is already invisible
            Files.delete(dir.resolve(REPOSITORY_MARKER));
            deleteTree(dir.resolve("_manifests"));
            deleteTree(dir.resolve("_layers"));
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to delete repository " + repository, e);
        }
        log.info("Deleted repository: {}", repository);
        return true;
    }

    @Override
    public List<String> listRepositories() {
        if (!Files.exists(repositoriesRoot)) {
            return List.of();
        }
        try (Stream<Path> paths = Files.walk(repositoriesRoot)) {
            return paths.filter(path -> path.getFileName().toString().equals(REPOSITORY_MARKER))
                    .map(path -> repositoriesRoot.relativize(path.getParent()))
                    // skip tag records that happen to be named like the marker
                    .filter(relative -> !relative.toString().isEmpty() && isRepositoryPath(relative))
                    .map(relative -> relative.toString().replace(relative.getFileSystem().getSeparator(), "/"))
                    .sorted()
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            throw new StoreUnavailableException("Failed to list repositories", e);
        }
    }

    @Override
    public Optional<TagRecord> getTag(String repository, String tag) {
        return read(tagPath(repository, tag), TagRecord.class);
    }

    @Override
    public void putTag(String repository, TagRecord tag) {
        write(tagPath(repository, tag.getName()), tag);
    }

    @Override
    public boolean deleteTag(String repository, String tag) {
        return delete(tagPath(repository, tag));
    }

    @Override
    public List<TagRecord> listTags(String repository) {
        List<TagRecord> tags = readAll(repositoryDir(repository).resolve("_manifests").resolve("tags"), TagRecord.class);
        tags.sort(Comparator.comparing(TagRecord::getName));
        return tags;
    }

    @Override
    public Optional<ManifestRevision> getRevision(String repository, Digest digest) {
        return read(revisionPath(repository, digest), ManifestRevision.class);
    }

    @Override
    public void putRevision(String repository, ManifestRevision revision) {
        write(revisionPath(repository, Digest.parse(revision.getDigest())), revision);
    }

    @Override
    public boolean deleteRevision(String repository, Digest digest) {
        return delete(revisionPath(repository, digest));
    }

    @Override
    public List<ManifestRevision> listRevisions(String repository) {
        Path revisions = repositoryDir(repository).resolve("_manifests").resolve("revisions");
        List<ManifestRevision> result = new ArrayList<>();
        if (!Files.isDirectory(revisions)) {
            return result;
        }
        try (Stream<Path> algorithms = Files.list(revisions)) {
            for (Path algorithm : algorithms.toList()) {
                result.addAll(readAll(algorithm, ManifestRevision.class));
            }
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to list revisions of " + repository, e);
        }
        return result;
    }

    @Override
    public void linkBlob(String repository, BlobLink link) {
        write(layerPath(repository, Digest.parse(link.getDigest())), link);
    }

    @Override
    public Optional<BlobLink> getBlobLink(String repository, Digest digest) {
        return read(layerPath(repository, digest), BlobLink.class);
    }

    @Override
    public boolean unlinkBlob(String repository, Digest digest) {
        return delete(layerPath(repository, digest));
    }

    private static boolean isRepositoryPath(Path relative) {
        for (Path component : relative) {
            if (component.toString().startsWith("_")) {
                return false;
            }
        }
        return true;
    }

    private Path repositoryDir(String repository) {
        return repositoriesRoot.resolve(repository);
    }

    private Path tagPath(String repository, String tag) {
        return repositoryDir(repository).resolve("_manifests").resolve("tags").resolve(tag + JSON);
    }

    private Path revisionPath(String repository, Digest digest) {
        return repositoryDir(repository).resolve("_manifests").resolve("revisions")
                .resolve(digest.getAlgorithm().getPrefix()).resolve(digest.getHex() + JSON);
    }

    private Path layerPath(String repository, Digest digest) {
        return repositoryDir(repository).resolve("_layers")
                .resolve(digest.getAlgorithm().getPrefix()).resolve(digest.getHex() + JSON);
    }

    private <T> Optional<T> read(Path path, Class<T> type) {
        try {
            return Optional.of(objectMapper.readValue(Files.readAllBytes(path), type));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to read " + path, e);
        }
    }

    private <T> List<T> readAll(Path dir, Class<T> type) {
        List<T> result = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return result;
        }
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : files.filter(path -> path.getFileName().toString().endsWith(JSON)).toList()) {
                read(file, type).ifPresent(result::add);
            }
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to list " + dir, e);
        }
        return result;
    }

    private void write(Path path, Object value) {
        Path temp = path.resolveSibling("." + path.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.createDirectories(path.getParent());
            Files.write(temp, objectMapper.writeValueAsBytes(value), StandardOpenOption.CREATE_NEW);
            Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new StoreUnavailableException("Failed to write " + path, e);
        }
    }

    private boolean delete(Path path) {
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to delete " + path, e);
        }
    }

    private void deleteTree(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
