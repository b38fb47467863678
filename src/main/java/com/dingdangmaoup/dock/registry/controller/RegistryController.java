package com.dingdangmaoup.dock.registry.controller;

import com.dingdangmaoup.dock.blob.BlobService;
import com.dingdangmaoup.dock.config.properties.UploadProperties;
import com.dingdangmaoup.dock.digest.Digest;
import com.dingdangmaoup.dock.exception.ErrorCode;
import com.dingdangmaoup.dock.exception.PayloadTooLargeException;
import com.dingdangmaoup.dock.exception.RegistryException;
import com.dingdangmaoup.dock.manifest.ManifestService;
import com.dingdangmaoup.dock.registry.model.BlobResponse;
import com.dingdangmaoup.dock.registry.model.CatalogResponse;
import com.dingdangmaoup.dock.registry.model.ManifestPutResponse;
import com.dingdangmaoup.dock.registry.model.TagListResponse;
import com.dingdangmaoup.dock.registry.model.UploadResponse;
import com.dingdangmaoup.dock.repository.Pagination;
import com.dingdangmaoup.dock.repository.RepositoryService;
import com.dingdangmaoup.dock.storage.BlobMetadata;
import com.dingdangmaoup.dock.upload.BlobUploadManager;
import com.dingdangmaoup.dock.upload.UploadSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Docker Registry API v2. Repository names are {@code name} or {@code namespace/name}.
 */
@Slf4j
@RestController
@RequestMapping("/v2")
@RequiredArgsConstructor
public class RegistryController {

    private final RepositoryService repositoryService;
    private final ManifestService manifestService;
    private final BlobService blobService;
    private final BlobUploadManager uploadManager;
    private final UploadProperties uploadProperties;

    /**
     * API version check endpoint
     */
    @GetMapping("/")
    public Mono<ResponseEntity<Map<String, Object>>> apiVersion() {
        return Mono.just(ResponseEntity.ok()
                .header(RegistryHeaders.API_VERSION, RegistryHeaders.API_VERSION_VALUE)
                .body(Map.of()));
    }

    @GetMapping("/_catalog")
    public Mono<ResponseEntity<CatalogResponse>> catalog(
            @RequestParam(required = false) String n,
            @RequestParam(required = false) String last) {
        Integer limit = parseLimit(n);
        return repositoryService.listRepositories(limit, last)
                .map(page -> withNextLink(ResponseEntity.ok(), "/v2/_catalog", limit, page)
                        .body(new CatalogResponse(page.getItems())));
    }

    @GetMapping(value = {
            "/{name}/tags/list",
            "/{namespace}/{name}/tags/list"
    })
    public Mono<ResponseEntity<TagListResponse>> listTags(
            @PathVariable(required = false) String namespace,
            @PathVariable String name,
            @RequestParam(required = false) String n,
            @RequestParam(required = false) String last) {
        String repository = repositoryName(namespace, name);
        Integer limit = parseLimit(n);
        return manifestService.listTags(repository, limit, last)
                .map(page -> withNextLink(ResponseEntity.ok(), "/v2/" + repository + "/tags/list", limit, page)
                        .body(new TagListResponse(repository, page.getItems())));
    }

    // ---- manifests ----

    @GetMapping(value = {
            "/{name}/manifests/{reference}",
            "/{namespace}/{name}/manifests/{reference}"
    })
    public Mono<ResponseEntity<byte[]>> getManifest(
            @PathVariable(required = false) String namespace,
            @PathVariable String name,
            @PathVariable String reference) {
        String repository = repositoryName(namespace, name);
        log.debug("GET manifest: {}:{}", repository, reference);
        return manifestService.getManifest(repository, reference)
                .map(manifest -> ResponseEntity.ok()
                        .header(HttpHeaders.CONTENT_TYPE, manifest.getMediaType())
                        .header(RegistryHeaders.CONTENT_DIGEST, manifest.getDigest())
                        .contentLength(manifest.getContent().length)
                        .body(manifest.getContent()));
    }

    @RequestMapping(value = {
            "/{name}/manifests/{reference}",
            "/{namespace}/{name}/manifests/{reference}"
    }, method = RequestMethod.HEAD)
    public Mono<ResponseEntity<Void>> headManifest(
            @PathVariable(required = false) String namespace,
            @PathVariable String name,
            @PathVariable String reference) {
        String repository = repositoryName(namespace, name);
        return manifestService.getManifest(repository, reference)
                .map(manifest -> ResponseEntity.ok()
                        .header(HttpHeaders.CONTENT_TYPE, manifest.getMediaType())
                        .header(RegistryHeaders.CONTENT_DIGEST, manifest.getDigest())
                        .contentLength(manifest.getContent().length)
                        .build());
    }

    @PutMapping(value = {
            "/{name}/manifests/{reference}",
            "/{namespace}/{name}/manifests/{reference}"
    })
    public Mono<ResponseEntity<ManifestPutResponse>> putManifest(
            @PathVariable(required = false) String namespace,
            @PathVariable String name,
            @PathVariable String reference,
            ServerHttpRequest request) {
        String repository = repositoryName(namespace, name);
        String contentType = request.getHeaders().getFirst(HttpHeaders.CONTENT_TYPE);
        log.debug("PUT manifest: {}:{} ({})", repository, reference, contentType);
        return readBody(request)
                .flatMap(content -> manifestService.putManifest(repository, reference, content, contentType))
                .map(digest -> {
                    String location = "/v2/" + repository + "/manifests/" + digest;
                    return ResponseEntity.status(HttpStatus.CREATED)
                            .header(HttpHeaders.LOCATION, location)
                            .header(RegistryHeaders.CONTENT_DIGEST, digest.toString())
                            .body(new ManifestPutResponse(digest.toString(), location));
                });
    }

    @DeleteMapping(value = {
            "/{name}/manifests/{reference}",
            "/{namespace}/{name}/manifests/{reference}"
    })
    public Mono<ResponseEntity<Void>> deleteManifest(
            @PathVariable(required = false) String namespace,
            @PathVariable String name,
            @PathVariable String reference) {
        String repository = repositoryName(namespace, name);
        return manifestService.deleteManifest(repository, reference)
                .thenReturn(ResponseEntity.accepted().<Void>build());
    }

    // ---- blobs ----

    @RequestMapping(value = {
            "/{name}/blobs/{digest}",
            "/{namespace}/{name}/blobs/{digest}"
    }, method = RequestMethod.HEAD)
    public Mono<ResponseEntity<Void>> headBlob(
            @PathVariable(required = false) String namespace,
            @PathVariable String name,
            @PathVariable String digest) {
        String repository = repositoryName(namespace, name);
        return Mono.fromCallable(() -> Digest.parse(digest))
                .flatMap(parsed -> blobService.stat(repository, parsed))
                .map(blob -> blobHeaders(ResponseEntity.ok(), blob).build());
    }

    @GetMapping(value = {
            "/{name}/blobs/{digest}",
            "/{namespace}/{name}/blobs/{digest}"
    })
    public Mono<ResponseEntity<Flux<DataBuffer>>> getBlob(
            @PathVariable(required = false) String namespace,
            @PathVariable String name,
            @PathVariable String digest) {
        String repository = repositoryName(namespace, name);
        log.debug("GET blob: {}@{}", repository, digest);
        return Mono.fromCallable(() -> Digest.parse(digest))
                .flatMap(parsed -> blobService.stat(repository, parsed)
                        .map(blob -> blobHeaders(ResponseEntity.ok(), blob)
                                .body(blobService.read(parsed))));
    }

    /**
     * Unlinks the blob from the repository
     */
    @DeleteMapping(value = {
            "/{name}/blobs/{digest}",
            "/{namespace}/{name}/blobs/{digest}"
    })
    public Mono<ResponseEntity<Void>> deleteBlob(
            @PathVariable(required = false) String namespace,
            @PathVariable String name,
            @PathVariable String digest) {
        String repository = repositoryName(namespace, name);
        return Mono.fromCallable(() -> Digest.parse(digest))
                .flatMap(parsed -> blobService.unlink(repository, parsed))
                .thenReturn(ResponseEntity.accepted().<Void>build());
    }

    // ---- uploads ----

    /**
     * Start an upload. With {@code digest} the body is the whole blob; with
     * {@code mount} and {@code from} the blob is linked from another repository
     * when possible, otherwise a regular session is started.
     */
    @PostMapping(value = {
            "/{name}/blobs/uploads",
            "/{name}/blobs/uploads/",
            "/{namespace}/{name}/blobs/uploads",
            "/{namespace}/{name}/blobs/uploads/"
    })
    public Mono<ResponseEntity<Object>> startUpload(
            @PathVariable(required = false) String namespace,
            @PathVariable String name,
            @RequestParam(required = false) String digest,
            @RequestParam(required = false) String mount,
            @RequestParam(required = false) String from,
            ServerHttpRequest request) {
        String repository = repositoryName(namespace, name);

        if (digest != null) {
            return Mono.fromCallable(() -> Digest.parse(digest))
                    .flatMap(expected -> readBody(request)
                            .flatMap(content -> uploadManager.monolithic(repository, content, expected)))
                    .map(blob -> blobCreated(repository, blob));
        }

        if (mount != null && from != null) {
            return Mono.fromCallable(() -> Digest.parse(mount))
                    .flatMap(parsed -> uploadManager.mount(repository, parsed, from))
                    .map(blob -> blobCreated(repository, blob))
                    .switchIfEmpty(Mono.defer(() -> startSession(repository)));
        }

        return startSession(repository);
    }

    @GetMapping(value = {
            "/{name}/blobs/uploads/{uuid}",
            "/{namespace}/{name}/blobs/uploads/{uuid}"
    })
    public Mono<ResponseEntity<Void>> uploadStatus(
            @PathVariable(required = false) String namespace,
            @PathVariable String name,
            @PathVariable String uuid) {
        String repository = repositoryName(namespace, name);
        return uploadManager.status(repository, uuid)
                .map(session -> ResponseEntity.noContent()
                        .header(HttpHeaders.LOCATION, uploadLocation(repository, session.getId()))
                        .header(RegistryHeaders.RANGE, RegistryHeaders.range(session.getOffset()))
                        .header(RegistryHeaders.UPLOAD_UUID, session.getId())
                        .build());
    }

    @PatchMapping(value = {
            "/{name}/blobs/uploads/{uuid}",
            "/{namespace}/{name}/blobs/uploads/{uuid}"
    })
    public Mono<ResponseEntity<Object>> uploadChunk(
            @PathVariable(required = false) String namespace,
            @PathVariable String name,
            @PathVariable String uuid,
            ServerHttpRequest request) {
        String repository = repositoryName(namespace, name);
        String contentRange = request.getHeaders().getFirst(RegistryHeaders.CONTENT_RANGE);
        return readBody(request)
                .flatMap(chunk -> {
                    Long start = ContentRange.parseStart(contentRange, chunk.length);
                    return uploadManager.appendChunk(repository, uuid, chunk, start);
                })
                .map(session -> uploadAccepted(repository, session));
    }

    @PutMapping(value = {
            "/{name}/blobs/uploads/{uuid}",
            "/{namespace}/{name}/blobs/uploads/{uuid}"
    })
    public Mono<ResponseEntity<Object>> completeUpload(
            @PathVariable(required = false) String namespace,
            @PathVariable String name,
            @PathVariable String uuid,
            @RequestParam(required = false) String digest,
            ServerHttpRequest request) {
        String repository = repositoryName(namespace, name);
        return Mono.fromCallable(() -> Digest.parse(digest))
                .flatMap(expected -> readBody(request)
                        .flatMap(content -> uploadManager.complete(repository, uuid, content, expected)))
                .map(blob -> blobCreated(repository, blob));
    }

    @DeleteMapping(value = {
            "/{name}/blobs/uploads/{uuid}",
            "/{namespace}/{name}/blobs/uploads/{uuid}"
    })
    public Mono<ResponseEntity<Void>> cancelUpload(
            @PathVariable(required = false) String namespace,
            @PathVariable String name,
            @PathVariable String uuid) {
        return uploadManager.cancel(repositoryName(namespace, name), uuid)
                .thenReturn(ResponseEntity.noContent().<Void>build());
    }

    private Mono<ResponseEntity<Object>> startSession(String repository) {
        return uploadManager.start(repository)
                .map(session -> uploadAccepted(repository, session));
    }

    private ResponseEntity<Object> uploadAccepted(String repository, UploadSession session) {
        String location = uploadLocation(repository, session.getId());
        return ResponseEntity.accepted()
                .header(HttpHeaders.LOCATION, location)
                .header(RegistryHeaders.RANGE, RegistryHeaders.range(session.getOffset()))
                .header(RegistryHeaders.UPLOAD_UUID, session.getId())
                .body(UploadResponse.builder()
                        .uuid(session.getId())
                        .location(location)
                        .offset(session.getOffset())
                        .build());
    }

    private ResponseEntity<Object> blobCreated(String repository, BlobMetadata blob) {
        String location = "/v2/" + repository + "/blobs/" + blob.getDigest();
        return ResponseEntity.status(HttpStatus.CREATED)
                .header(HttpHeaders.LOCATION, location)
                .header(RegistryHeaders.CONTENT_DIGEST, blob.getDigest())
                .body(BlobResponse.builder()
                        .digest(blob.getDigest())
                        .size(blob.getSize())
                        .location(location)
                        .build());
    }

    private static ResponseEntity.BodyBuilder blobHeaders(ResponseEntity.BodyBuilder builder, BlobMetadata blob) {
        return builder
                .header(HttpHeaders.CONTENT_TYPE, blob.getMediaType())
                .header(RegistryHeaders.CONTENT_DIGEST, blob.getDigest())
                .contentLength(blob.getSize());
    }

    private static ResponseEntity.BodyBuilder withNextLink(ResponseEntity.BodyBuilder builder, String path,
                                                           Integer limit, Pagination.Page page) {
        if (page.isHasMore() && limit != null) {
            String next = path + "?n=" + limit + "&last="
                    + UriUtils.encodeQueryParam(page.lastItem(), StandardCharsets.UTF_8);
            builder.header(HttpHeaders.LINK, "<" + next + ">; rel=\"next\"");
        }
        return builder;
    }

    private Mono<byte[]> readBody(ServerHttpRequest request) {
        long limit = uploadProperties.getMaxChunkSize().toBytes();
        return DataBufferUtils.join(request.getBody(), (int) Math.min(Integer.MAX_VALUE, limit))
                .map(buffer -> {
                    byte[] bytes = new byte[buffer.readableByteCount()];
                    buffer.read(bytes);
                    DataBufferUtils.release(buffer);
                    return bytes;
                })
                .defaultIfEmpty(new byte[0])
                .onErrorMap(DataBufferLimitException.class, e -> new PayloadTooLargeException(limit));
    }

    private static Integer parseLimit(String n) {
        if (n == null || n.isEmpty()) {
            return null;
        }
        try {
            return Integer.valueOf(n);
        } catch (NumberFormatException e) {
            throw new RegistryException(ErrorCode.PAGINATION_NUMBER_INVALID, "n is not a number", Map.of("n", n));
        }
    }

    private static String uploadLocation(String repository, String uuid) {
        return "/v2/" + repository + "/blobs/uploads/" + uuid;
    }

    private static String repositoryName(String namespace, String name) {
        return (namespace != null) ? namespace + "/" + name : name;
    }
}
