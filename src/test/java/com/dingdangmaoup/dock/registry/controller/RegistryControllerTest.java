package com.dingdangmaoup.dock.registry.controller;

import com.dingdangmaoup.dock.RegistryFixture;
import com.dingdangmaoup.dock.digest.Digest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.EntityExchangeResult;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class RegistryControllerTest {

    private static final String MANIFEST_TYPE = "application/vnd.oci.image.manifest.v1+json";

    @TempDir
    Path base;

    private RegistryFixture registry;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        registry = new RegistryFixture(base);
        client = WebTestClient.bindToController(registry.controller(), new HealthController(registry.cacheManager))
                .controllerAdvice(new RegistryExceptionHandler())
                .build();
    }

    @Test
    void apiVersionCheck() {
        client.get().uri("/v2/")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().valueEquals(RegistryHeaders.API_VERSION, RegistryHeaders.API_VERSION_VALUE)
                .expectBody().json("{}");
    }

    @Test
    void chunkedPushThenPull() {
        byte[] first = filled(1024, (byte) 'x');
        byte[] second = filled(1024, (byte) 'y');
        byte[] whole = new byte[2048];
        System.arraycopy(first, 0, whole, 0, 1024);
        System.arraycopy(second, 0, whole, 1024, 1024);
        Digest digest = registry.digestEngine.compute(whole);

        EntityExchangeResult<byte[]> started = client.post().uri("/v2/library/app/blobs/uploads/")
                .exchange()
                .expectStatus().isAccepted()
                .expectHeader().valueEquals(RegistryHeaders.RANGE, "0-0")
                .expectHeader().exists(RegistryHeaders.UPLOAD_UUID)
                .expectBody().returnResult();
        String location = started.getResponseHeaders().getLocation().toString();
        assertThat(location).startsWith("/v2/library/app/blobs/uploads/");

        client.patch().uri(location)
                .header(RegistryHeaders.CONTENT_RANGE, "0-1023")
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .bodyValue(first)
                .exchange()
                .expectStatus().isAccepted()
                .expectHeader().valueEquals(RegistryHeaders.RANGE, "0-1023");

        client.patch().uri(location)
                .header(RegistryHeaders.CONTENT_RANGE, "1024-2047")
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .bodyValue(second)
                .exchange()
                .expectStatus().isAccepted()
                .expectHeader().valueEquals(RegistryHeaders.RANGE, "0-2047");

        client.get().uri(location)
                .exchange()
                .expectStatus().isNoContent()
                .expectHeader().valueEquals(RegistryHeaders.RANGE, "0-2047");

        client.put().uri(location + "?digest=" + digest)
                .exchange()
                .expectStatus().isCreated()
                .expectHeader().valueEquals(RegistryHeaders.CONTENT_DIGEST, digest.toString())
                .expectHeader().valueEquals(HttpHeaders.LOCATION, "/v2/library/app/blobs/" + digest);

        client.head().uri("/v2/library/app/blobs/" + digest)
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentLength(2048)
                .expectHeader().valueEquals(RegistryHeaders.CONTENT_DIGEST, digest.toString());

        client.get().uri("/v2/library/app/blobs/" + digest)
                .exchange()
                .expectStatus().isOk()
                .expectBody(byte[].class).isEqualTo(whole);
    }

    @Test
    void outOfOrderChunkIsRangeInvalid() {
        String location = startUpload("app");

        client.patch().uri(location)
                .header(RegistryHeaders.CONTENT_RANGE, "0-9")
                .bodyValue(filled(10, (byte) 1))
                .exchange()
                .expectStatus().isAccepted();

        client.patch().uri(location)
                .header(RegistryHeaders.CONTENT_RANGE, "20-29")
                .bodyValue(filled(10, (byte) 1))
                .exchange()
                .expectStatus().isEqualTo(416)
                .expectHeader().valueEquals(RegistryHeaders.RANGE, "0-9")
                .expectBody().jsonPath("$.errors[0].code").isEqualTo("RANGE_INVALID");
    }

    @Test
    void uploadFromAnotherRepositoryIsConflict() {
        String location = startUpload("app");
        String uuid = location.substring(location.lastIndexOf('/') + 1);

        client.get().uri("/v2/other/blobs/uploads/" + uuid)
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody().jsonPath("$.errors[0].code").isEqualTo("UNSUPPORTED");
    }

    @Test
    void completeWithWrongDigestIsDigestInvalid() {
        String location = startUpload("app");
        Digest wrong = registry.digestEngine.compute("other".getBytes(StandardCharsets.UTF_8));

        client.put().uri(location + "?digest=" + wrong)
                .bodyValue("content".getBytes(StandardCharsets.UTF_8))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody().jsonPath("$.errors[0].code").isEqualTo("DIGEST_INVALID");

        client.get().uri(location)
                .exchange()
                .expectStatus().isNotFound()
                .expectBody().jsonPath("$.errors[0].code").isEqualTo("BLOB_UPLOAD_UNKNOWN");
    }

    @Test
    void malformedDigestIsRejected() {
        String location = startUpload("app");

        client.put().uri(location + "?digest=sha256:nothex")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody().jsonPath("$.errors[0].code").isEqualTo("DIGEST_INVALID");
    }

    @Test
    void monolithicUploadAndUnknownBlob() {
        byte[] content = "monolithic".getBytes(StandardCharsets.UTF_8);
        Digest digest = registry.digestEngine.compute(content);

        client.post().uri("/v2/app/blobs/uploads/?digest=" + digest)
                .bodyValue(content)
                .exchange()
                .expectStatus().isCreated()
                .expectHeader().valueEquals(RegistryHeaders.CONTENT_DIGEST, digest.toString());

        client.head().uri("/v2/app/blobs/" + registry.digestEngine.compute(new byte[]{1}))
                .exchange()
                .expectStatus().isNotFound();

        client.get().uri("/v2/app/blobs/" + registry.digestEngine.compute(new byte[]{1}))
                .exchange()
                .expectStatus().isNotFound()
                .expectBody().jsonPath("$.errors[0].code").isEqualTo("BLOB_UNKNOWN");

        client.delete().uri("/v2/app/blobs/" + digest)
                .exchange()
                .expectStatus().isAccepted();

        client.head().uri("/v2/app/blobs/" + digest)
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void crossRepositoryMount() {
        byte[] content = "shared layer".getBytes(StandardCharsets.UTF_8);
        Digest digest = registry.digestEngine.compute(content);
        registry.uploadManager.monolithic("source/app", content, digest).block();

        client.post().uri("/v2/target/blobs/uploads/?mount=" + digest + "&from=source/app")
                .exchange()
                .expectStatus().isCreated()
                .expectHeader().valueEquals(RegistryHeaders.CONTENT_DIGEST, digest.toString());

        client.post().uri("/v2/target/blobs/uploads/?mount=" + digest + "&from=elsewhere")
                .exchange()
                .expectStatus().isAccepted()
                .expectHeader().exists(RegistryHeaders.UPLOAD_UUID);
    }

    @Test
    void manifestLifecycle() {
        byte[] manifest = ("{\"schemaVersion\":2,\"mediaType\":\"" + MANIFEST_TYPE + "\"}").getBytes(StandardCharsets.UTF_8);
        Digest digest = registry.digestEngine.compute(manifest);

        client.put().uri("/v2/library/app/manifests/latest")
                .contentType(MediaType.parseMediaType(MANIFEST_TYPE))
                .bodyValue(manifest)
                .exchange()
                .expectStatus().isCreated()
                .expectHeader().valueEquals(RegistryHeaders.CONTENT_DIGEST, digest.toString())
                .expectHeader().valueEquals(HttpHeaders.LOCATION, "/v2/library/app/manifests/" + digest);

        client.get().uri("/v2/library/app/manifests/latest")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().valueEquals(HttpHeaders.CONTENT_TYPE, MANIFEST_TYPE)
                .expectHeader().valueEquals(RegistryHeaders.CONTENT_DIGEST, digest.toString())
                .expectBody(byte[].class).isEqualTo(manifest);

        client.method(HttpMethod.HEAD).uri("/v2/library/app/manifests/" + digest)
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentLength(manifest.length);

        client.get().uri("/v2/library/app/tags/list")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.name").isEqualTo("library/app")
                .jsonPath("$.tags[0]").isEqualTo("latest");

        client.delete().uri("/v2/library/app/manifests/latest")
                .exchange()
                .expectStatus().isAccepted();

        client.get().uri("/v2/library/app/manifests/latest")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody().jsonPath("$.errors[0].code").isEqualTo("MANIFEST_UNKNOWN");
    }

    @Test
    void unknownRepositoryTagsAre404() {
        client.get().uri("/v2/missing/tags/list")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody().jsonPath("$.errors[0].code").isEqualTo("NAME_UNKNOWN");
    }

    @Test
    void invalidRepositoryNameIs400() {
        client.post().uri("/v2/Bad_Name-/blobs/uploads/")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody().jsonPath("$.errors[0].code").isEqualTo("NAME_INVALID");
    }

    @Test
    void catalogPaginationSetsLinkHeader() {
        registry.repositoryService.createRepository("a").block();
        registry.repositoryService.createRepository("b").block();
        registry.repositoryService.createRepository("c").block();

        client.get().uri("/v2/_catalog?n=2")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().valueEquals(HttpHeaders.LINK, "</v2/_catalog?n=2&last=b>; rel=\"next\"")
                .expectBody().jsonPath("$.repositories.length()").isEqualTo(2);

        client.get().uri("/v2/_catalog?n=2&last=b")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().doesNotExist(HttpHeaders.LINK)
                .expectBody().jsonPath("$.repositories[0]").isEqualTo("c");

        client.get().uri("/v2/_catalog?n=abc")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody().jsonPath("$.errors[0].code").isEqualTo("PAGINATION_NUMBER_INVALID");
    }

    @Test
    void readOnlyRegistryDeniesPush() {
        registry.accessProperties.setReadOnly(true);

        client.post().uri("/v2/app/blobs/uploads/")
                .exchange()
                .expectStatus().isForbidden()
                .expectBody().jsonPath("$.errors[0].code").isEqualTo("DENIED");
    }

    @Test
    void cacheHealthReportsLocalTier() {
        client.get().uri("/health/cache")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.cache_stats.memory_cache.entries").isEqualTo(0)
                .jsonPath("$.cache_stats.redis_connected").isEqualTo(false);
    }

    private String startUpload(String repository) {
        return client.post().uri("/v2/" + repository + "/blobs/uploads/")
                .exchange()
                .expectStatus().isAccepted()
                .expectBody().returnResult()
                .getResponseHeaders().getLocation().toString();
    }

    private static byte[] filled(int size, byte value) {
        byte[] bytes = new byte[size];
        Arrays.fill(bytes, value);
        return bytes;
    }
}
