package com.dingdangmaoup.dock.manifest;

import com.dingdangmaoup.dock.RegistryFixture;
import com.dingdangmaoup.dock.digest.Digest;
import com.dingdangmaoup.dock.exception.DigestMismatchException;
import com.dingdangmaoup.dock.exception.ErrorCode;
import com.dingdangmaoup.dock.exception.ManifestInvalidException;
import com.dingdangmaoup.dock.exception.NotFoundException;
import com.dingdangmaoup.dock.exception.RepositoryInvalidException;
import com.dingdangmaoup.dock.storage.ManifestRevision;
import com.dingdangmaoup.dock.storage.TagRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ManifestServiceTest {

    private static final String OCI_MANIFEST = "application/vnd.oci.image.manifest.v1+json";

    @TempDir
    Path base;

    private RegistryFixture registry;
    private ManifestService manifests;

    @BeforeEach
    void setUp() {
        registry = new RegistryFixture(base);
        manifests = registry.manifestService;
    }

    @Test
    void sameManifestUnderTwoTagsIsStoredOnce() {
        byte[] content = manifest("layer-1");

        Digest first = manifests.putManifest("app", "v1", content, OCI_MANIFEST).block();
        Digest second = manifests.putManifest("app", "latest", content, OCI_MANIFEST).block();

        assertThat(first).isEqualTo(second).isEqualTo(registry.digestEngine.compute(content));
        assertThat(registry.metadataStore.listRevisions("app")).hasSize(1);
        assertThat(manifests.listTags("app", null, null).block().getItems()).containsExactly("latest", "v1");
    }

    @Test
    void repointingTagRemovesUnreferencedManifest() {
        byte[] oldContent = manifest("old");
        byte[] newContent = manifest("new");
        Digest oldDigest = manifests.putManifest("app", "latest", oldContent, OCI_MANIFEST).block();

        // warm the cache with the old state
        assertThat(manifests.getManifest("app", "latest").block().getDigest()).isEqualTo(oldDigest.toString());
        assertThat(manifests.getManifest("app", oldDigest.toString()).block().getContent()).isEqualTo(oldContent);

        Digest newDigest = manifests.putManifest("app", "latest", newContent, OCI_MANIFEST).block();

        StepVerifier.create(manifests.getManifest("app", "latest"))
                .assertNext(m -> {
                    assertThat(m.getDigest()).isEqualTo(newDigest.toString());
                    assertThat(m.getContent()).isEqualTo(newContent);
                })
                .verifyComplete();
        assertThat(manifests.listTags("app", null, null).block().getItems()).containsExactly("latest");
        StepVerifier.create(manifests.getManifest("app", oldDigest.toString())).expectError(NotFoundException.class).verify();
    }

    @Test
    void repointingKeepsManifestStillTaggedElsewhere() {
        byte[] shared = manifest("shared");
        Digest sharedDigest = manifests.putManifest("app", "v1", shared, OCI_MANIFEST).block();
        manifests.putManifest("app", "latest", shared, OCI_MANIFEST).block();

        manifests.putManifest("app", "latest", manifest("next"), OCI_MANIFEST).block();

        StepVerifier.create(manifests.getManifest("app", sharedDigest.toString())).expectNextCount(1).verifyComplete();
    }

    @Test
    void manifestPushedByDigestSurvivesTagRemoval() {
        byte[] content = manifest("pinned");
        Digest digest = registry.digestEngine.compute(content);
        manifests.putManifest("app", digest.toString(), content, OCI_MANIFEST).block();
        manifests.putManifest("app", "latest", content, OCI_MANIFEST).block();

        manifests.deleteTag("app", "latest").block();

        StepVerifier.create(manifests.getManifest("app", digest.toString())).expectNextCount(1).verifyComplete();
        StepVerifier.create(manifests.getManifest("app", "latest")).expectError(NotFoundException.class).verify();
    }

    @Test
    void deleteTagRemovesOnlyUntaggedManifest() {
        byte[] content = manifest("tagged-only");
        Digest digest = manifests.putManifest("app", "latest", content, OCI_MANIFEST).block();

        StepVerifier.create(manifests.deleteManifest("app", "latest")).verifyComplete();

        assertThat(manifests.listTags("app", null, null).block().getItems()).isEmpty();
        StepVerifier.create(manifests.getManifest("app", digest.toString())).expectError(NotFoundException.class).verify();
        StepVerifier.create(manifests.deleteTag("app", "latest")).expectError(NotFoundException.class).verify();
    }

    @Test
    void deleteByDigestRemovesEveryTagPointingAtIt() {
        byte[] content = manifest("multi");
        Digest digest = manifests.putManifest("app", "v1", content, OCI_MANIFEST).block();
        manifests.putManifest("app", "v2", content, OCI_MANIFEST).block();
        manifests.putManifest("app", "other", manifest("unrelated"), OCI_MANIFEST).block();

        StepVerifier.create(manifests.deleteManifest("app", digest.toString())).verifyComplete();

        assertThat(manifests.listTags("app", null, null).block().getItems()).containsExactly("other");
        StepVerifier.create(manifests.getManifest("app", "v1")).expectError(NotFoundException.class).verify();
    }

    @Test
    void readsAreByteIdentical() {
        byte[] content = "{ \"schemaVersion\": 2,\n  \"layers\": [] }".getBytes(StandardCharsets.UTF_8);
        manifests.putManifest("app", "latest", content, null).block();

        for (int i = 0; i < 3; i++) {
            StepVerifier.create(manifests.getManifest("app", "latest"))
                    .assertNext(m -> assertThat(m.getContent()).isEqualTo(content))
                    .verifyComplete();
        }
    }

    @Test
    void mediaTypeFallsBackToManifestFieldThenDefault() {
        byte[] withField = ("{\"schemaVersion\":2,\"mediaType\":\"" + OCI_MANIFEST + "\"}").getBytes(StandardCharsets.UTF_8);
        byte[] withoutField = "{\"schemaVersion\":2}".getBytes(StandardCharsets.UTF_8);
        manifests.putManifest("app", "a", withField, null).block();
        manifests.putManifest("app", "b", withoutField, "").block();

        assertThat(manifests.getManifest("app", "a").block().getMediaType()).isEqualTo(OCI_MANIFEST);
        assertThat(manifests.getManifest("app", "b").block().getMediaType()).isEqualTo(ManifestValidator.DEFAULT_MEDIA_TYPE);
    }

    @Test
    void tagListReflectsWritesImmediately() {
        assertThat(manifests.putManifest("app", "one", manifest("1"), null).block()).isNotNull();
        assertThat(manifests.listTags("app", null, null).block().getItems()).containsExactly("one");

        manifests.putManifest("app", "two", manifest("2"), null).block();

        assertThat(manifests.listTags("app", null, null).block().getItems()).containsExactly("one", "two");
        assertThat(manifests.listTags("app", 1, null).block().isHasMore()).isTrue();
        assertThat(manifests.listTags("app", 1, "one").block().getItems()).containsExactly("two");
    }

    @Test
    void rejectsWrongDigestReference() {
        byte[] content = manifest("x");
        String otherDigest = registry.digestEngine.compute(manifest("y")).toString();

        StepVerifier.create(manifests.putManifest("app", otherDigest, content, null))
                .expectError(DigestMismatchException.class)
                .verify();
    }

    @Test
    void rejectsMalformedManifestAndTag() {
        StepVerifier.create(manifests.putManifest("app", "latest", "not json".getBytes(StandardCharsets.UTF_8), null))
                .expectError(ManifestInvalidException.class)
                .verify();
        StepVerifier.create(manifests.putManifest("app", "latest", "[1,2]".getBytes(StandardCharsets.UTF_8), null))
                .expectError(ManifestInvalidException.class)
                .verify();
        StepVerifier.create(manifests.putManifest("app", "bad tag", manifest("z"), null))
                .expectError(RepositoryInvalidException.class)
                .verify();
    }

    @Test
    void strictModeRequiresReferencedBlobs() {
        registry.registryProperties.setStrictManifestReferences(true);
        byte[] layer = "layer".getBytes(StandardCharsets.UTF_8);
        Digest layerDigest = registry.digestEngine.compute(layer);
        byte[] content = ("{\"schemaVersion\":2,\"layers\":[{\"digest\":\"" + layerDigest + "\",\"size\":5}]}")
                .getBytes(StandardCharsets.UTF_8);

        StepVerifier.create(manifests.putManifest("app", "latest", content, OCI_MANIFEST))
                .expectErrorSatisfies(error -> assertThat(((ManifestInvalidException) error).getErrorCode())
                        .isEqualTo(ErrorCode.MANIFEST_BLOB_UNKNOWN))
                .verify();

        registry.uploadManager.monolithic("app", layer, layerDigest).block();

        StepVerifier.create(manifests.putManifest("app", "latest", content, OCI_MANIFEST))
                .expectNextCount(1)
                .verifyComplete();
    }

    @Test
    void unknownRepositoryAndReference() {
        StepVerifier.create(manifests.getManifest("nope", "latest"))
                .expectErrorSatisfies(error -> assertThat(((NotFoundException) error).getErrorCode()).isEqualTo(ErrorCode.NAME_UNKNOWN))
                .verify();
        StepVerifier.create(manifests.listTags("nope", null, null)).expectError(NotFoundException.class).verify();

        manifests.putManifest("app", "latest", manifest("a"), null).block();
        StepVerifier.create(manifests.getManifest("app", "missing"))
                .expectErrorSatisfies(error -> assertThat(((NotFoundException) error).getErrorCode()).isEqualTo(ErrorCode.MANIFEST_UNKNOWN))
                .verify();
    }

    @Test
    void concurrentPushesToOneTagLeaveASingleWinner() {
        List<Digest> pushed = Flux.range(0, 8)
                .flatMap(i -> manifests.putManifest("app", "latest", manifest("layer-" + i), OCI_MANIFEST)
                        .subscribeOn(Schedulers.boundedElastic()))
                .collectList()
                .block(Duration.ofSeconds(30));

        assertThat(pushed).hasSize(8).doesNotHaveDuplicates();
        String winner = manifests.getManifest("app", "latest").block().getDigest();
        assertThat(pushed).extracting(Digest::toString).contains(winner);
        assertThat(manifests.listTags("app", null, null).block().getItems()).containsExactly("latest");
        assertThat(registry.metadataStore.listRevisions("app"))
                .extracting(ManifestRevision::getDigest)
                .containsExactly(winner);
    }

    @Test
    void tagDeletesRacingPushesNeverLeaveDanglingTags() {
        manifests.putManifest("app", "latest", manifest("seed"), OCI_MANIFEST).block();

        Flux<Void> pushes = Flux.range(0, 10)
                .flatMap(i -> manifests.putManifest("app", "latest", manifest("push-" + i), OCI_MANIFEST)
                        .subscribeOn(Schedulers.boundedElastic())
                        .then());
        Flux<Void> deletes = Flux.range(0, 10)
                .flatMap(i -> manifests.deleteTag("app", "latest")
                        .onErrorResume(NotFoundException.class, e -> Mono.empty())
                        .subscribeOn(Schedulers.boundedElastic()));
        Flux.merge(pushes, deletes).blockLast(Duration.ofSeconds(30));

        List<TagRecord> tags = registry.metadataStore.listTags("app");
        for (TagRecord tag : tags) {
            assertThat(registry.metadataStore.getRevision("app", Digest.parse(tag.getDigest()))).isPresent();
        }
        assertThat(registry.metadataStore.listRevisions("app"))
                .extracting(ManifestRevision::getDigest)
                .containsExactlyInAnyOrderElementsOf(tags.stream().map(TagRecord::getDigest).toList());
    }

    private static byte[] manifest(String layerName) {
        return ("{\"schemaVersion\":2,\"mediaType\":\"" + OCI_MANIFEST + "\",\"annotations\":{\"name\":\"" + layerName + "\"}}")
                .getBytes(StandardCharsets.UTF_8);
    }
}
