package com.dingdangmaoup.dock.manifest;

import com.dingdangmaoup.dock.digest.Digest;
import com.dingdangmaoup.dock.exception.ManifestInvalidException;
import com.dingdangmaoup.dock.exception.RegistryException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Structural checks on pushed manifests. Only what the registry itself
 * relies on is checked: a JSON object, and well-formed digests wherever it
 * references other content.
 */
@Component
@RequiredArgsConstructor
public class ManifestValidator {

    public static final String DEFAULT_MEDIA_TYPE = "application/vnd.docker.distribution.manifest.v2+json";

    private final ObjectMapper objectMapper;

    public ParsedManifest parse(byte[] content) {
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (IOException e) {
            throw new ManifestInvalidException("manifest is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ManifestInvalidException("manifest must be a JSON object");
        }

        List<Digest> blobs = new ArrayList<>();
        JsonNode config = root.get("config");
        if (config != null && !config.isNull()) {
            blobs.add(referencedDigest(config, "config"));
        }
        collect(root, "layers", blobs);

        List<Digest> manifests = new ArrayList<>();
        collect(root, "manifests", manifests);

        String mediaType = root.path("mediaType").isTextual() ? root.get("mediaType").asText() : null;
        return new ParsedManifest(mediaType, blobs, manifests);
    }

    /**
     * Content-Type header first, then the manifest's own mediaType field, then the Docker v2 schema 2 type.
     */
    public String resolveMediaType(String contentType, ParsedManifest manifest) {
        if (contentType != null && !contentType.isBlank()) {
            return contentType;
        }
        if (manifest.getMediaType() != null && !manifest.getMediaType().isBlank()) {
            return manifest.getMediaType();
        }
        return DEFAULT_MEDIA_TYPE;
    }

    private void collect(JsonNode root, String field, List<Digest> into) {
        JsonNode array = root.get(field);
        if (array == null || array.isNull()) {
            return;
        }
        if (!array.isArray()) {
            throw new ManifestInvalidException("'" + field + "' must be an array");
        }
        for (int i = 0; i < array.size(); i++) {
            into.add(referencedDigest(array.get(i), field + "[" + i + "]"));
        }
    }

    private Digest referencedDigest(JsonNode descriptor, String location) {
        JsonNode digest = descriptor.get("digest");
        if (digest == null || !digest.isTextual()) {
            throw new ManifestInvalidException(location + " has no digest");
        }
        try {
            return Digest.parse(digest.asText());
        } catch (RegistryException e) {
            throw new ManifestInvalidException(location + " has an invalid digest: " + digest.asText(), e);
        }
    }

    @Data
    @AllArgsConstructor
    public static class ParsedManifest {
        private String mediaType;
        private List<Digest> blobReferences;
        private List<Digest> manifestReferences;
    }
}
