package com.dingdangmaoup.dock.cache;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheKey {

    public enum Type {
        CATALOG,
        TAGS,
        MANIFEST_DIGEST,
        MANIFEST_TAG
    }

    private Type type;
    private String repository;
    private String reference;  // tag or digest

    public static CacheKey catalog() {
        return CacheKey.builder().type(Type.CATALOG).build();
    }

    public static CacheKey tags(String repository) {
        return CacheKey.builder().type(Type.TAGS).repository(repository).build();
    }

    public static CacheKey manifestByDigest(String repository, String digest) {
        return CacheKey.builder().type(Type.MANIFEST_DIGEST).repository(repository).reference(digest).build();
    }

    public static CacheKey manifestByTag(String repository, String tag) {
        return CacheKey.builder().type(Type.MANIFEST_TAG).repository(repository).reference(tag).build();
    }

    public String toCacheKey() {
        return switch (type) {
            case CATALOG -> "catalog";
            case TAGS -> "tags:" + repository;
            case MANIFEST_DIGEST -> "manifest:" + repository + "@" + reference;
            case MANIFEST_TAG -> "manifest:" + repository + ":" + reference;
        };
    }

    @Override
    public String toString() {
        return toCacheKey();
    }
}
