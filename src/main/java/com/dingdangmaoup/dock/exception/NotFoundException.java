package com.dingdangmaoup.dock.exception;

import java.util.Map;

public class NotFoundException extends RegistryException {

    public NotFoundException(ErrorCode errorCode, String message, Object detail) {
        super(errorCode, message, detail);
    }

    public static NotFoundException repository(String repository) {
        return new NotFoundException(ErrorCode.NAME_UNKNOWN,
                "repository name not known to registry", Map.of("name", repository));
    }

    public static NotFoundException manifest(String repository, String reference) {
        return new NotFoundException(ErrorCode.MANIFEST_UNKNOWN,
                "manifest unknown", Map.of("name", repository, "reference", reference));
    }

    public static NotFoundException blob(String digest) {
        return new NotFoundException(ErrorCode.BLOB_UNKNOWN,
                "blob unknown to registry", Map.of("digest", digest));
    }
}
