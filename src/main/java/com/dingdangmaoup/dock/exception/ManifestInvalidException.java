package com.dingdangmaoup.dock.exception;

import java.util.Map;

public class ManifestInvalidException extends RegistryException {

    public ManifestInvalidException(String message) {
        super(ErrorCode.MANIFEST_INVALID, message);
    }

    public ManifestInvalidException(String message, Throwable cause) {
        super(ErrorCode.MANIFEST_INVALID, message, null, cause);
    }

    private ManifestInvalidException(ErrorCode errorCode, String message, Object detail) {
        super(errorCode, message, detail);
    }

    public static ManifestInvalidException unknownBlob(String digest) {
        return new ManifestInvalidException(ErrorCode.MANIFEST_BLOB_UNKNOWN,
                "manifest references unknown blob " + digest, Map.of("digest", digest));
    }

    public static ManifestInvalidException unknownManifest(String digest) {
        return new ManifestInvalidException(ErrorCode.MANIFEST_BLOB_UNKNOWN,
                "index references unknown manifest " + digest, Map.of("digest", digest));
    }
}
