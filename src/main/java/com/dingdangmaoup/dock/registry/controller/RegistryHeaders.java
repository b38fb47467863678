package com.dingdangmaoup.dock.registry.controller;

/**
 * Header names and values of the distribution protocol
 */
public final class RegistryHeaders {

    public static final String API_VERSION = "Docker-Distribution-API-Version";
    public static final String API_VERSION_VALUE = "registry/2.0";
    public static final String CONTENT_DIGEST = "Docker-Content-Digest";
    public static final String UPLOAD_UUID = "Docker-Upload-UUID";
    public static final String RANGE = "Range";
    public static final String CONTENT_RANGE = "Content-Range";

    private RegistryHeaders() {
    }

    /**
     * Range header for an upload holding {@code offset} bytes; {@code 0-0} while empty.
     */
    public static String range(long offset) {
        return "0-" + Math.max(0, offset - 1);
    }
}
