package com.dingdangmaoup.dock.exception;

import lombok.Getter;

import java.util.Map;

/**
 * Unknown, finished or expired upload session.
 */
@Getter
public class SessionNotFoundException extends RegistryException {

    private final boolean expired;

    public SessionNotFoundException(String sessionId, boolean expired) {
        super(ErrorCode.BLOB_UPLOAD_UNKNOWN,
                expired ? "upload session expired" : "blob upload unknown to registry",
                Map.of("uuid", String.valueOf(sessionId)));
        this.expired = expired;
    }
}
