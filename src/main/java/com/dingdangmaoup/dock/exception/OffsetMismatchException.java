package com.dingdangmaoup.dock.exception;

import lombok.Getter;

import java.util.Map;

/**
 * A chunk did not start where the session currently ends. Carries the session
 * offset so the client can resume from it.
 */
@Getter
public class OffsetMismatchException extends RegistryException {

    private final String sessionId;
    private final long currentOffset;
    private final long requestedOffset;

    public OffsetMismatchException(String sessionId, long currentOffset, long requestedOffset) {
        super(ErrorCode.RANGE_INVALID,
                "chunk starts at " + requestedOffset + " but upload is at " + currentOffset,
                Map.of("uuid", sessionId, "offset", currentOffset));
        this.sessionId = sessionId;
        this.currentOffset = currentOffset;
        this.requestedOffset = requestedOffset;
    }
}
