package com.dingdangmaoup.dock.exception;

import java.util.Map;

public class PayloadTooLargeException extends RegistryException {

    public PayloadTooLargeException(long limit) {
        super(ErrorCode.SIZE_INVALID, "request body exceeds " + limit + " bytes",
                Map.of("limit", limit));
    }
}
