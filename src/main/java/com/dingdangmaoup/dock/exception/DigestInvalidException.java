package com.dingdangmaoup.dock.exception;

import java.util.Map;

public class DigestInvalidException extends RegistryException {

    public DigestInvalidException(String digest) {
        super(ErrorCode.DIGEST_INVALID, "invalid digest format",
                Map.of("digest", digest == null ? "" : digest));
    }
}
