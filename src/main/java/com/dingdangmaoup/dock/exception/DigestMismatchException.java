package com.dingdangmaoup.dock.exception;

import lombok.Getter;

import java.util.Map;

@Getter
public class DigestMismatchException extends RegistryException {

    private final String expected;
    private final String actual;

    public DigestMismatchException(String expected, String actual) {
        super(ErrorCode.DIGEST_INVALID,
                "provided digest did not match uploaded content",
                Map.of("expected", expected, "actual", actual));
        this.expected = expected;
        this.actual = actual;
    }
}
