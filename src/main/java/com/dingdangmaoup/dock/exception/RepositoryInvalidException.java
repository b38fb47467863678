package com.dingdangmaoup.dock.exception;

import java.util.Map;

public class RepositoryInvalidException extends RegistryException {

    private RepositoryInvalidException(ErrorCode errorCode, String message, Object detail) {
        super(errorCode, message, detail);
    }

    public static RepositoryInvalidException name(String repository, String reason) {
        return new RepositoryInvalidException(ErrorCode.NAME_INVALID,
                "invalid repository name: " + reason, Map.of("name", String.valueOf(repository)));
    }

    public static RepositoryInvalidException tag(String tag, String reason) {
        return new RepositoryInvalidException(ErrorCode.TAG_INVALID,
                "invalid tag: " + reason, Map.of("tag", String.valueOf(tag)));
    }
}
