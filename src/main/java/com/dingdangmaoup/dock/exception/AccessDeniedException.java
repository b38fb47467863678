package com.dingdangmaoup.dock.exception;

import java.util.Map;

public class AccessDeniedException extends RegistryException {

    public AccessDeniedException(String repository, String action) {
        super(ErrorCode.DENIED, "requested access to the resource is denied",
                Map.of("name", repository, "action", action));
    }
}
