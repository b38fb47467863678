package com.dingdangmaoup.dock.exception;

import lombok.Getter;

/**
 * Base of every failure the registry reports to clients. The {@link ErrorCode}
 * decides the status code and the code string in the error body.
 */
@Getter
public class RegistryException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Object detail;

    public RegistryException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    public RegistryException(ErrorCode errorCode, String message, Object detail) {
        this(errorCode, message, detail, null);
    }

    public RegistryException(ErrorCode errorCode, String message, Object detail, Throwable cause) {
        super(message != null ? message : errorCode.getDefaultMessage(), cause);
        this.errorCode = errorCode;
        this.detail = detail;
    }
}
