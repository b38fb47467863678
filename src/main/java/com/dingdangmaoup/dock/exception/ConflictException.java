package com.dingdangmaoup.dock.exception;

public class ConflictException extends RegistryException {

    public ConflictException(String message) {
        super(ErrorCode.UNSUPPORTED, message);
    }
}
