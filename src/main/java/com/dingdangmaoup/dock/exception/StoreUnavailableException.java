package com.dingdangmaoup.dock.exception;

/**
 * The durable store could not answer. Never reported as "not found".
 */
public class StoreUnavailableException extends RegistryException {

    public StoreUnavailableException(String message) {
        super(ErrorCode.UNKNOWN, message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(ErrorCode.UNKNOWN, message, null, cause);
    }
}
