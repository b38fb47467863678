package com.dingdangmaoup.dock.registry.controller;

import com.dingdangmaoup.dock.exception.ErrorCode;
import com.dingdangmaoup.dock.exception.OffsetMismatchException;
import com.dingdangmaoup.dock.exception.RegistryException;
import com.dingdangmaoup.dock.registry.model.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

/**
 * Renders failures as distribution error bodies.
 * - RegistryException: status and code from its ErrorCode
 * - bad request input: 400
 * - anything else: 500 UNKNOWN, logged with stack trace
 */
@Slf4j
@RestControllerAdvice
public class RegistryExceptionHandler {

    @ExceptionHandler(OffsetMismatchException.class)
    public ResponseEntity<ErrorResponse> handleOffsetMismatch(OffsetMismatchException ex) {
        log.info("Rejected chunk for upload {}: {}", ex.getSessionId(), ex.getMessage());
        return ResponseEntity.status(ex.getErrorCode().getStatus())
                .header(RegistryHeaders.RANGE, RegistryHeaders.range(ex.getCurrentOffset()))
                .header(RegistryHeaders.UPLOAD_UUID, ex.getSessionId())
                .body(body(ex));
    }

    @ExceptionHandler(RegistryException.class)
    public ResponseEntity<ErrorResponse> handleRegistry(RegistryException ex) {
        if (ex.getErrorCode().getStatus().is5xxServerError()) {
            log.error("Registry operation failed: {}", ex.getMessage(), ex);
        } else {
            log.debug("Registry request rejected: {} {}", ex.getErrorCode(), ex.getMessage());
        }
        return ResponseEntity.status(ex.getErrorCode().getStatus()).body(body(ex));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInput(ServerWebInputException ex) {
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of(ErrorCode.UNSUPPORTED.name(), ex.getReason(), null));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleStatus(ResponseStatusException ex) {
        return ResponseEntity.status(ex.getStatusCode())
                .body(ErrorResponse.of(ErrorCode.UNSUPPORTED.name(), ex.getReason(), null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(ErrorCode.UNKNOWN.getStatus())
                .body(ErrorResponse.of(ErrorCode.UNKNOWN.name(), ErrorCode.UNKNOWN.getDefaultMessage(), null));
    }

    private static ErrorResponse body(RegistryException ex) {
        return ErrorResponse.of(ex.getErrorCode().name(), ex.getMessage(), ex.getDetail());
    }
}
