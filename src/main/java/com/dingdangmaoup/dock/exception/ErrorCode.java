package com.dingdangmaoup.dock.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Error codes of the distribution protocol, with the status each one is served under.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    BLOB_UNKNOWN(HttpStatus.NOT_FOUND, "blob unknown to registry"),
    BLOB_UPLOAD_INVALID(HttpStatus.BAD_REQUEST, "blob upload invalid"),
    BLOB_UPLOAD_UNKNOWN(HttpStatus.NOT_FOUND, "blob upload unknown to registry"),
    DIGEST_INVALID(HttpStatus.BAD_REQUEST, "provided digest did not match uploaded content"),
    MANIFEST_BLOB_UNKNOWN(HttpStatus.BAD_REQUEST, "manifest references a blob unknown to registry"),
    MANIFEST_INVALID(HttpStatus.BAD_REQUEST, "manifest invalid"),
    MANIFEST_UNKNOWN(HttpStatus.NOT_FOUND, "manifest unknown to registry"),
    NAME_INVALID(HttpStatus.BAD_REQUEST, "invalid repository name"),
    NAME_UNKNOWN(HttpStatus.NOT_FOUND, "repository name not known to registry"),
    PAGINATION_NUMBER_INVALID(HttpStatus.BAD_REQUEST, "invalid number of results requested"),
    RANGE_INVALID(HttpStatus.REQUESTED_RANGE_NOT_SATISFIABLE, "invalid content range"),
    SIZE_INVALID(HttpStatus.PAYLOAD_TOO_LARGE, "provided length did not match content length"),
    TAG_INVALID(HttpStatus.BAD_REQUEST, "manifest tag did not match URI"),
    DENIED(HttpStatus.FORBIDDEN, "requested access to the resource is denied"),
    UNSUPPORTED(HttpStatus.CONFLICT, "the operation is unsupported"),
    UNKNOWN(HttpStatus.INTERNAL_SERVER_ERROR, "unknown error");

    private final HttpStatus status;
    private final String defaultMessage;
}
