package com.dingdangmaoup.dock.registry.controller;

import com.dingdangmaoup.dock.exception.ErrorCode;
import com.dingdangmaoup.dock.exception.RegistryException;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code Content-Range} of a PATCH chunk: {@code start-end}, inclusive, with an optional {@code bytes } prefix.
 */
final class ContentRange {

    private static final Pattern RANGE = Pattern.compile("^(?:bytes[ =])?(\\d+)-(\\d+)(?:/(?:\\d+|\\*))?$");

    private ContentRange() {
    }

    /**
     * @return the start offset, or null when the header is absent
     */
    static Long parseStart(String header, int chunkLength) {
        if (header == null || header.isBlank()) {
            return null;
        }
        Matcher matcher = RANGE.matcher(header.trim());
        if (!matcher.matches()) {
            throw invalid(header, "malformed Content-Range");
        }
        long start;
        long end;
        try {
            start = Long.parseLong(matcher.group(1));
            end = Long.parseLong(matcher.group(2));
        } catch (NumberFormatException e) {
            throw invalid(header, "Content-Range out of range");
        }
        if (end < start) {
            throw invalid(header, "Content-Range ends before it starts");
        }
        if (chunkLength > 0 && end - start + 1 != chunkLength) {
            throw invalid(header, "Content-Range covers " + (end - start + 1) + " bytes but body has " + chunkLength);
        }
        return start;
    }

    private static RegistryException invalid(String header, String message) {
        return new RegistryException(ErrorCode.RANGE_INVALID, message, Map.of("contentRange", header));
    }
}
