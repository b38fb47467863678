package com.dingdangmaoup.dock.registry.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Distribution error body: {@code {"errors":[{"code","message","detail"}]}}
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    private List<Error> errors;

    public static ErrorResponse of(String code, String message, Object detail) {
        return new ErrorResponse(List.of(new Error(code, message, detail)));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Error {
        private String code;
        private String message;
        private Object detail;
    }
}
