package com.branchsync.ingest.web;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Envelope shared by every sync API response; branch agents key off {@code success}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, String message, T data) {

    public static <T> ApiResponse<T> ok(String message, T data) {
        return new ApiResponse<>(true, message, data);
    }

    public static <T> ApiResponse<T> error(String message) {
        return new ApiResponse<>(false, message, null);
    }
}
