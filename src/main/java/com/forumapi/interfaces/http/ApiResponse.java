package com.forumapi.interfaces.http;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * JSON envelope shared by every route.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse(String status, String message, Object data) {

    public static ApiResponse success() {
        return new ApiResponse("success", null, null);
    }

    public static ApiResponse success(String key, Object value) {
        return new ApiResponse("success", null, Map.of(key, value));
    }

    public static ApiResponse success(Map<String, ?> data) {
        return new ApiResponse("success", null, data);
    }

    public static ApiResponse fail(String message) {
        return new ApiResponse("fail", message, null);
    }

    public static ApiResponse error(String message) {
        return new ApiResponse("error", message, null);
    }
}
