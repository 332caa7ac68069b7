package com.example.oncall.common;

import java.util.Collections;
import java.util.Map;

/**
 * JSON envelope shared by the API endpoints. Clients check {@code success} before reading
 * {@code data}; {@code meta} carries request echoes and aggregates.
 */
public record ApiResponse<T>(boolean success, String message, T data, Map<String, Object> meta) {

    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(true, message, data, Collections.emptyMap());
    }

    public static <T> ApiResponse<T> success(String message, T data, Map<String, Object> meta) {
        return new ApiResponse<>(true, message, data, meta == null ? Collections.emptyMap() : Map.copyOf(meta));
    }
}
