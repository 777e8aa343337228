package io.toolmesh.core.admin;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AdminResponse<T>(boolean success, T data, String message, AdminError error) {

    public static <T> AdminResponse<T> ok(T data) {
        return new AdminResponse<>(true, data, null, null);
    }

    public static <T> AdminResponse<T> ok(T data, String message) {
        return new AdminResponse<>(true, data, message, null);
    }

    public static <T> AdminResponse<T> failure(String code, String message) {
        return new AdminResponse<>(false, null, null, new AdminError(code, message));
    }

    public record AdminError(String code, String message) {
    }
}
