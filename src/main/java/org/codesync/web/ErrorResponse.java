package org.codesync.web;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 统一的错误响应体。{@code status} 固定为 {@code error}，与 sync/confirm 响应的状态字段保持一致。
 *
 * @param status         固定为 error
 * @param error          错误类别（validation_error / not_found / capability_expired ...）
 * @param errorMessage   说明
 * @param currentVersion 已知时附带的服务端当前版本
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String status,
        String error,
        String errorMessage,
        Long currentVersion
) {

    public static ErrorResponse of(String error, String message) {
        return new ErrorResponse("error", error, message, null);
    }
}
