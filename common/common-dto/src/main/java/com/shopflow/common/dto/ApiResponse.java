package com.shopflow.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 공통 API 응답 래퍼 (Common API Response Wrapper)
 *
 * <p>stock-service와 order-service가 같은 응답 형식을 사용하도록 강제하는 공통 DTO.
 * 서비스 간 Feign 호출도 이 형식을 그대로 역직렬화한다.</p>
 *
 * <pre>
 *   // 성공: {"success": true, "data": {...}}
 *   return ApiResponse.ok(status);
 *
 *   // 실패: {"success": false, "message": "already completed"}
 *   return ApiResponse.error("already completed");
 * </pre>
 *
 * @param <T> 응답 데이터 타입
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
        boolean success,
        T data,
        String message
) {
    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static <T> ApiResponse<T> error(String message) {
        return new ApiResponse<>(false, null, message);
    }
}
