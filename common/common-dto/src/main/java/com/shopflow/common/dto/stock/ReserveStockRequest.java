package com.shopflow.common.dto.stock;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * 재고 예약 요청. ttlMinutes가 없으면 서버 기본값(15분)을 사용한다.
 */
public record ReserveStockRequest(
        @Positive int quantity,
        @NotBlank String orderId,
        @Positive Integer ttlMinutes
) {
}
