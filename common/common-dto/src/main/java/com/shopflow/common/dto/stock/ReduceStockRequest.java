package com.shopflow.common.dto.stock;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/** 예약을 영구 차감으로 전환하는 요청 (orderId의 활성 예약 필요) */
public record ReduceStockRequest(
        @Positive int quantity,
        @NotBlank String orderId
) {
}
