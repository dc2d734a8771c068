package com.shopflow.common.dto.stock;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/** Reduce 보상: 차감했던 수량을 on-hand에 되돌린다 */
public record RestoreStockRequest(
        @Positive int quantity,
        @NotBlank String orderId
) {
}
