package com.shopflow.common.dto.stock;

import jakarta.validation.constraints.NotBlank;

public record ReleaseStockRequest(@NotBlank String orderId) {
}
