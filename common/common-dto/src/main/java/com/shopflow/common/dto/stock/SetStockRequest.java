package com.shopflow.common.dto.stock;

import jakarta.validation.constraints.PositiveOrZero;

public record SetStockRequest(@PositiveOrZero int onHand) {
}
