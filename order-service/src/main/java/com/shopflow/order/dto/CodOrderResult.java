package com.shopflow.order.dto;

import java.math.BigDecimal;

public record CodOrderResult(String orderId, BigDecimal totalAmount) {
}
