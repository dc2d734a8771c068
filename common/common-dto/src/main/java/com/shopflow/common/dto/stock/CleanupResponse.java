package com.shopflow.common.dto.stock;

public record CleanupResponse(String productId, int removed) {
}
