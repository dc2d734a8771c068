package com.shopflow.common.dto.stock;

/**
 * 상품 재고 스냅샷.
 * available = max(0, onHand - reserved)
 */
public record StockStatusResponse(
        String productId,
        int onHand,
        int reserved,
        int available
) {
}
