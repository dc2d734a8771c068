package com.shopflow.common.dto.stock;

/** released=false 이면 해제할 예약이 없었음 (멱등 no-op) */
public record ReleaseResponse(String productId, String orderId, boolean released) {
}
