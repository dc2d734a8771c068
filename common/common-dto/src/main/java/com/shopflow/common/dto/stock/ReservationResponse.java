package com.shopflow.common.dto.stock;

import java.time.Instant;

public record ReservationResponse(
        String productId,
        String orderId,
        int quantity,
        Instant expiresAt,
        boolean expired
) {
}
