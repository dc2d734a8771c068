package com.shopflow.order.dto;

import com.shopflow.order.entity.OrderStatus;

import java.math.BigDecimal;

/**
 * 결제 확정 결과. 동시 취소에 밀렸거나 이미 처리된 주문이면 ok=false + "already &lt;status&gt;"
 */
public record CaptureResult(boolean ok, String orderId, OrderStatus status, String paymentReference,
                            BigDecimal totalAmount, String message) {

    public static CaptureResult completed(String orderId, String paymentReference, BigDecimal totalAmount) {
        return new CaptureResult(true, orderId, OrderStatus.COMPLETED, paymentReference, totalAmount, "completed");
    }

    public static CaptureResult already(String orderId, OrderStatus status, String paymentReference,
                                        BigDecimal totalAmount) {
        return new CaptureResult(false, orderId, status, paymentReference, totalAmount, "already " + status.label());
    }
}
