package com.shopflow.order.dto;

import jakarta.validation.constraints.NotBlank;

/** 사용자가 PayPal에서 승인한 뒤 돌아오면 받는 결제 주문 ID */
public record CaptureRequest(@NotBlank String paymentReference) {
}
