package com.shopflow.order.dto;

import java.math.BigDecimal;

/** PayPal 체크아웃 결과. approvalUrl로 사용자를 보내 결제를 승인받는다 */
public record CheckoutResult(String orderId, String paymentReference, String approvalUrl, BigDecimal totalAmount) {
}
