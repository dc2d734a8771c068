package com.shopflow.order.saga;

import java.math.BigDecimal;

/**
 * 보상 단계 - 부수 효과가 있는 단계가 성공한 직후 하나씩 기록된다.
 *
 * <pre>
 *   ReleaseReservation  재고 예약 해제 (멱등)
 *   RestoreStock        reduce로 줄인 on-hand 복구
 *   MarkOrderCancelled  주문 CANCELLED (종료 상태면 그대로)
 *   MarkOrderFailed     주문 FAILED (종료 상태면 그대로)
 *   VoidPaymentNote     결제는 자동 취소하지 않는다. 수동 처리용 기록만 남긴다
 * </pre>
 */
public sealed interface CompensationStep {

    String describe();

    record ReleaseReservation(String productId, String orderId) implements CompensationStep {
        @Override
        public String describe() {
            return "release reservation " + productId + "/" + orderId;
        }
    }

    record RestoreStock(String productId, String orderId, int quantity) implements CompensationStep {
        @Override
        public String describe() {
            return "restore " + quantity + " units of " + productId + " for " + orderId;
        }
    }

    record MarkOrderCancelled(String orderId, String userId) implements CompensationStep {
        @Override
        public String describe() {
            return "cancel order " + orderId;
        }
    }

    record MarkOrderFailed(String orderId, String userId) implements CompensationStep {
        @Override
        public String describe() {
            return "fail order " + orderId;
        }
    }

    /** captured=false: 승인 전 결제 주문 (만료되면 PayPal이 폐기), true: 이미 돈이 빠져나간 결제 */
    record VoidPaymentNote(String paymentReference, String orderId, BigDecimal amount,
                           boolean captured) implements CompensationStep {
        @Override
        public String describe() {
            return (captured ? "refund captured payment " : "void payment ") + paymentReference;
        }
    }
}
