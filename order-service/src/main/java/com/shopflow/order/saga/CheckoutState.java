package com.shopflow.order.saga;

import com.shopflow.order.client.CartClient;
import com.shopflow.order.client.PaymentClient;
import com.shopflow.order.entity.Order;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.List;

/**
 * 체크아웃(PayPal/COD) Saga 실행 하나의 상태.
 * 요청 스레드 하나가 소유하며 실행이 끝나면 버려진다.
 */
@Getter
@Setter
@RequiredArgsConstructor
class CheckoutState {

    private final CheckoutCommand command;
    private final CompensationLog compensations = new CompensationLog();

    private SagaStep step = SagaStep.FETCH_CART;
    private CartClient.Cart cart;
    private List<CartClient.CartItem> items = List.of();
    private List<PricedLine> lines = List.of();
    private BigDecimal totalAmount = BigDecimal.ZERO;
    private PaymentClient.PaymentOrder payment;
    private Order order;

    boolean orderCreated() {
        return order != null;
    }
}
