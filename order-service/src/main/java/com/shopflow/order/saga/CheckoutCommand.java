package com.shopflow.order.saga;

/** 체크아웃 입력. accessToken은 장바구니 서비스 호출에 그대로 전달한다 */
public record CheckoutCommand(String userId, String accessToken, ShippingSelection shipping) {
}
