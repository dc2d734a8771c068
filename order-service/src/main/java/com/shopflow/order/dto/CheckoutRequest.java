package com.shopflow.order.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

import java.util.Map;

/**
 * 체크아웃 요청 (PayPal, COD 공통)
 *
 * @param shippingMode      기본 배송 모드 (standard|express), 없으면 standard
 * @param itemShippingModes 상품별 배송 모드 (productId → mode)
 */
public record CheckoutRequest(
        @NotBlank String userId,
        @Valid AddressRequest address,
        @Pattern(regexp = "standard|express") String shippingMode,
        Map<String, @Pattern(regexp = "standard|express") String> itemShippingModes
) {
    public record AddressRequest(String zipCode, String city, String state) {}
}
