package com.shopflow.order.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

import java.math.BigDecimal;

/**
 * 가격/배송 서비스 - 상품 한 줄의 배송비와 예상 소요일 계산
 *
 * <pre>
 *   POST /shipping/calculate {category, shippingMode, quantity, address{pincode, city, state}, productId}
 *     → {cost, estimatedDays}
 * </pre>
 */
@FeignClient(name = "pricing-service", url = "${pricing-service.url:http://localhost:8083}")
public interface PricingClient {

    @PostMapping("/shipping/calculate")
    ShippingQuote calculateShipping(@RequestBody ShippingRequest request);

    record ShippingRequest(String category, String shippingMode, int quantity,
                           Address address, String productId) {}

    record Address(String pincode, String city, String state) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ShippingQuote(BigDecimal cost, Integer estimatedDays) {}
}
