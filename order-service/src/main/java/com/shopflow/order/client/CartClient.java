package com.shopflow.order.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;

import java.math.BigDecimal;
import java.util.List;

/**
 * 장바구니 서비스 Feign 클라이언트
 *
 * <pre>
 *   GET  /cart                 (Authorization: Bearer ...) → 사용자 장바구니
 *   POST /cart/validate        {cartId} → 가격 재확인 + 재고 확인
 *   POST /cart/{cartId}/clear  결제 완료 후 비우기
 * </pre>
 *
 * validate는 가격이 바뀌면 장바구니에 새 가격을 저장하고 cartUpdated=true를 돌려준다.
 */
@FeignClient(name = "cart-service", url = "${cart-service.url:http://localhost:8081}")
public interface CartClient {

    @GetMapping("/cart")
    Cart getCart(@RequestHeader(HttpHeaders.AUTHORIZATION) String authorization);

    @PostMapping("/cart/validate")
    CartValidation validate(@RequestBody ValidateCartRequest request);

    @PostMapping("/cart/{cartId}/clear")
    void clear(@PathVariable String cartId);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Cart(String cartId, String userId, List<CartItem> items, BigDecimal totalPrice) {
        public boolean isEmpty() {
            return items == null || items.isEmpty();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CartItem(String productId, int quantity, BigDecimal price) {}

    record ValidateCartRequest(String cartId) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CartValidation(boolean valid, List<String> errors, boolean cartUpdated, List<CartItem> updatedItems) {}
}
