package com.shopflow.order.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

/** 카탈로그 서비스 - 배송비 계산에 필요한 상품 카테고리 조회 */
@FeignClient(name = "catalog-service", url = "${catalog-service.url:http://localhost:8082}")
public interface CatalogClient {

    @GetMapping("/product/{productId}")
    Product getProduct(@PathVariable String productId);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Product(String productId, String name, String category, Double discountPercentage) {}
}
