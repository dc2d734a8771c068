package com.shopflow.order.service;

import com.shopflow.order.client.CatalogClient;
import com.shopflow.order.client.PricingClient;
import com.shopflow.order.client.PricingClient.ShippingQuote;
import com.shopflow.order.client.PricingClient.ShippingRequest;
import com.shopflow.order.config.SagaProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;

/**
 * 상품 한 줄의 배송비 견적
 *
 * <h3>Resilience4j</h3>
 * <ul>
 *   <li>카테고리 조회: @CircuitBreaker(catalogService) + fallback → 기본 카테고리로 계속 진행</li>
 *   <li>배송비 계산: @Retry(pricingService) → 일시 오류 재시도, 끝내 실패하면 Saga 실패</li>
 * </ul>
 * 응답에 비용/소요일이 없으면 0원, 5일로 본다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ShippingQuoteService {

    static final int DEFAULT_ESTIMATED_DAYS = 5;

    private final CatalogClient catalogClient;
    private final PricingClient pricingClient;
    private final SagaProperties properties;

    @CircuitBreaker(name = "catalogService", fallbackMethod = "defaultCategory")
    public String resolveCategory(String productId) {
        String category = catalogClient.getProduct(productId).category();
        return StringUtils.hasText(category) ? category : properties.getDefaultCategory();
    }

    @Retry(name = "pricingService")
    public ShippingQuote quote(ShippingRequest request) {
        ShippingQuote quote = pricingClient.calculateShipping(request);
        BigDecimal cost = quote == null || quote.cost() == null ? BigDecimal.ZERO : quote.cost();
        int days = quote == null || quote.estimatedDays() == null ? DEFAULT_ESTIMATED_DAYS : quote.estimatedDays();
        return new ShippingQuote(cost, days);
    }

    @SuppressWarnings("unused")
    private String defaultCategory(String productId, Throwable t) {
        log.warn("Catalog lookup failed, using default category: productId={}, error={}",
                productId, t.getMessage());
        return properties.getDefaultCategory();
    }
}
