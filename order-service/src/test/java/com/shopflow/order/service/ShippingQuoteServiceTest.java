package com.shopflow.order.service;

import com.shopflow.order.client.CatalogClient;
import com.shopflow.order.client.CatalogClient.Product;
import com.shopflow.order.client.PricingClient;
import com.shopflow.order.client.PricingClient.Address;
import com.shopflow.order.client.PricingClient.ShippingQuote;
import com.shopflow.order.client.PricingClient.ShippingRequest;
import com.shopflow.order.config.SagaProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
class ShippingQuoteServiceTest {

    @Mock
    private CatalogClient catalogClient;

    @Mock
    private PricingClient pricingClient;

    @Spy
    private SagaProperties properties = new SagaProperties();

    @InjectMocks
    private ShippingQuoteService shippingQuoteService;

    private final ShippingRequest request = new ShippingRequest("electronics", "express", 2,
            new Address("560001", "Bengaluru", "KA"), "P1");

    @Test
    @DisplayName("카탈로그에 카테고리가 없으면 기본 카테고리")
    void resolveCategory_BlankFallsBack() {
        given(catalogClient.getProduct("P1")).willReturn(new Product("P1", "Mouse", " ", null));

        assertThat(shippingQuoteService.resolveCategory("P1")).isEqualTo("accessories");
    }

    @Test
    @DisplayName("카탈로그 카테고리를 그대로 쓴다")
    void resolveCategory_FromCatalog() {
        given(catalogClient.getProduct("P1")).willReturn(new Product("P1", "Phone", "electronics", 10.0));

        assertThat(shippingQuoteService.resolveCategory("P1")).isEqualTo("electronics");
    }

    @Test
    @DisplayName("견적 응답에 비용/소요일이 없으면 0원, 5일")
    void quote_Defaults() {
        given(pricingClient.calculateShipping(request)).willReturn(new ShippingQuote(null, null));

        ShippingQuote quote = shippingQuoteService.quote(request);

        assertThat(quote.cost()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(quote.estimatedDays()).isEqualTo(5);
    }

    @Test
    @DisplayName("견적 응답을 그대로 돌려준다")
    void quote_PassThrough() {
        given(pricingClient.calculateShipping(request)).willReturn(new ShippingQuote(new BigDecimal("120.50"), 2));

        ShippingQuote quote = shippingQuoteService.quote(request);

        assertThat(quote.cost()).isEqualByComparingTo("120.50");
        assertThat(quote.estimatedDays()).isEqualTo(2);
    }
}
